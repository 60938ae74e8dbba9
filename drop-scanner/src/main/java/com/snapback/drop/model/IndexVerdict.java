package com.snapback.drop.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Answer from one content-index source, or an abstention when the source
 * could not be consulted.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IndexVerdict {

    IndexPresence indexed;

    /** Count of distinct pages/results; null when the source gave no figure */
    Integer estimatedPages;

    /** Source id, null for the chain-exhausted verdict */
    String source;

    /** Error marker for abstentions, null otherwise */
    String error;

    boolean abstained;

    public static IndexVerdict present(String source, Integer estimatedPages) {
        return new IndexVerdict(IndexPresence.PRESENT, estimatedPages, source, null, false);
    }

    public static IndexVerdict absent(String source) {
        return new IndexVerdict(IndexPresence.ABSENT, 0, source, null, false);
    }

    public static IndexVerdict abstain(String source, String error) {
        return new IndexVerdict(IndexPresence.UNKNOWN, null, source, error, true);
    }

    /** Every source abstained: no source, no count. */
    public static IndexVerdict unknown(String lastError) {
        return new IndexVerdict(IndexPresence.UNKNOWN, null, null, lastError, false);
    }
}
