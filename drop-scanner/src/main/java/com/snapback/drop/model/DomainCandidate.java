package com.snapback.drop.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A dropping domain carried through probing and filtering.
 *
 * Probe stages annotate candidates in place. Both probe fields start out
 * UNKNOWN and only a probe may move them to a definitive value.
 */
@Data
@Builder
public class DomainCandidate {

    // ── Carried from the drop list ──────────────────────────────────────────
    private String name;
    private Namespace namespace;
    private LocalDate releaseDate;

    // ── Probe results ───────────────────────────────────────────────────────
    @Builder.Default
    private Availability available = Availability.UNKNOWN;

    @Builder.Default
    private IndexPresence indexed = IndexPresence.UNKNOWN;

    /** Page count; only ever set while indexed == PRESENT, and may still be null then */
    private Integer estimatedPages;

    /** Id of the index source that produced the verdict, "" when none answered */
    @Builder.Default
    private String indexSource = "";

    /** When the last probe for this candidate finished */
    private Instant checkedAt;

    public static DomainCandidate from(DropRecord record, Instant checkedAt) {
        return DomainCandidate.builder()
                .name(record.getName())
                .namespace(record.getNamespace())
                .releaseDate(record.getReleaseDate())
                .checkedAt(checkedAt)
                .build();
    }

    public void applyIndexVerdict(IndexVerdict verdict) {
        this.indexed = verdict.getIndexed();
        this.estimatedPages = verdict.getIndexed() == IndexPresence.PRESENT ? verdict.getEstimatedPages() : null;
        this.indexSource = verdict.getSource() == null ? "" : verdict.getSource();
    }
}
