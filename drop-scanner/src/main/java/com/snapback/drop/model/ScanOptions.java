package com.snapback.drop.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.LocalDate;

/**
 * Per-run switches. A null target date means "tomorrow" in UTC.
 */
@Value
@Builder
@With
public class ScanOptions {

    LocalDate targetDate;

    @Builder.Default
    boolean checkAvailability = true;

    @Builder.Default
    boolean checkIndex = true;

    /** Apply the value filter; false reports every candidate */
    @Builder.Default
    boolean filterValuable = true;

    /** Assemble and summarise without writing report files */
    @Builder.Default
    boolean dryRun = false;

    /** Consult search-engine sources when the archive abstains */
    @Builder.Default
    boolean useFallback = true;

    public static ScanOptions defaults() {
        return ScanOptions.builder().build();
    }
}
