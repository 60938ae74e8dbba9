package com.snapback.drop.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Snapshot of the process-wide scan status. Instances are immutable;
 * transitions swap in a new snapshot.
 */
@Value
@Builder(toBuilder = true)
public class ScanRun {

    @JsonIgnore
    String runId;

    ScanState state;

    @JsonProperty("message")
    String statusMessage;

    LocalDate targetDate;
    Instant startedAt;

    /** Set when a scan finishes successfully; kept across later failures */
    Instant lastCompletedAt;

    public static ScanRun idle() {
        return ScanRun.builder()
                .state(ScanState.IDLE)
                .statusMessage("")
                .build();
    }

    @JsonProperty("running")
    public boolean isRunning() {
        return state == ScanState.RUNNING;
    }
}
