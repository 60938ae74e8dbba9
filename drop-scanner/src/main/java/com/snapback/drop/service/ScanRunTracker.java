package com.snapback.drop.service;

import com.snapback.drop.model.ScanRun;
import com.snapback.drop.model.ScanState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the single process-wide {@link ScanRun}.
 *
 * Lifecycle: IDLE → RUNNING → IDLE (success) or FAILED. The move into RUNNING
 * is a compare-and-set, so at most one scan runs at a time. Finishing
 * transitions carry the run id and are ignored for any other run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScanRunTracker {

    private final Clock clock;
    private final AtomicReference<ScanRun> current = new AtomicReference<>(ScanRun.idle());

    public ScanRun current() {
        return current.get();
    }

    /**
     * @throws ScanAlreadyRunningException if a scan is in flight; its state is left untouched
     */
    public ScanRun tryStart(LocalDate targetDate) {
        ScanRun previous = current.get();
        if (previous.isRunning()) {
            throw new ScanAlreadyRunningException("Scan already running for " + previous.getTargetDate());
        }
        ScanRun next = previous.toBuilder()
                .runId(UUID.randomUUID().toString())
                .state(ScanState.RUNNING)
                .statusMessage("Scanning domains for " + targetDate + "...")
                .targetDate(targetDate)
                .startedAt(clock.instant())
                .build();
        if (!current.compareAndSet(previous, next)) {
            throw new ScanAlreadyRunningException("Scan already running for " + current.get().getTargetDate());
        }
        return next;
    }

    public ScanRun complete(String runId, String message) {
        return finish(runId, ScanState.IDLE, message, true);
    }

    public ScanRun fail(String runId, String message) {
        return finish(runId, ScanState.FAILED, message, false);
    }

    private ScanRun finish(String runId, ScanState state, String message, boolean succeeded) {
        return current.updateAndGet(run -> {
            if (!run.isRunning() || !run.getRunId().equals(runId)) {
                log.warn("Ignoring finish for stale scan run {}", runId);
                return run;
            }
            return run.toBuilder()
                    .state(state)
                    .statusMessage(message)
                    .lastCompletedAt(succeeded ? clock.instant() : run.getLastCompletedAt())
                    .build();
        });
    }
}
