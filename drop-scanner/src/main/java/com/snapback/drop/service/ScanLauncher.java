package com.snapback.drop.service;

import com.snapback.drop.model.ScanOptions;
import com.snapback.drop.model.ScanRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Starts scans on a background worker so request threads return immediately.
 * Progress is published only through {@link ScanRunTracker}.
 */
@Service
@Slf4j
public class ScanLauncher {

    private final DomainScanService scanService;
    private final DropDateFilter dropDateFilter;
    private final ScanRunTracker scanRunTracker;
    private final Executor scanExecutor;

    public ScanLauncher(DomainScanService scanService,
                        DropDateFilter dropDateFilter,
                        ScanRunTracker scanRunTracker,
                        @Qualifier("scanExecutor") Executor scanExecutor) {
        this.scanService = scanService;
        this.dropDateFilter = dropDateFilter;
        this.scanRunTracker = scanRunTracker;
        this.scanExecutor = scanExecutor;
    }

    /**
     * @return the RUNNING snapshot of the newly started scan
     * @throws ScanAlreadyRunningException if another scan is in flight
     */
    public ScanRun start(ScanOptions options) {
        LocalDate targetDate = options.getTargetDate() != null
                ? options.getTargetDate()
                : dropDateFilter.defaultTargetDate();
        ScanOptions resolved = options.withTargetDate(targetDate);

        ScanRun run = scanRunTracker.tryStart(targetDate);
        try {
            scanExecutor.execute(() -> runScan(run, resolved));
        } catch (RejectedExecutionException e) {
            scanRunTracker.fail(run.getRunId(), "Scan could not be started: " + e.getMessage());
            throw e;
        }
        return run;
    }

    private void runScan(ScanRun run, ScanOptions options) {
        try {
            ScanOutcome outcome = scanService.scan(options);
            scanRunTracker.complete(run.getRunId(),
                    "Scan completed successfully: " + outcome.reported() + " domains reported");
        } catch (Exception e) {
            log.error("Scan for {} failed: {}", options.getTargetDate(), e.getMessage(), e);
            scanRunTracker.fail(run.getRunId(), "Scan failed: " + e.getMessage());
        }
    }
}
