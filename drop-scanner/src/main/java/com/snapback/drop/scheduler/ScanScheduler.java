package com.snapback.drop.scheduler;

import com.snapback.drop.config.DropScannerProperties;
import com.snapback.drop.model.ScanOptions;
import com.snapback.drop.service.ScanAlreadyRunningException;
import com.snapback.drop.service.ScanLauncher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup scans.
 *
 * Default schedule: daily at 20:00 UTC, a few hours before the registry's
 * early-morning release, scanning tomorrow's drops.
 *
 * Override with CRON env var or drop-scanner.scheduling.cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScanScheduler {

    private final ScanLauncher scanLauncher;
    private final DropScannerProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, starting scan for tomorrow's drops");
            launch();
        } else if (properties.getScheduling().isEnabled()) {
            log.info("Scanner ready. Scheduled runs: {}", properties.getScheduling().getCron());
        } else {
            log.info("Scanner ready. Scheduled runs disabled");
        }
    }

    @Scheduled(cron = "${drop-scanner.scheduling.cron:0 0 20 * * *}", zone = "UTC")
    public void scheduledScan() {
        if (!properties.getScheduling().isEnabled()) {
            return;
        }
        log.info("Scheduled scan triggered");
        launch();
    }

    void launch() {
        try {
            scanLauncher.start(ScanOptions.defaults());
        } catch (ScanAlreadyRunningException e) {
            log.warn("Skipping scan: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Could not start scan: {}", e.getMessage(), e);
        }
    }
}
