package com.snapback.drop.config;

import com.snapback.drop.model.ScanOptions;
import com.snapback.drop.model.ScanRun;
import com.snapback.drop.service.ScanLauncher;
import com.snapback.drop.service.ScanRunTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ScanController {

    private final ScanLauncher scanLauncher;
    private final ScanRunTracker scanRunTracker;

    /**
     * Start a scan on a background worker and return immediately.
     *
     * POST /api/scan/start  {"date": "2026-01-11"}
     *
     * 409 when a scan is already running; poll /api/scan/status and retry.
     */
    @PostMapping("/api/scan/start")
    public ResponseEntity<?> start(@RequestBody(required = false) ScanRequest request) {
        ScanRequest body = request == null ? new ScanRequest() : request;

        LocalDate targetDate;
        try {
            targetDate = body.getDate() == null || body.getDate().isBlank() ? null : LocalDate.parse(body.getDate());
        } catch (DateTimeParseException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "date must be YYYY-MM-DD"));
        }

        ScanOptions defaults = ScanOptions.defaults();
        ScanOptions options = ScanOptions.builder()
                .targetDate(targetDate)
                .checkAvailability(orDefault(body.getCheckAvailability(), defaults.isCheckAvailability()))
                .checkIndex(orDefault(body.getCheckIndex(), defaults.isCheckIndex()))
                .filterValuable(orDefault(body.getFilterValuable(), defaults.isFilterValuable()))
                .dryRun(orDefault(body.getDryRun(), defaults.isDryRun()))
                .useFallback(orDefault(body.getUseFallback(), defaults.isUseFallback()))
                .build();

        ScanRun run = scanLauncher.start(options);
        log.info("Scan accepted for {}", run.getTargetDate());
        return ResponseEntity.accepted().body(Map.of("message", "Scan started", "status", run));
    }

    @GetMapping("/api/scan/status")
    public ResponseEntity<ScanRun> status() {
        return ResponseEntity.ok(scanRunTracker.current());
    }

    private boolean orDefault(Boolean value, boolean fallback) {
        return value == null ? fallback : value;
    }
}
