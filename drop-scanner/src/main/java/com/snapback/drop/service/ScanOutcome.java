package com.snapback.drop.service;

import com.snapback.drop.model.Report;
import com.snapback.drop.output.ReportPaths;

import java.time.LocalDate;

/**
 * Result of one pipeline run. {@code paths} is null for dry runs.
 */
public record ScanOutcome(LocalDate targetDate, int dropping, Report report, ReportPaths paths) {

    public int reported() {
        return report.getTotalDomains();
    }
}
