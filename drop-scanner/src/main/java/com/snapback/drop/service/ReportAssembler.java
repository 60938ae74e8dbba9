package com.snapback.drop.service;

import com.snapback.drop.model.DomainCandidate;
import com.snapback.drop.model.IndexPresence;
import com.snapback.drop.model.Report;
import com.snapback.drop.model.ReportRow;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Maps candidates to canonical report rows and fixes the one report order:
 * estimated pages descending (missing counts as 0), then domain ascending.
 */
@Component
public class ReportAssembler {

    static final Comparator<ReportRow> REPORT_ORDER = Comparator
            .comparingInt(ReportRow::pagesOrZero).reversed()
            .thenComparing(ReportRow::getDomain);

    private static final int SUMMARY_TOP = 5;

    public Report assemble(List<DomainCandidate> candidates, Instant generatedAt) {
        List<ReportRow> rows = candidates.stream()
                .map(this::toRow)
                .sorted(REPORT_ORDER)
                .toList();
        return new Report(generatedAt.toString(), rows.size(), rows);
    }

    /**
     * Plain-text digest of a report, logged at the end of each run.
     */
    public String summarize(Report report) {
        List<ReportRow> rows = report.getDomains();
        long indexed = rows.stream().filter(r -> r.getIndexed() == IndexPresence.PRESENT).count();
        List<ReportRow> withPages = rows.stream().filter(r -> r.getEstimatedPages() != null).toList();

        StringBuilder summary = new StringBuilder()
                .append("Domain Scan Summary\n")
                .append("==================\n")
                .append("Total domains scanned: ").append(rows.size()).append('\n')
                .append("Indexed in search engines: ").append(indexed).append('\n')
                .append("With page count data: ").append(withPages.size());

        withPages.stream()
                .mapToInt(ReportRow::getEstimatedPages)
                .max()
                .ifPresent(max -> summary.append("\nHighest page count: ").append(max));

        if (!rows.isEmpty()) {
            summary.append("\n\nTop domains by indexed pages:");
            rows.stream().limit(SUMMARY_TOP).forEach(r -> summary
                    .append("\n  - ").append(r.getDomain()).append(": ")
                    .append(r.getEstimatedPages() == null ? "?" : r.getEstimatedPages()).append(" pages"));
        }
        return summary.toString();
    }

    private ReportRow toRow(DomainCandidate c) {
        return ReportRow.builder()
                .domain(c.getName())
                .tld(c.getNamespace() == null ? "" : c.getNamespace().label())
                .releaseDate(c.getReleaseDate() == null ? "" : c.getReleaseDate().toString())
                .available(c.getAvailable())
                .indexed(c.getIndexed())
                .estimatedPages(c.getEstimatedPages())
                .indexSource(c.getIndexSource() == null ? "" : c.getIndexSource())
                .checkedAt(c.getCheckedAt() == null ? "" : c.getCheckedAt().toString())
                .build();
    }
}
