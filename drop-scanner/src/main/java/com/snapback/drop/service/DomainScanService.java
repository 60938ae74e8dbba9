package com.snapback.drop.service;

import com.snapback.drop.model.DomainCandidate;
import com.snapback.drop.model.DropRecord;
import com.snapback.drop.model.Namespace;
import com.snapback.drop.model.Report;
import com.snapback.drop.model.ScanOptions;
import com.snapback.drop.output.ReportPaths;
import com.snapback.drop.output.ReportWriter;
import com.snapback.drop.service.index.IndexSignalProber;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the scan pipeline once:
 *
 *   fetch (.se, .nu) → date filter → availability → index signals → value filter → report
 *
 * Stages run strictly one after another on the calling thread. Probe stages
 * annotate candidates; filter stages only remove them. Ordering is only
 * changed by the report assembler.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DomainScanService {

    private final DropListFetcher dropListFetcher;
    private final DropDateFilter dropDateFilter;
    private final AvailabilityProber availabilityProber;
    private final IndexSignalProber indexSignalProber;
    private final ValueFilter valueFilter;
    private final ReportAssembler reportAssembler;
    private final ReportWriter reportWriter;
    private final Clock clock;

    public ScanOutcome scan(ScanOptions options) {
        LocalDate targetDate = options.getTargetDate() != null
                ? options.getTargetDate()
                : dropDateFilter.defaultTargetDate();
        log.info("Starting drop scan for {}", targetDate);

        // Step 1: drop lists for every namespace, narrowed to the target date
        List<DomainCandidate> candidates = new ArrayList<>();
        for (Namespace namespace : Namespace.values()) {
            List<DropRecord> dropping = dropDateFilter.selectByDate(dropListFetcher.fetch(namespace), targetDate);
            log.info(".{}: {} domains dropping on {}", namespace.label(), dropping.size(), targetDate);
            dropping.forEach(r -> candidates.add(DomainCandidate.from(r, clock.instant())));
        }
        int dropping = candidates.size();

        // Step 2: availability via DNS
        if (options.isCheckAvailability() && !candidates.isEmpty()) {
            availabilityProber.probeAll(candidates);
        }

        // Step 3: historical index signals, paced
        if (options.isCheckIndex() && !candidates.isEmpty()) {
            log.info("Checking index signals for {} domains, this may take a while", candidates.size());
            indexSignalProber.probeAll(candidates, options.isUseFallback());
        }

        // Step 4: keep valuable domains only
        List<DomainCandidate> reported = options.isFilterValuable()
                ? valueFilter.filter(candidates)
                : candidates;
        log.info("{} of {} domains pass the value filter", reported.size(), dropping);

        // Step 5: report
        Report report = reportAssembler.assemble(reported, clock.instant());
        ReportPaths paths = null;
        if (options.isDryRun()) {
            log.info("Dry run, report for {} not written", targetDate);
        } else {
            paths = reportWriter.write(report, targetDate);
        }

        log.info("Scan for {} complete\n{}", targetDate, reportAssembler.summarize(report));
        return new ScanOutcome(targetDate, dropping, report, paths);
    }
}
