package com.snapback.drop.service.index;

import com.snapback.drop.config.DropScannerProperties;
import com.snapback.drop.model.DomainCandidate;
import com.snapback.drop.model.IndexPresence;
import com.snapback.drop.model.IndexVerdict;
import com.snapback.drop.service.RequestPacer;
import com.snapback.drop.service.Sleeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Walks the ordered source chain for each domain until one source gives a
 * definitive answer. If every source abstains the verdict is UNKNOWN.
 *
 * Domains are probed one at a time with a fixed pause between consecutive
 * domains (not before the first, not after the last).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IndexSignalProber {

    private final List<IndexSignalSource> sources;
    private final DropScannerProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;

    public IndexVerdict probe(String domain, boolean useFallback) {
        String lastError = null;
        for (IndexSignalSource source : sources) {
            if (source.isFallback() && !useFallback) {
                continue;
            }
            IndexVerdict verdict = source.probe(domain);
            if (!verdict.isAbstained()) {
                return verdict;
            }
            lastError = source.id() + ": " + verdict.getError();
            log.debug("{} abstained for {} ({})", source.id(), domain, verdict.getError());
        }
        log.warn("No index source answered for {}; last error {}", domain, lastError);
        return IndexVerdict.unknown(lastError);
    }

    /**
     * Annotate every candidate in place, in order. Never drops a candidate.
     * Fallback sources are used only when both the caller and configuration allow them.
     */
    public List<DomainCandidate> probeAll(List<DomainCandidate> candidates, boolean useFallback) {
        RequestPacer pacer = new RequestPacer(properties.getIndex().getScanDelay(), clock, sleeper);
        boolean fallback = useFallback && properties.getIndex().isUseFallback();
        int present = 0;
        int unknown = 0;

        for (DomainCandidate candidate : candidates) {
            IndexVerdict verdict = pacer.pace(() -> probe(candidate.getName(), fallback));
            candidate.applyIndexVerdict(verdict);
            candidate.setCheckedAt(clock.instant());

            if (verdict.getIndexed() == IndexPresence.PRESENT) present++;
            if (verdict.getIndexed() == IndexPresence.UNKNOWN) unknown++;
        }

        log.info("Index signals: {} of {} domains have indexed content, {} unknown",
                present, candidates.size(), unknown);
        return candidates;
    }
}
