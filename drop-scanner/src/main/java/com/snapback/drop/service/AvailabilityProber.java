package com.snapback.drop.service;

import com.snapback.drop.config.DropScannerProperties;
import com.snapback.drop.model.Availability;
import com.snapback.drop.model.DomainCandidate;
import com.snapback.drop.service.dns.DnsLookupClient;
import com.snapback.drop.service.dns.DnsOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Approximates registration state from DNS.
 *
 * Record types are tried in configured order (A, AAAA, NS, MX by default).
 * Any answer, or an empty answer for an existing name, means REGISTERED.
 * NXDOMAIN, no-nameserver and timeout outcomes are inconclusive for that type;
 * when every type is inconclusive the domain is reported AVAILABLE.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AvailabilityProber {

    private final DnsLookupClient dnsLookupClient;
    private final DropScannerProperties properties;
    private final Clock clock;

    public Availability probe(String domain) {
        for (String recordType : properties.getDns().getRecordTypes()) {
            DnsOutcome outcome = dnsLookupClient.lookup(domain, recordType);
            if (outcome.provesExistence()) {
                log.debug("{} {} -> {}: registered", domain, recordType, outcome);
                return Availability.REGISTERED;
            }
            log.debug("{} {} -> {}: inconclusive", domain, recordType, outcome);
        }
        // TODO: report UNKNOWN when every lookup timed out instead of AVAILABLE
        return Availability.AVAILABLE;
    }

    /**
     * Annotate every candidate in place. Order and count are preserved.
     */
    public List<DomainCandidate> probeAll(List<DomainCandidate> candidates) {
        int available = 0;
        for (DomainCandidate candidate : candidates) {
            candidate.setAvailable(probe(candidate.getName()));
            candidate.setCheckedAt(clock.instant());
            if (candidate.getAvailable() == Availability.AVAILABLE) {
                available++;
            }
        }
        log.info("Availability: {} of {} domains appear available", available, candidates.size());
        return candidates;
    }
}
