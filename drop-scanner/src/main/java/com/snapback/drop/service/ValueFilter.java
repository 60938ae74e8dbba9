package com.snapback.drop.service;

import com.snapback.drop.config.DropScannerProperties;
import com.snapback.drop.model.DomainCandidate;
import com.snapback.drop.model.IndexPresence;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Keeps indexed domains whose page count meets the configured minimum.
 * A missing count does not fail the threshold; ABSENT and UNKNOWN always go.
 */
@Component
@RequiredArgsConstructor
public class ValueFilter {

    private final DropScannerProperties properties;

    public List<DomainCandidate> filter(List<DomainCandidate> candidates) {
        int minPages = properties.getFilter().getMinIndexedPages();
        return candidates.stream()
                .filter(c -> c.getIndexed() == IndexPresence.PRESENT)
                .filter(c -> c.getEstimatedPages() == null || c.getEstimatedPages() >= minPages)
                .toList();
    }
}
