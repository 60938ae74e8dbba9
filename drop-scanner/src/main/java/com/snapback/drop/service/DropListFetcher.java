package com.snapback.drop.service;

import com.snapback.drop.config.DropScannerProperties;
import com.snapback.drop.model.DropListResponse;
import com.snapback.drop.model.DropRecord;
import com.snapback.drop.model.Namespace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Thin client over the Internetstiftelsen drop-list feeds, one JSON document per TLD.
 *
 * A failing feed yields an empty list so that one namespace's outage never
 * blocks the other. No retries; the next scan simply asks again.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DropListFetcher {

    private final RestTemplate restTemplate;
    private final DropScannerProperties properties;

    /**
     * @return every entry of the namespace's drop list, empty on any failure
     */
    public List<DropRecord> fetch(Namespace namespace) {
        String url = properties.getSources().urlFor(namespace);
        log.debug("Fetching .{} drop list from {}", namespace.label(), url);

        DropListResponse response;
        try {
            response = restTemplate.getForObject(URI.create(url), DropListResponse.class);
        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("Could not fetch .{} drop list from {}: {}", namespace.label(), url, e.getMessage());
            return List.of();
        }

        if (response == null || response.getData() == null) {
            log.warn("Empty .{} drop list response from {}", namespace.label(), url);
            return List.of();
        }

        List<DropRecord> records = new ArrayList<>();
        int malformed = 0;
        for (DropListResponse.Entry entry : response.getData()) {
            DropRecord record = toRecord(entry, namespace);
            if (record == null) {
                malformed++;
                continue;
            }
            records.add(record);
        }

        log.info(".{} drop list: {} entries, {} malformed skipped", namespace.label(), records.size(), malformed);
        return records;
    }

    private DropRecord toRecord(DropListResponse.Entry entry, Namespace namespace) {
        if (entry == null || entry.getName() == null || entry.getName().isBlank() || entry.getReleaseAt() == null) {
            return null;
        }
        try {
            return DropRecord.builder()
                    .name(entry.getName().trim().toLowerCase(Locale.ROOT))
                    .releaseDate(LocalDate.parse(entry.getReleaseAt().trim()))
                    .namespace(namespace)
                    .build();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
