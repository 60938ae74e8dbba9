package com.snapback.drop.service.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.snapback.drop.config.DropScannerProperties;
import com.snapback.drop.model.IndexVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Counts distinct archived URLs under a domain using the Wayback Machine CDX API.
 *
 * Free, unauthenticated and not bot-challenged, which is why it leads the chain.
 * Response is a JSON array of rows; the first row is the header ["urlkey"],
 * each further row holds one collapsed urlkey. Capped at the configured row limit.
 */
@Component
@Order(1)
@Slf4j
@RequiredArgsConstructor
public class WaybackCdxSource implements IndexSignalSource {

    public static final String ID = "archive";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final DropScannerProperties properties;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean isFallback() {
        return false;
    }

    @Override
    public IndexVerdict probe(String domain) {
        DropScannerProperties.Index.Archive archive = properties.getIndex().getArchive();
        URI uri = UriComponentsBuilder.fromHttpUrl(archive.getCdxUrl())
                .queryParam("url", "*." + domain)
                .queryParam("matchType", "domain")
                .queryParam("output", "json")
                .queryParam("fl", "urlkey")
                .queryParam("collapse", "urlkey")
                .queryParam("limit", archive.getRowLimit())
                .build()
                .encode()
                .toUri();

        try {
            String body = restTemplate.getForObject(uri, String.class);
            int pages = countDistinctUrls(body, archive.getRowLimit());
            log.debug("CDX {} -> {} distinct urls", domain, pages);
            return pages == 0 ? IndexVerdict.absent(ID) : IndexVerdict.present(ID, pages);
        } catch (Exception e) {
            log.warn("CDX lookup failed for {}: {}", domain, e.getMessage());
            return IndexVerdict.abstain(ID, e.getMessage());
        }
    }

    private int countDistinctUrls(String body, int rowLimit) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return 0;
        }
        JsonNode rows = objectMapper.readTree(body);
        if (!rows.isArray()) {
            throw new IllegalStateException("CDX response is not a JSON array");
        }

        Set<String> urls = new HashSet<>();
        // Row 0 is the header
        for (int i = 1; i < rows.size() && urls.size() < rowLimit; i++) {
            JsonNode row = rows.get(i);
            String key = row.isArray() && row.size() > 0 ? row.get(0).asText() : row.asText();
            if (key != null && !key.isBlank()) {
                urls.add(key.trim().toLowerCase(Locale.ROOT));
            }
        }
        return urls.size();
    }
}
