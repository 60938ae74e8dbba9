package com.snapback.drop.service.index;

import com.snapback.drop.model.IndexVerdict;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrapes a search engine's result page for a {@code site:domain} query.
 *
 * The page is reduced to visible text with jsoup, then:
 *  1. any "no results" pattern ⇒ ABSENT
 *  2. first result-count pattern that matches ⇒ PRESENT with that count
 *  3. page has the engine's result container ⇒ PRESENT, count unknown
 *  4. anything else (consent wall, bot challenge) ⇒ abstain
 *
 * Patterns track the engines' current markup and will need updating when it changes.
 */
@Slf4j
public abstract class SearchResultPageSource implements IndexSignalSource {

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final String searchUrl;

    protected SearchResultPageSource(RestTemplate restTemplate, CircuitBreaker circuitBreaker, String searchUrl) {
        this.restTemplate = restTemplate;
        this.circuitBreaker = circuitBreaker;
        this.searchUrl = searchUrl;
    }

    protected abstract List<Pattern> noResultPatterns();

    /** Group 1 of each pattern must capture the count figure. */
    protected abstract List<Pattern> resultCountPatterns();

    /** CSS selector present only on a genuine results page */
    protected abstract String resultsContainerSelector();

    @Override
    public boolean isFallback() {
        return true;
    }

    @Override
    public IndexVerdict probe(String domain) {
        String html;
        try {
            html = circuitBreaker.executeSupplier(() -> fetchPage(domain));
        } catch (CallNotPermittedException e) {
            log.debug("{} circuit open, skipping {}", id(), domain);
            return IndexVerdict.abstain(id(), "circuit_open");
        } catch (Exception e) {
            log.warn("{} search failed for {}: {}", id(), domain, e.getMessage());
            return IndexVerdict.abstain(id(), e.getMessage());
        }
        return interpret(domain, html);
    }

    IndexVerdict interpret(String domain, String html) {
        if (html == null || html.isBlank()) {
            return IndexVerdict.abstain(id(), "empty_page");
        }
        Document document = Jsoup.parse(html);
        String text = document.text();

        for (Pattern pattern : noResultPatterns()) {
            if (pattern.matcher(text).find()) {
                log.debug("{} {}: no results", id(), domain);
                return IndexVerdict.absent(id());
            }
        }

        for (Pattern pattern : resultCountPatterns()) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                Integer count = parseCount(matcher.group(1));
                if (count != null) {
                    log.debug("{} {}: {} results", id(), domain, count);
                    return count == 0 ? IndexVerdict.absent(id()) : IndexVerdict.present(id(), count);
                }
            }
        }

        if (document.selectFirst(resultsContainerSelector()) != null) {
            return IndexVerdict.present(id(), null);
        }
        return IndexVerdict.abstain(id(), "unrecognised_page");
    }

    private String fetchPage(String domain) {
        URI uri = UriComponentsBuilder.fromHttpUrl(searchUrl)
                .queryParam("q", "site:" + domain)
                .build()
                .encode()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9");
        return restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class).getBody();
    }

    /** "About 1,230 results" / "Ungefär 1 230 resultat" → 1230 */
    static Integer parseCount(String figure) {
        if (figure == null) {
            return null;
        }
        String digits = figure.replaceAll("[^0-9]", "");
        if (digits.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }
}
