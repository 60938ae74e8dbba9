package com.snapback.drop.service.index;

import com.snapback.drop.config.DropScannerProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.regex.Pattern;

@Component
@Order(2)
public class GoogleSearchSource extends SearchResultPageSource {

    public static final String ID = "google";

    private static final List<Pattern> NO_RESULTS = List.of(
            Pattern.compile("did not match any documents", Pattern.CASE_INSENSITIVE),
            Pattern.compile("matchade inte några dokument", Pattern.CASE_INSENSITIVE),
            Pattern.compile("No results found for", Pattern.CASE_INSENSITIVE)
    );

    private static final List<Pattern> RESULT_COUNTS = List.of(
            Pattern.compile("About ([\\d][\\d,.\\s\\u00a0]*) results?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Ungefär ([\\d][\\d,.\\s\\u00a0]*) resultat", Pattern.CASE_INSENSITIVE),
            Pattern.compile("([\\d][\\d,.\\u00a0]*) results?", Pattern.CASE_INSENSITIVE)
    );

    public GoogleSearchSource(RestTemplate restTemplate, CircuitBreakerRegistry circuitBreakerRegistry,
                              DropScannerProperties properties) {
        super(restTemplate, circuitBreakerRegistry.circuitBreaker(ID), properties.getIndex().getSearch().getGoogleUrl());
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    protected List<Pattern> noResultPatterns() {
        return NO_RESULTS;
    }

    @Override
    protected List<Pattern> resultCountPatterns() {
        return RESULT_COUNTS;
    }

    @Override
    protected String resultsContainerSelector() {
        return "#search, #rso, #result-stats";
    }
}
