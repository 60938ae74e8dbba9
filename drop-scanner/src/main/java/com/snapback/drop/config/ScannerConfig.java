package com.snapback.drop.config;

import com.snapback.drop.service.Sleeper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
public class ScannerConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, DropScannerProperties properties) {
        DropScannerProperties.Http http = properties.getHttp();
        return builder
                .setConnectTimeout(http.getConnectTimeout())
                .setReadTimeout(http.getReadTimeout())
                .defaultHeader(HttpHeaders.USER_AGENT, http.getUserAgent())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    /**
     * Breakers for the search-engine sources. Bot challenges show up as
     * failures, so a tripped breaker stops hammering the engine for a while.
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(DropScannerProperties properties) {
        DropScannerProperties.Index.Search search = properties.getIndex().getSearch();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(search.getFailureRateThreshold())
                .minimumNumberOfCalls(search.getMinimumCalls())
                .slidingWindowSize(Math.max(search.getMinimumCalls(), 10))
                .waitDurationInOpenState(search.getOpenDuration())
                .build();
        return CircuitBreakerRegistry.of(config);
    }

    /** One daemon thread per scan; the run guard keeps it to one at a time. */
    @Bean
    public Executor scanExecutor() {
        return runnable -> {
            Thread worker = new Thread(runnable, "drop-scan-worker");
            worker.setDaemon(true);
            worker.start();
        };
    }
}
