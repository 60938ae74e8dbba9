package com.snapback.drop.config;

import com.snapback.drop.model.Namespace;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "drop-scanner")
@Data
public class DropScannerProperties {

    private Sources sources = new Sources();
    private Http http = new Http();
    private Dns dns = new Dns();
    private Index index = new Index();
    private Filter filter = new Filter();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Sources {
        private String seUrl = "https://data.internetstiftelsen.se/bardate_domains.json";
        private String nuUrl = "https://data.internetstiftelsen.se/bardate_domains_nu.json";

        public String urlFor(Namespace namespace) {
            return switch (namespace) {
                case SE -> seUrl;
                case NU -> nuUrl;
            };
        }
    }

    @Data
    public static class Http {
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Dns {
        private Duration timeout = Duration.ofSeconds(3);
        private List<String> recordTypes = new ArrayList<>(List.of("A", "AAAA", "NS", "MX"));
        /** Resolver host; blank uses the system resolver */
        private String server = "";
    }

    @Data
    public static class Index {
        /** Pause between two consecutive per-domain index probes */
        private Duration scanDelay = Duration.ofMillis(2500);
        private boolean useFallback = true;
        private Archive archive = new Archive();
        private Search search = new Search();

        @Data
        public static class Archive {
            private String cdxUrl = "http://web.archive.org/cdx/search/cdx";
            private int rowLimit = 500;
        }

        @Data
        public static class Search {
            private String googleUrl = "https://www.google.com/search";
            private String bingUrl = "https://www.bing.com/search";
            private float failureRateThreshold = 50;
            private int minimumCalls = 4;
            private Duration openDuration = Duration.ofMinutes(10);
        }
    }

    @Data
    public static class Filter {
        /** Inclusive lower bound on estimated pages */
        private int minIndexedPages = 1;
    }

    @Data
    public static class Output {
        private String reportDir = "reports";
        private boolean includeHeader = true;
    }

    @Data
    public static class Scheduling {
        private boolean enabled = false;
        private String cron = "0 0 20 * * *";
        private boolean runOnStartup = false;
    }
}
