package com.kotsin.optionsengine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "engine.market")
public class MarketDataSettings {

    /** Oldest points beyond this count are dropped from each series. */
    private int maxHistoryPoints = 5000;
    private Fallback fallback = new Fallback();

    @Data
    public static class Fallback {
        private boolean enabled = false;
        private String baseUrl = "http://localhost:8208";
        private long staleAfterSeconds = 10;
    }
}
