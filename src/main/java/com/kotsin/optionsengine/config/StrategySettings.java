package com.kotsin.optionsengine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "engine.strategy")
public class StrategySettings {

    private int regularMaxHoldingMinutes = 10;
    private int scalpingMaxHoldingMinutes = 5;
    private int momentumMaxHoldingMinutes = 3;
    private int patternMaxHoldingMinutes = 4;
    private Expiry expiry = new Expiry();

    /** Thresholds of the expiry-day scalping variant. */
    @Data
    public static class Expiry {
        private int minDirection = 2;
        private double minStrength = 1.0;
        private double minVolatility = 0.05;
        private double maxVolatility = 1.0;
        private int maxHoldingMinutes = 3;
        private double riskRewardMultiplier = 2.5;
    }
}
