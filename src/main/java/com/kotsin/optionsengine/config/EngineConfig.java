package com.kotsin.optionsengine.config;

import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties({RiskSettings.class, StrategySettings.class, MarketDataSettings.class})
public class EngineConfig {

    public static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    /** Every "now" in the engine is read from this clock. */
    @Bean
    public Clock engineClock() {
        return Clock.system(IST);
    }

    @Bean
    public OkHttpClient priceHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(2))
                .readTimeout(Duration.ofSeconds(3))
                .build();
    }
}
