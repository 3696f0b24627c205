package com.kotsin.optionsengine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Intraday options scalping engine for NIFTY, BANKNIFTY and SENSEX.
 * <p>
 * Consumes spot and option premium ticks, keeps per-leg signals and market state, runs the
 * regular and scalping strategies and publishes every closed trade.
 */
@SpringBootApplication
@Slf4j
public class OptionsEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptionsEngineApplication.class, args);
        log.info("🚀 Kotsin Options Scalping Engine started");
    }
}
