package com.kotsin.optionsengine.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the strategy sweep and the fallback price poller.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {
}
