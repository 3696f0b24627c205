package com.kotsin.optionsengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Central sink for recoverable failures: logs them, counts them per area and feeds the
 * sweep error metric.
 */
@Service
@Slf4j
public class ErrorMonitoringService {

    private final EngineMetrics metrics;
    private final Map<String, AtomicLong> errorCounts = new ConcurrentHashMap<>();

    public ErrorMonitoringService(EngineMetrics metrics) {
        this.metrics = metrics;
    }

    public void recordError(String area, String message, Throwable t) {
        errorCounts.computeIfAbsent(area, a -> new AtomicLong()).incrementAndGet();
        metrics.recordSweepError(area);
        log.error("🚨 Error area={} msg={}", area, message, t);
    }

    public Map<String, Long> errorCounts() {
        Map<String, Long> out = new TreeMap<>();
        errorCounts.forEach((area, count) -> out.put(area, count.get()));
        return out;
    }
}
