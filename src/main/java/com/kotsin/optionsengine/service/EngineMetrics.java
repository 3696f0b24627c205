package com.kotsin.optionsengine.service;

import com.kotsin.optionsengine.model.ExitReason;
import com.kotsin.optionsengine.model.StrategyKind;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class EngineMetrics {

    private final MeterRegistry registry;
    private final Timer sweepLatency;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.sweepLatency = Timer.builder("engine.sweep.latency")
                .description("Duration of one strategy sweep")
                .register(registry);
    }

    public void recordEntry(StrategyKind kind) {
        registry.counter("engine.entries", "strategy", kind.name()).increment();
    }

    public void recordExit(StrategyKind kind, ExitReason reason) {
        registry.counter("engine.exits", "strategy", kind.name(), "reason", reason.name()).increment();
    }

    public void recordSweepError(String area) {
        registry.counter("engine.sweep.errors", "area", area).increment();
    }

    public void recordSweep(long nanos) {
        sweepLatency.record(nanos, TimeUnit.NANOSECONDS);
    }
}
