package com.kotsin.optionsengine.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ErrorMonitoringService
 */
class ErrorMonitoringServiceTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ErrorMonitoringService service = new ErrorMonitoringService(new EngineMetrics(registry));

    @Test
    @DisplayName("Errors are counted per area and mirrored to the sweep error counter")
    void testRecordError() {
        service.recordError("sweep:NIFTY_CALL", "boom", new IllegalStateException("boom"));
        service.recordError("sweep:NIFTY_CALL", "boom again", new IllegalStateException("boom"));
        service.recordError("tick:SENSEX_PUT", "bad tick", null);

        Map<String, Long> counts = service.errorCounts();
        assertEquals(2, counts.size());
        assertEquals(2L, counts.get("sweep:NIFTY_CALL"));
        assertEquals(1L, counts.get("tick:SENSEX_PUT"));
        assertEquals(2.0, registry.counter("engine.sweep.errors", "area", "sweep:NIFTY_CALL").count());
    }
}
