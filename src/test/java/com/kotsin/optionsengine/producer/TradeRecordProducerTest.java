package com.kotsin.optionsengine.producer;

import com.kotsin.optionsengine.model.ExitReason;
import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.OptionLeg;
import com.kotsin.optionsengine.model.StrategyKind;
import com.kotsin.optionsengine.model.TradeRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TradeRecordProducer
 */
class TradeRecordProducerTest {

    private final TradeRecord record = TradeRecord.builder()
            .id("NIFTY_CALL-1")
            .index(IndexName.NIFTY)
            .leg(OptionLeg.CALL)
            .strategyKind(StrategyKind.REGULAR)
            .entryPrice(100.0)
            .exitPrice(102.0)
            .quantity(1000)
            .pnl(2000.0)
            .exitReason(ExitReason.TARGET)
            .build();

    @Test
    @DisplayName("Disabled producer skips publishing")
    void testDisabled() {
        TradeRecordProducer producer = new TradeRecordProducer(null, "option-trade-records", false);
        assertFalse(producer.publish(record));
    }

    @Test
    @DisplayName("Send failure is contained and reported as not published")
    void testSendFailureContained() {
        // null template makes send fail inside the guarded block
        TradeRecordProducer producer = new TradeRecordProducer(null, "option-trade-records", true);
        assertFalse(producer.publish(record));
        assertDoesNotThrow(() -> producer.onTradeClosed(record));
    }
}
