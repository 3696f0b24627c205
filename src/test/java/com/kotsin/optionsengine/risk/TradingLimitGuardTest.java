package com.kotsin.optionsengine.risk;

import com.kotsin.optionsengine.model.EntryOutcome;
import com.kotsin.optionsengine.model.ExitReason;
import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.LimitStatus;
import com.kotsin.optionsengine.model.OptionLeg;
import com.kotsin.optionsengine.model.PositionSnapshot;
import com.kotsin.optionsengine.model.PriceChannel;
import com.kotsin.optionsengine.model.StrategyKind;
import com.kotsin.optionsengine.model.TradeRecord;
import com.kotsin.optionsengine.support.EngineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TradingLimitGuard
 */
class TradingLimitGuardTest {

    private static final InstrumentKey NIFTY_CALL = InstrumentKey.of(IndexName.NIFTY, OptionLeg.CALL);

    private final EngineFixture fx = new EngineFixture(EngineFixture.MIDDAY);

    @Test
    @DisplayName("Fresh session allows entries")
    void testFreshSession() {
        LimitStatus status = fx.limits.status();
        assertTrue(fx.limits.isEntryAllowed());
        assertEquals(0, status.getTradesToday());
        assertEquals(40, status.getMaxTradesPerDay());
        assertEquals(5000.0, status.getMaxDailyLoss(), 1e-9);
    }

    @Test
    @DisplayName("A 5100 loss on 100000 capital stops all entries until the next day")
    void testDailyLossLimit() {
        fx.marketData.updatePrice(IndexName.NIFTY, PriceChannel.CALL, 100.0, 10L, EngineFixture.MIDDAY);
        assertEquals(EntryOutcome.ENTERED, fx.engine.enterTrade(NIFTY_CALL, StrategyKind.REGULAR));
        PositionSnapshot position = fx.store.snapshot(NIFTY_CALL);
        assertEquals(1000, position.getQuantity());
        assertEquals(99.0, position.getStopLoss(), 1e-9);

        // next tick hits the stop
        fx.marketData.updatePrice(IndexName.NIFTY, PriceChannel.CALL, 94.9, 10L, EngineFixture.MIDDAY);

        TradeRecord loss = fx.closedTrades.get(0);
        assertEquals(ExitReason.STOP_LOSS, loss.getExitReason());
        assertEquals(-5100.0, loss.getPnl(), 1e-6);

        LimitStatus status = fx.limits.status();
        assertTrue(status.isLossCapReached());
        assertFalse(fx.limits.isEntryAllowed());
        for (InstrumentKey key : InstrumentKey.all()) {
            for (StrategyKind kind : StrategyKind.values()) {
                assertFalse(fx.engine.shouldEnterTrade(key, kind), key + " " + kind);
            }
        }
        assertEquals(EntryOutcome.DAILY_LIMIT, fx.engine.enterTrade(NIFTY_CALL, StrategyKind.REGULAR),
                "Manual entries obey the limit too");

        fx.clock.advance(Duration.ofDays(1));
        assertTrue(fx.limits.isEntryAllowed());
        assertEquals(EntryOutcome.ENTERED, fx.engine.enterTrade(NIFTY_CALL, StrategyKind.REGULAR));
    }

    @Test
    @DisplayName("Trade count limit blocks entries once reached")
    void testTradeCountLimit() {
        fx.risk.setMaxTradesPerDay(2);
        fx.appendLeg(NIFTY_CALL, 100.0);
        fx.appendLeg(InstrumentKey.of(IndexName.NIFTY, OptionLeg.PUT), 80.0);

        assertEquals(EntryOutcome.ENTERED, fx.engine.enterTrade(NIFTY_CALL, StrategyKind.REGULAR));
        fx.engine.exitTrade(NIFTY_CALL, ExitReason.MANUAL);
        assertEquals(EntryOutcome.ENTERED, fx.engine.enterTrade(NIFTY_CALL, StrategyKind.REGULAR));

        LimitStatus status = fx.limits.status();
        assertTrue(status.isTradeCapReached());
        assertFalse(status.isLossCapReached());
        assertFalse(fx.limits.isEntryAllowed());
        assertEquals(EntryOutcome.DAILY_LIMIT,
                fx.engine.enterTrade(InstrumentKey.of(IndexName.NIFTY, OptionLeg.PUT), StrategyKind.REGULAR));
    }

    @Test
    @DisplayName("Limits changed at runtime apply to the next decision")
    void testRuntimeChange() {
        fx.risk.setMaxTradesPerDay(0);
        assertFalse(fx.limits.isEntryAllowed());
        fx.risk.setMaxTradesPerDay(5);
        assertTrue(fx.limits.isEntryAllowed());
    }
}
