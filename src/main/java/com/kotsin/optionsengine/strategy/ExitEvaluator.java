package com.kotsin.optionsengine.strategy;

import com.kotsin.optionsengine.model.ExitReason;
import com.kotsin.optionsengine.model.PositionSnapshot;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Exit rules common to every variant: stop, target, the strategy's own early exit, then
 * the holding-time limit.
 */
@Component
public class ExitEvaluator {

    public Optional<ExitReason> evaluate(StrategyContext context, PositionSnapshot position, TradingStrategy strategy) {
        if (!position.isActive()) {
            return Optional.empty();
        }
        double price = context.getPrice();
        if (price <= position.getStopLoss()) {
            return Optional.of(ExitReason.STOP_LOSS);
        }
        if (price >= position.getTarget()) {
            return Optional.of(ExitReason.TARGET);
        }
        Optional<ExitReason> early = strategy.earlyExit(context, position);
        if (early.isPresent()) {
            return early;
        }
        if (position.minutesHeld(context.getNow()) >= strategy.maxHoldingMinutes(context.getKey())) {
            return Optional.of(ExitReason.TIME_EXIT);
        }
        return Optional.empty();
    }
}
