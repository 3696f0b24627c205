package com.kotsin.optionsengine.strategy;

import com.kotsin.optionsengine.analysis.PatternDetector;
import com.kotsin.optionsengine.analysis.PatternScoreService;
import com.kotsin.optionsengine.config.StrategySettings;
import com.kotsin.optionsengine.model.ExitReason;
import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.PatternScore;
import com.kotsin.optionsengine.model.PositionSnapshot;
import com.kotsin.optionsengine.model.StrategyKind;
import com.kotsin.optionsengine.service.TradingHoursService;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Enters on a qualifying chart pattern; the target scales with pattern quality.
 */
@Component
public class PatternScalpingStrategy extends AbstractScalpingStrategy {

    static final double MIN_VOLATILITY = 0.05;
    static final double MAX_VOLATILITY = 0.5;
    static final double BASE_RISK_REWARD = 1.8;

    private final PatternScoreService patternScores;
    private final StrategySettings settings;

    public PatternScalpingStrategy(TradingHoursService tradingHours, PatternScoreService patternScores,
                                   StrategySettings settings) {
        super(tradingHours);
        this.patternScores = patternScores;
        this.settings = settings;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.PATTERN_SCALP;
    }

    @Override
    public boolean shouldEnter(StrategyContext context) {
        PatternScore score = context.getPatternScore();
        return score != null
                && score.hasPattern()
                && score.getQuality() >= PatternDetector.MIN_PATTERN_QUALITY
                && volatilityBetween(context, MIN_VOLATILITY, MAX_VOLATILITY)
                && outsideEdgeWindows(context);
    }

    @Override
    public Optional<ExitReason> earlyExit(StrategyContext context, PositionSnapshot position) {
        if (patternScores.isInvalidated(context.getKey())) {
            return Optional.of(ExitReason.PATTERN_INVALIDATION);
        }
        return scalpExit(context, position);
    }

    @Override
    public double targetMultiplier(StrategyContext context) {
        PatternScore score = context.getPatternScore();
        double quality = score == null ? 0.0 : score.getQuality();
        return BASE_RISK_REWARD * quality;
    }

    @Override
    public int maxHoldingMinutes(InstrumentKey key) {
        return settings.getPatternMaxHoldingMinutes();
    }
}
