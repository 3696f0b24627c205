package com.kotsin.optionsengine.analysis;

import com.kotsin.optionsengine.market.PriceHistoryStore;
import com.kotsin.optionsengine.market.PriceSeries;
import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.OptionLeg;
import com.kotsin.optionsengine.model.PatternScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the best qualifying pattern per leg.
 */
@Service
@Slf4j
public class PatternScoreService {

    private final PriceHistoryStore historyStore;
    private final PatternDetector detector;
    private final Map<InstrumentKey, PatternScore> scores = new ConcurrentHashMap<>();

    public PatternScoreService(PriceHistoryStore historyStore, PatternDetector detector) {
        this.historyStore = historyStore;
        this.detector = detector;
        for (InstrumentKey key : InstrumentKey.all()) {
            scores.put(key, PatternScore.NONE);
        }
    }

    /** Re-scores the leg; with fewer than 20 points the previous score stays. */
    public PatternScore update(InstrumentKey key) {
        PriceSeries series = historyStore.series(key.index(), key.leg().channel());
        if (series.size() < PatternDetector.LOOKBACK) {
            return score(key);
        }
        double[] prices = series.prices(PatternDetector.LOOKBACK);
        double[] volumes = series.volumes(PatternDetector.LOOKBACK);

        PatternMatch best = null;
        for (PatternMatch match : detector.detect(key.leg(), prices, volumes)) {
            if (match.found() && match.quality() >= PatternDetector.MIN_PATTERN_QUALITY
                    && (best == null || match.quality() > best.quality())) {
                best = match;
            }
        }
        PatternScore score = best == null ? PatternScore.NONE : PatternScore.of(best.descriptor());
        PatternScore previous = scores.put(key, score);
        if (score.hasPattern() && (previous == null || !score.equals(previous))) {
            log.info("🔍 [Pattern] {} {} quality={}", key, score.getPattern().getType(),
                    String.format("%.2f", score.getQuality()));
        }
        return score;
    }

    public PatternScore score(InstrumentKey key) {
        return scores.getOrDefault(key, PatternScore.NONE);
    }

    /**
     * True when an engulfing move against the leg's own pattern polarity has formed with
     * qualifying strength.
     */
    public boolean isInvalidated(InstrumentKey key) {
        PriceSeries series = historyStore.series(key.index(), key.leg().channel());
        double[] prices = series.prices(PatternDetector.LOOKBACK);
        double[] volumes = series.volumes(PatternDetector.LOOKBACK);
        PatternMatch opposite = key.leg() == OptionLeg.CALL
                ? detector.bearishEngulfing(prices, volumes)
                : detector.bullishEngulfing(prices, volumes);
        return opposite.found() && opposite.quality() >= PatternDetector.MIN_PATTERN_QUALITY;
    }

    public Map<InstrumentKey, PatternScore> snapshot() {
        Map<InstrumentKey, PatternScore> out = new LinkedHashMap<>();
        for (InstrumentKey key : InstrumentKey.all()) {
            out.put(key, score(key));
        }
        return out;
    }
}
