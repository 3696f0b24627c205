package com.kotsin.optionsengine.analysis;

import com.kotsin.optionsengine.model.OptionLeg;
import com.kotsin.optionsengine.model.PatternDescriptor;
import com.kotsin.optionsengine.model.PatternType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Stateless chart-pattern recognition over a leg's recent prices.
 * <p>
 * Double bottom/top quality adds the peak (trough) height and the recovery (decline) after
 * the second extreme, both in percent, to a 0.5 base. Engulfing quality scales the relative
 * jump by 50 and may be boosted by rising volume.
 */
@Component
public class PatternDetector {

    public static final int LOOKBACK = 20;
    public static final double MIN_PATTERN_QUALITY = 0.75;
    static final double EXTREME_TOLERANCE = 0.005;
    static final double ENGULFING_SCALE = 50.0;
    static final double VOLUME_BOOST = 0.2;

    public List<PatternMatch> detect(OptionLeg leg, double[] prices, double[] volumes) {
        List<PatternMatch> matches = new ArrayList<>(2);
        if (leg == OptionLeg.CALL) {
            matches.add(doubleBottom(prices));
            matches.add(bullishEngulfing(prices, volumes));
        } else {
            matches.add(doubleTop(prices));
            matches.add(bearishEngulfing(prices, volumes));
        }
        return matches;
    }

    public PatternMatch doubleBottom(double[] prices) {
        if (prices.length < LOOKBACK) {
            return PatternMatch.NONE;
        }
        double[] w = lastWindow(prices);
        List<Integer> minima = new ArrayList<>();
        for (int i = 1; i < w.length - 1; i++) {
            if (w[i] < w[i - 1] && w[i] < w[i + 1]) {
                minima.add(i);
            }
        }
        if (minima.size() < 2) {
            return PatternMatch.NONE;
        }
        int first = minima.get(minima.size() - 2);
        int second = minima.get(minima.size() - 1);
        double m1 = w[first];
        double m2 = w[second];
        if (m1 <= 0 || Math.abs(m1 - m2) / m1 > EXTREME_TOLERANCE) {
            return PatternMatch.NONE;
        }
        double peak = max(w, first, second);
        if (peak <= m1 || peak <= m2 || second + 1 >= w.length) {
            return PatternMatch.NONE;
        }
        double recovery = (w[w.length - 1] - m2) / m2;
        if (recovery <= 0) {
            return PatternMatch.NONE;
        }
        double peakHeight = (peak - m1) / m1;
        double quality = Math.min(0.5 + peakHeight * 100.0 + recovery * 100.0, 1.0);
        return PatternMatch.of(PatternDescriptor.builder()
                .type(PatternType.DOUBLE_BOTTOM)
                .quality(quality)
                .firstExtreme(m1)
                .secondExtreme(m2)
                .interveningLevel(peak)
                .moveRatio(recovery)
                .build());
    }

    public PatternMatch doubleTop(double[] prices) {
        if (prices.length < LOOKBACK) {
            return PatternMatch.NONE;
        }
        double[] w = lastWindow(prices);
        List<Integer> maxima = new ArrayList<>();
        for (int i = 1; i < w.length - 1; i++) {
            if (w[i] > w[i - 1] && w[i] > w[i + 1]) {
                maxima.add(i);
            }
        }
        if (maxima.size() < 2) {
            return PatternMatch.NONE;
        }
        int first = maxima.get(maxima.size() - 2);
        int second = maxima.get(maxima.size() - 1);
        double m1 = w[first];
        double m2 = w[second];
        if (m1 <= 0 || Math.abs(m1 - m2) / m1 > EXTREME_TOLERANCE) {
            return PatternMatch.NONE;
        }
        double trough = min(w, first, second);
        if (trough >= m1 || trough >= m2 || second + 1 >= w.length) {
            return PatternMatch.NONE;
        }
        double decline = (m2 - w[w.length - 1]) / m2;
        if (decline <= 0) {
            return PatternMatch.NONE;
        }
        double troughDepth = (m1 - trough) / m1;
        double quality = Math.min(0.5 + troughDepth * 100.0 + decline * 100.0, 1.0);
        return PatternMatch.of(PatternDescriptor.builder()
                .type(PatternType.DOUBLE_TOP)
                .quality(quality)
                .firstExtreme(m1)
                .secondExtreme(m2)
                .interveningLevel(trough)
                .moveRatio(decline)
                .build());
    }

    public PatternMatch bullishEngulfing(double[] prices, double[] volumes) {
        if (prices.length < 2) {
            return PatternMatch.NONE;
        }
        double previous = prices[prices.length - 2];
        double current = prices[prices.length - 1];
        if (previous <= 0 || current <= previous) {
            return PatternMatch.NONE;
        }
        double jump = (current - previous) / previous;
        return engulfing(PatternType.BULLISH_ENGULFING, previous, current, jump, volumes);
    }

    public PatternMatch bearishEngulfing(double[] prices, double[] volumes) {
        if (prices.length < 2) {
            return PatternMatch.NONE;
        }
        double previous = prices[prices.length - 2];
        double current = prices[prices.length - 1];
        if (previous <= 0 || current >= previous) {
            return PatternMatch.NONE;
        }
        double drop = (previous - current) / previous;
        return engulfing(PatternType.BEARISH_ENGULFING, previous, current, drop, volumes);
    }

    private PatternMatch engulfing(PatternType type, double previous, double current, double move, double[] volumes) {
        double quality = Math.min(0.5 + ENGULFING_SCALE * move, 1.0);
        if (volumes != null && volumes.length >= 2) {
            double prevVolume = volumes[volumes.length - 2];
            double curVolume = volumes[volumes.length - 1];
            if (prevVolume > 0 && curVolume > prevVolume) {
                double ratio = curVolume / prevVolume;
                quality = Math.min(quality * (1 + (ratio - 1) * VOLUME_BOOST), 1.0);
            }
        }
        return PatternMatch.of(PatternDescriptor.builder()
                .type(type)
                .quality(quality)
                .firstExtreme(previous)
                .secondExtreme(current)
                .interveningLevel(previous)
                .moveRatio(move)
                .build());
    }

    private static double[] lastWindow(double[] prices) {
        double[] w = new double[LOOKBACK];
        System.arraycopy(prices, prices.length - LOOKBACK, w, 0, LOOKBACK);
        return w;
    }

    private static double max(double[] w, int from, int to) {
        double m = w[from];
        for (int i = from; i <= to; i++) {
            m = Math.max(m, w[i]);
        }
        return m;
    }

    private static double min(double[] w, int from, int to) {
        double m = w[from];
        for (int i = from; i <= to; i++) {
            m = Math.min(m, w[i]);
        }
        return m;
    }
}
