package com.kotsin.optionsengine.indicator;

import org.springframework.stereotype.Component;

/**
 * Textbook indicator math: Wilder RSI, EMA seeded with the first price, sample-deviation
 * Bollinger bands and a simple mean of close-to-close ranges for ATR.
 */
@Component
public class StandardIndicatorLibrary implements IndicatorLibrary {

    private static final double NEUTRAL_RSI = 50.0;

    @Override
    public double rsi(double[] prices, int period) {
        if (prices.length <= period) {
            return NEUTRAL_RSI;
        }
        double gain = 0.0;
        double loss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = prices[i] - prices[i - 1];
            if (change > 0) gain += change;
            else loss -= change;
        }
        double avgGain = gain / period;
        double avgLoss = loss / period;
        for (int i = period + 1; i < prices.length; i++) {
            double change = prices[i] - prices[i - 1];
            avgGain = (avgGain * (period - 1) + Math.max(change, 0.0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0.0)) / period;
        }
        if (avgLoss == 0.0) {
            return avgGain == 0.0 ? NEUTRAL_RSI : 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - 100.0 / (1.0 + rs);
    }

    @Override
    public MacdResult macd(double[] prices, int fastPeriod, int slowPeriod, int signalPeriod) {
        if (prices.length == 0) {
            return new MacdResult(0.0, 0.0, 0.0);
        }
        double[] fast = emaSeries(prices, fastPeriod);
        double[] slow = emaSeries(prices, slowPeriod);
        double[] line = new double[prices.length];
        for (int i = 0; i < prices.length; i++) {
            line[i] = fast[i] - slow[i];
        }
        double[] signal = emaSeries(line, signalPeriod);
        int last = prices.length - 1;
        return new MacdResult(line[last], signal[last], line[last] - signal[last]);
    }

    @Override
    public BollingerBands bollinger(double[] prices, int period, double stdDevs) {
        int n = Math.min(period, prices.length);
        if (n == 0) {
            return new BollingerBands(0.0, 0.0, 0.0);
        }
        double sum = 0.0;
        for (int i = prices.length - n; i < prices.length; i++) {
            sum += prices[i];
        }
        double mean = sum / n;
        double squares = 0.0;
        for (int i = prices.length - n; i < prices.length; i++) {
            double d = prices[i] - mean;
            squares += d * d;
        }
        double std = n > 1 ? Math.sqrt(squares / (n - 1)) : 0.0;
        return new BollingerBands(mean + stdDevs * std, mean, mean - stdDevs * std);
    }

    @Override
    public double ema(double[] prices, int period) {
        if (prices.length == 0) {
            return 0.0;
        }
        double[] series = emaSeries(prices, period);
        return series[series.length - 1];
    }

    @Override
    public double atr(double[] prices, int period) {
        if (prices.length < 2) {
            return 0.0;
        }
        int ranges = Math.min(period, prices.length - 1);
        double sum = 0.0;
        for (int i = prices.length - ranges; i < prices.length; i++) {
            sum += Math.abs(prices[i] - prices[i - 1]);
        }
        return sum / ranges;
    }

    private static double[] emaSeries(double[] values, int period) {
        double alpha = 2.0 / (period + 1);
        double[] out = new double[values.length];
        out[0] = values[0];
        for (int i = 1; i < values.length; i++) {
            out[i] = alpha * values[i] + (1 - alpha) * out[i - 1];
        }
        return out;
    }
}
