package com.kotsin.optionsengine.indicator;

/**
 * Technical indicators over a price series ordered oldest first. Every method returns the
 * value for the last point of the series.
 */
public interface IndicatorLibrary {

    double rsi(double[] prices, int period);

    MacdResult macd(double[] prices, int fastPeriod, int slowPeriod, int signalPeriod);

    BollingerBands bollinger(double[] prices, int period, double stdDevs);

    double ema(double[] prices, int period);

    /** Average true range where the true range is the close-to-close move. */
    double atr(double[] prices, int period);
}
