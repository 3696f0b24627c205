package com.kotsin.optionsengine.analysis;

import com.kotsin.optionsengine.market.PriceHistoryStore;
import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.PriceChannel;
import com.kotsin.optionsengine.model.PriceRange;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Put/call ratio and a volatility-implied range for the index.
 */
@Service
public class MarketAnalyticsService {

    public static final int MIN_RANGE_POINTS = 30;
    static final double TRADING_DAYS = 252.0;

    private final PriceHistoryStore historyStore;

    public MarketAnalyticsService(PriceHistoryStore historyStore) {
        this.historyStore = historyStore;
    }

    /** Put volume over call volume; 1.0 with no data. */
    public double putCallRatio(IndexName index) {
        long putVolume = historyStore.series(index, PriceChannel.PUT).totalVolume();
        long callVolume = historyStore.series(index, PriceChannel.CALL).totalVolume();
        if (putVolume == 0 && callVolume == 0) {
            return 1.0;
        }
        return (double) putVolume / Math.max(callVolume, 1L);
    }

    public Optional<PriceRange> predictedRange(IndexName index) {
        double[] spot = historyStore.series(index, PriceChannel.SPOT).prices(Integer.MAX_VALUE);
        if (spot.length < MIN_RANGE_POINTS) {
            return Optional.empty();
        }
        double[] returns = new double[spot.length - 1];
        for (int i = 1; i < spot.length; i++) {
            returns[i - 1] = (spot[i] - spot[i - 1]) / spot[i - 1];
        }
        double mean = 0.0;
        for (double r : returns) {
            mean += r;
        }
        mean /= returns.length;
        double variance = 0.0;
        for (double r : returns) {
            variance += (r - mean) * (r - mean);
        }
        double std = Math.sqrt(variance / (returns.length - 1));
        double annualised = std * Math.sqrt(TRADING_DAYS);
        double price = spot[spot.length - 1];
        return Optional.of(new PriceRange(price * (1 - annualised), price * (1 + annualised), annualised));
    }
}
