package com.kotsin.optionsengine.analysis;

import com.kotsin.optionsengine.market.PriceHistoryStore;
import com.kotsin.optionsengine.model.InstrumentKey;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling percentage momentum of each leg's premium over a 5-point window.
 */
@Service
public class MomentumTracker {

    public static final int WINDOW = 5;
    public static final int MAX_READINGS = 20;

    private final PriceHistoryStore historyStore;
    private final Map<InstrumentKey, Deque<Double>> readings = new ConcurrentHashMap<>();

    public MomentumTracker(PriceHistoryStore historyStore) {
        this.historyStore = historyStore;
        for (InstrumentKey key : InstrumentKey.all()) {
            readings.put(key, new ArrayDeque<>());
        }
    }

    /**
     * Appends a fresh reading for the leg.
     *
     * @return the new reading, or null when the leg has fewer than six points
     */
    public Double update(InstrumentKey key) {
        double[] prices = historyStore.series(key.index(), key.leg().channel()).prices(WINDOW + 1);
        if (prices.length < WINDOW + 1) {
            return null;
        }
        double base = prices[prices.length - WINDOW];
        if (base <= 0) {
            return null;
        }
        double momentum = (prices[prices.length - 1] - base) / base * 100.0;
        Deque<Double> window = readings.get(key);
        synchronized (window) {
            window.addLast(momentum);
            while (window.size() > MAX_READINGS) {
                window.removeFirst();
            }
        }
        return momentum;
    }

    /** Last {@code n} readings, oldest first. */
    public List<Double> recent(InstrumentKey key, int n) {
        Deque<Double> window = readings.get(key);
        synchronized (window) {
            List<Double> all = new ArrayList<>(window);
            return new ArrayList<>(all.subList(Math.max(0, all.size() - n), all.size()));
        }
    }

    public Double current(InstrumentKey key) {
        Deque<Double> window = readings.get(key);
        synchronized (window) {
            return window.peekLast();
        }
    }
}
