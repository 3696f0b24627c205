package com.kotsin.optionsengine.market;

import com.kotsin.optionsengine.config.MarketDataSettings;
import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.PriceChannel;
import com.kotsin.optionsengine.model.PricePoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds every price series plus the rolling window of spot percentage changes used for
 * volatility. Writes are serialised by the price lock; only {@link MarketDataService}
 * appends in production.
 */
@Component
@Slf4j
public class PriceHistoryStore {

    public static final int VOLATILITY_WINDOW = 30;

    private final ReentrantLock priceLock = new ReentrantLock();
    private final Map<IndexName, Map<PriceChannel, PriceSeries>> series = new EnumMap<>(IndexName.class);
    private final Map<IndexName, Deque<Double>> spotChanges = new EnumMap<>(IndexName.class);

    public PriceHistoryStore(MarketDataSettings settings) {
        for (IndexName index : IndexName.values()) {
            Map<PriceChannel, PriceSeries> channels = new EnumMap<>(PriceChannel.class);
            for (PriceChannel channel : PriceChannel.values()) {
                channels.put(channel, new PriceSeries(settings.getMaxHistoryPoints()));
            }
            series.put(index, channels);
            spotChanges.put(index, new ArrayDeque<>());
        }
    }

    public void append(IndexName index, PriceChannel channel, double price, long volume, LocalDateTime timestamp) {
        priceLock.lock();
        try {
            PriceSeries target = series(index, channel);
            if (channel == PriceChannel.SPOT) {
                PricePoint previous = target.last();
                if (previous != null && previous.price() > 0) {
                    Deque<Double> window = spotChanges.get(index);
                    window.addLast((price - previous.price()) / previous.price() * 100.0);
                    while (window.size() > VOLATILITY_WINDOW) {
                        window.removeFirst();
                    }
                }
            }
            target.append(new PricePoint(timestamp, price, volume));
        } finally {
            priceLock.unlock();
        }
    }

    public PriceSeries series(IndexName index, PriceChannel channel) {
        return series.get(index).get(channel);
    }

    public Double lastPrice(IndexName index, PriceChannel channel) {
        PricePoint last = series(index, channel).last();
        return last == null ? null : last.price();
    }

    public LocalDateTime lastUpdate(IndexName index, PriceChannel channel) {
        PricePoint last = series(index, channel).last();
        return last == null ? null : last.timestamp();
    }

    /** Copy of the spot percentage-change window, oldest first. */
    public List<Double> volatilitySamples(IndexName index) {
        priceLock.lock();
        try {
            return new ArrayList<>(spotChanges.get(index));
        } finally {
            priceLock.unlock();
        }
    }
}
