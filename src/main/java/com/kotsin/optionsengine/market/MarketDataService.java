package com.kotsin.optionsengine.market;

import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.MarketTick;
import com.kotsin.optionsengine.model.PriceChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Entry point for every price update. Validates the tick, appends it and hands the index
 * to the tick listeners on the calling thread.
 */
@Service
@Slf4j
public class MarketDataService {

    private final PriceHistoryStore historyStore;
    private final List<PriceUpdateListener> listeners;
    private final Clock clock;

    public MarketDataService(PriceHistoryStore historyStore, List<PriceUpdateListener> listeners, Clock clock) {
        this.historyStore = historyStore;
        this.listeners = listeners;
        this.clock = clock;
    }

    public boolean onTick(MarketTick tick) {
        if (tick == null || tick.getIndex() == null || tick.getChannel() == null) {
            log.warn("⚠️ [MarketData] Dropping tick without index/channel: {}", tick);
            return false;
        }
        LocalDateTime ts = tick.getTimestamp() == null
                ? LocalDateTime.now(clock)
                : LocalDateTime.ofInstant(Instant.ofEpochMilli(tick.getTimestamp()), clock.getZone());
        return updatePrice(tick.getIndex(), tick.getChannel(), tick.getPrice(), tick.getVolume(), ts);
    }

    /**
     * @return false when the tick was rejected
     */
    public boolean updatePrice(IndexName index, PriceChannel channel, double price, long volume, LocalDateTime timestamp) {
        if (Double.isNaN(price) || price <= 0) {
            log.warn("⚠️ [MarketData] Rejected non-positive price index={} channel={} price={}", index, channel, price);
            return false;
        }
        double accepted = price;
        if (channel == PriceChannel.SPOT && price < index.getMinPlausibleSpot()) {
            Double lastSpot = historyStore.lastPrice(index, PriceChannel.SPOT);
            if (lastSpot == null) {
                log.warn("⚠️ [MarketData] Implausible spot {} for {} and no previous spot, dropped", price, index);
                return false;
            }
            log.warn("⚠️ [MarketData] Implausible spot {} for {}, reusing last spot {}", price, index, lastSpot);
            accepted = lastSpot;
        }
        historyStore.append(index, channel, accepted, Math.max(0L, volume),
                timestamp != null ? timestamp : LocalDateTime.now(clock));

        for (PriceUpdateListener listener : listeners) {
            try {
                listener.onPriceUpdate(index);
            } catch (Exception e) {
                log.error("🚨 [MarketData] Tick processing failed for {}: {}", index, e.getMessage(), e);
            }
        }
        return true;
    }
}
