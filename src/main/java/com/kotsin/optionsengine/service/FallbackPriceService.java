package com.kotsin.optionsengine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.optionsengine.config.MarketDataSettings;
import com.kotsin.optionsengine.market.MarketDataService;
import com.kotsin.optionsengine.market.PriceHistoryStore;
import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.PriceChannel;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Pulls the last traded price over HTTP for any series whose ticks have gone stale and
 * feeds it through the normal update path. Disabled unless
 * {@code engine.market.fallback.enabled} is set.
 */
@Component
@Slf4j
public class FallbackPriceService {

    private final OkHttpClient http;
    private final ObjectMapper objectMapper;
    private final MarketDataSettings settings;
    private final PriceHistoryStore historyStore;
    private final MarketDataService marketDataService;
    private final Clock clock;

    public FallbackPriceService(OkHttpClient http, ObjectMapper objectMapper, MarketDataSettings settings,
                                PriceHistoryStore historyStore, MarketDataService marketDataService, Clock clock) {
        this.http = http;
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.historyStore = historyStore;
        this.marketDataService = marketDataService;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${engine.market.fallback.poll-interval-ms:5000}",
            initialDelayString = "${engine.market.fallback.initial-delay-ms:10000}")
    public void pollStaleSeries() {
        if (!settings.getFallback().isEnabled()) {
            return;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Duration staleAfter = Duration.ofSeconds(settings.getFallback().getStaleAfterSeconds());
        for (IndexName index : IndexName.values()) {
            for (PriceChannel channel : PriceChannel.values()) {
                LocalDateTime last = historyStore.lastUpdate(index, channel);
                if (last != null && Duration.between(last, now).compareTo(staleAfter) < 0) {
                    continue;
                }
                Double ltp = fetchLtp(index, channel);
                if (ltp != null) {
                    log.debug("[Fallback] {} {} stale since {}, using polled ltp {}", index, channel, last, ltp);
                    marketDataService.updatePrice(index, channel, ltp, 0L, now);
                }
            }
        }
    }

    public Double fetchLtp(IndexName index, PriceChannel channel) {
        String url = settings.getFallback().getBaseUrl() + "/api/ltp/" + index + "/" + channel;
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = http.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                log.debug("[Fallback] {} returned HTTP {}", url, response.code());
                return null;
            }
            return parseLtp(response.body().string());
        } catch (IOException e) {
            log.debug("[Fallback] LTP fetch failed for {} {}: {}", index, channel, e.getMessage());
            return null;
        }
    }

    /** Accepts {@code {"ltp": x}} or {@code {"lastRate": x}}; anything else yields null. */
    Double parseLtp(String body) throws IOException {
        JsonNode node = objectMapper.readTree(body);
        if (node.hasNonNull("ltp")) {
            return node.get("ltp").asDouble();
        }
        if (node.hasNonNull("lastRate")) {
            return node.get("lastRate").asDouble();
        }
        return null;
    }
}
