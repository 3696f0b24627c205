package com.kotsin.optionsengine.service;

import com.kotsin.optionsengine.market.PriceHistoryStore;
import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.OptionContract;
import com.kotsin.optionsengine.model.OptionLeg;
import com.kotsin.optionsengine.model.PriceChannel;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves the at-the-money contract of each leg from the latest spot.
 */
@Service
public class OptionContractResolver {

    private static final DateTimeFormatter EXPIRY_CODE = DateTimeFormatter.ofPattern("ddMMMyy", Locale.ENGLISH);

    private final PriceHistoryStore historyStore;
    private final ExpiryCalendar expiryCalendar;

    public OptionContractResolver(PriceHistoryStore historyStore, ExpiryCalendar expiryCalendar) {
        this.historyStore = historyStore;
        this.expiryCalendar = expiryCalendar;
    }

    public Optional<OptionContract> atm(IndexName index, OptionLeg leg) {
        Double spot = historyStore.lastPrice(index, PriceChannel.SPOT);
        if (spot == null) {
            return Optional.empty();
        }
        int strike = atmStrike(spot, index.getStrikeInterval());
        LocalDate expiry = expiryCalendar.currentExpiry(index);
        return Optional.of(OptionContract.builder()
                .symbol(symbol(index, expiry, leg, strike))
                .index(index)
                .leg(leg)
                .strike(strike)
                .expiry(expiry)
                .exchange(index.getExchange())
                .build());
    }

    public static int atmStrike(double spot, int interval) {
        return (int) Math.round(spot / interval) * interval;
    }

    /** e.g. NIFTY25JUL24C24500 */
    public static String symbol(IndexName index, LocalDate expiry, OptionLeg leg, int strike) {
        return index.name() + expiry.format(EXPIRY_CODE).toUpperCase(Locale.ENGLISH) + leg.getSymbolCode() + strike;
    }
}
