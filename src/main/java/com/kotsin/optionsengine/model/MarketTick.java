package com.kotsin.optionsengine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Price tick as it arrives on the ticks topic. Timestamp is epoch millis; when absent
 * the engine clock stamps the tick.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MarketTick {
    private IndexName index;
    private PriceChannel channel;
    private double price;
    private long volume;
    private Long timestamp;
}
