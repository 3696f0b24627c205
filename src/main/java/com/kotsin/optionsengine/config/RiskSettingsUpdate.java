package com.kotsin.optionsengine.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kotsin.optionsengine.model.IndexName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** Partial update body for the risk endpoint; null means unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RiskSettingsUpdate {
    private Double capital;
    private Double riskPerTradePct;
    private Integer maxTradesPerDay;
    private Double maxDailyLossPct;
    private Double trailingActivationPct;
    private Double trailingStopPct;
    private Double scalpingStopLossPct;
    private Boolean scalpingEnabled;
    private Map<IndexName, IndexToggleUpdate> indices;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IndexToggleUpdate {
        private Boolean tradingEnabled;
        private Boolean scalpingEnabled;
    }
}
