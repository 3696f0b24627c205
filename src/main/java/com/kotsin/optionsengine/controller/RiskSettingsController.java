package com.kotsin.optionsengine.controller;

import com.kotsin.optionsengine.config.RiskSettings;
import com.kotsin.optionsengine.config.RiskSettingsUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/engine/risk")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class RiskSettingsController {

    private final RiskSettings riskSettings;

    @GetMapping
    public ResponseEntity<RiskSettings> getRiskSettings() {
        return ResponseEntity.ok(riskSettings);
    }

    /** Partial update; omitted fields keep their value. */
    @PutMapping
    public ResponseEntity<?> updateRiskSettings(@RequestBody RiskSettingsUpdate update) {
        if (update.getCapital() != null && update.getCapital() < 0
                || update.getMaxTradesPerDay() != null && update.getMaxTradesPerDay() < 0
                || update.getRiskPerTradePct() != null && update.getRiskPerTradePct() < 0) {
            return ResponseEntity.badRequest()
                    .body(Map.of("success", false, "message", "capital, maxTradesPerDay and riskPerTradePct must be >= 0"));
        }
        riskSettings.apply(update);
        log.info("⚙️ Risk settings updated: {}", update);
        return ResponseEntity.ok(riskSettings);
    }
}
