package com.kotsin.optionsengine.controller;

import com.kotsin.optionsengine.model.EntryOutcome;
import com.kotsin.optionsengine.model.ExitReason;
import com.kotsin.optionsengine.model.IndexName;
import com.kotsin.optionsengine.model.InstrumentKey;
import com.kotsin.optionsengine.model.OptionLeg;
import com.kotsin.optionsengine.model.StrategyKind;
import com.kotsin.optionsengine.model.TradeRecord;
import com.kotsin.optionsengine.strategy.StrategyEngine;
import com.kotsin.optionsengine.trading.PositionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Manual enter/exit commands. They go through the same position store checks as the
 * automatic passes.
 */
@RestController
@RequestMapping("/api/v1/engine/positions")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class ManualTradeController {

    private final StrategyEngine strategyEngine;
    private final PositionStore positionStore;

    /**
     * POST /api/v1/engine/positions/NIFTY/CALL/enter?strategy=SCALPING
     */
    @PostMapping("/{index}/{leg}/enter")
    public ResponseEntity<Map<String, Object>> enter(@PathVariable IndexName index,
                                                     @PathVariable OptionLeg leg,
                                                     @RequestParam(defaultValue = "REGULAR") StrategyKind strategy) {
        InstrumentKey key = InstrumentKey.of(index, leg);
        try {
            EntryOutcome outcome = strategyEngine.enterTrade(key, strategy);
            Map<String, Object> response = new HashMap<>();
            response.put("success", outcome.isEntered());
            response.put("outcome", outcome);
            response.put("message", outcome.isEntered() ? "Entered " + key + " as " + strategy
                    : "Entry rejected for " + key + ": " + outcome.getDescription());
            response.put("position", positionStore.snapshot(key));
            log.info("🖐️ Manual entry {} {} -> {}", key, strategy, outcome);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            log.error("🚨 Manual entry failed for {}: {}", key, e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("success", false, "message", String.valueOf(e.getMessage())));
        }
    }

    /**
     * POST /api/v1/engine/positions/NIFTY/CALL/exit?reason=MANUAL
     */
    @PostMapping("/{index}/{leg}/exit")
    public ResponseEntity<Map<String, Object>> exit(@PathVariable IndexName index,
                                                    @PathVariable OptionLeg leg,
                                                    @RequestParam(defaultValue = "MANUAL") ExitReason reason) {
        InstrumentKey key = InstrumentKey.of(index, leg);
        try {
            Optional<TradeRecord> record = strategyEngine.exitTrade(key, reason);
            Map<String, Object> response = new HashMap<>();
            response.put("success", record.isPresent());
            response.put("message", record.isPresent() ? "Exited " + key : "No active position for " + key);
            record.ifPresent(r -> response.put("trade", r));
            log.info("🖐️ Manual exit {} reason={} -> {}", key, reason, record.isPresent());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            log.error("🚨 Manual exit failed for {}: {}", key, e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("success", false, "message", String.valueOf(e.getMessage())));
        }
    }
}
