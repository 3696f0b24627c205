package com.kotsin.optionsengine.consumer;

import com.kotsin.optionsengine.market.MarketDataService;
import com.kotsin.optionsengine.model.MarketTick;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Feeds spot and option premium ticks into the engine. The tick pass runs synchronously
 * on the listener thread.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MarketTickConsumer {

    private final MarketDataService marketDataService;

    @KafkaListener(
            topics = "${engine.kafka.topics.ticks:option-ticks}",
            containerFactory = "marketTickKafkaListenerContainerFactory",
            autoStartup = "${engine.kafka.enabled:true}"
    )
    public void consumeTick(@Payload(required = false) MarketTick tick, Acknowledgment acknowledgment) {
        if (tick == null) {
            acknowledgment.acknowledge();
            return;
        }
        try {
            boolean accepted = marketDataService.onTick(tick);
            if (!accepted) {
                log.debug("Tick rejected: {}", tick);
            }
            acknowledgment.acknowledge();
        } catch (Exception e) {
            log.error("🚨 Error processing tick {}: {}", tick, e.getMessage(), e);
            throw e;
        }
    }
}
