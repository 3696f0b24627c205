package com.kotsin.optionsengine.producer;

import com.kotsin.optionsengine.model.TradeRecord;
import com.kotsin.optionsengine.trading.TradeRecordListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Publishes every closed trade, keyed by trade id. Best effort: failures are logged and
 * never reach the position store.
 */
@Service
@Slf4j
public class TradeRecordProducer implements TradeRecordListener {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String tradeRecordsTopic;
    private final boolean enabled;

    public TradeRecordProducer(KafkaTemplate<String, Object> kafkaTemplate,
                               @Value("${engine.kafka.topics.trade-records:option-trade-records}") String tradeRecordsTopic,
                               @Value("${engine.kafka.enabled:true}") boolean enabled) {
        this.kafkaTemplate = kafkaTemplate;
        this.tradeRecordsTopic = tradeRecordsTopic;
        this.enabled = enabled;
    }

    @Override
    public void onTradeClosed(TradeRecord record) {
        publish(record);
    }

    public boolean publish(TradeRecord record) {
        if (!enabled) {
            return false;
        }
        try {
            kafkaTemplate.send(tradeRecordsTopic, record.getId(), record);
            log.info("trade_record_published topic={} key={} kind={} reason={} entry={} exit={} pnl={}",
                    tradeRecordsTopic, record.getId(), record.getStrategyKind(), record.getExitReason(),
                    record.getEntryPrice(), record.getExitPrice(), record.getPnl());
            return true;
        } catch (Exception e) {
            log.error("Failed to publish TradeRecord {}: {}", record.getId(), e.toString(), e);
            return false;
        }
    }
}
