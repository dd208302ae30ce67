package com.creditdesk.producer;

import com.creditdesk.config.BanqueProperties;
import com.creditdesk.event.SnapshotKeyChanged;
import com.creditdesk.service.store.AbstractSnapshotChangeRelay;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Relay publishing snapshot change announcements to Kafka.
 *
 * ASYNC SEND:
 * ===========
 * announce() returns as soon as the record is handed to the producer.
 * Success and failure are only logged in the send callback: a lost
 * announcement costs other instances one refresh, it never fails the write
 * that triggered it.
 *
 * Announcements received back from Kafka (see SnapshotSyncConsumer) are
 * dispatched to the local stores, which skip the ones they sent.
 */
@Service
@ConditionalOnProperty(prefix = "banque.sync", name = "kafka-enabled", havingValue = "true")
@Slf4j
public class KafkaSnapshotChangeRelay extends AbstractSnapshotChangeRelay {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;
    private final Clock clock;

    public KafkaSnapshotChangeRelay(KafkaTemplate<String, Object> kafkaTemplate,
                                    BanqueProperties properties,
                                    Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = properties.getSync().getTopic();
        this.clock = clock;
    }

    @Override
    public void announce(String key, String originId) {
        SnapshotKeyChanged event = new SnapshotKeyChanged(key, originId, clock.instant());
        log.debug("Publishing SnapshotKeyChanged for {} from {}", key, originId);

        CompletableFuture<SendResult<String, Object>> future;
        try {
            // Keyed by snapshot key: all announcements of one key stay ordered on one partition
            future = kafkaTemplate.send(topic, key, event);
        } catch (RuntimeException e) {
            log.error("Failed to publish SnapshotKeyChanged for {}", key, e);
            return;
        }

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish SnapshotKeyChanged for {}", key, ex);
            } else {
                log.debug("Published SnapshotKeyChanged for {} to partition {}",
                        key, result.getRecordMetadata().partition());
            }
        });
    }

    /**
     * Hand an announcement read from Kafka to the local stores.
     */
    public void receive(SnapshotKeyChanged event) {
        dispatch(event.key(), event.originId());
    }
}
