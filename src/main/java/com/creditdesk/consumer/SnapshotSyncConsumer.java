package com.creditdesk.consumer;

import com.creditdesk.event.SnapshotKeyChanged;
import com.creditdesk.producer.KafkaSnapshotChangeRelay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * Receives snapshot change announcements published by every instance.
 *
 * Each instance listens in its own consumer group (random suffix) so that
 * all instances get every announcement. The announcement only names the key;
 * the local stores re-read the snapshot from the shared backend.
 */
@Service
@ConditionalOnProperty(prefix = "banque.sync", name = "kafka-enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class SnapshotSyncConsumer {

    private final KafkaSnapshotChangeRelay relay;

    @KafkaListener(
            topics = "${banque.sync.topic:banque.snapshot.changed}",
            groupId = "banque-sync-${random.uuid}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void onSnapshotKeyChanged(SnapshotKeyChanged event) {
        log.debug("Received SnapshotKeyChanged for {} from {}", event.key(), event.originId());
        relay.receive(event);
    }
}
