package com.creditdesk.config;

/**
 * Centralized Kafka topic names.
 */
public class KafkaTopics {

    // Announces that the snapshot stored under a key was rewritten
    public static final String SNAPSHOT_CHANGED = "banque.snapshot.changed";

    private KafkaTopics() {
    }
}
