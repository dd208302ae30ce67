package com.creditdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Credit desk for real-estate lending dossiers.
 *
 * Flow:
 * Section saves -> BanqueSnapshotStore (lifecycle + audit hooks) -> change listeners / relay
 * On demand: ProfitabilityService, SmartScoreService -> ReportService -> DocumentExporter
 *
 * The snapshot is persisted in H2 through JPA by default (banque.store.backend=jpa);
 * Redis and an in-memory map are the alternatives. Cross-instance change
 * announcements go through Kafka when banque.sync.kafka-enabled=true.
 */
@SpringBootApplication
public class CreditDeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreditDeskApplication.class, args);
    }
}
