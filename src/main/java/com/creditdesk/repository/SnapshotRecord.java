package com.creditdesk.repository;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One persisted snapshot: the JSON document written by the store under its key.
 *
 * The payload is opaque to this layer. The row is the unit of durability,
 * the JSON layout is owned by the snapshot model.
 */
@Entity
@Table(name = "snapshot_records")
@Data
@NoArgsConstructor
public class SnapshotRecord {

    /**
     * Namespaced key, e.g. "mimmoza.banque.snapshot.v1"
     */
    @Id
    @Column(name = "snapshot_key", length = 128)
    private String key;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public SnapshotRecord(String key, String payload) {
        this.key = key;
        this.payload = payload;
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
