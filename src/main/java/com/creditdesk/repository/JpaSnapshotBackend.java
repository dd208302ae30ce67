package com.creditdesk.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Default backend: one {@link SnapshotRecord} row per key in the relational store.
 */
@Component
@ConditionalOnProperty(prefix = "banque.store", name = "backend", havingValue = "jpa", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JpaSnapshotBackend implements SnapshotBackend {

    private final SnapshotRecordRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<String> load(String key) {
        try {
            return repository.findById(key).map(SnapshotRecord::getPayload);
        } catch (DataAccessException e) {
            throw new SnapshotPersistenceException("Failed to load snapshot " + key, e);
        }
    }

    @Override
    @Transactional
    public void save(String key, String payload) {
        try {
            SnapshotRecord record = repository.findById(key)
                    .orElseGet(() -> new SnapshotRecord(key, payload));
            record.setPayload(payload);
            repository.save(record);
            log.debug("Saved snapshot {} ({} chars)", key, payload.length());
        } catch (DataAccessException e) {
            throw new SnapshotPersistenceException("Failed to save snapshot " + key, e);
        }
    }

    @Override
    @Transactional
    public void delete(String key) {
        try {
            repository.deleteById(key);
        } catch (DataAccessException e) {
            throw new SnapshotPersistenceException("Failed to delete snapshot " + key, e);
        }
    }
}
