package com.creditdesk.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class JpaSnapshotBackendTest {

    private static final String KEY = "test.banque.snapshot";

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private SnapshotRecordRepository repository;

    private JpaSnapshotBackend backend;

    @BeforeEach
    void setUp() {
        backend = new JpaSnapshotBackend(repository);
    }

    @Test
    void unknownKeyLoadsEmpty() {
        assertThat(backend.load(KEY)).isEmpty();
    }

    @Test
    void saveStoresOneRowPerKey() {
        backend.save(KEY, "{\"version\":1}");
        backend.save(KEY, "{\"version\":1,\"activeDossierId\":\"dos-1\"}");
        entityManager.flush();
        entityManager.clear();

        assertThat(repository.count()).isEqualTo(1);
        assertThat(backend.load(KEY)).contains("{\"version\":1,\"activeDossierId\":\"dos-1\"}");
        SnapshotRecord record = repository.findById(KEY).orElseThrow();
        assertThat(record.getCreatedAt()).isNotNull();
        assertThat(record.getUpdatedAt()).isNotNull();
    }

    @Test
    void keysAreIndependent() {
        backend.save(KEY, "{\"version\":1}");
        backend.save("other.key", "{}");

        backend.delete("other.key");
        entityManager.flush();

        assertThat(backend.load("other.key")).isEmpty();
        assertThat(backend.load(KEY)).contains("{\"version\":1}");
    }
}
