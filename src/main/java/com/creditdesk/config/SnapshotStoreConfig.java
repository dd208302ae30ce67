package com.creditdesk.config;

import com.creditdesk.repository.SnapshotBackend;
import com.creditdesk.service.store.BanqueSnapshotStore;
import com.creditdesk.service.store.SnapshotChangeRelay;
import com.creditdesk.service.store.SnapshotMutationHook;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Wires the snapshot store to the backend and relay selected by configuration.
 * Mutation hooks are applied in their {@code @Order}.
 */
@Configuration
@Slf4j
public class SnapshotStoreConfig {

    @Bean(destroyMethod = "close")
    public BanqueSnapshotStore banqueSnapshotStore(SnapshotBackend backend,
                                                   SnapshotChangeRelay relay,
                                                   List<SnapshotMutationHook> hooks,
                                                   @Qualifier("snapshotObjectMapper") ObjectMapper objectMapper,
                                                   BanqueProperties properties,
                                                   Clock clock) {
        log.info("Snapshot store on key {} with {} backend, relay {}, {} hook(s)",
                properties.getStore().getKey(),
                properties.getStore().getBackend(),
                relay.getClass().getSimpleName(),
                hooks.size());
        return new BanqueSnapshotStore(backend, relay, hooks, objectMapper,
                properties.getStore().getKey(), clock);
    }
}
