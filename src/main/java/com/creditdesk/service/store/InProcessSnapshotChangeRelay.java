package com.creditdesk.service.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Default relay: announcements reach every store of this JVM synchronously.
 */
@Component
@ConditionalOnProperty(prefix = "banque.sync", name = "kafka-enabled", havingValue = "false", matchIfMissing = true)
@Slf4j
public class InProcessSnapshotChangeRelay extends AbstractSnapshotChangeRelay {

    @Override
    public void announce(String key, String originId) {
        log.debug("Announcing change of {} from {} to {} in-process handler(s)", key, originId, handlerCount());
        dispatch(key, originId);
    }
}
