package com.creditdesk.service.store;

import com.creditdesk.model.ModuleKey;
import com.creditdesk.model.Snapshot;
import com.creditdesk.model.dossier.Dossier;
import com.creditdesk.model.dossier.DossierStatus;
import com.creditdesk.model.module.DossierModule;
import com.creditdesk.model.module.MonitoringAlert;
import com.creditdesk.model.module.MonitoringModule;
import com.creditdesk.model.module.MonitoringRule;
import com.creditdesk.model.report.StructuredReport;
import com.creditdesk.repository.SnapshotBackend;
import com.creditdesk.repository.SnapshotPersistenceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Single source of truth of the Banque vertical: one versioned snapshot,
 * stored as JSON under one key.
 *
 * DESIGN DECISIONS:
 * =================
 * 1. Read-modify-write: every mutation re-reads the snapshot, edits it and
 *    writes it back whole. Inside a JVM mutations are serialized on the store
 *    monitor; across contexts the last writer wins.
 * 2. Guarded mutation: every dossier-scoped call names its dossier id. A call
 *    targeting anything but the active dossier is logged and ignored, nothing
 *    is written and the method returns false.
 * 3. Durability is best effort: a backend failure is logged, the in-memory
 *    state still advances and listeners are still notified.
 * 4. Notification happens outside the monitor, so that two stores announcing
 *    to each other cannot deadlock.
 *
 * MERGE RULES:
 * ============
 * - upsertDossier: deep merge. Nested sections merge field by field, arrays
 *   and scalars replace, a borrower of another type replaces the old one.
 * - patchModule: shallow merge of the module's first-level fields, then the
 *   module recomputes its derived fields and the mutation hooks run.
 */
@Slf4j
public class BanqueSnapshotStore implements AutoCloseable {

    private final SnapshotBackend backend;
    private final SnapshotChangeRelay relay;
    private final List<SnapshotMutationHook> hooks;
    private final ObjectMapper objectMapper;
    private final String key;
    private final Clock clock;

    private final String originId = UUID.randomUUID().toString();
    private final SnapshotChangeBus bus = new SnapshotChangeBus();
    private final Subscription relaySubscription;

    // Last payload read or written; a null payload with a valid cache means "nothing stored"
    private String cachedPayload;
    private boolean cacheValid;

    public BanqueSnapshotStore(SnapshotBackend backend,
                               SnapshotChangeRelay relay,
                               List<SnapshotMutationHook> hooks,
                               ObjectMapper objectMapper,
                               String key,
                               Clock clock) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.relay = Objects.requireNonNull(relay, "relay");
        this.hooks = hooks == null ? List.of() : List.copyOf(hooks);
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.key = Objects.requireNonNull(key, "key");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.relaySubscription = relay.subscribe(this::onRemoteChange);
    }

    public String key() {
        return key;
    }

    public String originId() {
        return originId;
    }

    // ==================== READ ====================

    /**
     * Current snapshot, a private copy the caller may edit and pass to {@link #write}.
     * An absent or unparsable payload reads as an empty snapshot.
     */
    public synchronized Snapshot read() {
        String payload = currentPayload();
        if (payload == null || payload.isBlank()) {
            return Snapshot.empty(clock.instant());
        }
        try {
            Snapshot snapshot = objectMapper.readValue(payload, Snapshot.class);
            if (snapshot == null) {
                return Snapshot.empty(clock.instant());
            }
            if (snapshot.getVersion() == null) {
                snapshot.setVersion(Snapshot.CURRENT_VERSION);
            }
            return snapshot;
        } catch (JsonProcessingException e) {
            log.warn("Corrupt snapshot payload under {}, treating it as empty: {}", key, e.getOriginalMessage());
            return Snapshot.empty(clock.instant());
        }
    }

    public Optional<Dossier> readActiveDossier() {
        return Optional.ofNullable(read().getDossier());
    }

    public <M extends DossierModule> Optional<M> readModule(ModuleKey<M> moduleKey) {
        return Optional.ofNullable(moduleKey.get(read()));
    }

    public Optional<String> activeDossierId() {
        return Optional.ofNullable(read().resolveActiveDossierId());
    }

    // ==================== WRITE ====================

    /**
     * Stamp, persist and broadcast a whole snapshot.
     */
    public void write(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        Snapshot written;
        synchronized (this) {
            written = persist(snapshot);
        }
        notifyChange(written);
    }

    /**
     * Create or update the dossier and make it the active one.
     *
     * Switching to another dossier id replaces the dossier and drops the
     * previous dossier's modules.
     *
     * @return the dossier as written
     */
    public Dossier upsertDossier(Dossier partial) {
        if (partial == null || partial.getId() == null || partial.getId().isBlank()) {
            throw new IllegalArgumentException("Dossier id is required");
        }
        Snapshot written = mutate(snapshot -> {
            Instant now = clock.instant();
            Dossier current = snapshot.getDossier();
            boolean created = current == null || !partial.getId().equals(current.getId());

            Dossier merged;
            if (created) {
                if (current != null) {
                    log.info("Switching active dossier from {} to {}, dropping its modules",
                            current.getId(), partial.getId());
                    ModuleKey.values().forEach(moduleKey -> moduleKey.clear(snapshot));
                }
                merged = convert(objectMapper.valueToTree(partial), Dossier.class);
                applyCreationDefaults(merged, now);
            } else {
                ObjectNode target = objectMapper.valueToTree(current);
                merged = convert(JsonMerge.deepMerge(target, objectMapper.valueToTree(partial)), Dossier.class);
            }
            // A report is an artifact, never a mix of two generations
            if (partial.getReport() != null) {
                merged.setReport(partial.getReport());
            }
            merged.setUpdatedAt(now);

            snapshot.setDossier(merged);
            snapshot.setActiveDossierId(merged.getId());
            hooks.forEach(hook -> hook.afterDossierUpsert(snapshot, partial, created, now));
            log.info("{} dossier {} ({})", created ? "Created" : "Updated", merged.getId(), merged.getStatus());
            return true;
        });
        return written.getDossier();
    }

    /**
     * Shallow-merge a partial module into the active dossier's module.
     *
     * @return false when {@code dossierId} is not the active dossier, or the
     *         patch carries another dossier id; nothing is written then
     */
    public <M extends DossierModule> boolean patchModule(String dossierId, ModuleKey<M> moduleKey, M partial) {
        Objects.requireNonNull(moduleKey, "moduleKey");
        Objects.requireNonNull(partial, "partial");
        return mutate(snapshot -> {
            if (!isActive(snapshot, dossierId, "patch " + moduleKey)) {
                return false;
            }
            if (partial.getDossierId() != null && !partial.getDossierId().equals(dossierId)) {
                log.warn("Patch of {} carries dossierId={} but targets {}, ignored",
                        moduleKey, partial.getDossierId(), dossierId);
                return false;
            }
            Instant now = clock.instant();
            M existing = moduleKey.get(snapshot);
            ObjectNode target = existing == null ? objectMapper.createObjectNode() : objectMapper.valueToTree(existing);
            M merged = convert(JsonMerge.shallowMerge(target, objectMapper.valueToTree(partial)), moduleKey.type());
            merged.setDossierId(dossierId);
            merged.setUpdatedAt(now);
            merged.afterPatch(partial, now);
            moduleKey.set(snapshot, merged);
            hooks.forEach(hook -> hook.afterModulePatch(snapshot, moduleKey, partial, now));
            log.debug("Patched module {} of dossier {}", moduleKey, dossierId);
            return true;
        }) != null;
    }

    /**
     * Delete the active dossier and every module keyed to it. Any other id is a no-op.
     */
    public boolean removeDossier(String dossierId) {
        return mutate(snapshot -> {
            Dossier current = snapshot.getDossier();
            if (current == null || dossierId == null || !dossierId.equals(current.getId())) {
                log.debug("removeDossier({}) ignored, active dossier is {}",
                        dossierId, current == null ? null : current.getId());
                return false;
            }
            snapshot.setDossier(null);
            snapshot.setActiveDossierId(null);
            ModuleKey.values().forEach(moduleKey -> moduleKey.clear(snapshot));
            log.info("Removed dossier {} and its modules", dossierId);
            return true;
        }) != null;
    }

    /**
     * Manual status change; any status may be set, the lifecycle is advisory.
     */
    public boolean updateStatus(String dossierId, DossierStatus status) {
        Objects.requireNonNull(status, "status");
        return mutate(snapshot -> {
            if (!isActive(snapshot, dossierId, "updateStatus")) {
                return false;
            }
            Dossier dossier = snapshot.getDossier();
            log.info("Dossier {} status {} -> {}", dossierId, dossier.getStatus(), status);
            dossier.setStatus(status);
            dossier.setUpdatedAt(clock.instant());
            return true;
        }) != null;
    }

    /**
     * Replace the dossier's report wholesale and flag it as generated.
     */
    public boolean attachReport(String dossierId, StructuredReport report) {
        Objects.requireNonNull(report, "report");
        return mutate(snapshot -> {
            if (!isActive(snapshot, dossierId, "attachReport")) {
                return false;
            }
            Dossier dossier = snapshot.getDossier();
            dossier.setReport(report);
            dossier.setReportGenerated(true);
            dossier.setUpdatedAt(clock.instant());
            return true;
        }) != null;
    }

    // ==================== MONITORING LOG ====================

    /**
     * Insert an alert, or replace the one with the same id.
     */
    public boolean upsertAlert(String dossierId, MonitoringAlert alert) {
        Objects.requireNonNull(alert, "alert");
        return mutate(snapshot -> {
            if (!isActive(snapshot, dossierId, "upsertAlert")) {
                return false;
            }
            MonitoringLog.upsert(snapshot, dossierId, alert, clock.instant());
            return true;
        }) != null;
    }

    public boolean acknowledgeAlert(String dossierId, String alertId) {
        return mutate(snapshot -> {
            if (!isActive(snapshot, dossierId, "acknowledgeAlert") || snapshot.getMonitoring() == null) {
                return false;
            }
            MonitoringModule monitoring = snapshot.getMonitoring();
            List<MonitoringAlert> alerts = monitoring.getAlerts() == null
                    ? new ArrayList<>()
                    : new ArrayList<>(monitoring.getAlerts());
            int index = MonitoringLog.indexOf(alerts, alertId);
            if (index < 0) {
                return false;
            }
            Instant now = clock.instant();
            alerts.set(index, alerts.get(index).withAcknowledgedAt(now).withUpdatedAt(now));
            monitoring.setAlerts(alerts);
            monitoring.setUpdatedAt(now);
            return true;
        }) != null;
    }

    public boolean removeAlert(String dossierId, String alertId) {
        return mutate(snapshot -> {
            if (!isActive(snapshot, dossierId, "removeAlert") || snapshot.getMonitoring() == null) {
                return false;
            }
            MonitoringModule monitoring = snapshot.getMonitoring();
            List<MonitoringAlert> alerts = monitoring.getAlerts() == null ? List.of() : monitoring.getAlerts();
            List<MonitoringAlert> kept = alerts.stream()
                    .filter(alert -> !Objects.equals(alert.id(), alertId))
                    .toList();
            if (kept.size() == alerts.size()) {
                return false;
            }
            monitoring.setAlerts(new ArrayList<>(kept));
            monitoring.setUpdatedAt(clock.instant());
            return true;
        }) != null;
    }

    /**
     * Swap every alert whose rule key starts with {@code ruleKeyPrefix} for {@code alerts}
     * and stamp {@code lastRunAt}. Used by rule-driven producers that recompute their whole alert set.
     */
    public boolean replaceAlerts(String dossierId, String ruleKeyPrefix, List<MonitoringAlert> alerts) {
        Objects.requireNonNull(ruleKeyPrefix, "ruleKeyPrefix");
        return mutate(snapshot -> {
            if (!isActive(snapshot, dossierId, "replaceAlerts")) {
                return false;
            }
            Instant now = clock.instant();
            MonitoringModule monitoring = MonitoringLog.ensure(snapshot, dossierId, now);
            List<MonitoringAlert> next = new ArrayList<>();
            for (MonitoringAlert existing : monitoring.getAlerts()) {
                if (existing.ruleKey() == null || !existing.ruleKey().startsWith(ruleKeyPrefix)) {
                    next.add(existing);
                }
            }
            if (alerts != null) {
                next.addAll(alerts);
            }
            monitoring.setAlerts(next);
            monitoring.setLastRunAt(now);
            monitoring.setUpdatedAt(now);
            return true;
        }) != null;
    }

    /**
     * Replace the per-dossier rule overrides (enabled flag, threshold) read by the alert rules.
     */
    public boolean patchMonitoringRules(String dossierId, List<MonitoringRule> rules) {
        return mutate(snapshot -> {
            if (!isActive(snapshot, dossierId, "patchMonitoringRules")) {
                return false;
            }
            Instant now = clock.instant();
            MonitoringModule monitoring = MonitoringLog.ensure(snapshot, dossierId, now);
            monitoring.setRules(rules == null ? new ArrayList<>() : new ArrayList<>(rules));
            monitoring.setUpdatedAt(now);
            return true;
        }) != null;
    }

    // ==================== RESET ====================

    /**
     * Delete the stored snapshot; the next read is an empty snapshot.
     */
    public void clear() {
        log.info("Resetting snapshot {}", key);
        Snapshot empty;
        synchronized (this) {
            cachedPayload = null;
            cacheValid = true;
            try {
                backend.delete(key);
            } catch (SnapshotPersistenceException e) {
                log.error("Failed to delete snapshot {}, in-memory state reset", key, e);
            }
            empty = Snapshot.empty(clock.instant());
        }
        notifyChange(empty);
    }

    public void clearModule(ModuleKey<?> moduleKey) {
        Objects.requireNonNull(moduleKey, "moduleKey");
        mutate(snapshot -> {
            moduleKey.clear(snapshot);
            return true;
        });
    }

    // ==================== CHANGE NOTIFICATION ====================

    /**
     * Register for local writes and for writes announced by other contexts.
     * Registering the same listener again returns the existing subscription.
     */
    public Subscription onChange(SnapshotListener listener) {
        return bus.subscribe(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void close() {
        relaySubscription.unsubscribe();
    }

    private void onRemoteChange(String changedKey, String changeOrigin) {
        if (!key.equals(changedKey) || originId.equals(changeOrigin)) {
            return;
        }
        Snapshot snapshot;
        synchronized (this) {
            cacheValid = false;
            snapshot = read();
        }
        log.debug("Snapshot {} changed in context {}, re-read", changedKey, changeOrigin);
        bus.publish(new SnapshotChangeEvent(key, snapshot, true));
    }

    private void notifyChange(Snapshot written) {
        bus.publish(new SnapshotChangeEvent(key, written, false));
        try {
            relay.announce(key, originId);
        } catch (RuntimeException e) {
            log.error("Failed to announce change of {} to other contexts", key, e);
        }
    }

    // ==================== INTERNALS ====================

    /**
     * Apply a mutation to a fresh read and write the result.
     *
     * @return the written snapshot, or null when the mutation declined
     */
    private Snapshot mutate(Predicate<Snapshot> mutation) {
        Snapshot written;
        synchronized (this) {
            Snapshot snapshot = read();
            if (!mutation.test(snapshot)) {
                return null;
            }
            written = persist(snapshot);
        }
        notifyChange(written);
        return written;
    }

    private Snapshot persist(Snapshot snapshot) {
        snapshot.setVersion(Snapshot.CURRENT_VERSION);
        snapshot.setUpdatedAt(clock.instant());
        String payload;
        try {
            payload = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Snapshot is not serializable", e);
        }
        cachedPayload = payload;
        cacheValid = true;
        try {
            backend.save(key, payload);
        } catch (SnapshotPersistenceException e) {
            log.error("Failed to persist snapshot {}, in-memory state kept", key, e);
        }
        // Listeners get their own copy
        return convertPayload(payload);
    }

    private String currentPayload() {
        if (!cacheValid) {
            try {
                cachedPayload = backend.load(key).orElse(null);
                cacheValid = true;
                log.debug("Loaded snapshot {} from backend", key);
            } catch (SnapshotPersistenceException e) {
                log.error("Failed to load snapshot {}, using last known state", key, e);
            }
        }
        return cachedPayload;
    }

    private boolean isActive(Snapshot snapshot, String dossierId, String operation) {
        Dossier dossier = snapshot.getDossier();
        if (dossier == null || dossierId == null || !dossierId.equals(dossier.getId())) {
            log.warn("Dossier id mismatch on {}: expected={}, got={}; mutation ignored",
                    operation, dossier == null ? null : dossier.getId(), dossierId);
            return false;
        }
        return true;
    }

    private void applyCreationDefaults(Dossier dossier, Instant now) {
        if (dossier.getCreatedAt() == null) {
            dossier.setCreatedAt(now);
        }
        if (dossier.getStatus() == null) {
            dossier.setStatus(DossierStatus.BROUILLON);
        }
        if (dossier.getReference() == null || dossier.getReference().isBlank()) {
            String suffix = dossier.getId().replaceAll("[^A-Za-z0-9]", "");
            suffix = suffix.substring(0, Math.min(6, suffix.length())).toUpperCase(Locale.ROOT);
            dossier.setReference("DOSS-" + now.atZone(ZoneOffset.UTC).getYear() + "-" + suffix);
        }
    }

    private Snapshot convertPayload(String payload) {
        try {
            return objectMapper.readValue(payload, Snapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Snapshot written by this store cannot be read back", e);
        }
    }

    private <T> T convert(ObjectNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot convert merged JSON to " + type.getSimpleName(), e);
        }
    }
}
