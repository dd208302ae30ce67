package com.creditdesk.model;

import com.creditdesk.model.module.CommitteeModule;
import com.creditdesk.model.module.DocumentsModule;
import com.creditdesk.model.module.DossierModule;
import com.creditdesk.model.module.GuaranteesModule;
import com.creditdesk.model.module.MarketModule;
import com.creditdesk.model.module.MonitoringModule;
import com.creditdesk.model.module.RiskAnalysisModule;
import com.creditdesk.model.module.SmartScoreModule;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Closed set of auxiliary module keys a caller may patch.
 * The constants are the only instances; arbitrary keys cannot be built.
 *
 * @param <M> module type stored under the key
 */
public final class ModuleKey<M extends DossierModule> {

    public static final ModuleKey<RiskAnalysisModule> RISK_ANALYSIS = new ModuleKey<>(
            "riskAnalysis", RiskAnalysisModule.class, Snapshot::getRiskAnalysis, Snapshot::setRiskAnalysis);
    public static final ModuleKey<GuaranteesModule> GUARANTEES = new ModuleKey<>(
            "guarantees", GuaranteesModule.class, Snapshot::getGuarantees, Snapshot::setGuarantees);
    public static final ModuleKey<DocumentsModule> DOCUMENTS = new ModuleKey<>(
            "documents", DocumentsModule.class, Snapshot::getDocuments, Snapshot::setDocuments);
    public static final ModuleKey<CommitteeModule> COMMITTEE = new ModuleKey<>(
            "committee", CommitteeModule.class, Snapshot::getCommittee, Snapshot::setCommittee);
    public static final ModuleKey<MonitoringModule> MONITORING = new ModuleKey<>(
            "monitoring", MonitoringModule.class, Snapshot::getMonitoring, Snapshot::setMonitoring);
    public static final ModuleKey<SmartScoreModule> SMART_SCORE = new ModuleKey<>(
            "smartScore", SmartScoreModule.class, Snapshot::getSmartScore, Snapshot::setSmartScore);
    public static final ModuleKey<MarketModule> MARKET = new ModuleKey<>(
            "market", MarketModule.class, Snapshot::getMarket, Snapshot::setMarket);

    private static final List<ModuleKey<?>> VALUES = List.of(
            RISK_ANALYSIS, GUARANTEES, DOCUMENTS, COMMITTEE, MONITORING, SMART_SCORE, MARKET);

    private final String name;
    private final Class<M> type;
    private final Function<Snapshot, M> getter;
    private final BiConsumer<Snapshot, M> setter;

    private ModuleKey(String name, Class<M> type, Function<Snapshot, M> getter, BiConsumer<Snapshot, M> setter) {
        this.name = name;
        this.type = type;
        this.getter = getter;
        this.setter = setter;
    }

    public static List<ModuleKey<?>> values() {
        return VALUES;
    }

    /** JSON field name of the module in the persisted snapshot. */
    public String name() {
        return name;
    }

    public Class<M> type() {
        return type;
    }

    public M get(Snapshot snapshot) {
        return getter.apply(snapshot);
    }

    public void set(Snapshot snapshot, M module) {
        setter.accept(snapshot, module);
    }

    public void clear(Snapshot snapshot) {
        setter.accept(snapshot, null);
    }

    @Override
    public String toString() {
        return name;
    }
}
