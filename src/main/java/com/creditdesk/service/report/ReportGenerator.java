package com.creditdesk.service.report;

import com.creditdesk.model.DossierAggregate;
import com.creditdesk.model.dossier.AnalysisSection;
import com.creditdesk.model.dossier.Borrower;
import com.creditdesk.model.dossier.BudgetSection;
import com.creditdesk.model.dossier.CompanyBorrower;
import com.creditdesk.model.dossier.Dossier;
import com.creditdesk.model.dossier.OriginationSection;
import com.creditdesk.model.dossier.PersonBorrower;
import com.creditdesk.model.dossier.RevenueSection;
import com.creditdesk.model.dossier.RiskLevel;
import com.creditdesk.model.financial.ProfitabilityResult;
import com.creditdesk.model.module.CommitteeModule;
import com.creditdesk.model.module.DocumentItem;
import com.creditdesk.model.module.DocumentsModule;
import com.creditdesk.model.module.GuaranteesModule;
import com.creditdesk.model.module.MarketModule;
import com.creditdesk.model.module.RiskAnalysisModule;
import com.creditdesk.model.report.ReportBorrower;
import com.creditdesk.model.report.ReportDocumentSection;
import com.creditdesk.model.report.ReportGuaranteeSection;
import com.creditdesk.model.report.ReportMeta;
import com.creditdesk.model.report.ReportProject;
import com.creditdesk.model.report.ReportRiskSection;
import com.creditdesk.model.report.ReportRow;
import com.creditdesk.model.report.ReportTable;
import com.creditdesk.model.report.ReportVerdict;
import com.creditdesk.model.report.StructuredReport;
import com.creditdesk.model.scoring.SmartScoreResult;
import com.creditdesk.service.committee.CommitteeEngine;
import com.creditdesk.service.committee.CommitteeInputs;
import com.creditdesk.service.scoring.SmartScoreEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Assembles the committee report from a dossier aggregate and the engines' outputs.
 *
 * Pure: nothing is read from or written to the store, the generation time is
 * passed in. Absent sections give empty tables, never an exception.
 */
@Component
@RequiredArgsConstructor
public class ReportGenerator {

    static final String NOT_PROVIDED = "Non renseigné";

    private final SmartScoreEngine smartScoreEngine;
    private final CommitteeEngine committeeEngine;

    /**
     * @param profitability base-case profitability, null when not computed
     * @param score         SmartScore of the same aggregate
     */
    public StructuredReport generate(DossierAggregate aggregate,
                                     ProfitabilityResult profitability,
                                     SmartScoreResult score,
                                     Instant generatedAt) {
        Objects.requireNonNull(aggregate.dossier(), "aggregate has no dossier");
        Objects.requireNonNull(score, "score");
        Objects.requireNonNull(generatedAt, "generatedAt");
        Dossier dossier = aggregate.dossier();

        return new StructuredReport(
                generatedAt,
                new ReportMeta(
                        dossier.getId(),
                        dossier.getLabel() == null || dossier.getLabel().isBlank() ? "Sans nom" : dossier.getLabel(),
                        dossier.getReference(),
                        dossier.getStatus()),
                borrower(dossier.getBorrower()),
                project(dossier.getOrigination()),
                budgetTable(dossier),
                financingTable(aggregate, profitability),
                revenueTable(dossier, profitability),
                marketTable(aggregate.market()),
                riskSection(aggregate, score),
                guaranteeSection(aggregate),
                documentSection(aggregate),
                profitability,
                score,
                verdict(aggregate, profitability, score),
                committeeEngine.outlook(CommitteeInputs.from(aggregate, profitability, score)));
    }

    // ==================== IDENTITY ====================

    ReportBorrower borrower(Borrower borrower) {
        Map<String, String> details = new LinkedHashMap<>();
        if (borrower instanceof PersonBorrower person) {
            putIfPresent(details, "Date de naissance", person.birthDate());
            putIfPresent(details, "Nationalité", person.nationality());
            putIfPresent(details, "Adresse", person.address());
            putIfPresent(details, "Email", person.email());
            putIfPresent(details, "Téléphone", person.phone());
            return new ReportBorrower(ReportBorrower.Kind.PERSON, person.displayName(), details);
        }
        if (borrower instanceof CompanyBorrower company) {
            putIfPresent(details, "Forme juridique", company.legalForm());
            putIfPresent(details, "SIREN/SIRET", company.sirenSiret());
            putIfPresent(details, "Représentant légal", company.legalRepresentative());
            putIfPresent(details, "Siège", company.headOfficeAddress());
            putIfPresent(details, "Email", company.email());
            putIfPresent(details, "Téléphone", company.phone());
            return new ReportBorrower(ReportBorrower.Kind.COMPANY, company.displayName(), details);
        }
        return new ReportBorrower(ReportBorrower.Kind.UNKNOWN, NOT_PROVIDED, details);
    }

    private ReportProject project(OriginationSection origination) {
        if (origination == null) {
            return new ReportProject(null, null, null, NOT_PROVIDED, null, "", "");
        }
        OriginationSection.LoanType loanType = origination.getLoanType();
        return new ReportProject(
                origination.getLoanAmount(),
                origination.getDurationMonths(),
                loanType == null ? null : loanType.name().toLowerCase(Locale.ROOT),
                loanType == null ? NOT_PROVIDED : loanType.label(),
                origination.getProjectType() == null ? null : origination.getProjectType().name().toLowerCase(Locale.ROOT),
                origination.getProjectAddress() == null ? "" : origination.getProjectAddress(),
                origination.getNotes() == null ? "" : origination.getNotes());
    }

    // ==================== TABLES ====================

    private ReportTable budgetTable(Dossier dossier) {
        List<ReportRow> rows = new ArrayList<>();
        BudgetSection budget = dossier.getAnalysis() == null ? null : dossier.getAnalysis().getBudget();
        if (budget != null) {
            addAmount(rows, "Prix d'acquisition", budget.getPurchasePrice());
            addPercent(rows, "Frais de notaire", budget.getNotaryFeePct());
            addAmount(rows, "Travaux", budget.getWorks());
            addAmount(rows, "Frais divers", budget.getFees());
            addAmount(rows, "Apport", budget.getEquity());
            addAmount(rows, "Valeur de sortie", budget.getExitValue());
        }
        return new ReportTable("Budget", rows);
    }

    private ReportTable financingTable(DossierAggregate aggregate, ProfitabilityResult profitability) {
        List<ReportRow> rows = new ArrayList<>();
        OriginationSection origination = aggregate.dossier().getOrigination();
        Double loanAmount = origination == null ? null : origination.getLoanAmount();
        addAmount(rows, "Montant demandé", loanAmount);
        if (origination != null && origination.getDurationMonths() != null) {
            rows.add(ReportRow.number("Durée", origination.getDurationMonths().doubleValue(), "mois"));
        }
        if (profitability != null && profitability.totalCost() > 0) {
            rows.add(ReportRow.amount("Coût total de l'opération", profitability.totalCost()));
            if (loanAmount != null && loanAmount > 0) {
                rows.add(ReportRow.percent("LTC (prêt / coût total)",
                        Math.round(loanAmount / profitability.totalCost() * 10_000) / 100.0));
            }
        }
        CommitteeModule committee = aggregate.committee();
        if (committee != null) {
            addAmount(rows, "Montant accordé", committee.getGrantedAmount());
            addPercent(rows, "Taux accordé", committee.getGrantedRatePct());
            if (committee.getGrantedDurationMonths() != null) {
                rows.add(ReportRow.number("Durée accordée", committee.getGrantedDurationMonths().doubleValue(), "mois"));
            }
        }
        return new ReportTable("Financement", rows);
    }

    private ReportTable revenueTable(Dossier dossier, ProfitabilityResult profitability) {
        List<ReportRow> rows = new ArrayList<>();
        AnalysisSection analysis = dossier.getAnalysis();
        RevenueSection revenue = analysis == null ? null : analysis.getRevenue();
        if (revenue != null) {
            if (revenue.getMode() != null) {
                rows.add(ReportRow.text("Mode", revenue.getMode() == RevenueSection.Mode.LOCATIF ? "Locatif" : "Résidence"));
            }
            addAmount(rows, "Revenus nets mensuels", revenue.getIncomeMonthlyNet());
            addAmount(rows, "Autres charges de dette mensuelles", revenue.getOtherDebtMonthly());
            addAmount(rows, "Loyer mensuel", revenue.getRentMonthly());
            addAmount(rows, "Charges mensuelles", revenue.getChargesMonthly());
            addAmount(rows, "Taxe foncière annuelle", revenue.getPropertyTaxAnnual());
            addPercent(rows, "Vacance locative", revenue.getVacancyRatePct());
        }
        if (profitability != null) {
            rows.add(ReportRow.amount("Marge brute", profitability.grossMargin()));
            rows.add(ReportRow.percent("Marge", profitability.marginPct()));
            rows.add(ReportRow.percent("TRI annualisé", profitability.annualizedReturnPct()));
            if (profitability.grossYieldPct() != 0 || profitability.monthlyCashflow() != 0) {
                rows.add(ReportRow.amount("Cashflow mensuel", profitability.monthlyCashflow()));
                rows.add(ReportRow.percent("Rendement brut", profitability.grossYieldPct()));
            }
        }
        return new ReportTable("Revenus et rentabilité", rows);
    }

    private ReportTable marketTable(MarketModule market) {
        List<ReportRow> rows = new ArrayList<>();
        if (market != null) {
            if (market.getCommune() != null) {
                rows.add(ReportRow.text("Commune", market.getCommune()));
            }
            if (market.getPricePerSqm() != null) {
                rows.add(ReportRow.number("Prix au m²", market.getPricePerSqm(), "EUR/m²"));
            }
            if (market.getDemandIndex() != null) {
                rows.add(ReportRow.number("Indice de demande", market.getDemandIndex().doubleValue(), "/100"));
            }
            if (market.getCompsCount() != null) {
                rows.add(ReportRow.number("Transactions comparables", market.getCompsCount().doubleValue(), null));
            }
            if (market.getAbsorptionMonths() != null) {
                rows.add(ReportRow.number("Délai d'écoulement", market.getAbsorptionMonths(), "mois"));
            }
            addPercent(rows, "Évolution des prix", market.getEvolutionPct());
        }
        return new ReportTable("Marché", rows);
    }

    // ==================== SECTIONS ====================

    private ReportRiskSection riskSection(DossierAggregate aggregate, SmartScoreResult score) {
        RiskAnalysisModule riskAnalysis = aggregate.riskAnalysis();
        RiskLevel globalLevel = riskAnalysis != null && riskAnalysis.getGlobalLevel() != null
                ? riskAnalysis.getGlobalLevel()
                : RiskLevel.fromScore(score.score());
        Integer globalScore = riskAnalysis != null && riskAnalysis.getGlobalScore() != null
                ? riskAnalysis.getGlobalScore()
                : Integer.valueOf(score.score());
        List<ReportRiskSection.Row> rows = aggregate.risks().stream()
                .map(risk -> new ReportRiskSection.Row(
                        risk.category(), risk.label(), risk.level(), risk.status(), risk.mitigation()))
                .toList();
        return new ReportRiskSection(globalLevel, globalScore, rows);
    }

    private ReportGuaranteeSection guaranteeSection(DossierAggregate aggregate) {
        GuaranteesModule guarantees = aggregate.guarantees();
        List<ReportGuaranteeSection.Row> rows = aggregate.guaranteeItems().stream()
                .map(item -> new ReportGuaranteeSection.Row(
                        item.type(),
                        item.description() == null || item.description().isBlank() ? "Sans description" : item.description(),
                        item.estimatedValue(),
                        item.rank(),
                        item.status()))
                .toList();
        return new ReportGuaranteeSection(
                rows.size(),
                aggregate.guaranteeCoverage(),
                aggregate.coverageRatioPct(),
                rows,
                guarantees == null ? List.of() : guarantees.getGaps(),
                guarantees == null || guarantees.getComment() == null ? "" : guarantees.getComment());
    }

    private ReportDocumentSection documentSection(DossierAggregate aggregate) {
        DocumentsModule documents = aggregate.documents();
        List<DocumentItem> items = aggregate.documentItems();
        List<ReportDocumentSection.Row> rows = items.stream()
                .map(item -> new ReportDocumentSection.Row(
                        item.name() == null || item.name().isBlank() ? "Sans nom" : item.name(),
                        item.type() == null ? "autre" : item.type(),
                        item.status() == null ? DocumentItem.Status.EXPECTED : item.status(),
                        item.comment()))
                .toList();
        int completeness = documents != null && documents.getCompletenessPct() != null
                ? documents.getCompletenessPct()
                : completeness(items);
        return new ReportDocumentSection(
                rows.size(),
                completeness,
                rows,
                documents == null ? List.of() : documents.getMissing());
    }

    private ReportVerdict verdict(DossierAggregate aggregate, ProfitabilityResult profitability, SmartScoreResult score) {
        RiskAnalysisModule riskAnalysis = aggregate.riskAnalysis();
        RiskLevel riskLevel = riskAnalysis != null && riskAnalysis.getGlobalLevel() != null
                ? riskAnalysis.getGlobalLevel()
                : RiskLevel.fromScore(score.score());
        return new ReportVerdict(
                score.verdict(),
                score.verdict().label(),
                score.score(),
                score.grade(),
                riskLevel,
                profitability == null ? null : profitability.decision(),
                smartScoreEngine.verdictExplanation(score),
                score.blockers());
    }

    // ==================== HELPERS ====================

    private static int completeness(List<DocumentItem> items) {
        long applicable = items.stream().filter(d -> d.status() != DocumentItem.Status.NOT_APPLICABLE).count();
        long provided = items.stream().filter(d -> d.status() != null && d.status().isProvided()).count();
        return applicable == 0 ? 0 : (int) Math.round(provided * 100.0 / applicable);
    }

    private static void addAmount(List<ReportRow> rows, String label, Double value) {
        if (value != null) {
            rows.add(ReportRow.amount(label, value));
        }
    }

    private static void addPercent(List<ReportRow> rows, String label, Double value) {
        if (value != null) {
            rows.add(ReportRow.percent(label, value));
        }
    }

    private static void putIfPresent(Map<String, String> details, String label, String value) {
        if (value != null && !value.isBlank()) {
            details.put(label, value);
        }
    }
}
