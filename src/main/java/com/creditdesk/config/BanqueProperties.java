package com.creditdesk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tunables of the Banque vertical, bound from {@code banque.*}.
 *
 * Every decision threshold and scoring weight lives here so that
 * the engines carry no magic numbers.
 */
@Configuration
@ConfigurationProperties(prefix = "banque")
@Data
public class BanqueProperties {

    private Store store = new Store();
    private Sync sync = new Sync();
    private Decision decision = new Decision();
    private Scoring scoring = new Scoring();
    private Alerts alerts = new Alerts();

    @Data
    public static class Store {
        private String key = "mimmoza.banque.snapshot.v1";
        // jpa | redis | memory
        private String backend = "jpa";
    }

    @Data
    public static class Sync {
        private boolean kafkaEnabled = false;
        private String topic = KafkaTopics.SNAPSHOT_CHANGED;
    }

    @Data
    public static class Decision {
        // Resale, GO tier (all three required)
        private double goMarginPct = 15.0;
        private double goGrossMargin = 30_000.0;
        private double goAnnualizedReturnPct = 20.0;
        // Resale, reserve tier (either one)
        private double reserveMarginPct = 10.0;
        private double reserveAnnualizedReturnPct = 15.0;
        // Rental
        private double minGrossYieldPct = 5.0;
        private double minMonthlyCashflow = 0.0;
        // Scenarios and stress tests
        private double optimisticResaleFactor = 1.03;
        private double optimisticWorksFactor = 0.95;
        private double pessimisticResaleFactor = 0.95;
        private double pessimisticWorksFactor = 1.10;
        private double stressResaleFactor = 0.95;
        private double stressWorksFactor = 1.10;
    }

    @Data
    public static class Scoring {
        private Map<String, Integer> weights = defaultWeights();
        private Grades grades = new Grades();
        private Penalties penalties = new Penalties();
        private int maxRecommendations = 6;
        private int maxDrivers = 3;
        // Guarantees coverage, as a whole percentage of the loan, that earns full marks
        private int fullCoveragePct = 120;
        // Loan-to-cost above which the financial pillar is penalised
        private double maxLoanToCostPct = 90.0;
        // A loan above this amount over less than a year is a cash-flow strain
        private double largeLoanAmount = 500_000.0;
    }

    @Data
    public static class Grades {
        private int a = 80;
        private int b = 65;
        private int c = 50;
        private int d = 35;
    }

    @Data
    public static class Penalties {
        private int blocker = 8;
        private int warn = 3;
        private int info = 0;
    }

    /**
     * Default thresholds of the monitoring alert rules; a dossier's rule overrides win.
     */
    @Data
    public static class Alerts {
        private double scoreMin = 40;
        private double scoreDrop = 15;
        private double completenessMin = 80;
        private double missingDocsMax = 2;
        private double unknownRisksMax = 3;
        private double staleAfterDays = 30;
        private double ltvMax = 80;
        private double dscrMin = 1.2;
        private double preCommercialisationMin = 30;
    }

    private static Map<String, Integer> defaultWeights() {
        Map<String, Integer> weights = new LinkedHashMap<>();
        weights.put("documentation", 25);
        weights.put("garanties", 25);
        weights.put("emprunteur", 20);
        weights.put("projet", 15);
        weights.put("financier", 15);
        return weights;
    }
}
