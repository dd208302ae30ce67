package com.creditdesk.model.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Committee decision as read by one risk appetite.
 *
 * @param confidence 0-100
 */
public record DecisionScenario(
        Profile profile,
        String label,
        Outcome decision,
        int confidence,
        List<String> pros,
        List<String> cons,
        List<String> conditions,
        List<String> targets
) {
    public DecisionScenario {
        pros = pros == null ? List.of() : List.copyOf(pros);
        cons = cons == null ? List.of() : List.copyOf(cons);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public enum Profile {
        @JsonProperty("conservative") CONSERVATIVE,
        @JsonProperty("balanced") BALANCED,
        @JsonProperty("opportunistic") OPPORTUNISTIC
    }

    public enum Outcome {
        @JsonProperty("no_go") NO_GO("NO GO"),
        @JsonProperty("go_strict_conditions") GO_STRICT_CONDITIONS("GO sous conditions strictes"),
        @JsonProperty("go_conditions") GO_CONDITIONS("GO sous conditions"),
        @JsonProperty("go") GO("GO"),
        @JsonProperty("go_patrimonial") GO_PATRIMONIAL("GO patrimonial");

        private final String label;

        Outcome(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
