package com.creditdesk.model.dossier;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Operation calendar. Dates are ISO-8601 strings as entered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleSection {

    private String acquisitionDate;
    private Integer worksMonths;
    private String exitDate;
    private ExecutionRisk executionRisk;
    private String notes;

    public enum ExecutionRisk {
        @JsonProperty("faible") FAIBLE,
        @JsonProperty("moyen") MOYEN,
        @JsonProperty("fort") FORT
    }
}
