package com.creditdesk.model.dossier;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Post-disbursement follow-up figures.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoringSection {

    private Double outstandingCapital;
    private Integer unpaidInstalments;
    private String lastFollowUpOn;
    private Double preCommercialisationPct;
    private String comment;
}
