package com.creditdesk.model.module;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitteeModule implements DossierModule {

    private String dossierId;
    private CommitteeVerdict decision;
    private List<String> conditions;
    private String committeeDate;
    private List<String> members;
    private String comment;
    private Double grantedAmount;
    private Double grantedRatePct;
    private Integer grantedDurationMonths;
    private String memo;
    private Instant updatedAt;
}
