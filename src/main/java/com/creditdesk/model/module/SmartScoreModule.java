package com.creditdesk.model.module;

import com.creditdesk.model.scoring.SmartScoreResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SmartScoreModule implements DossierModule {

    private String dossierId;
    private SmartScoreResult result;
    private Integer previousScore;     // score of the run before this one
    private Instant updatedAt;
}
