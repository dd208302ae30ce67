package com.creditdesk.model.module;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuaranteesModule implements DossierModule {

    private String dossierId;
    private List<GuaranteeItem> items;
    private Double totalCoverage;      // EUR; when absent the sum of item values is used
    private List<String> gaps;         // derived
    private String comment;
    private Instant updatedAt;

    @Override
    public void afterPatch(DossierModule patch, Instant now) {
        if (items == null) {
            return;
        }
        gaps = items.stream()
                .filter(g -> g.status() != GuaranteeItem.Status.OBTAINED)
                .map(g -> String.format("%s (%s) - non obtenue",
                        g.description() == null ? "Garantie" : g.description(),
                        g.type() == null ? "autre" : g.type().name().toLowerCase(Locale.ROOT)))
                .toList();
    }
}
