package com.creditdesk.model.module;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentsModule implements DossierModule {

    private String dossierId;
    private List<DocumentItem> items;
    private List<String> required;     // required document types
    private List<String> missing;      // derived
    private Integer completenessPct;   // derived, 0-100
    private Instant updatedAt;

    @Override
    public void afterPatch(DossierModule patch, Instant now) {
        if (items == null) {
            return;
        }
        if (required != null) {
            Set<String> providedTypes = items.stream()
                    .filter(d -> d.status() != null && d.status().isProvided())
                    .map(DocumentItem::type)
                    .collect(Collectors.toSet());
            missing = required.stream().filter(r -> !providedTypes.contains(r)).toList();
        }
        long applicable = items.stream()
                .filter(d -> d.status() != DocumentItem.Status.NOT_APPLICABLE)
                .count();
        long provided = items.stream()
                .filter(d -> d.status() != null && d.status().isProvided())
                .count();
        completenessPct = applicable > 0 ? (int) Math.round(provided * 100.0 / applicable) : 0;
    }
}
