package com.creditdesk.service.committee;

import com.creditdesk.model.DossierAggregate;
import com.creditdesk.model.financial.ProfitabilityResult;
import com.creditdesk.model.scoring.MissingDataItem;
import com.creditdesk.model.scoring.PillarResult;
import com.creditdesk.model.scoring.SmartScoreResult;

import java.util.List;

/**
 * Key figures the committee engine reads. Null means unknown, and an unknown
 * figure neither helps nor hurts.
 *
 * @param marketScore market demand index, 0-100
 * @param missing     labels of the data the SmartScore found missing
 */
public record CommitteeInputs(
        Double dscr,
        Double ltv,
        Integer score,
        Integer marketScore,
        List<String> missing,
        Double marginPct,
        Double yieldPct,
        List<String> strongPillars,
        List<String> weakPillars
) {
    static final int STRONG_PILLAR = 70;
    static final int WEAK_PILLAR = 40;

    public CommitteeInputs {
        missing = missing == null ? List.of() : List.copyOf(missing);
        strongPillars = strongPillars == null ? List.of() : List.copyOf(strongPillars);
        weakPillars = weakPillars == null ? List.of() : List.copyOf(weakPillars);
    }

    public static CommitteeInputs from(DossierAggregate aggregate, ProfitabilityResult profitability,
                                       SmartScoreResult score) {
        List<PillarResult> pillars = score == null ? List.of() : score.pillars();
        return new CommitteeInputs(
                aggregate.debtServiceCoverage(),
                aggregate.loanToValuePct(),
                score == null ? null : score.score(),
                aggregate.market() == null ? null : aggregate.market().getDemandIndex(),
                score == null ? List.of() : score.missingItems().stream().map(MissingDataItem::label).toList(),
                profitability == null ? null : profitability.marginPct(),
                profitability == null || profitability.grossYieldPct() <= 0 ? null : profitability.grossYieldPct(),
                pillars.stream()
                        .filter(pillar -> pillar.hasData() && pillar.rawScore() >= STRONG_PILLAR)
                        .map(PillarResult::label)
                        .toList(),
                pillars.stream()
                        .filter(pillar -> pillar.hasData() && pillar.rawScore() < WEAK_PILLAR)
                        .map(PillarResult::label)
                        .toList());
    }
}
