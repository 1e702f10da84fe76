package com.ecoscore.impact.engine;

import com.ecoscore.impact.domain.MaterialComposition;
import com.ecoscore.impact.domain.MaterialFactor;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Share-weighted material sub-score plus per-kg CO2 and water intensities.
 */
@Component
@RequiredArgsConstructor
public class MaterialScorer {

    // Returned when no material carries a positive share
    static final double NEUTRAL_SCORE = 50.0;

    private final FactorTables factorTables;

    public MaterialScore score(MaterialComposition composition) {
        double totalShare = 0.0;
        double weightedScore = 0.0;
        double co2PerKg = 0.0;
        double waterPerKg = 0.0;

        for (Map.Entry<String, Double> e : composition.shares().entrySet()) {
            double share = e.getValue();
            if (share <= 0.0) {
                continue;
            }
            MaterialFactor factor = factorTables.factorFor(e.getKey());
            weightedScore += share * factor.getSustainabilityWeight();
            co2PerKg += share * factor.getCo2PerKg();
            waterPerKg += share * factor.getWaterPerKg();
            totalShare += share;
        }

        double materialScore = totalShare > 0.0 ? weightedScore / totalShare : NEUTRAL_SCORE;
        return new MaterialScore(Scores.clamp(materialScore), co2PerKg, waterPerKg);
    }

    @Value
    public static class MaterialScore {
        double score;
        double co2PerKg;
        double waterPerKg;
    }
}
