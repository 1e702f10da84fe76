package com.ecoscore.impact.engine;

import com.ecoscore.impact.domain.AssessmentRequest;
import com.ecoscore.impact.domain.DistanceTier;
import com.ecoscore.impact.domain.ImpactResult;
import com.ecoscore.impact.domain.MaterialFactor;
import com.ecoscore.impact.domain.ScoreBreakdown;
import com.ecoscore.impact.engine.CbamDetector.CbamAnalysis;
import com.ecoscore.impact.engine.LogisticsScorer.LogisticsScore;
import com.ecoscore.impact.engine.MaterialScorer.MaterialScore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Combines the sub-scores into the final, immutable {@link ImpactResult}.
 * Pure: the same inputs always give an equal result.
 */
@Component
@RequiredArgsConstructor
public class ScoreAggregator {

    public static final double MATERIAL_WEIGHT = 0.5;
    public static final double LOGISTICS_WEIGHT = 0.3;
    public static final double WEIGHT_IMPACT_WEIGHT = 0.2;

    public static final String METHODOLOGY_VERSION = "1.0.0-indicative";
    public static final String LIMITATIONS =
            "Indicative model-based estimate for internal assessment only; not a certified LCA "
                    + "and not for regulatory CBAM filings.";

    static final double HEAVY_PRODUCT_KG = 5.0;
    static final double LIGHT_PRODUCT_KG = 0.3;

    private final FactorTables factorTables;

    public static double totalScore(double materialScore, double logisticsScore, double weightImpact) {
        return Scores.clamp(MATERIAL_WEIGHT * materialScore
                + LOGISTICS_WEIGHT * logisticsScore
                + WEIGHT_IMPACT_WEIGHT * weightImpact);
    }

    public ImpactResult aggregate(AssessmentRequest request,
                                  MaterialScore material,
                                  LogisticsScore logistics,
                                  double weightImpact,
                                  CbamAnalysis cbam) {
        ScoreBreakdown breakdown = ScoreBreakdown.builder()
                .materialScore(Scores.round2(material.getScore()))
                .logisticsScore(Scores.round2(logistics.getScore()))
                .weightImpact(Scores.round2(weightImpact))
                .build();

        double total = totalScore(breakdown.getMaterialScore(), breakdown.getLogisticsScore(), breakdown.getWeightImpact());

        double weightKg = request.getWeightKg();
        double co2 = weightKg * material.getCo2PerKg() + logistics.getCo2Kg();
        double water = weightKg * material.getWaterPerKg();

        return ImpactResult.builder()
                .productName(request.getProductName())
                .totalSustainabilityScore(total)
                .co2EstimateKg(Scores.round2(Math.max(0.0, co2)))
                .waterUsageLiters(Scores.round2(Math.max(0.0, water)))
                .breakdown(breakdown)
                .cbamRelevant(cbam.isRelevant())
                .cbamReason(cbam.getReason())
                .explanation(explain(request, logistics))
                .limitations(LIMITATIONS)
                .methodologyVersion(METHODOLOGY_VERSION)
                .build();
    }

    private List<String> explain(AssessmentRequest request, LogisticsScore logistics) {
        List<String> lines = new ArrayList<>();

        for (Map.Entry<String, Double> e : request.getComposition().shares().entrySet()) {
            if (e.getValue() <= 0.0) {
                continue;
            }
            if (!factorTables.isKnownMaterial(e.getKey())) {
                lines.add("Unknown material '" + e.getKey() + "' scored with default factors.");
                continue;
            }
            MaterialFactor factor = factorTables.factorFor(e.getKey());
            if (factor.getExplanation() != null) {
                lines.add(factor.getExplanation());
            }
        }

        DistanceTier tier = logistics.getProfile().getTier();
        if (!logistics.getProfile().isResolved()) {
            lines.add("Route could not be resolved; the most conservative shipping tier was applied.");
        } else if (tier == DistanceTier.DOMESTIC) {
            lines.add("Domestic delivery keeps logistics impact minimal.");
        } else if (tier == DistanceTier.REGIONAL) {
            lines.add("Short shipping distance keeps logistics impact low.");
        } else if (tier == DistanceTier.INTERCONTINENTAL) {
            lines.add("Intercontinental shipping substantially increases emissions.");
        }

        double weightKg = request.getWeightKg();
        if (weightKg > HEAVY_PRODUCT_KG) {
            lines.add(String.format(Locale.ROOT, "Heavy product (%.1f kg) lowers the weight impact score.", weightKg));
        } else if (weightKg < LIGHT_PRODUCT_KG) {
            lines.add("Lightweight product contributes to a better sustainability score.");
        }
        return List.copyOf(lines);
    }
}
