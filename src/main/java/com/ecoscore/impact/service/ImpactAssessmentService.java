package com.ecoscore.impact.service;

import com.ecoscore.impact.domain.AssessmentRequest;
import com.ecoscore.impact.domain.DistanceTier;
import com.ecoscore.impact.domain.ImpactResult;
import com.ecoscore.impact.domain.MaterialComposition;
import com.ecoscore.impact.domain.MaterialFactor;
import com.ecoscore.impact.domain.Methodology;
import com.ecoscore.impact.engine.FactorTables;
import com.ecoscore.impact.engine.ImpactEngine;
import com.ecoscore.impact.engine.ScoreAggregator;
import com.ecoscore.impact.engine.WeightImpactScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ImpactAssessmentService {

    static final String DESCRIPTION = "Indicative sustainability scoring and impact estimates for products "
            + "based on material composition, weight, and origin-to-destination logistics. Not a certified LCA.";

    static final String DISCLAIMER = "Results are indicative estimates only. They are not a certified Life Cycle "
            + "Assessment (LCA) and must not be used as the sole basis for compliance or marketing claims. "
            + "Methodology may change; check methodology_version.";

    private final ImpactEngine impactEngine;
    private final FactorTables factorTables;

    /**
     * Validates the raw fields and runs the engine.
     *
     * @throws com.ecoscore.impact.exception.AssessmentValidationException if any field is invalid
     */
    public ImpactResult assess(String productName,
                               Map<String, Double> materialComposition,
                               Double weightKg,
                               String originCountry,
                               String destinationCountry) {
        AssessmentRequest request = AssessmentRequest.of(
                productName, materialComposition, weightKg, originCountry, destinationCountry);
        return assess(request);
    }

    public ImpactResult assess(AssessmentRequest request) {
        ImpactResult result = impactEngine.assess(request);
        log.info("Assessed '{}': score={}, co2Kg={}, cbam={}",
                result.getProductName(), result.getTotalSustainabilityScore(),
                result.getCo2EstimateKg(), result.isCbamRelevant());
        return result;
    }

    public Methodology methodology() {
        Map<String, Object> total = new LinkedHashMap<>();
        total.put("formula", "0.50 * material_score + 0.30 * logistics_score + 0.20 * weight_impact, clamped to 0-100");
        Map<String, Object> weights = new LinkedHashMap<>();
        weights.put("material", ScoreAggregator.MATERIAL_WEIGHT);
        weights.put("logistics", ScoreAggregator.LOGISTICS_WEIGHT);
        weights.put("weight", ScoreAggregator.WEIGHT_IMPACT_WEIGHT);
        total.put("weights", weights);
        total.put("range", "0-100, higher is better");

        Map<String, Object> co2 = new LinkedHashMap<>();
        co2.put("components", List.of(
                "Material CO2: weight_kg * sum(share * material_co2_per_kg)",
                "Logistics CO2: weight_kg * distance_tier_co2_per_kg"));
        co2.put("unit", "kg CO2 equivalent");

        Map<String, Object> water = new LinkedHashMap<>();
        water.put("formula", "weight_kg * sum(share * material_water_liters_per_kg)");
        water.put("unit", "liters");

        Map<String, Object> breakdown = new LinkedHashMap<>();
        breakdown.put("material_score", "Share-weighted average of per-material sustainability weights (0-100).");
        breakdown.put("logistics_score", "Fixed score per distance tier; closer = higher (0-100).");
        breakdown.put("weight_impact", String.format(Locale.ROOT,
                "%.0f + %.0f * exp(-weight_kg / %.1f); lighter = higher, never below %.0f.",
                WeightImpactScorer.FLOOR, 100.0 - WeightImpactScorer.FLOOR,
                WeightImpactScorer.SCALE_KG, WeightImpactScorer.FLOOR));

        Map<String, Object> validation = new LinkedHashMap<>();
        validation.put("share_sum", 1.0);
        validation.put("share_sum_tolerance", MaterialComposition.SHARE_SUM_TOLERANCE);
        validation.put("weight_kg", "> 0");
        validation.put("max_weight_kg", AssessmentRequest.MAX_WEIGHT_KG);

        return Methodology.builder()
                .methodologyVersion(ScoreAggregator.METHODOLOGY_VERSION)
                .description(DESCRIPTION)
                .totalSustainabilityScore(total)
                .co2EstimateKg(co2)
                .waterUsageLiters(water)
                .breakdown(breakdown)
                .validation(validation)
                .factorTables(factorTableSummary())
                .disclaimer(DISCLAIMER)
                .build();
    }

    private Map<String, Object> factorTableSummary() {
        Map<String, Object> materials = new LinkedHashMap<>();
        for (MaterialFactor f : factorTables.materialFactors()) {
            materials.put(f.getMaterialId(), materialRow(f));
        }

        Map<String, Object> tiers = new LinkedHashMap<>();
        for (DistanceTier tier : DistanceTier.values()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("representative_km", tier.getRepresentativeKm());
            row.put("co2_per_kg", tier.getCo2PerKg());
            row.put("logistics_score", tier.getScore());
            tiers.put(tier.name().toLowerCase(Locale.ROOT), row);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("materials", materials);
        summary.put("default_material", materialRow(factorTables.defaultFactor()));
        summary.put("cbam_materials", List.copyOf(factorTables.cbamMaterialIds()));
        summary.put("distance_tiers", tiers);
        summary.put("unknown_route_tier", DistanceTier.mostConservative().name().toLowerCase(Locale.ROOT));
        return summary;
    }

    private static Map<String, Object> materialRow(MaterialFactor f) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("co2_per_kg", f.getCo2PerKg());
        row.put("water_liters_per_kg", f.getWaterPerKg());
        row.put("sustainability_weight", f.getSustainabilityWeight());
        row.put("cbam_relevant", f.isCbamRelevant());
        return row;
    }
}
