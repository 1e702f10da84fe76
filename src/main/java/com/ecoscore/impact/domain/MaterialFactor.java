package com.ecoscore.impact.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MaterialFactor {
    private String materialId;

    // kg CO2e per kg of material
    private double co2PerKg;

    // liters per kg of material
    private double waterPerKg;

    // Intrinsic sustainability (0-100), higher = lower impact
    private double sustainabilityWeight;

    // EU Carbon Border Adjustment Mechanism category
    private boolean cbamRelevant;

    // Optional one-line note surfaced in the result explanation
    private String explanation;
}
