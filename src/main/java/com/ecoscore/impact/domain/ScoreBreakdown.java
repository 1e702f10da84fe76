package com.ecoscore.impact.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ScoreBreakdown {
    @JsonProperty("material_score")
    private double materialScore;

    @JsonProperty("logistics_score")
    private double logisticsScore;

    @JsonProperty("weight_impact")
    private double weightImpact;
}
