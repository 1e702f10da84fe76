package com.ecoscore.impact.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ImpactResult {
    @JsonProperty("product_name")
    private String productName;

    // 0-100, higher is better
    @JsonProperty("total_sustainability_score")
    private double totalSustainabilityScore;

    @JsonProperty("co2_estimate_kg")
    private double co2EstimateKg;

    @JsonProperty("water_usage_liters")
    private double waterUsageLiters;

    @JsonProperty("breakdown")
    private ScoreBreakdown breakdown;

    @JsonProperty("cbam_relevant")
    private boolean cbamRelevant;

    @JsonProperty("cbam_reason")
    private String cbamReason;

    @JsonProperty("explanation")
    private List<String> explanation;

    @JsonProperty("limitations")
    private String limitations;

    @JsonProperty("methodology_version")
    private String methodologyVersion;
}
