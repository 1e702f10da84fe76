package com.ecoscore.impact.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Published description of how scores and estimates are derived.
 */
@Value
@Builder
@Jacksonized
public class Methodology {
    @JsonProperty("methodology_version")
    private String methodologyVersion;

    @JsonProperty("description")
    private String description;

    @JsonProperty("total_sustainability_score")
    private Map<String, Object> totalSustainabilityScore;

    @JsonProperty("co2_estimate_kg")
    private Map<String, Object> co2EstimateKg;

    @JsonProperty("water_usage_liters")
    private Map<String, Object> waterUsageLiters;

    @JsonProperty("breakdown")
    private Map<String, Object> breakdown;

    @JsonProperty("validation")
    private Map<String, Object> validation;

    @JsonProperty("factor_tables")
    private Map<String, Object> factorTables;

    @JsonProperty("disclaimer")
    private String disclaimer;
}
