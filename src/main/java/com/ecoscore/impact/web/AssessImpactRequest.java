package com.ecoscore.impact.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssessImpactRequest {
    @JsonProperty("product_name")
    private String productName;

    // Material -> share by weight, summing to 1.0
    @JsonProperty("material_composition")
    private Map<String, Double> materialComposition;

    @JsonProperty("weight_kg")
    private Double weightKg;

    @JsonProperty("origin_country")
    private String originCountry;

    @JsonProperty("destination_country")
    private String destinationCountry;
}
