package com.ecoscore.impact.domain;

import com.ecoscore.impact.exception.AssessmentValidationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Map;

/**
 * A product description that has passed boundary validation.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AssessmentRequest {

    // Keeps weight * factor products finite
    public static final double MAX_WEIGHT_KG = 1_000_000.0;

    private String productName;
    private MaterialComposition composition;
    private double weightKg;
    private String originCountry;
    private String destinationCountry;

    public static AssessmentRequest of(String productName,
                                       Map<String, Double> composition,
                                       Double weightKg,
                                       String originCountry,
                                       String destinationCountry) {
        if (productName == null || productName.isBlank()) {
            throw new AssessmentValidationException("product_name must not be empty");
        }
        if (weightKg == null || !Double.isFinite(weightKg) || weightKg <= 0.0) {
            throw new AssessmentValidationException("weight_kg must be greater than 0, got " + weightKg);
        }
        if (weightKg > MAX_WEIGHT_KG) {
            throw new AssessmentValidationException(
                    "weight_kg must not exceed " + (long) MAX_WEIGHT_KG + ", got " + weightKg);
        }
        if (originCountry == null || originCountry.isBlank()) {
            throw new AssessmentValidationException("origin_country must not be empty");
        }
        if (destinationCountry == null || destinationCountry.isBlank()) {
            throw new AssessmentValidationException("destination_country must not be empty");
        }
        return new AssessmentRequest(
                productName.trim(),
                MaterialComposition.of(composition),
                weightKg,
                originCountry.trim(),
                destinationCountry.trim());
    }
}
