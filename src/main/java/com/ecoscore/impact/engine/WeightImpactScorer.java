package com.ecoscore.impact.engine;

import org.springframework.stereotype.Component;

/**
 * Saturating weight penalty: {@code floor + (100 - floor) * exp(-weightKg / scaleKg)}.
 * <p>
 * Strictly decreasing in weight, tends to 100 for very light items and to the
 * floor for very heavy ones.
 */
@Component
public class WeightImpactScorer {

    public static final double FLOOR = 10.0;
    public static final double SCALE_KG = 5.0;

    public double score(double weightKg) {
        double w = Math.max(0.0, weightKg);
        return Scores.clamp(FLOOR + (Scores.MAX - FLOOR) * Math.exp(-w / SCALE_KG));
    }
}
