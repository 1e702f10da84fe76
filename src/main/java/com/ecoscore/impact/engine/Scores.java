package com.ecoscore.impact.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class Scores {

    static final double MIN = 0.0;
    static final double MAX = 100.0;

    private Scores() {}

    static double clamp(double score) {
        return Math.max(MIN, Math.min(MAX, score));
    }

    // Half-up at 2 decimals, matching how the API reports figures
    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
