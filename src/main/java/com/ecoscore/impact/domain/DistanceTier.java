package com.ecoscore.impact.domain;

/**
 * Coarse shipping distance buckets, ordered from closest to farthest.
 * <p>
 * CO2 factors are sea freight (0.58 kg CO2e per kg per 1000 km) with a 1.5x
 * route circuitry over a representative distance per tier.
 */
public enum DistanceTier {
    DOMESTIC(0, 0.0, 95),
    REGIONAL(1_000, 0.87, 90),
    CONTINENTAL(4_000, 3.48, 75),
    INTERCONTINENTAL(9_000, 7.83, 50);

    private final int representativeKm;
    private final double co2PerKg;
    private final double score;

    DistanceTier(int representativeKm, double co2PerKg, double score) {
        this.representativeKm = representativeKm;
        this.co2PerKg = co2PerKg;
        this.score = score;
    }

    public int getRepresentativeKm() {
        return representativeKm;
    }

    public double getCo2PerKg() {
        return co2PerKg;
    }

    public double getScore() {
        return score;
    }

    /** The tier used when a route cannot be resolved. */
    public static DistanceTier mostConservative() {
        return INTERCONTINENTAL;
    }
}
