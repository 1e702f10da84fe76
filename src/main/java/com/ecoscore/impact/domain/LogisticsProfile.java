package com.ecoscore.impact.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LogisticsProfile {
    private String origin;
    private String destination;

    // Great-circle distance in km; NaN when either country is unknown
    private double distanceKm;

    private DistanceTier tier;

    public boolean isResolved() {
        return !Double.isNaN(distanceKm);
    }
}
