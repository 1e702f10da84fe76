package com.ecoscore.impact.engine;

import com.ecoscore.impact.domain.LogisticsProfile;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

/**
 * Logistics sub-score and transport CO2 from the origin/destination tier.
 */
@Component
@RequiredArgsConstructor
public class LogisticsScorer {

    private final FactorTables factorTables;

    public LogisticsScore score(String origin, String destination, double weightKg) {
        LogisticsProfile profile = factorTables.logisticsProfile(origin, destination);
        return new LogisticsScore(
                profile,
                Scores.clamp(profile.getTier().getScore()),
                weightKg * profile.getTier().getCo2PerKg());
    }

    @Value
    public static class LogisticsScore {
        LogisticsProfile profile;
        double score;
        double co2Kg;
    }
}
