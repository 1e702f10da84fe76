package com.ecoscore.impact.engine;

import com.ecoscore.impact.domain.AssessmentRequest;
import com.ecoscore.impact.domain.ImpactResult;
import com.ecoscore.impact.engine.CbamDetector.CbamAnalysis;
import com.ecoscore.impact.engine.LogisticsScorer.LogisticsScore;
import com.ecoscore.impact.engine.MaterialScorer.MaterialScore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Static-factor engine: material, then logistics, then weight, then CBAM, then aggregation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IndicativeImpactEngine implements ImpactEngine {

    private final MaterialScorer materialScorer;
    private final LogisticsScorer logisticsScorer;
    private final WeightImpactScorer weightImpactScorer;
    private final CbamDetector cbamDetector;
    private final ScoreAggregator scoreAggregator;

    @Override
    public ImpactResult assess(AssessmentRequest request) {
        MaterialScore material = materialScorer.score(request.getComposition());
        LogisticsScore logistics = logisticsScorer.score(
                request.getOriginCountry(), request.getDestinationCountry(), request.getWeightKg());
        double weightImpact = weightImpactScorer.score(request.getWeightKg());
        CbamAnalysis cbam = cbamDetector.analyze(request.getComposition());

        log.debug("Sub-scores for '{}': material={}, logistics={} ({}), weight={}, cbam={}",
                request.getProductName(), material.getScore(), logistics.getScore(),
                logistics.getProfile().getTier(), weightImpact, cbam.isRelevant());

        return scoreAggregator.aggregate(request, material, logistics, weightImpact, cbam);
    }
}
