package com.ecoscore.impact.engine;

import com.ecoscore.impact.domain.AssessmentRequest;
import com.ecoscore.impact.domain.ImpactResult;

public interface ImpactEngine {
    ImpactResult assess(AssessmentRequest request);
}
