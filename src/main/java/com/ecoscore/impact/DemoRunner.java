package com.ecoscore.impact;

import com.ecoscore.impact.domain.ImpactResult;
import com.ecoscore.impact.exception.AssessmentValidationException;
import com.ecoscore.impact.service.ImpactAssessmentService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs two sample assessments at startup when {@code ecoscore.demo.enabled=true}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "ecoscore.demo", name = "enabled", havingValue = "true")
public class DemoRunner implements CommandLineRunner {

    private final ImpactAssessmentService service;

    public DemoRunner(ImpactAssessmentService service) {
        this.service = service;
    }

    @Override
    public void run(String... args) {
        log.info("=== STARTING IMPACT ASSESSMENT DEMO ===");

        // 1. Single natural fibre, long haul
        report(service.assess("Organic Cotton T-Shirt", Map.of("organic_cotton", 1.0), 0.25, "India", "Germany"));

        // 2. Blended jacket with a CBAM metal zipper, regional route
        Map<String, Double> jacket = new LinkedHashMap<>();
        jacket.put("recycled_polyester", 0.7);
        jacket.put("wool", 0.25);
        jacket.put("aluminum", 0.05);
        report(service.assess("Winter Jacket", jacket, 1.4, "PL", "DE"));

        // 3. Shares not summing to 1.0 are rejected
        try {
            service.assess("Broken Blend", Map.of("cotton", 0.5, "polyester", 0.3), 0.3, "CN", "US");
        } catch (AssessmentValidationException e) {
            log.info("Rejected as expected: {}", e.getMessage());
        }
    }

    private void report(ImpactResult result) {
        log.info("--- {} ---", result.getProductName());
        log.info("Score: {} (material {}, logistics {}, weight {})",
                result.getTotalSustainabilityScore(),
                result.getBreakdown().getMaterialScore(),
                result.getBreakdown().getLogisticsScore(),
                result.getBreakdown().getWeightImpact());
        log.info("CO2: {} kg, water: {} L, CBAM: {}",
                result.getCo2EstimateKg(), result.getWaterUsageLiters(), result.isCbamRelevant());
        result.getExplanation().forEach(line -> log.info("  - {}", line));
    }
}
