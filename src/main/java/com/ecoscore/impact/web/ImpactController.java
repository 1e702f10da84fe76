package com.ecoscore.impact.web;

import com.ecoscore.impact.domain.ImpactResult;
import com.ecoscore.impact.domain.Methodology;
import com.ecoscore.impact.service.ImpactAssessmentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class ImpactController {

    private final ImpactAssessmentService assessmentService;

    @PostMapping("/v1/assess-impact")
    public ResponseEntity<ImpactResult> assessImpact(@RequestBody AssessImpactRequest request) {
        ImpactResult result = assessmentService.assess(
                request.getProductName(),
                request.getMaterialComposition(),
                request.getWeightKg(),
                request.getOriginCountry(),
                request.getDestinationCountry()
        );
        return ResponseEntity.ok(result);
    }

    @GetMapping("/v1/methodology")
    public ResponseEntity<Methodology> methodology() {
        return ResponseEntity.ok(assessmentService.methodology());
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }
}
