package com.ecoscore.impact.engine;

import com.ecoscore.impact.domain.MaterialComposition;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flags compositions containing any CBAM category material with a positive share.
 */
@Component
@RequiredArgsConstructor
public class CbamDetector {

    private final FactorTables factorTables;

    public CbamAnalysis analyze(MaterialComposition composition) {
        List<String> found = new ArrayList<>();
        for (Map.Entry<String, Double> e : composition.shares().entrySet()) {
            if (e.getValue() > 0.0 && factorTables.factorFor(e.getKey()).isCbamRelevant()) {
                found.add(e.getKey());
            }
        }

        if (!found.isEmpty()) {
            return new CbamAnalysis(true,
                    "Product contains CBAM-relevant material(s): " + String.join(", ", found) + ".");
        }
        return new CbamAnalysis(false,
                "Materials do not contain " + String.join(", ", factorTables.cbamMaterialIds()) + ".");
    }

    @Value
    public static class CbamAnalysis {
        boolean relevant;
        String reason;
    }
}
