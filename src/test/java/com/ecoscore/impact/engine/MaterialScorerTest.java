package com.ecoscore.impact.engine;

import com.ecoscore.impact.domain.MaterialComposition;
import com.ecoscore.impact.domain.MaterialFactor;
import com.ecoscore.impact.engine.MaterialScorer.MaterialScore;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MaterialScorerTest {

    private final FactorTables tables = new FactorTables();
    private final MaterialScorer scorer = new MaterialScorer(tables);

    @Test
    void singleMaterialIsDirectLookup() {
        MaterialFactor hemp = tables.factorFor("hemp");

        MaterialScore s = scorer.score(MaterialComposition.single("hemp"));

        assertEquals(hemp.getSustainabilityWeight(), s.getScore(), 1e-9);
        assertEquals(hemp.getCo2PerKg(), s.getCo2PerKg(), 1e-9);
        assertEquals(hemp.getWaterPerKg(), s.getWaterPerKg(), 1e-9);
    }

    @Test
    void blendIsShareWeighted() {
        Map<String, Double> blend = new LinkedHashMap<>();
        blend.put("polyester", 0.6);
        blend.put("cotton", 0.4);

        MaterialScore s = scorer.score(MaterialComposition.of(blend));

        assertEquals(0.6 * 36 + 0.4 * 48, s.getScore(), 1e-9);
        assertEquals(0.6 * 8.2 + 0.4 * 5.2, s.getCo2PerKg(), 1e-9);
        assertEquals(0.6 * 95 + 0.4 * 9_500, s.getWaterPerKg(), 1e-9);
    }

    @Test
    void zeroSharesAreIgnored() {
        Map<String, Double> blend = new LinkedHashMap<>();
        blend.put("linen", 1.0);
        blend.put("leather", 0.0);

        MaterialScore s = scorer.score(MaterialComposition.of(blend));

        assertEquals(76, s.getScore(), 1e-9);
        assertEquals(1.9, s.getCo2PerKg(), 1e-9);
    }

    @Test
    void unknownMaterialUsesDefaultFactor() {
        MaterialScore s = scorer.score(MaterialComposition.single("unobtainium"));

        assertEquals(52, s.getScore(), 1e-9);
        assertEquals(5.8, s.getCo2PerKg(), 1e-9);
        assertEquals(1_800, s.getWaterPerKg(), 1e-9);
    }

    @Test
    void scoreStaysWithinBounds() {
        for (MaterialFactor f : tables.materialFactors()) {
            double score = scorer.score(MaterialComposition.single(f.getMaterialId())).getScore();
            assertTrue(score >= 0 && score <= 100, f.getMaterialId() + " -> " + score);
        }
    }
}
