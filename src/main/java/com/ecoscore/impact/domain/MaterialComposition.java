package com.ecoscore.impact.domain;

import com.ecoscore.impact.exception.AssessmentValidationException;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Validated material shares keyed by normalized material id.
 * <p>
 * Entries are kept sorted by id so that every iteration, and therefore every
 * floating-point sum over the shares, happens in the same order.
 */
@EqualsAndHashCode
@ToString
public final class MaterialComposition {

    public static final double SHARE_SUM_TOLERANCE = 0.01;

    private final SortedMap<String, Double> shares;

    private MaterialComposition(SortedMap<String, Double> shares) {
        this.shares = Collections.unmodifiableSortedMap(shares);
    }

    public static MaterialComposition of(Map<String, Double> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new AssessmentValidationException("material_composition must contain at least one material");
        }

        TreeMap<String, Double> normalized = new TreeMap<>();
        for (Map.Entry<String, Double> e : raw.entrySet()) {
            String id = normalizeId(e.getKey());
            if (id.isEmpty()) {
                throw new AssessmentValidationException("material_composition contains a blank material name");
            }
            Double share = e.getValue();
            if (share == null || !Double.isFinite(share) || share < 0.0 || share > 1.0) {
                throw new AssessmentValidationException(
                        "Share for material '" + e.getKey() + "' must be between 0 and 1, got " + share);
            }
            normalized.merge(id, share, Double::sum);
        }

        double sum = 0.0;
        for (double share : normalized.values()) {
            sum += share;
        }
        // compare at 6 decimals so 0.99 and 1.01 stay inside the tolerance despite binary rounding
        BigDecimal deviation = BigDecimal.valueOf(sum).setScale(6, RoundingMode.HALF_UP).subtract(BigDecimal.ONE).abs();
        if (deviation.compareTo(BigDecimal.valueOf(SHARE_SUM_TOLERANCE)) > 0) {
            throw new AssessmentValidationException(String.format(Locale.ROOT,
                    "material_composition shares must sum to 1.0 (+/- %.2f), got %.4f", SHARE_SUM_TOLERANCE, sum));
        }
        return new MaterialComposition(normalized);
    }

    public static MaterialComposition single(String materialId) {
        return of(Map.of(materialId, 1.0));
    }

    /** Lower-case, trimmed, with spaces and hyphens folded to underscores. */
    public static String normalizeId(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    }

    public Map<String, Double> shares() {
        return shares;
    }
}
