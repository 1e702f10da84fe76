package com.ecoscore.impact.engine;

import com.ecoscore.impact.domain.DistanceTier;
import com.ecoscore.impact.domain.LogisticsProfile;
import com.ecoscore.impact.domain.MaterialComposition;
import com.ecoscore.impact.domain.MaterialFactor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Built-in, read-only emission, water and distance data.
 * <p>
 * Populated once in the constructor; all views handed out are unmodifiable, so a
 * single instance is shared by every scorer and every request thread.
 */
@Slf4j
@Component
public class FactorTables {

    public static final String DEFAULT_MATERIAL_ID = "default";

    public static final double EARTH_RADIUS_KM = 6371.0;
    public static final double REGIONAL_MAX_KM = 2_000.0;
    public static final double CONTINENTAL_MAX_KM = 6_000.0;

    private final Map<String, MaterialFactor> materials;
    private final MaterialFactor defaultFactor;
    private final Map<String, double[]> countryCoordinates;

    public FactorTables() {
        Map<String, MaterialFactor> m = new LinkedHashMap<>();
        put(m, "cotton", 5.2, 9_500, 48, false, "Conventional cotton has high water usage (up to 10,000 L/kg).");
        put(m, "organic_cotton", 3.0, 6_500, 74, false, "Organic cotton uses less water and no synthetic pesticides.");
        put(m, "polyester", 8.2, 95, 36, false, "Polyester is a synthetic material with high energy intensity.");
        put(m, "recycled_polyester", 5.7, 70, 72, false, "Recycled polyester cuts emissions by about 30% against virgin polyester.");
        put(m, "nylon", 8.8, 95, 34, false, "Nylon production is energy-intensive with significant CO2 emissions.");
        put(m, "wool", 24.0, 480, 42, false, "Wool production has high methane emissions from sheep.");
        put(m, "linen", 1.9, 1_900, 76, false, "Linen (flax) is one of the most sustainable natural fibers.");
        put(m, "hemp", 2.3, 2_400, 82, false, "Hemp requires minimal water and no pesticides.");
        put(m, "bamboo", 3.5, 750, 70, false, "Bamboo grows fast but processing can be chemical-intensive.");
        put(m, "viscose", 4.0, 580, 56, false, null);
        put(m, "lyocell", 2.6, 380, 72, false, null);
        put(m, "leather", 62.0, 16_000, 26, false, "Leather has very high CO2 due to cattle farming and tanning.");
        put(m, "rubber", 2.8, 1_900, 62, false, null);
        put(m, "steel", 1.85, 150, 55, true, "Steel production is carbon-intensive (CBAM-relevant).");
        put(m, "aluminum", 11.5, 1_200, 38, true, "Aluminum smelting is very energy-intensive (CBAM-relevant).");
        put(m, "cement", 0.85, 50, 50, true, "Cement is a major industrial CO2 source (CBAM-relevant).");
        put(m, "fertilizer", 2.1, 200, 52, true, "Fertilizer production relies on fossil-derived ammonia (CBAM-relevant).");
        put(m, "hydrogen", 10.0, 20, 45, true, null);
        put(m, "iron", 1.9, 120, 52, true, "Iron production involves high-temperature furnaces (CBAM-relevant).");
        this.materials = Collections.unmodifiableMap(m);

        // Neutral values used for any material not listed above
        this.defaultFactor = MaterialFactor.builder()
                .materialId(DEFAULT_MATERIAL_ID)
                .co2PerKg(5.8)
                .waterPerKg(1_800)
                .sustainabilityWeight(52)
                .cbamRelevant(false)
                .build();

        Map<String, double[]> c = new LinkedHashMap<>();
        country(c, 47.5162, 14.5501, "at", "austria");
        country(c, -25.2744, 133.7751, "au", "australia");
        country(c, 50.5039, 4.4699, "be", "belgium");
        country(c, 42.7339, 25.4858, "bg", "bulgaria");
        country(c, -14.2350, -51.9253, "br", "brazil");
        country(c, 23.6850, 90.3563, "bd", "bangladesh");
        country(c, 56.1304, -106.3468, "ca", "canada");
        country(c, 35.8617, 104.1954, "cn", "china");
        country(c, 51.1657, 10.4515, "de", "germany");
        country(c, 46.2276, 2.2137, "fr", "france");
        country(c, 55.3781, -3.4360, "gb", "uk", "united_kingdom");
        country(c, 20.5937, 78.9629, "in", "india");
        country(c, 41.8719, 12.5674, "it", "italy");
        country(c, 36.2048, 138.2529, "jp", "japan");
        country(c, 23.6345, -102.5528, "mx", "mexico");
        country(c, 52.1326, 5.2913, "nl", "netherlands");
        country(c, 51.9194, 19.1451, "pl", "poland");
        country(c, 39.3999, -8.2245, "pt", "portugal");
        country(c, 45.9432, 24.9668, "ro", "romania");
        country(c, 61.5240, 105.3188, "ru", "russia");
        country(c, 40.4637, -3.7492, "es", "spain");
        country(c, 38.9637, 35.2433, "tr", "turkey");
        country(c, 37.0902, -95.7129, "us", "usa", "united_states");
        country(c, 14.0583, 108.2772, "vn", "vietnam");
        this.countryCoordinates = Collections.unmodifiableMap(c);

        log.info("Factor tables loaded: {} materials, {} country keys", materials.size(), countryCoordinates.size());
    }

    /**
     * Factor for a material id, or the default factor when the id is unknown.
     */
    public MaterialFactor factorFor(String materialId) {
        return materials.getOrDefault(MaterialComposition.normalizeId(materialId), defaultFactor);
    }

    public boolean isKnownMaterial(String materialId) {
        return materials.containsKey(MaterialComposition.normalizeId(materialId));
    }

    public MaterialFactor defaultFactor() {
        return defaultFactor;
    }

    public Collection<MaterialFactor> materialFactors() {
        return materials.values();
    }

    public Set<String> cbamMaterialIds() {
        Set<String> ids = new TreeSet<>();
        for (MaterialFactor f : materials.values()) {
            if (f.isCbamRelevant()) {
                ids.add(f.getMaterialId());
            }
        }
        return Collections.unmodifiableSet(ids);
    }

    /**
     * Resolves the shipping tier for an origin/destination pair. Same country is
     * DOMESTIC; an unrecognized country yields the most conservative tier.
     */
    public LogisticsProfile logisticsProfile(String origin, String destination) {
        String o = normalizeCountry(origin);
        String d = normalizeCountry(destination);

        double[] from = countryCoordinates.get(o);
        double[] to = countryCoordinates.get(d);

        double distanceKm;
        DistanceTier tier;
        if (!o.isEmpty() && (o.equals(d) || (from != null && from == to))) {
            distanceKm = 0.0;
            tier = DistanceTier.DOMESTIC;
        } else if (from != null && to != null) {
            distanceKm = haversineKm(from[0], from[1], to[0], to[1]);
            tier = tierFor(distanceKm);
        } else {
            distanceKm = Double.NaN;
            tier = DistanceTier.mostConservative();
        }

        return LogisticsProfile.builder()
                .origin(origin)
                .destination(destination)
                .distanceKm(distanceKm)
                .tier(tier)
                .build();
    }

    static DistanceTier tierFor(double distanceKm) {
        if (distanceKm <= 0.0) {
            return DistanceTier.DOMESTIC;
        }
        if (distanceKm < REGIONAL_MAX_KM) {
            return DistanceTier.REGIONAL;
        }
        if (distanceKm < CONTINENTAL_MAX_KM) {
            return DistanceTier.CONTINENTAL;
        }
        return DistanceTier.INTERCONTINENTAL;
    }

    static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    static String normalizeCountry(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    private static void put(Map<String, MaterialFactor> m, String id, double co2, double water,
                            double weight, boolean cbam, String explanation) {
        m.put(id, MaterialFactor.builder()
                .materialId(id)
                .co2PerKg(co2)
                .waterPerKg(water)
                .sustainabilityWeight(weight)
                .cbamRelevant(cbam)
                .explanation(explanation)
                .build());
    }

    private static void country(Map<String, double[]> c, double lat, double lon, String... keys) {
        double[] point = {lat, lon};
        for (String key : keys) {
            c.put(key, point);
        }
    }
}
