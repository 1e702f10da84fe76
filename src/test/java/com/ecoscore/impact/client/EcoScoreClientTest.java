package com.ecoscore.impact.client;

import com.ecoscore.impact.domain.ImpactResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class EcoScoreClientTest {

    private static final String RESPONSE = """
            {
              "product_name": "T-Shirt",
              "total_sustainability_score": 71.12,
              "co2_estimate_kg": 2.71,
              "water_usage_liters": 1625.0,
              "breakdown": {"material_score": 74.0, "logistics_score": 50.0, "weight_impact": 95.61},
              "cbam_relevant": false,
              "cbam_reason": "Materials do not contain aluminum, cement, fertilizer, hydrogen, iron, steel.",
              "explanation": ["Organic cotton uses less water and no synthetic pesticides."],
              "limitations": "Indicative model-based estimate.",
              "methodology_version": "1.0.0-indicative"
            }
            """;

    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    @Test
    void singleMaterialIsSentAsFullShareWithKeyHeader() {
        EcoScoreClient client = new EcoScoreClient("secret", "https://api.example.test/", restTemplate, k -> null);

        server.expect(requestTo("https://api.example.test/v1/assess-impact"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("X-API-Key", "secret"))
                .andExpect(jsonPath("$.product_name").value("T-Shirt"))
                .andExpect(jsonPath("$.material_composition.organic_cotton").value(1.0))
                .andExpect(jsonPath("$.weight_kg").value(0.25))
                .andExpect(jsonPath("$.origin_country").value("India"))
                .andRespond(withSuccess(RESPONSE, MediaType.APPLICATION_JSON));

        ImpactResult r = client.assessImpact("T-Shirt", "Organic Cotton", 0.25, "India", "Germany");

        server.verify();
        assertEquals(71.12, r.getTotalSustainabilityScore());
        assertEquals(2.71, r.getCo2EstimateKg());
        assertEquals(95.61, r.getBreakdown().getWeightImpact());
        assertFalse(r.isCbamRelevant());
        assertEquals("1.0.0-indicative", r.getMethodologyVersion());
        assertEquals(1, r.getExplanation().size());
    }

    @Test
    void blendNamesAreNormalizedAndDefaultsApplied() {
        EcoScoreClient client = new EcoScoreClient("secret", "https://api.example.test", restTemplate, k -> null);
        Map<String, Double> blend = new LinkedHashMap<>();
        blend.put("Recycled Polyester", 0.6);
        blend.put("Cotton", 0.4);

        server.expect(requestTo("https://api.example.test/v1/assess-impact"))
                .andExpect(jsonPath("$.material_composition.recycled_polyester").value(0.6))
                .andExpect(jsonPath("$.material_composition.cotton").value(0.4))
                .andRespond(withSuccess(RESPONSE, MediaType.APPLICATION_JSON));

        client.assessImpact("Jacket", blend, EcoScoreClient.DEFAULT_WEIGHT_KG,
                EcoScoreClient.DEFAULT_ORIGIN, EcoScoreClient.DEFAULT_DESTINATION);
        server.verify();
    }

    @Test
    void shortFormUsesDefaultWeightAndRoute() {
        EcoScoreClient client = new EcoScoreClient("secret", "https://api.example.test", restTemplate, k -> null);

        server.expect(requestTo("https://api.example.test/v1/assess-impact"))
                .andExpect(jsonPath("$.weight_kg").value(0.2))
                .andExpect(jsonPath("$.origin_country").value("CN"))
                .andExpect(jsonPath("$.destination_country").value("US"))
                .andRespond(withSuccess(RESPONSE, MediaType.APPLICATION_JSON));

        client.assessImpact("T-Shirt", "cotton");
        server.verify();
    }

    @Test
    void httpErrorsCarryStatus() {
        EcoScoreClient client = new EcoScoreClient("bad", "https://api.example.test", restTemplate, k -> null);

        server.expect(requestTo("https://api.example.test/v1/assess-impact"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"message\":\"Invalid API key.\"}"));

        EcoScoreClientException ex = assertThrows(EcoScoreClientException.class,
                () -> client.assessImpact("T-Shirt", "cotton"));
        assertEquals(401, ex.getStatusCode());
        assertTrue(ex.getMessage().contains("Invalid API key."));
    }

    @Test
    void methodologyIsReturnedAsMap() {
        EcoScoreClient client = new EcoScoreClient("secret", "https://api.example.test", restTemplate, k -> null);

        server.expect(requestTo("https://api.example.test/v1/methodology"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"methodology_version\":\"1.0.0-indicative\"}", MediaType.APPLICATION_JSON));

        assertEquals("1.0.0-indicative", client.getMethodology().get("methodology_version"));
    }

    @Test
    void configurationFallsBackToEnvironment() {
        Map<String, String> env = Map.of(
                EcoScoreClient.API_KEY_ENV, "env-key",
                EcoScoreClient.BASE_URL_ENV, "https://env.example.test//");

        EcoScoreClient client = new EcoScoreClient(null, " ", restTemplate, env::get);

        assertEquals("https://env.example.test", client.getBaseUrl());
    }

    @Test
    void missingConfigurationIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new EcoScoreClient(null, "https://api.example.test", restTemplate, k -> null));
        assertThrows(IllegalArgumentException.class,
                () -> new EcoScoreClient("secret", null, restTemplate, k -> null));
    }
}
