package com.ecoscore.impact.client;

import com.ecoscore.impact.domain.ImpactResult;
import com.ecoscore.impact.domain.MaterialComposition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Client for the assessment API. Sends the {@code X-API-Key} header on every call.
 * <p>
 * The API key and base URL come from the constructor arguments, or from the
 * {@code ECOSCORE_API_KEY} and {@code ECOSCORE_BASE_URL} environment variables.
 */
@Slf4j
public class EcoScoreClient {

    public static final String API_KEY_ENV = "ECOSCORE_API_KEY";
    public static final String BASE_URL_ENV = "ECOSCORE_BASE_URL";

    static final double DEFAULT_WEIGHT_KG = 0.2;
    static final String DEFAULT_ORIGIN = "CN";
    static final String DEFAULT_DESTINATION = "US";

    private final String apiKey;
    private final String baseUrl;
    private final RestTemplate restTemplate;

    public EcoScoreClient() {
        this(null, null);
    }

    public EcoScoreClient(String apiKey, String baseUrl) {
        this(apiKey, baseUrl, new RestTemplate(), System::getenv);
    }

    public EcoScoreClient(String apiKey, String baseUrl, RestTemplate restTemplate) {
        this(apiKey, baseUrl, restTemplate, System::getenv);
    }

    EcoScoreClient(String apiKey, String baseUrl, RestTemplate restTemplate, Function<String, String> env) {
        this.apiKey = firstNonBlank(apiKey, env.apply(API_KEY_ENV));
        if (this.apiKey == null) {
            throw new IllegalArgumentException("API key required. Pass apiKey or set " + API_KEY_ENV + ".");
        }
        String url = firstNonBlank(baseUrl, env.apply(BASE_URL_ENV));
        if (url == null) {
            throw new IllegalArgumentException("Base URL required. Pass baseUrl or set " + BASE_URL_ENV + ".");
        }
        this.baseUrl = url.replaceAll("/+$", "");
        this.restTemplate = restTemplate;
    }

    public ImpactResult assessImpact(String product, String material) {
        return assessImpact(product, material, DEFAULT_WEIGHT_KG, DEFAULT_ORIGIN, DEFAULT_DESTINATION);
    }

    /** Assesses a product made entirely of one material. */
    public ImpactResult assessImpact(String product, String material, double weightKg,
                                     String originCountry, String destinationCountry) {
        return assessImpact(product, Map.of(material, 1.0), weightKg, originCountry, destinationCountry);
    }

    public ImpactResult assessImpact(String product, Map<String, Double> materials, double weightKg,
                                     String originCountry, String destinationCountry) {
        Map<String, Double> composition = new LinkedHashMap<>();
        materials.forEach((name, share) -> composition.merge(MaterialComposition.normalizeId(name), share, Double::sum));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("product_name", product);
        payload.put("material_composition", composition);
        payload.put("weight_kg", weightKg);
        payload.put("origin_country", originCountry);
        payload.put("destination_country", destinationCountry);

        return exchange(HttpMethod.POST, "/v1/assess-impact", payload,
                new ParameterizedTypeReference<ImpactResult>() {});
    }

    public Map<String, Object> getMethodology() {
        return exchange(HttpMethod.GET, "/v1/methodology", null,
                new ParameterizedTypeReference<Map<String, Object>>() {});
    }

    String getBaseUrl() {
        return baseUrl;
    }

    private <T> T exchange(HttpMethod method, String path, Object body, ParameterizedTypeReference<T> type) {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-API-Key", apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        String url = baseUrl + path;
        try {
            ResponseEntity<T> resp = restTemplate.exchange(url, method, new HttpEntity<>(body, headers), type);
            return resp.getBody();
        } catch (RestClientResponseException e) {
            log.warn("{} {} failed with HTTP {}", method, url, e.getStatusCode().value());
            throw new EcoScoreClientException(
                    method + " " + path + " failed with HTTP " + e.getStatusCode().value() + ": "
                            + e.getResponseBodyAsString(),
                    e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new EcoScoreClientException(method + " " + path + " failed: " + e.getMessage(), -1, e);
        }
    }

    private static String firstNonBlank(String explicit, String fallback) {
        if (explicit != null && !explicit.isBlank()) {
            return explicit.trim();
        }
        if (fallback != null && !fallback.isBlank()) {
            return fallback.trim();
        }
        return null;
    }
}
