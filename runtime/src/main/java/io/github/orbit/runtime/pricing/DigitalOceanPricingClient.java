package io.github.orbit.runtime.pricing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.orbit.persistence.document.ApiKeyDocument;
import io.github.orbit.persistence.repository.ApiKeyRepository;
import io.github.orbit.protocol.api.ProviderType;
import io.github.orbit.runtime.config.OrbitProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.OptionalDouble;

/**
 * Reads hourly droplet prices from the DigitalOcean sizes catalog. Pages through
 * {@code /v2/sizes} and matches the slug among sizes offered in the provider's region.
 */
@Component
public class DigitalOceanPricingClient implements PricingClient {

    private static final Logger log = LoggerFactory.getLogger(DigitalOceanPricingClient.class);
    static final int PAGE_SIZE = 200;
    private static final int MAX_PAGES = 50;

    private final ApiKeyRepository apiKeyRepository;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final String baseUrl;

    @Autowired
    public DigitalOceanPricingClient(ApiKeyRepository apiKeyRepository, ObjectMapper objectMapper,
                                     OrbitProperties properties) {
        this(apiKeyRepository, objectMapper,
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                properties.pricing().digitalocean().baseUrl());
    }

    DigitalOceanPricingClient(ApiKeyRepository apiKeyRepository, ObjectMapper objectMapper,
                              HttpClient httpClient, String baseUrl) {
        this.apiKeyRepository = apiKeyRepository;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public ProviderType providerType() {
        return ProviderType.DIGITALOCEAN;
    }

    @Override
    public OptionalDouble hourlyPrice(ProviderSettings provider, String sizeSlug) throws PricingLookupException {
        String token = apiKeyRepository
                .findFirstByProviderIdAndKeyTypeOrderByCreatedAtAsc(provider.providerId(), ApiKeyDocument.KEY_TYPE_API_KEY)
                .map(ApiKeyDocument::getKey)
                .orElseThrow(() -> new PricingLookupException("No API key found for provider " + provider.providerId()));

        for (int page = 1; page <= MAX_PAGES; page++) {
            JsonNode body = fetchPage(token, page);
            for (JsonNode size : body.path("sizes")) {
                if (!sizeSlug.equals(size.path("slug").asText())) continue;
                if (!offeredIn(size, provider.region())) continue;
                double price = size.path("price_hourly").asDouble(0);
                if (price > 0) return OptionalDouble.of(price);
            }
            if (body.path("links").path("pages").path("next").isMissingNode()) break;
        }
        log.debug("Size {} not offered in region {} by provider {}", sizeSlug, provider.region(), provider.providerId());
        return OptionalDouble.empty();
    }

    private JsonNode fetchPage(String token, int page) throws PricingLookupException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/v2/sizes?per_page=" + PAGE_SIZE + "&page=" + page))
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(30))
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new PricingLookupException("DigitalOcean sizes request failed with HTTP " + response.statusCode());
            }
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new PricingLookupException("Failed to fetch DigitalOcean sizes: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PricingLookupException("Interrupted while fetching DigitalOcean sizes", e);
        }
    }

    private static boolean offeredIn(JsonNode size, String region) {
        for (JsonNode r : size.path("regions")) {
            if (region.equals(r.asText())) return true;
        }
        return false;
    }
}
