package com.realestate.spatial.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.realestate.spatial.application.port.out.GeocodingPort;
import com.realestate.spatial.domain.model.Coordinate;
import com.realestate.spatial.domain.model.GeocodeOutcome;
import com.realestate.spatial.infrastructure.config.SpatialProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * Forward geocoding against a Nominatim instance, restricted to one country.
 * No retries: every request counts against the provider's usage limit.
 */
@Service
public class NominatimClient implements GeocodingPort {

    private static final Logger logger = LoggerFactory.getLogger(NominatimClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final SpatialProperties.Geocoding settings;

    public NominatimClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        SpatialProperties properties
    ) {
        this.objectMapper = objectMapper;
        this.settings = properties.getGeocoding();
        this.webClient = webClientBuilder.clone()
            .baseUrl(settings.getBaseUrl())
            .defaultHeader(HttpHeaders.USER_AGENT, settings.getUserAgent())
            .build();
    }

    /**
     * Look up the best match for a free-text query.
     *
     * @param query place name or address
     * @return FOUND with coordinate, NOT_FOUND on an empty result,
     *         UNAVAILABLE on timeout, transport or HTTP error
     */
    @Override
    public GeocodeOutcome search(String query) {
        logger.debug("Geocoding query: '{}'", query);

        String responseBody;
        try {
            responseBody = webClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path("/search")
                    .queryParam("q", query)
                    .queryParam("countrycodes", settings.getCountryCode())
                    .queryParam("format", "json")
                    .queryParam("limit", 1)
                    .queryParam("accept-language", settings.getLanguage())
                    .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
                .block();
        } catch (WebClientResponseException e) {
            logger.warn("Geocoder returned {} for '{}'", e.getStatusCode(), query);
            return GeocodeOutcome.unavailable();
        } catch (WebClientException e) {
            logger.warn("Failed to reach geocoder for '{}': {}", query, e.getMessage());
            return GeocodeOutcome.unavailable();
        } catch (RuntimeException e) {
            // Mono#block rethrows timeouts as unchecked wrappers
            logger.warn("Geocoder call failed for '{}': {}", query, e.toString());
            return GeocodeOutcome.unavailable();
        }

        return parseResponse(query, responseBody);
    }

    private GeocodeOutcome parseResponse(String query, String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return GeocodeOutcome.notFound();
        }
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            if (!root.isArray() || root.isEmpty()) {
                logger.debug("No geocoding match for '{}'", query);
                return GeocodeOutcome.notFound();
            }

            JsonNode first = root.get(0);
            double lat = Double.parseDouble(first.path("lat").asText());
            double lon = Double.parseDouble(first.path("lon").asText());
            if (!Coordinate.isValid(lat, lon)) {
                logger.warn("Geocoder returned out-of-range coordinate {},{} for '{}'", lat, lon, query);
                return GeocodeOutcome.notFound();
            }

            String displayName = first.path("display_name").asText(null);
            logger.debug("Geocoded '{}' -> {},{}", query, lat, lon);
            return GeocodeOutcome.found(new Coordinate(lat, lon), displayName);
        } catch (Exception e) {
            logger.warn("Failed to parse geocoder response for '{}': {}", query, e.getMessage());
            return GeocodeOutcome.unavailable();
        }
    }
}
