package com.realestate.spatial.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.realestate.spatial.application.port.out.RoutingPort;
import com.realestate.spatial.domain.model.Coordinate;
import com.realestate.spatial.domain.service.GeometryTextCodec;
import com.realestate.spatial.infrastructure.config.SpatialProperties;
import org.locationtech.jts.geom.LineString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Road routing through an OSRM server.
 * OSRM speaks longitude-first in both the URL and the GeoJSON response.
 */
@Service
public class OsrmClient implements RoutingPort {

    private static final Logger logger = LoggerFactory.getLogger(OsrmClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final GeometryTextCodec geometryTextCodec;
    private final SpatialProperties.Routing settings;

    public OsrmClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        GeometryTextCodec geometryTextCodec,
        SpatialProperties properties
    ) {
        this.objectMapper = objectMapper;
        this.geometryTextCodec = geometryTextCodec;
        this.settings = properties.getRouting();
        this.webClient = webClientBuilder.clone()
            .baseUrl(settings.getBaseUrl())
            .build();
    }

    @Override
    public Optional<LineString> route(Coordinate start, Coordinate end) {
        String waypoints = String.format(Locale.ROOT, "%.6f,%.6f;%.6f,%.6f",
            start.getLongitude(), start.getLatitude(), end.getLongitude(), end.getLatitude());
        logger.debug("Requesting route {}", waypoints);

        String responseBody;
        try {
            responseBody = webClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path("/route/v1/" + settings.getProfile() + "/" + waypoints)
                    .queryParam("geometries", "geojson")
                    .queryParam("overview", "full")
                    .build())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
                .retryWhen(Retry.fixedDelay(1, Duration.ofMillis(500))
                    .filter(throwable -> throwable instanceof WebClientRequestException))
                .block();
        } catch (WebClientResponseException e) {
            logger.warn("Router returned {} for {}", e.getStatusCode(), waypoints);
            return Optional.empty();
        } catch (WebClientException e) {
            logger.warn("Failed to reach router for {}: {}", waypoints, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.warn("Routing call failed for {}: {}", waypoints, e.toString());
            return Optional.empty();
        }

        return parseResponse(responseBody);
    }

    private Optional<LineString> parseResponse(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            if (!"Ok".equals(root.path("code").asText())) {
                logger.warn("Router answered with code '{}'", root.path("code").asText());
                return Optional.empty();
            }

            JsonNode coordinates = root.path("routes").path(0).path("geometry").path("coordinates");
            if (!coordinates.isArray()) {
                logger.warn("Router response has no geometry");
                return Optional.empty();
            }

            List<Coordinate> points = new ArrayList<>(coordinates.size());
            for (JsonNode position : coordinates) {
                double lon = position.path(0).asDouble(Double.NaN);
                double lat = position.path(1).asDouble(Double.NaN);
                if (Coordinate.isValid(lat, lon)) {
                    points.add(new Coordinate(lat, lon));
                }
            }

            if (points.size() < 2) {
                logger.warn("Router returned a degenerate route with {} points", points.size());
                return Optional.empty();
            }

            logger.info("Route received with {} points", points.size());
            return Optional.of(geometryTextCodec.lineString(points));
        } catch (Exception e) {
            logger.warn("Failed to parse router response: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
