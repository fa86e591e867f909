package com.realestate.spatial.infrastructure.external;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.realestate.spatial.domain.model.Coordinate;
import com.realestate.spatial.domain.service.GeometryTextCodec;
import com.realestate.spatial.infrastructure.config.SpatialProperties;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.LineString;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class OsrmClientTest {

    private static final Coordinate PRAGUE = new Coordinate(50.0755, 14.4378);
    private static final Coordinate KOLIN = new Coordinate(50.0281, 15.2001);

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    @Test
    void geoJsonRouteBecomesLineString() {
        OsrmClient client = clientReturning(HttpStatus.OK, "{\"code\": \"Ok\", \"routes\": [{\"geometry\": {\"type\": \"LineString\",\n" +
                "  \"coordinates\": [[14.4378, 50.0755], [14.8, 50.05], [15.2001, 50.0281]]}}]}\n");

        Optional<LineString> route = client.route(PRAGUE, KOLIN);

        assertThat(route).isPresent();
        assertThat(route.get().getNumPoints()).isEqualTo(3);
        assertThat(route.get().getCoordinateN(1).getX()).isEqualTo(14.8);
        assertThat(route.get().getCoordinateN(1).getY()).isEqualTo(50.05);
        assertThat(lastRequest.get().url().getPath())
                .isEqualTo("/route/v1/driving/14.437800,50.075500;15.200100,50.028100");
        assertThat(lastRequest.get().url().getQuery()).contains("geometries=geojson").contains("overview=full");
    }

    @Test
    void noRouteCodeIsEmpty() {
        OsrmClient client = clientReturning(HttpStatus.OK, "{\"code\": \"NoRoute\", \"routes\": []}");

        assertThat(client.route(PRAGUE, KOLIN)).isEmpty();
    }

    @Test
    void degenerateGeometryIsEmpty() {
        OsrmClient client = clientReturning(HttpStatus.OK, "{\"code\": \"Ok\", \"routes\": [{\"geometry\": {\"coordinates\": [[14.4378, 50.0755]]}}]}\n");

        assertThat(client.route(PRAGUE, KOLIN)).isEmpty();
    }

    @Test
    void httpErrorIsEmpty() {
        OsrmClient client = clientReturning(HttpStatus.BAD_GATEWAY, "");

        assertThat(client.route(PRAGUE, KOLIN)).isEmpty();
    }

    private OsrmClient clientReturning(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            lastRequest.set(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
        return new OsrmClient(builder, new ObjectMapper(), new GeometryTextCodec(), new SpatialProperties());
    }
}
