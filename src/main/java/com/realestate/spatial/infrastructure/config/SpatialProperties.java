package com.realestate.spatial.infrastructure.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed settings for the spatial engine, bound from {@code app.*}.
 * Defaults match production behaviour against the public OSM services.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app")
public class SpatialProperties {

    private Geocoding geocoding = new Geocoding();
    private Routing routing = new Routing();
    private Corridor corridor = new Corridor();
    private Search search = new Search();
    private Enrichment enrichment = new Enrichment();

    @Getter
    @Setter
    public static class Geocoding {
        private String baseUrl = "https://nominatim.openstreetmap.org";
        private String countryCode = "cz";
        private String language = "cs";
        private String userAgent = "realestate-spatial/0.1";
        private int timeoutSeconds = 10;
    }

    @Getter
    @Setter
    public static class Routing {
        private String baseUrl = "https://router.project-osrm.org";
        private String profile = "driving";
        private int timeoutSeconds = 10;
    }

    @Getter
    @Setter
    public static class Corridor {
        private int minBufferMeters = 100;
        private int maxBufferMeters = 50_000;
        /** proj4 definition of the metric CRS used for buffering. */
        private String metricCrs = "+proj=utm +zone=33 +datum=WGS84 +units=m +no_defs";
        private int quadrantSegments = 8;
    }

    @Getter
    @Setter
    public static class Search {
        private int defaultPageSize = 200;
        private int maxPageSize = 500;
        private int mapPointsLimit = 2000;
    }

    @Getter
    @Setter
    public static class Enrichment {
        private int defaultBatchSize = 50;
        private int maxBatchSize = 200;
        private long minIntervalMs = 1100;
    }
}
