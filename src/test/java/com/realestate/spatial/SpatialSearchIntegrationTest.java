package com.realestate.spatial;

import com.realestate.spatial.api.dto.CorridorResponseDto;
import com.realestate.spatial.api.dto.MapPointDto;
import com.realestate.spatial.api.dto.SavedAreaDto;
import com.realestate.spatial.api.dto.SpatialSearchRequestDto;
import com.realestate.spatial.application.dto.CorridorCommand;
import com.realestate.spatial.application.port.in.BuildCorridorUseCase;
import com.realestate.spatial.application.port.in.EnrichCoordinatesUseCase;
import com.realestate.spatial.application.port.in.ManageSavedAreasUseCase;
import com.realestate.spatial.application.port.in.SearchListingsUseCase;
import com.realestate.spatial.application.port.out.GeocodingPort;
import com.realestate.spatial.application.port.out.ListingRepository;
import com.realestate.spatial.domain.model.Coordinate;
import com.realestate.spatial.domain.model.EnrichmentReport;
import com.realestate.spatial.domain.model.GeocodeOutcome;
import com.realestate.spatial.domain.model.GeocodeSource;
import com.realestate.spatial.domain.model.Listing;
import com.realestate.spatial.infrastructure.cache.TestCacheConfig;
import com.realestate.spatial.module.test.support.PostgisContainerSupport;
import com.realestate.spatial.module.test.support.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end checks of the PostGIS queries, paging and enrichment writes.
 */
@SpringBootTest(properties = "app.search.map-points-limit=2")
@ActiveProfiles("test")
@Import(TestCacheConfig.class)
class SpatialSearchIntegrationTest extends PostgisContainerSupport {

    private static final String SOUTH_MORAVIA = "POLYGON ((16.0 48.9, 17.0 48.9, 17.0 49.5, 16.0 49.5, 16.0 48.9))";

    @Autowired
    private SearchListingsUseCase searchListingsUseCase;

    @Autowired
    private BuildCorridorUseCase buildCorridorUseCase;

    @Autowired
    private ManageSavedAreasUseCase manageSavedAreasUseCase;

    @Autowired
    private EnrichCoordinatesUseCase enrichCoordinatesUseCase;

    @Autowired
    private ListingRepository listingRepository;

    @Autowired
    private TestDataBuilder testData;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private CacheManager cacheManager;

    @MockBean
    private GeocodingPort geocodingPort;

    @BeforeEach
    void cleanDatabase() {
        jdbcTemplate.update("DELETE FROM spatial_areas");
        jdbcTemplate.update("DELETE FROM listings");
        cacheManager.getCacheNames().forEach(name -> cacheManager.getCache(name).clear());
    }

    @Test
    void triggerKeepsLocationPointInSync() {
        Listing listing = testData.listing().at(49.19, 16.6).save();

        Double x = jdbcTemplate.queryForObject("SELECT ST_X(location_point) FROM listings WHERE id = ?",
                Double.class, listing.getId());
        Double y = jdbcTemplate.queryForObject("SELECT ST_Y(location_point) FROM listings WHERE id = ?",
                Double.class, listing.getId());

        assertThat(x).isEqualTo(16.6);
        assertThat(y).isEqualTo(49.19);
    }

    @Test
    void polygonSearchReturnsOnlyActiveListingsInside() {
        testData.listing().withTitle("inside").at(49.19, 16.6).save();
        testData.listing().withTitle("inside but inactive").at(49.2, 16.61).inactive().save();
        testData.listing().withTitle("outside").at(50.07, 14.43).save();
        testData.listing().withTitle("no coordinate").save();

        SpatialSearchRequestDto request = new SpatialSearchRequestDto();
        request.setPolygonWkt(SOUTH_MORAVIA);

        List<MapPointDto> items = searchListingsUseCase.search(request).getItems();

        assertThat(items).extracting(MapPointDto::getTitle).containsExactly("inside");
    }

    @Test
    void boundingBoxSearchAppliesFilters() {
        testData.listing().withTitle("cheap flat").at(49.19, 16.6).withPrice(new BigDecimal("3000000")).save();
        testData.listing().withTitle("expensive flat").at(49.19, 16.61).withPrice(new BigDecimal("9000000")).save();
        testData.listing().withTitle("house").at(49.2, 16.62).withPropertyType("house").save();

        SpatialSearchRequestDto request = new SpatialSearchRequestDto();
        request.setMinLat(49.0);
        request.setMinLon(16.0);
        request.setMaxLat(49.5);
        request.setMaxLon(17.0);
        request.setPropertyType("flat");
        request.setPriceMax(new BigDecimal("5000000"));

        assertThat(searchListingsUseCase.search(request).getItems())
                .extracting(MapPointDto::getTitle)
                .containsExactly("cheap flat");
    }

    @Test
    void consecutivePagesAreDisjointAndCoverUnpagedResult() {
        for (int i = 0; i < 25; i++) {
            testData.listing().at(49.0 + i * 0.01, 16.5).save();
        }

        List<UUID> pageOne = pageIds(1, 10);
        List<UUID> pageTwo = pageIds(2, 10);
        List<UUID> firstTwenty = pageIds(1, 20);

        assertThat(pageOne).hasSize(10).doesNotContainAnyElementsOf(pageTwo);
        List<UUID> union = new ArrayList<>(pageOne);
        union.addAll(pageTwo);
        assertThat(union).containsExactlyElementsOf(firstTwenty);
        assertThat(pageIds(3, 10)).hasSize(5);
    }

    @Test
    void corridorCountsListingsNearTheLine() {
        testData.listing().withTitle("on the line").at(49.0, 16.05).save();
        testData.listing().withTitle("4 km off").at(49.036, 16.05).save();
        testData.listing().withTitle("10 km off").at(49.0898, 16.05).save();

        CorridorResponseDto response = buildCorridorUseCase.buildCorridor(
                new CorridorCommand("49.0,16.0", "49.0,16.1", 5000, false, null, null, true));

        assertThat(response.getMatchCount()).isEqualTo(2);
        assertThat(response.getListings()).extracting(MapPointDto::getTitle)
                .containsExactly("on the line", "4 km off");
    }

    @Test
    void corridorMatchCountCoversListingsBeyondTheLimit() {
        testData.listing().withTitle("first").at(49.0, 16.02).save();
        testData.listing().withTitle("second").at(49.0, 16.05).save();
        testData.listing().withTitle("third").at(49.0, 16.08).save();

        CorridorResponseDto response = buildCorridorUseCase.buildCorridor(
                new CorridorCommand("49.0,16.0", "49.0,16.1", 1000, false, null, null, true));

        assertThat(response.getMatchCount()).isEqualTo(3);
        assertThat(response.getListings()).extracting(MapPointDto::getTitle).containsExactly("first", "second");
    }

    @Test
    void statsReadRowsWrittenWithScraperCodes() {
        jdbcTemplate.update("INSERT INTO listings (title, location_text, latitude, longitude, geocode_source) "
                + "VALUES ('Scraped', 'Brno', 49.19, 16.6, 'scraper')");
        jdbcTemplate.update("INSERT INTO listings (title, location_text, latitude, longitude, geocode_source) "
                + "VALUES ('Geocoded', 'Kolín', 50.03, 15.2, 'nominatim')");

        Map<String, Long> bySource = enrichCoordinatesUseCase.geocodeStats().getBySource();

        assertThat(bySource).containsEntry("provider-supplied", 1L).containsEntry("external-geocoder", 1L);
    }

    @Test
    void savingSameCorridorTwiceCreatesTwoAreas() {
        CorridorCommand command = new CorridorCommand("49.0,16.0", "49.0,16.1", 2000, false, "Commute", null, false);

        UUID first = buildCorridorUseCase.buildCorridor(command).getSavedAreaId();
        UUID second = buildCorridorUseCase.buildCorridor(command).getSavedAreaId();

        assertThat(first).isNotEqualTo(second);
        List<SavedAreaDto> areas = manageSavedAreasUseCase.listAreas(true);
        assertThat(areas).hasSize(2).allSatisfy(area -> {
            assertThat(area.getAreaType()).isEqualTo("corridor");
            assertThat(area.getGeometryWkt()).startsWith("POLYGON");
            assertThat(area.getBufferMeters()).isEqualTo(2000);
        });

        manageSavedAreasUseCase.deactivateArea(first);

        assertThat(manageSavedAreasUseCase.listAreas(true)).extracting(SavedAreaDto::getId).containsExactly(second);
        assertThat(manageSavedAreasUseCase.listAreas(false)).hasSize(2);
    }

    @Test
    void enrichmentFillsMissingCoordinatesOnlyOnce() {
        testData.listing().withLocationText("Brno, okres Brno-město").save();
        testData.listing().withLocationText("Atlantis").save();
        testData.listing().withLocationText("Praha").at(50.07, 14.43).save();
        when(geocodingPort.search(anyString())).thenAnswer(invocation -> "Brno".equals(invocation.getArgument(0))
                ? GeocodeOutcome.found(new Coordinate(49.1951, 16.6068), "Brno")
                : GeocodeOutcome.notFound());

        EnrichmentReport first = enrichCoordinatesUseCase.enrichBatch(10);
        EnrichmentReport second = enrichCoordinatesUseCase.enrichBatch(10);

        assertThat(first.getAttempted()).isEqualTo(2);
        assertThat(first.getSucceeded()).isEqualTo(1);
        assertThat(first.getRemaining()).isEqualTo(1);
        assertThat(second.getAttempted()).isEqualTo(1);
        verify(geocodingPort, times(1)).search("Brno");

        assertThat(listingRepository.countBySource())
                .anySatisfy(row -> {
                    assertThat(row.getSource()).isEqualTo(GeocodeSource.EXTERNAL_GEOCODER);
                    assertThat(row.getTotal()).isEqualTo(1L);
                });
    }

    private List<UUID> pageIds(int page, int pageSize) {
        SpatialSearchRequestDto request = new SpatialSearchRequestDto();
        request.setPolygonWkt(SOUTH_MORAVIA);
        request.setPage(page);
        request.setPageSize(pageSize);
        return searchListingsUseCase.search(request).getItems().stream().map(MapPointDto::getId).toList();
    }
}
