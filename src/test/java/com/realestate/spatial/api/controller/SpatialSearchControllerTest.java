package com.realestate.spatial.api.controller;

import com.realestate.spatial.api.dto.MapPointDto;
import com.realestate.spatial.api.dto.SpatialSearchResponseDto;
import com.realestate.spatial.application.port.in.SearchListingsUseCase;
import com.realestate.spatial.domain.exception.SpatialValidationException;
import com.realestate.spatial.domain.model.ListingFilters;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SpatialSearchController.class)
@ActiveProfiles("test")
class SpatialSearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SearchListingsUseCase searchListingsUseCase;

    @Test
    void searchReturnsPage() throws Exception {
        MapPointDto point = new MapPointDto(UUID.randomUUID(), "Flat 2+kk", new BigDecimal("5200000"), "Brno",
                49.19, 16.6, "flat", "sale", null, "test");
        when(searchListingsUseCase.search(any())).thenReturn(new SpatialSearchResponseDto(1, 200, 1, List.of(point)));

        mockMvc.perform(post("/api/spatial/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"minLat\":49.0,\"minLon\":16.0,\"maxLat\":49.5,\"maxLon\":16.9}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.items[0].latitude").value(49.19))
                .andExpect(jsonPath("$.items[0].longitude").value(16.6));
    }

    @Test
    void pageSizeAboveLimitFailsValidation() throws Exception {
        mockMvc.perform(post("/api/spatial/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"polygonWkt\":\"POLYGON ((16 49, 16.1 49, 16.1 49.1, 16 49))\",\"pageSize\":501}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.pageSize").exists());

        verifyNoInteractions(searchListingsUseCase);
    }

    @Test
    void ambiguousPredicateIs400() throws Exception {
        when(searchListingsUseCase.search(any()))
                .thenThrow(new SpatialValidationException("Provide either polygonWkt or a bounding box, not both"));

        mockMvc.perform(post("/api/spatial/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void mapPointsPassFilters() throws Exception {
        ListingFilters expected = new ListingFilters("house", null, null, new BigDecimal("8000000"));
        when(searchListingsUseCase.mapPoints(expected)).thenReturn(List.of());

        mockMvc.perform(get("/api/spatial/map-points")
                        .param("propertyType", "house")
                        .param("priceMax", "8000000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }

    @Test
    void malformedPriceIs400() throws Exception {
        mockMvc.perform(get("/api/spatial/map-points").param("priceMax", "cheap"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_PARAMETER"));
    }
}
