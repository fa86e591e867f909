package com.realestate.spatial.api.controller;

import com.realestate.spatial.api.dto.MapPointDto;
import com.realestate.spatial.api.dto.SpatialSearchRequestDto;
import com.realestate.spatial.api.dto.SpatialSearchResponseDto;
import com.realestate.spatial.application.port.in.SearchListingsUseCase;
import com.realestate.spatial.domain.model.ListingFilters;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/api/spatial")
public class SpatialSearchController {

    private final SearchListingsUseCase searchListingsUseCase;

    public SpatialSearchController(SearchListingsUseCase searchListingsUseCase) {
        this.searchListingsUseCase = searchListingsUseCase;
    }

    /**
     * POST /api/spatial/search
     *
     * Listings inside a polygon or bounding box, oldest first, paged.
     */
    @PostMapping("/search")
    public ResponseEntity<SpatialSearchResponseDto> search(@Valid @RequestBody SpatialSearchRequestDto request) {
        return ResponseEntity.ok(searchListingsUseCase.search(request));
    }

    /**
     * GET /api/spatial/map-points
     */
    @GetMapping("/map-points")
    public ResponseEntity<List<MapPointDto>> mapPoints(
            @RequestParam(required = false) String propertyType,
            @RequestParam(required = false) String offerType,
            @RequestParam(required = false) BigDecimal priceMin,
            @RequestParam(required = false) BigDecimal priceMax) {
        ListingFilters filters = new ListingFilters(propertyType, offerType, priceMin, priceMax);
        return ResponseEntity.ok(searchListingsUseCase.mapPoints(filters));
    }
}
