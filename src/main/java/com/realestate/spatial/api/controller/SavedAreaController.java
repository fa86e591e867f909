package com.realestate.spatial.api.controller;

import com.realestate.spatial.api.dto.SavedAreaDto;
import com.realestate.spatial.application.port.in.ManageSavedAreasUseCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/spatial/areas")
public class SavedAreaController {

    private static final Logger logger = LoggerFactory.getLogger(SavedAreaController.class);

    private final ManageSavedAreasUseCase manageSavedAreasUseCase;

    public SavedAreaController(ManageSavedAreasUseCase manageSavedAreasUseCase) {
        this.manageSavedAreasUseCase = manageSavedAreasUseCase;
    }

    @GetMapping
    public ResponseEntity<List<SavedAreaDto>> listAreas(
            @RequestParam(defaultValue = "true") boolean activeOnly) {
        return ResponseEntity.ok(manageSavedAreasUseCase.listAreas(activeOnly));
    }

    /**
     * DELETE /api/spatial/areas/{id}
     *
     * Soft delete: the area is kept but no longer listed as active.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deactivateArea(@PathVariable UUID id) {
        logger.info("Deactivating saved area {}", id);
        manageSavedAreasUseCase.deactivateArea(id);
        return ResponseEntity.noContent().build();
    }
}
