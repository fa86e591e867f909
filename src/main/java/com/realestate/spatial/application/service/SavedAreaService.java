package com.realestate.spatial.application.service;

import com.realestate.spatial.api.dto.SavedAreaDto;
import com.realestate.spatial.application.mapper.SavedAreaMapper;
import com.realestate.spatial.application.port.in.ManageSavedAreasUseCase;
import com.realestate.spatial.application.port.out.SavedAreaRepository;
import com.realestate.spatial.domain.exception.ResourceNotFoundException;
import com.realestate.spatial.domain.exception.SpatialValidationException;
import com.realestate.spatial.domain.model.AreaMetadata;
import com.realestate.spatial.domain.model.AreaType;
import com.realestate.spatial.domain.model.SavedArea;
import com.realestate.spatial.domain.service.GeometryTextCodec;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Registry of named search areas. Insert-only; areas are retired by clearing
 * their active flag.
 */
@Service
public class SavedAreaService implements ManageSavedAreasUseCase {

    private static final Logger logger = LoggerFactory.getLogger(SavedAreaService.class);

    private final SavedAreaRepository savedAreaRepository;
    private final GeometryTextCodec geometryTextCodec;
    private final SavedAreaMapper savedAreaMapper;

    public SavedAreaService(
            SavedAreaRepository savedAreaRepository,
            GeometryTextCodec geometryTextCodec,
            SavedAreaMapper savedAreaMapper) {
        this.savedAreaRepository = savedAreaRepository;
        this.geometryTextCodec = geometryTextCodec;
        this.savedAreaMapper = savedAreaMapper;
    }

    @Override
    @Transactional
    public UUID saveArea(String name, String geometryWkt, AreaType type, AreaMetadata metadata) {
        return saveArea(name, geometryTextCodec.parse(geometryWkt), type, metadata);
    }

    @Override
    @Transactional
    public UUID saveArea(String name, Geometry geometry, AreaType type, AreaMetadata metadata) {
        if (name == null || name.isBlank()) {
            throw new SpatialValidationException("Area name must not be empty");
        }
        if (geometry == null || geometry.isEmpty()) {
            throw new SpatialValidationException("Area geometry must not be empty");
        }
        if (type == null) {
            throw new SpatialValidationException("Area type is required");
        }

        Geometry stored = geometry.copy();
        stored.setSRID(GeometryTextCodec.WGS84_SRID);

        SavedArea area = new SavedArea(name.trim(), type, stored);
        AreaMetadata meta = metadata != null ? metadata : AreaMetadata.empty();
        area.setDescription(meta.getDescription());
        area.setStartLabel(meta.getStartLabel());
        area.setEndLabel(meta.getEndLabel());
        area.setBufferMeters(meta.getBufferMeters());

        SavedArea saved = savedAreaRepository.save(area);
        logger.info("Saved area '{}' ({}) with id {}", saved.getName(), type.getCode(), saved.getId());
        return saved.getId();
    }

    @Override
    @Transactional(readOnly = true)
    public List<SavedAreaDto> listAreas(boolean activeOnly) {
        List<SavedArea> areas = activeOnly
                ? savedAreaRepository.findActiveOrdered()
                : savedAreaRepository.findAllOrdered();
        return areas.stream()
                .map(savedAreaMapper::toDto)
                .toList();
    }

    @Override
    @Transactional
    public void deactivateArea(UUID id) {
        SavedArea area = savedAreaRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Saved area", id));
        if (!area.isActive()) {
            logger.debug("Saved area {} already inactive", id);
            return;
        }
        savedAreaRepository.deactivate(area);
        logger.info("Deactivated saved area {}", id);
    }
}
