package com.realestate.spatial.api.controller;

import com.realestate.spatial.api.dto.CorridorRequestDto;
import com.realestate.spatial.api.dto.CorridorResponseDto;
import com.realestate.spatial.application.dto.CorridorCommand;
import com.realestate.spatial.application.port.in.BuildCorridorUseCase;
import com.realestate.spatial.domain.exception.TrackParseException;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Corridor search along a route or an uploaded GPX track.
 */
@RestController
@RequestMapping("/api/spatial/corridor")
public class CorridorController {

    private static final Logger logger = LoggerFactory.getLogger(CorridorController.class);

    private final BuildCorridorUseCase buildCorridorUseCase;

    public CorridorController(BuildCorridorUseCase buildCorridorUseCase) {
        this.buildCorridorUseCase = buildCorridorUseCase;
    }

    /**
     * POST /api/spatial/corridor
     *
     * Geocodes both endpoints, routes between them and counts listings within
     * {@code bufferMeters} of the route. Optionally saves the corridor.
     */
    @PostMapping
    public ResponseEntity<CorridorResponseDto> buildCorridor(@Valid @RequestBody CorridorRequestDto request) {
        CorridorCommand command = new CorridorCommand(
                request.getStart(),
                request.getEnd(),
                request.getBufferMeters(),
                !Boolean.FALSE.equals(request.getUseRoute()),
                request.getSaveAsName(),
                request.getDescription(),
                Boolean.TRUE.equals(request.getIncludeListings()));
        return ResponseEntity.ok(buildCorridorUseCase.buildCorridor(command));
    }

    /**
     * POST /api/spatial/corridor/track (multipart)
     */
    @PostMapping(value = "/track", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<CorridorResponseDto> buildCorridorFromTrack(
            @RequestPart("file") MultipartFile file,
            @RequestParam("bufferMeters") int bufferMeters,
            @RequestParam(value = "saveAsName", required = false) String saveAsName) {
        logger.info("Track upload '{}' ({} bytes), buffer {} m", file.getOriginalFilename(), file.getSize(),
                bufferMeters);

        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new TrackParseException(TrackParseException.Reason.UNRECOGNIZED_FORMAT,
                    "Could not read uploaded track", e);
        }
        return ResponseEntity.ok(buildCorridorUseCase.buildCorridorFromTrack(content, bufferMeters, saveAsName));
    }
}
