package com.realestate.spatial.api.controller;

import com.realestate.spatial.api.dto.CoordinateDto;
import com.realestate.spatial.api.dto.CorridorResponseDto;
import com.realestate.spatial.application.dto.CorridorCommand;
import com.realestate.spatial.application.port.in.BuildCorridorUseCase;
import com.realestate.spatial.domain.exception.LocationNotResolvedException;
import com.realestate.spatial.domain.exception.SpatialValidationException;
import com.realestate.spatial.domain.exception.TrackParseException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CorridorController.class)
@ActiveProfiles("test")
class CorridorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BuildCorridorUseCase buildCorridorUseCase;

    @Test
    void corridorRequestIsMappedToCommand() throws Exception {
        CorridorResponseDto response = new CorridorResponseDto();
        response.setPolygonWkt("POLYGON ((14 50, 15 50, 15 51, 14 50))");
        response.setStart(new CoordinateDto(50.0755, 14.4378));
        response.setEnd(new CoordinateDto(50.0281, 15.2001));
        response.setBufferMeters(2000);
        response.setMatchCount(12);
        response.setRouted(true);
        when(buildCorridorUseCase.buildCorridor(any())).thenReturn(response);

        mockMvc.perform(post("/api/spatial/corridor")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"start\":\"Praha\",\"end\":\"Kolín\",\"bufferMeters\":2000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matchCount").value(12))
                .andExpect(jsonPath("$.routed").value(true))
                .andExpect(jsonPath("$.start.latitude").value(50.0755))
                .andExpect(jsonPath("$.savedAreaId").doesNotExist());

        ArgumentCaptor<CorridorCommand> command = ArgumentCaptor.forClass(CorridorCommand.class);
        verify(buildCorridorUseCase).buildCorridor(command.capture());
        assertThat(command.getValue().getStart()).isEqualTo("Praha");
        assertThat(command.getValue().isUseRoute()).isTrue();
        assertThat(command.getValue().isIncludeListings()).isFalse();
    }

    @Test
    void missingFieldsFailValidation() throws Exception {
        mockMvc.perform(post("/api/spatial/corridor")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"start\":\"\",\"end\":\"Brno\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.fieldErrors.start").exists())
                .andExpect(jsonPath("$.fieldErrors.bufferMeters").exists());

        verifyNoInteractions(buildCorridorUseCase);
    }

    @Test
    void unresolvedLocationIs404WithRoleAndInput() throws Exception {
        when(buildCorridorUseCase.buildCorridor(any()))
                .thenThrow(new LocationNotResolvedException("start", "Nonexistent Place XYZ"));

        mockMvc.perform(post("/api/spatial/corridor")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"start\":\"Nonexistent Place XYZ\",\"end\":\"Brno\",\"bufferMeters\":1000}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("LOCATION_NOT_RESOLVED"))
                .andExpect(jsonPath("$.role").value("start"))
                .andExpect(jsonPath("$.input").value("Nonexistent Place XYZ"));
    }

    @Test
    void bufferOutOfRangeIs400() throws Exception {
        when(buildCorridorUseCase.buildCorridor(any()))
                .thenThrow(new SpatialValidationException("bufferMeters must be between 100 and 50000, got 10"));

        mockMvc.perform(post("/api/spatial/corridor")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"start\":\"Praha\",\"end\":\"Brno\",\"bufferMeters\":10}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void trackUploadPassesBytesAndBuffer() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "ride.gpx", "application/gpx+xml",
                "<gpx/>".getBytes());
        CorridorResponseDto response = new CorridorResponseDto();
        response.setPointCount(120);
        response.setMatchCount(4);
        when(buildCorridorUseCase.buildCorridorFromTrack(any(), eq(3000), eq("Ride"))).thenReturn(response);

        mockMvc.perform(multipart("/api/spatial/corridor/track")
                        .file(file)
                        .param("bufferMeters", "3000")
                        .param("saveAsName", "Ride"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pointCount").value(120));
    }

    @Test
    void emptyTrackIs400WithReason() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "ride.gpx", "application/gpx+xml",
                "<gpx/>".getBytes());
        when(buildCorridorUseCase.buildCorridorFromTrack(any(), eq(3000), any()))
                .thenThrow(new TrackParseException(TrackParseException.Reason.EMPTY_TRACK, "no points"));

        mockMvc.perform(multipart("/api/spatial/corridor/track").file(file).param("bufferMeters", "3000"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("EMPTY_TRACK"));
    }

    @Test
    void trackWithoutFileIs400() throws Exception {
        mockMvc.perform(multipart("/api/spatial/corridor/track").param("bufferMeters", "3000"))
                .andExpect(status().isBadRequest());
    }
}
