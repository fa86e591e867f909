package com.realestate.spatial.api.controller;

import com.realestate.spatial.api.dto.SavedAreaDto;
import com.realestate.spatial.application.port.in.ManageSavedAreasUseCase;
import com.realestate.spatial.domain.exception.ResourceNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SavedAreaController.class)
@ActiveProfiles("test")
class SavedAreaControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ManageSavedAreasUseCase manageSavedAreasUseCase;

    @Test
    void listsActiveAreasByDefault() throws Exception {
        SavedAreaDto area = new SavedAreaDto(UUID.randomUUID(), "Commute", null, "corridor",
                "POLYGON ((14 50, 15 50, 15 51, 14 50))", "Praha", "Kolín", 2000, true, OffsetDateTime.now());
        when(manageSavedAreasUseCase.listAreas(true)).thenReturn(List.of(area));

        mockMvc.perform(get("/api/spatial/areas"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Commute"))
                .andExpect(jsonPath("$[0].areaType").value("corridor"));
    }

    @Test
    void deleteDeactivates() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(delete("/api/spatial/areas/{id}", id))
                .andExpect(status().isNoContent());

        verify(manageSavedAreasUseCase).deactivateArea(id);
    }

    @Test
    void deleteUnknownIs404() throws Exception {
        UUID id = UUID.randomUUID();
        doThrow(new ResourceNotFoundException("Saved area", id)).when(manageSavedAreasUseCase).deactivateArea(id);

        mockMvc.perform(delete("/api/spatial/areas/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void malformedIdIs400() throws Exception {
        mockMvc.perform(delete("/api/spatial/areas/not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_PARAMETER"));
    }
}
