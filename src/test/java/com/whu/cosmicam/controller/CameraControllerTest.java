package com.whu.cosmicam.controller;

import com.whu.cosmicam.dto.CameraProfileVo;
import com.whu.cosmicam.dto.LatestImageVo;
import com.whu.cosmicam.model.CameraProfile;
import com.whu.cosmicam.service.CameraQueryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CameraController.class)
class CameraControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CameraQueryService cameraQueryService;

    @Test
    void currentProfileUsesSnakeCaseFields() throws Exception {
        when(cameraQueryService.getCurrentProfile())
                .thenReturn(new CameraProfileVo("night", new CameraProfile(6000000, 2.0, 0.5, 1.4), "night"));

        mockMvc.perform(get("/api/camera/profile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value(200))
                .andExpect(jsonPath("$.data.current_profile").value("night"))
                .andExpect(jsonPath("$.data.sun_phase").value("night"))
                .andExpect(jsonPath("$.data.settings.shutter_speed").value(6000000));
    }

    @Test
    void latestImageReturns404WhenDirectoryIsEmpty() throws Exception {
        when(cameraQueryService.getLatestArtifact()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/latest-image"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("No images found"));
    }

    @Test
    void latestImageReturnsPathAndProfile() throws Exception {
        LatestImageVo vo = new LatestImageVo("/images/image_20240621_020000.jpg",
                LocalDateTime.of(2024, 6, 21, 2, 0), "night", "night", new CameraProfile(6000000, 2.0, 0.5, 1.4));
        when(cameraQueryService.getLatestArtifact()).thenReturn(Optional.of(vo));

        mockMvc.perform(get("/api/latest-image"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.path").value("/images/image_20240621_020000.jpg"))
                .andExpect(jsonPath("$.data.camera_profile").value("night"))
                .andExpect(jsonPath("$.data.camera_settings.contrast").value(1.4));
    }

    @Test
    void coordinatesUpdateRequiresBothValues() throws Exception {
        mockMvc.perform(post("/api/coordinates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latitude\": 51.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Missing coordinates"));

        verify(cameraQueryService, never()).updateCoordinates(anyDouble(), anyDouble());
    }

    @Test
    void coordinatesUpdateRejectsNonNumericValues() throws Exception {
        mockMvc.perform(post("/api/coordinates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latitude\": \"north\", \"longitude\": -0.12}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void coordinatesUpdateSucceeds() throws Exception {
        when(cameraQueryService.updateCoordinates(51.5, -0.12)).thenReturn(true);

        mockMvc.perform(post("/api/coordinates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latitude\": 51.5, \"longitude\": -0.12}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Coordinates updated successfully"));
    }

    @Test
    void coordinatesWriteFailureIs500() throws Exception {
        when(cameraQueryService.updateCoordinates(51.5, -0.12)).thenReturn(false);

        mockMvc.perform(post("/api/coordinates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latitude\": 51.5, \"longitude\": -0.12}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Failed to update coordinates"));
    }

    @Test
    void profileUpdateWithInvalidValueIs400() throws Exception {
        when(cameraQueryService.updateProfile(eq("night"), anyMap()))
                .thenThrow(new IllegalArgumentException("无效的相机参数"));

        mockMvc.perform(post("/api/camera/profile/night")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"gain\": \"high\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void activatingUnknownProfileIs404() throws Exception {
        when(cameraQueryService.switchProfile("aurora")).thenReturn(false);

        mockMvc.perform(post("/api/camera/profile/aurora/activate"))
                .andExpect(status().isNotFound());
    }
}
