package com.sensor.anomaly.controller;

import com.sensor.anomaly.engine.profile.HistoricalProfiler;
import com.sensor.anomaly.exception.SchemaMismatchException;
import com.sensor.anomaly.model.ProfileState;
import com.sensor.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ProfileController.class)
class ProfileControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HistoricalProfiler profiler;

    @Test
    void getProfile_returnsSnapshot() throws Exception {
        when(profiler.snapshot()).thenReturn(ProfileState.builder()
                .feature(TestDataFactory.createStatistics("sensor_value", 100, 150.0, 625.0))
                .capturedAt(1760800000000L)
                .build());

        mockMvc.perform(get("/api/v1/profile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.features[0].name").value("sensor_value"))
                .andExpect(jsonPath("$.features[0].count").value(100))
                .andExpect(jsonPath("$.features[0].stdDev").value(25.0));
    }

    @Test
    void reset_allFeatures() throws Exception {
        when(profiler.reset(List.of())).thenReturn(List.of("sensor_value"));

        mockMvc.perform(post("/api/v1/profile/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reset[0]").value("sensor_value"));
    }

    @Test
    void reset_unknownFeature_returns400() throws Exception {
        when(profiler.reset(anyList())).thenThrow(new SchemaMismatchException("Unknown feature: humidity"));

        mockMvc.perform(post("/api/v1/profile/reset").param("features", "humidity"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown feature: humidity"));
    }
}
