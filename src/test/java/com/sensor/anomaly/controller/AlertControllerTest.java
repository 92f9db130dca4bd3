package com.sensor.anomaly.controller;

import com.sensor.anomaly.engine.decision.AlertDecisionEngine;
import com.sensor.anomaly.model.AlertState;
import com.sensor.anomaly.model.DeadLetter;
import com.sensor.anomaly.model.EntityAlertState;
import com.sensor.anomaly.service.AlertDispatchService;
import com.sensor.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AlertController.class)
class AlertControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AlertDecisionEngine decisionEngine;

    @MockBean
    private AlertDispatchService dispatchService;

    @Test
    void getEntityStates() throws Exception {
        when(decisionEngine.getEntityStates()).thenReturn(List.of(EntityAlertState.builder()
                .entityId("MQ2-01")
                .status(EntityAlertState.Status.ALERTING)
                .lastRecordId("mq2_data-000000000042")
                .build()));

        mockMvc.perform(get("/api/v1/alerts/entities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].entityId").value("MQ2-01"))
                .andExpect(jsonPath("$[0].status").value("ALERTING"));
    }

    @Test
    void getDeadLetters_defaultLimit() throws Exception {
        when(dispatchService.getDeadLetters(50)).thenReturn(List.of(DeadLetter.builder()
                .event(TestDataFactory.createAlertEvent("EV-1", AlertState.NEW))
                .transport("twilio")
                .attempts(3)
                .lastError("gateway down")
                .failedAt(1760800000000L)
                .build()));

        mockMvc.perform(get("/api/v1/alerts/dead-letters"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].transport").value("twilio"))
                .andExpect(jsonPath("$[0].event.eventId").value("EV-1"));
    }

    @Test
    void getDeadLetters_customLimit() throws Exception {
        when(dispatchService.getDeadLetters(5)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/alerts/dead-letters").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }
}
