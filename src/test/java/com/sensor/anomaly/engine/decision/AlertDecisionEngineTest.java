package com.sensor.anomaly.engine.decision;

import com.sensor.anomaly.config.DetectionConfig;
import com.sensor.anomaly.model.AlertEvent;
import com.sensor.anomaly.model.AlertState;
import com.sensor.anomaly.model.EntityAlertState;
import com.sensor.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertDecisionEngineTest {

    private DetectionConfig config;

    @BeforeEach
    void setUp() {
        config = new DetectionConfig();
        config.setThresholdHigh(0.8);
        config.setThresholdLow(0.6);
        config.setRenotifyIntervalSeconds(0);
    }

    private List<AlertState> run(AlertDecisionEngine engine, String entityId, double... scores) {
        List<AlertState> emitted = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            engine.decide(TestDataFactory.createScore(entityId + "-" + i, entityId, scores[i]), 1000L * (i + 1))
                    .ifPresent(event -> emitted.add(event.getState()));
        }
        return emitted;
    }

    @Test
    void decide_hysteresisSequence_emitsNewOngoingCleared() {
        AlertDecisionEngine engine = new AlertDecisionEngine(config);

        List<AlertState> emitted = run(engine, "E-1", 0.5, 0.85, 0.7, 0.65, 0.55);

        assertThat(emitted).containsExactly(AlertState.NEW, AlertState.ONGOING, AlertState.ONGOING, AlertState.CLEARED);
    }

    @Test
    void decide_scoreBetweenThresholdsWhileNormal_staysSilent() {
        AlertDecisionEngine engine = new AlertDecisionEngine(config);

        assertThat(run(engine, "E-1", 0.75, 0.79, 0.7)).isEmpty();
    }

    @Test
    void decide_scoreAtHighThreshold_raisesAlert() {
        AlertDecisionEngine engine = new AlertDecisionEngine(config);

        assertThat(run(engine, "E-1", 0.8)).containsExactly(AlertState.NEW);
    }

    @Test
    void decide_scoreAtLowThreshold_clearsAlert() {
        AlertDecisionEngine engine = new AlertDecisionEngine(config);

        assertThat(run(engine, "E-1", 0.9, 0.6)).containsExactly(AlertState.NEW, AlertState.CLEARED);
    }

    @Test
    void decide_flappingAroundHighThreshold_neverReRaises() {
        AlertDecisionEngine engine = new AlertDecisionEngine(config);
        config.setRenotifyIntervalSeconds(3600);

        List<AlertState> emitted = run(engine, "E-1", 0.81, 0.79, 0.81, 0.79, 0.81);

        assertThat(emitted).containsExactly(AlertState.NEW);
    }

    @Test
    void decide_ongoingRespectsRenotifyInterval() {
        config.setRenotifyIntervalSeconds(300);
        AlertDecisionEngine engine = new AlertDecisionEngine(config);
        long t0 = 1_000_000L;

        Optional<AlertEvent> raised = engine.decide(TestDataFactory.createScore("R-1", "E-1", 0.9), t0);
        Optional<AlertEvent> tooSoon = engine.decide(TestDataFactory.createScore("R-2", "E-1", 0.9), t0 + 100_000);
        Optional<AlertEvent> due = engine.decide(TestDataFactory.createScore("R-3", "E-1", 0.9), t0 + 300_000);
        Optional<AlertEvent> afterReminder = engine.decide(TestDataFactory.createScore("R-4", "E-1", 0.9), t0 + 400_000);

        assertThat(raised).map(AlertEvent::getState).contains(AlertState.NEW);
        assertThat(tooSoon).isEmpty();
        assertThat(due).map(AlertEvent::getState).contains(AlertState.ONGOING);
        assertThat(afterReminder).isEmpty();
    }

    @Test
    void decide_eventCarriesScoreAndThreshold() {
        AlertDecisionEngine engine = new AlertDecisionEngine(config);

        AlertEvent event = engine.decide(TestDataFactory.createScore("R-1", "E-1", 0.9), 5000L).orElseThrow();

        assertThat(event.getEventId()).isNotBlank();
        assertThat(event.getRecordId()).isEqualTo("R-1");
        assertThat(event.getEntityId()).isEqualTo("E-1");
        assertThat(event.getScore()).isEqualTo(0.9);
        assertThat(event.getThreshold()).isEqualTo(0.8);
        assertThat(event.getModelVersionId()).isEqualTo(1L);
        assertThat(event.getEmittedAt()).isEqualTo(5000L);
    }

    @Test
    void decide_entitiesAreTrackedIndependently() {
        AlertDecisionEngine engine = new AlertDecisionEngine(config);

        assertThat(run(engine, "E-1", 0.9)).containsExactly(AlertState.NEW);
        assertThat(run(engine, "E-2", 0.9)).containsExactly(AlertState.NEW);
        assertThat(engine.alertingCount()).isEqualTo(2);
    }

    @Test
    void decide_redeliveredRecord_causesNoSecondTransition() {
        AlertDecisionEngine engine = new AlertDecisionEngine(config);

        Optional<AlertEvent> first = engine.decide(TestDataFactory.createScore("R-1", "E-1", 0.9), 1000L);
        Optional<AlertEvent> duplicate = engine.decide(TestDataFactory.createScore("R-1", "E-1", 0.1), 2000L);

        assertThat(first).isPresent();
        assertThat(duplicate).isEmpty();
        assertThat(engine.alertingCount()).isEqualTo(1);
    }

    @Test
    void decide_recordWithoutEntity_usesDefaultEntity() {
        AlertDecisionEngine engine = new AlertDecisionEngine(config);

        AlertEvent raised = engine.decide(TestDataFactory.createScore("R-1", null, 0.9), 1000L).orElseThrow();
        AlertEvent cleared = engine.decide(TestDataFactory.createScore("R-2", null, 0.1), 2000L).orElseThrow();

        assertThat(raised.getEntityId()).isEqualTo("default");
        assertThat(cleared.getEntityId()).isEqualTo("default");
        List<EntityAlertState> states = engine.getEntityStates();
        assertThat(states).hasSize(1);
        assertThat(states.get(0).getEntityId()).isEqualTo("default");
        assertThat(states.get(0).getStatus()).isEqualTo(EntityAlertState.Status.NORMAL);
        assertThat(states.get(0).getLastRecordId()).isEqualTo("R-2");
    }

    @Test
    void decide_statelessMode_raisesEveryRecordAboveHigh() {
        config.setEntityTracking(false);
        AlertDecisionEngine engine = new AlertDecisionEngine(config);

        List<AlertState> emitted = run(engine, "E-1", 0.9, 0.9, 0.5, 0.85);

        assertThat(emitted).containsExactly(AlertState.NEW, AlertState.NEW, AlertState.NEW);
        assertThat(engine.getEntityStates()).isEmpty();
    }

    @Test
    void decide_statelessModeWithoutEntity_stampsDefaultEntity() {
        config.setEntityTracking(false);
        AlertDecisionEngine engine = new AlertDecisionEngine(config);

        AlertEvent event = engine.decide(TestDataFactory.createScore("R-1", null, 0.9), 1000L).orElseThrow();

        assertThat(event.getEntityId()).isEqualTo("default");
    }

    @Test
    void getEntityStates_returnsCopies() {
        AlertDecisionEngine engine = new AlertDecisionEngine(config);
        engine.decide(TestDataFactory.createScore("R-1", "E-1", 0.9), 1000L);

        engine.getEntityStates().get(0).setStatus(EntityAlertState.Status.NORMAL);

        assertThat(engine.alertingCount()).isEqualTo(1);
    }

    @Test
    void constructor_lowNotBelowHigh_throws() {
        config.setThresholdLow(0.8);

        assertThatThrownBy(() -> new AlertDecisionEngine(config))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
