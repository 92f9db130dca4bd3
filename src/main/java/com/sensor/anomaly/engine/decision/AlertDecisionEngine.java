package com.sensor.anomaly.engine.decision;

import com.sensor.anomaly.config.DetectionConfig;
import com.sensor.anomaly.model.AlertEvent;
import com.sensor.anomaly.model.AlertState;
import com.sensor.anomaly.model.AnomalyScore;
import com.sensor.anomaly.model.EntityAlertState;
import com.sensor.anomaly.model.EntityAlertState.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Threshold and hysteresis policy.
 *
 * Per entity, states {NORMAL, ALERTING}:
 *   NORMAL   -> ALERTING  when score >= thresholdHigh          emits NEW
 *   ALERTING -> ALERTING  while score >  thresholdLow           emits ONGOING, at most once per re-notify interval
 *   ALERTING -> NORMAL    when score <= thresholdLow           emits CLEARED
 * Scores between the two thresholds never change the state, which keeps alerts from
 * flapping around a single boundary.
 *
 * With entity tracking disabled decisions are stateless: every record at or above
 * thresholdHigh emits NEW.
 *
 * Intervals are measured on record timestamps, not wall-clock time, so replayed data
 * produces the same alerts.
 */
@Component
public class AlertDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(AlertDecisionEngine.class);

    private final DetectionConfig config;
    private final ConcurrentHashMap<String, EntityAlertState> entities = new ConcurrentHashMap<>();

    public AlertDecisionEngine(DetectionConfig config) {
        if (config.getThresholdLow() >= config.getThresholdHigh()) {
            throw new IllegalArgumentException(String.format(
                    "detection.threshold-low (%.3f) must be below detection.threshold-high (%.3f)",
                    config.getThresholdLow(), config.getThresholdHigh()));
        }
        this.config = config;
    }

    /**
     * Apply one scored record. Updates for the same entity are atomic and take effect in
     * call order.
     *
     * @param score           the record's anomaly score
     * @param recordTimestamp ingestion timestamp of the record, epoch millis
     * @return the alert to emit, if the record caused one
     */
    public Optional<AlertEvent> decide(AnomalyScore score, long recordTimestamp) {
        String entityId = score.getEntityId() != null ? score.getEntityId() : config.getDefaultEntityId();

        if (!config.isEntityTracking()) {
            return score.getNormalizedScore() >= config.getThresholdHigh()
                    ? Optional.of(event(entityId, score, AlertState.NEW, config.getThresholdHigh(), recordTimestamp))
                    : Optional.empty();
        }

        AtomicReference<AlertEvent> emitted = new AtomicReference<>();

        entities.compute(entityId, (id, state) -> {
            if (state == null) {
                state = EntityAlertState.builder().entityId(id).build();
            }
            if (score.getRecordId() != null && score.getRecordId().equals(state.getLastRecordId())) {
                log.debug("Duplicate record {} for entity {}; no transition", score.getRecordId(), id);
                return state;
            }
            emitted.set(transition(state, score, recordTimestamp));
            state.setLastRecordId(score.getRecordId());
            state.setLastRecordAt(recordTimestamp);
            return state;
        });

        return Optional.ofNullable(emitted.get());
    }

    private AlertEvent transition(EntityAlertState state, AnomalyScore score, long timestamp) {
        double value = score.getNormalizedScore();

        if (state.getStatus() == Status.NORMAL) {
            if (value >= config.getThresholdHigh()) {
                state.setStatus(Status.ALERTING);
                state.setLastNotifiedAt(timestamp);
                return event(state.getEntityId(), score, AlertState.NEW, config.getThresholdHigh(), timestamp);
            }
            return null;
        }

        if (value <= config.getThresholdLow()) {
            state.setStatus(Status.NORMAL);
            state.setLastNotifiedAt(timestamp);
            return event(state.getEntityId(), score, AlertState.CLEARED, config.getThresholdLow(), timestamp);
        }

        long renotifyMs = config.getRenotifyIntervalSeconds() * 1000L;
        if (timestamp - state.getLastNotifiedAt() >= renotifyMs) {
            state.setLastNotifiedAt(timestamp);
            return event(state.getEntityId(), score, AlertState.ONGOING, config.getThresholdHigh(), timestamp);
        }
        return null;
    }

    private AlertEvent event(String entityId, AnomalyScore score, AlertState state, double threshold, long timestamp) {
        return AlertEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .recordId(score.getRecordId())
                .entityId(entityId)
                .state(state)
                .score(score.getNormalizedScore())
                .threshold(threshold)
                .deviationScore(score.getDeviationScore())
                .modelVersionId(score.getModelVersionId())
                .emittedAt(timestamp)
                .build();
    }

    /**
     * Copies of every tracked entity's state. Each copy is taken under the entity's map lock,
     * so it never reflects a half-applied transition.
     */
    public List<EntityAlertState> getEntityStates() {
        List<EntityAlertState> states = new ArrayList<>();
        for (String entityId : entities.keySet()) {
            entities.computeIfPresent(entityId, (id, state) -> {
                states.add(state.copy());
                return state;
            });
        }
        return states;
    }

    public int alertingCount() {
        return (int) getEntityStates().stream()
                .filter(state -> state.getStatus() == Status.ALERTING)
                .count();
    }
}
