package com.sensor.anomaly.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensor.anomaly.model.AlertEvent;
import com.sensor.anomaly.model.ModelVersion;
import com.sensor.anomaly.model.ProfileState;
import org.springframework.stereotype.Component;

/**
 * JSON form of the engine's durable state. Jackson writes doubles with
 * {@link Double#toString(double)}, which round-trips exactly, so statistics and split values
 * come back bit-for-bit.
 */
@Component
public class StateCodec {

    private final ObjectMapper objectMapper;

    public StateCodec() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
    }

    public String writeModel(ModelVersion model) throws JsonProcessingException {
        return objectMapper.writeValueAsString(model);
    }

    public ModelVersion readModel(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, ModelVersion.class);
    }

    public String writeProfile(ProfileState profile) throws JsonProcessingException {
        return objectMapper.writeValueAsString(profile);
    }

    public ProfileState readProfile(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, ProfileState.class);
    }

    public String writeEvent(AlertEvent event) throws JsonProcessingException {
        return objectMapper.writeValueAsString(event);
    }

    public AlertEvent readEvent(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, AlertEvent.class);
    }
}
