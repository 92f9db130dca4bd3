package com.sensor.anomaly.config;

import com.sensor.anomaly.model.FeatureDefinition;
import com.sensor.anomaly.model.FeatureSchema;
import com.sensor.anomaly.model.FeatureType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "features")
public class FeatureSchemaConfig {

    // Ordered: position = feature index in vectors, profile and model
    private List<FeatureDefinition> definitions = new ArrayList<>(List.of(
            FeatureDefinition.builder()
                    .name("sensor_value")
                    .type(FeatureType.DOUBLE)
                    .required(true)
                    .min(0.0)
                    .build()));

    @Bean
    public FeatureSchema featureSchema() {
        return new FeatureSchema(definitions);
    }
}
