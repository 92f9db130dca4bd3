package com.sensor.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI sensorAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Sensor Anomaly Engine API")
                        .version("1.0.0")
                        .description(
                                "Streaming anomaly detection for sensor readings.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Pull raw records from the source (or submit via `POST /records/score`)\n" +
                                "2. Extract a typed feature vector against the declared schema\n" +
                                "3. Score with the current Isolation Forest version (2^(-E(h)/c(psi)))\n" +
                                "4. Update the streaming profile (Welford mean/variance, P² quantiles)\n" +
                                "5. Apply hysteresis: **NEW** at >= threshold-high, **ONGOING** while above " +
                                "threshold-low, **CLEARED** at <= threshold-low\n\n" +
                                "Models retrain in the background on a timer, a sample count, or score drift, " +
                                "and are swapped atomically without pausing scoring.")
                        .contact(new Contact().name("Sensor Monitoring Team")));
    }
}
