package com.sensor.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "alerts.dispatch")
public class AlertDispatchConfig {

    // Delivery attempts per transport before the event is dead-lettered
    private int maxAttempts = 3;

    private long initialBackoffMs = 500;
    private double backoffMultiplier = 2.0;
    private long maxBackoffMs = 10000;
}
