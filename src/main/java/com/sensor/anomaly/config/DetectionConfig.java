package com.sensor.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // NORMAL -> ALERTING when the normalized score reaches this value
    private double thresholdHigh = 0.7;

    // ALERTING -> NORMAL only when the score falls to this value or below
    private double thresholdLow = 0.6;

    // Minimum gap between ONGOING notifications for the same entity
    private long renotifyIntervalSeconds = 300;

    // false = stateless per-record decisions
    private boolean entityTracking = true;

    // Entity key for records that carry no entity id
    private String defaultEntityId = "default";

    // Latest anomalies kept for the dashboard
    private int recentAnomalyLimit = 100;
}
