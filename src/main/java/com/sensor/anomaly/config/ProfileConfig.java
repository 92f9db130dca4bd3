package com.sensor.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "profile")
public class ProfileConfig {

    // Probabilities tracked by the per-feature P² quantile sketches
    private List<Double> quantiles = List.of(0.5, 0.9, 0.99);

    // How often the profile snapshot is flushed to Aerospike
    private int persistIntervalSeconds = 30;

    private boolean persistenceEnabled = true;
}
