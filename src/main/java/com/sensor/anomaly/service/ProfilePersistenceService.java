package com.sensor.anomaly.service;

import com.sensor.anomaly.config.ProfileConfig;
import com.sensor.anomaly.engine.profile.HistoricalProfiler;
import com.sensor.anomaly.exception.SchemaMismatchException;
import com.sensor.anomaly.model.ProfileState;
import com.sensor.anomaly.repository.ProfileStateRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Restores the profile at startup and flushes snapshots to Aerospike periodically and on
 * shutdown.
 */
@Service
public class ProfilePersistenceService {

    private static final Logger log = LoggerFactory.getLogger(ProfilePersistenceService.class);

    private final HistoricalProfiler profiler;
    private final ProfileStateRepository repository;
    private final ProfileConfig config;

    public ProfilePersistenceService(HistoricalProfiler profiler,
                                     ProfileStateRepository repository,
                                     ProfileConfig config) {
        this.profiler = profiler;
        this.repository = repository;
        this.config = config;
    }

    @PostConstruct
    public void restore() {
        if (!config.isPersistenceEnabled()) {
            return;
        }
        ProfileState persisted = repository.load();
        if (persisted == null) {
            log.info("No persisted profile; starting from an empty profile");
            return;
        }
        try {
            profiler.restore(persisted);
        } catch (SchemaMismatchException e) {
            log.warn("Persisted profile does not match the feature schema, starting empty: {}", e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${profile.persist-interval-seconds:30}",
               initialDelayString = "${profile.persist-interval-seconds:30}",
               timeUnit = TimeUnit.SECONDS)
    public void flush() {
        if (config.isPersistenceEnabled()) {
            repository.save(profiler.snapshot());
        }
    }

    @PreDestroy
    public void flushOnShutdown() {
        if (config.isPersistenceEnabled()) {
            log.info("Flushing profile before shutdown");
            repository.save(profiler.snapshot());
        }
    }
}
