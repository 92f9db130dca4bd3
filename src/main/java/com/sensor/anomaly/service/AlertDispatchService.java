package com.sensor.anomaly.service;

import com.sensor.anomaly.config.AlertDispatchConfig;
import com.sensor.anomaly.config.MetricsConfig;
import com.sensor.anomaly.exception.DispatchFailureException;
import com.sensor.anomaly.model.AlertEvent;
import com.sensor.anomaly.model.DeadLetter;
import com.sensor.anomaly.repository.DeadLetterRepository;
import com.sensor.anomaly.transport.AlertTransport;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Fans alert events out to every enabled transport. Delivery runs on the
 * {@code alertDispatchExecutor} so a slow channel never holds up scoring. Each transport is
 * retried with exponential backoff; an event that still fails is written to the dead-letter
 * set and delivery to the other transports continues.
 */
@Service
public class AlertDispatchService {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatchService.class);

    // Transport name recorded when the event never reached a transport
    static final String UNDISPATCHED = "dispatcher";

    private final List<AlertTransport> transports;
    private final AlertDispatchConfig config;
    private final DeadLetterRepository deadLetterRepository;
    private final MetricsConfig metricsConfig;

    public AlertDispatchService(List<AlertTransport> transports,
                                AlertDispatchConfig config,
                                DeadLetterRepository deadLetterRepository,
                                MetricsConfig metricsConfig) {
        this.transports = transports;
        this.config = config;
        this.deadLetterRepository = deadLetterRepository;
        this.metricsConfig = metricsConfig;
    }

    @Async("alertDispatchExecutor")
    @Observed(name = "alert.dispatch", contextualName = "dispatch-alert")
    public void dispatch(AlertEvent event) {
        deliver(event);
    }

    /**
     * Synchronous delivery to all enabled transports.
     *
     * @return number of transports that accepted the event
     */
    public int deliver(AlertEvent event) {
        int delivered = 0;
        for (AlertTransport transport : transports) {
            if (!transport.isEnabled()) {
                continue;
            }
            if (deliverTo(transport, event)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean deliverTo(AlertTransport transport, AlertEvent event) {
        int maxAttempts = Math.max(1, config.getMaxAttempts());
        long backoff = config.getInitialBackoffMs();
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                transport.dispatch(event);
                metricsConfig.recordDispatch(transport.name(), "success");
                return true;
            } catch (DispatchFailureException e) {
                lastError = e.getMessage();
                metricsConfig.recordDispatch(transport.name(), "retry");
                log.warn("Delivery of alert {} via {} failed (attempt {}/{}): {}",
                        event.getEventId(), transport.name(), attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts) {
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    lastError = "Interrupted while backing off: " + lastError;
                    deadLetter(transport, event, attempt, lastError);
                    return false;
                }
                backoff = Math.min(config.getMaxBackoffMs(), (long) (backoff * config.getBackoffMultiplier()));
            }
        }

        deadLetter(transport, event, maxAttempts, lastError);
        return false;
    }

    /**
     * Dead-letter an event the dispatch executor refused to queue. No transport was attempted.
     */
    public void deadLetterUndispatched(AlertEvent event, String reason) {
        deadLetter(UNDISPATCHED, event, 0, reason);
    }

    private void deadLetter(AlertTransport transport, AlertEvent event, int attempts, String lastError) {
        deadLetter(transport.name(), event, attempts, lastError);
    }

    private void deadLetter(String transportName, AlertEvent event, int attempts, String lastError) {
        metricsConfig.recordDispatch(transportName, "dead_letter");
        log.error("Alert {} for entity={} could not be delivered via {} after {} attempts. Dead-lettered.",
                event.getEventId(), event.getEntityId(), transportName, attempts);
        deadLetterRepository.save(DeadLetter.builder()
                .event(event)
                .transport(transportName)
                .attempts(attempts)
                .lastError(lastError)
                .failedAt(System.currentTimeMillis())
                .build());
    }

    public List<DeadLetter> getDeadLetters(int limit) {
        return deadLetterRepository.findRecent(limit);
    }
}
