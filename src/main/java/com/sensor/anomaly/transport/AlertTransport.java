package com.sensor.anomaly.transport;

import com.sensor.anomaly.exception.DispatchFailureException;
import com.sensor.anomaly.model.AlertEvent;

/**
 * Outbound channel for alert events. Implementations are discovered as Spring beans and
 * invoked by {@link com.sensor.anomaly.service.AlertDispatchService}, which owns retries.
 */
public interface AlertTransport {

    String name();

    boolean isEnabled();

    /**
     * Deliver one event. Implementations do not retry.
     *
     * @throws DispatchFailureException if the channel rejected or could not be reached
     */
    void dispatch(AlertEvent event);
}
