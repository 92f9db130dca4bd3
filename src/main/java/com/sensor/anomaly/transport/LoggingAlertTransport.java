package com.sensor.anomaly.transport;

import com.sensor.anomaly.model.AlertEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingAlertTransport implements AlertTransport {

    private static final Logger log = LoggerFactory.getLogger("alerts");

    @Override
    public String name() {
        return "log";
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public void dispatch(AlertEvent event) {
        log.warn("[{}] entity={} record={} score={} threshold={} deviation={} model={} contributions={}",
                event.getState(), event.getEntityId(), event.getRecordId(),
                String.format("%.3f", event.getScore()), event.getThreshold(),
                String.format("%.2f", event.getDeviationScore()), event.getModelVersionId(),
                event.getContributions());
    }
}
