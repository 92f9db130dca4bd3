package com.sensor.anomaly.transport;

import com.sensor.anomaly.config.TwilioNotificationConfig;
import com.sensor.anomaly.exception.DispatchFailureException;
import com.sensor.anomaly.model.AlertEvent;
import com.sensor.anomaly.model.AlertState;
import com.twilio.Twilio;
import com.twilio.exception.TwilioException;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Map;

@Component
public class TwilioAlertTransport implements AlertTransport {

    private static final Logger log = LoggerFactory.getLogger(TwilioAlertTransport.class);

    private final TwilioNotificationConfig config;

    public TwilioAlertTransport(TwilioNotificationConfig config) {
        this.config = config;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio alert transport initialized. Channel: {}, states: {}",
                    config.getChannel(), config.getNotifyStates());
        } else {
            log.info("Twilio alert transport is DISABLED.");
        }
    }

    @Override
    public String name() {
        return "twilio";
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public void dispatch(AlertEvent event) {
        if (!config.getNotifyStates().contains(event.getState())) {
            log.debug("Twilio skips {} alert for entity={}", event.getState(), event.getEntityId());
            return;
        }

        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(config.getToNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    buildMessageBody(event)
            ).create();
            log.info("Twilio alert sent for entity={}, record={}, sid={}",
                    event.getEntityId(), event.getRecordId(), message.getSid());
        } catch (TwilioException e) {
            throw new DispatchFailureException("Twilio rejected alert " + event.getEventId() + ": " + e.getMessage(), e);
        }
    }

    String buildMessageBody(AlertEvent event) {
        if (event.getState() == AlertState.CLEARED) {
            return String.format(
                    "[ANOMALY CLEARED] %s back to normal\n" +
                    "Record: %s\n" +
                    "Score: %.2f (clear threshold %.2f)",
                    event.getEntityId(), event.getRecordId(), event.getScore(), event.getThreshold());
        }

        String topFeature = event.getContributions() == null ? "N/A"
                : event.getContributions().entrySet().stream()
                        .max(Comparator.comparingDouble(Map.Entry::getValue))
                        .map(Map.Entry::getKey)
                        .orElse("N/A");

        return String.format(
                "[ANOMALY %s] Sensor %s\n" +
                "Record: %s\n" +
                "Score: %.2f (threshold %.2f)\n" +
                "Deviation: %.1f sigma\n" +
                "Top feature: %s",
                event.getState(),
                event.getEntityId(),
                event.getRecordId(),
                event.getScore(),
                event.getThreshold(),
                event.getDeviationScore(),
                topFeature
        );
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
