package com.sensor.anomaly.config;

import com.sensor.anomaly.model.AlertState;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumSet;
import java.util.Set;

@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String toNumber;
    private boolean enabled = false;
    private String channel = "sms";  // "sms" or "whatsapp"

    // ONGOING reminders stay in the logs unless listed here
    private Set<AlertState> notifyStates = EnumSet.of(AlertState.NEW, AlertState.CLEARED);
}
