package com.sensor.anomaly.transport;

import com.sensor.anomaly.config.TwilioNotificationConfig;
import com.sensor.anomaly.model.AlertEvent;
import com.sensor.anomaly.model.AlertState;
import com.sensor.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class TwilioAlertTransportTest {

    private TwilioNotificationConfig config;
    private TwilioAlertTransport transport;

    @BeforeEach
    void setUp() {
        config = new TwilioNotificationConfig();
        transport = new TwilioAlertTransport(config);
    }

    @Test
    void newAlert_bodyNamesEntityScoreAndTopFeature() {
        AlertEvent event = TestDataFactory.createAlertEvent("EV-1", AlertState.NEW)
                .withContributions(Map.of("sensor_value", 0.31, "humidity", 0.02));

        String body = transport.buildMessageBody(event);

        assertThat(body).startsWith("[ANOMALY NEW] Sensor MQ2-01");
        assertThat(body).contains("Record: mq2_data-000000000042");
        assertThat(body).contains("Score: 0.83 (threshold 0.70)");
        assertThat(body).contains("Deviation: 4.2 sigma");
        assertThat(body).contains("Top feature: sensor_value");
    }

    @Test
    void clearedAlert_usesClearTemplate() {
        AlertEvent event = TestDataFactory.createAlertEvent("EV-2", AlertState.CLEARED);

        String body = transport.buildMessageBody(event);

        assertThat(body).startsWith("[ANOMALY CLEARED] MQ2-01 back to normal");
        assertThat(body).doesNotContain("Top feature");
    }

    @Test
    void alertWithoutContributions_reportsNoTopFeature() {
        AlertEvent event = TestDataFactory.createAlertEvent("EV-3", AlertState.ONGOING)
                .withContributions(null);

        assertThat(transport.buildMessageBody(event)).contains("Top feature: N/A");
    }

    @Test
    void dispatch_stateNotSubscribed_isSkippedWithoutCallingTwilio() {
        config.setEnabled(true);

        // ONGOING is not in the default notify states, so no API call is attempted
        assertThatCode(() -> transport.dispatch(TestDataFactory.createAlertEvent("EV-4", AlertState.ONGOING)))
                .doesNotThrowAnyException();
    }

    @Test
    void enabledFlag_followsConfig() {
        assertThat(transport.isEnabled()).isFalse();
        config.setEnabled(true);
        assertThat(transport.isEnabled()).isTrue();
        assertThat(transport.name()).isEqualTo("twilio");
    }
}
