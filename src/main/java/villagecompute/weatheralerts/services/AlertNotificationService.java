/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.services;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.api.types.AlertLogEntryType;
import villagecompute.weatheralerts.api.types.AlertType;
import villagecompute.weatheralerts.api.types.TrackedAlertType;
import villagecompute.weatheralerts.exceptions.LogForwardException;
import villagecompute.weatheralerts.exceptions.NotificationException;
import villagecompute.weatheralerts.integration.logsink.AlertLogForwarder;
import villagecompute.weatheralerts.integration.telegram.TelegramClient;
import villagecompute.weatheralerts.util.AlertTextNormalizer;

/**
 * Formats and delivers alert notifications, then mirrors each delivery to the logging sink.
 *
 * <p>
 * <b>Message format:</b> {@code "Detailed alert for <event>. <description>"}, passed through
 * {@link AlertTextNormalizer} and upper-cased when {@code weather-alerts.uppercase=true}.
 *
 * <p>
 * <b>Error Handling:</b> Delivery failures are logged and counted, never thrown, so one failed send does not stop the
 * remaining sends of a cycle. Logging-sink failures are logged at debug level and otherwise ignored.
 */
@ApplicationScoped
public class AlertNotificationService {

    private static final Logger LOG = Logger.getLogger(AlertNotificationService.class);

    static final String ALL_CLEAR_MESSAGE = "ALL CLEAR: The national weather service has cleared all alerts for this area.";
    static final String ALL_CLEAR_EVENT = "ALL CLEAR";
    static final String DEV_COUNTY = "DEV";
    static final String ALL_COUNTY = "ALL";

    @Inject
    TelegramClient telegramClient;

    @Inject
    AlertLogForwarder logForwarder;

    @Inject
    ZoneRoutingService zoneRouting;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "weather-alerts.max-words",
            defaultValue = "150")
    int maxWords;

    @ConfigProperty(
            name = "weather-alerts.uppercase",
            defaultValue = "false")
    boolean uppercase;

    /**
     * Sends one alert notification to the alert's destination.
     *
     * @param alert
     *            new or changed alert
     * @return true when the message was delivered
     */
    public boolean dispatch(AlertType alert) {
        String destination = alert.destination() == null ? zoneRouting.defaultDestination() : alert.destination();
        boolean sent = send(destination, composeMessage(alert), "alert");
        if (sent) {
            LOG.infof("Sent alert '%s' (%s) to %s", alert.event(), alert.id(), destination);
        }

        forward(new AlertLogEntryType(timestamp(), alert.zone() == null ? DEV_COUNTY : alert.zone(), alert.event(),
                alert.description()));
        return sent;
    }

    /**
     * Broadcasts the all-clear message, once per target.
     *
     * @param targets
     *            one entry per distinct destination (see {@link AlertDiffService#allClearTargets})
     * @return number of destinations the message was delivered to
     */
    public int dispatchAllClear(List<TrackedAlertType> targets) {
        String message = uppercase ? ALL_CLEAR_MESSAGE.toUpperCase(Locale.ROOT) : ALL_CLEAR_MESSAGE;
        int delivered = 0;

        for (TrackedAlertType target : targets) {
            if (send(target.destination(), message, "all_clear")) {
                delivered++;
                LOG.infof("Sent all-clear to %s", target.destination());
            }
            forward(new AlertLogEntryType(timestamp(), target.zone() == null ? ALL_COUNTY : target.zone(),
                    ALL_CLEAR_EVENT, ""));
        }

        return delivered;
    }

    /**
     * Builds the outbound text for an alert.
     */
    String composeMessage(AlertType alert) {
        String message = AlertTextNormalizer.normalize("Detailed alert for " + alert.event() + ". " + alert.description(),
                maxWords);
        return uppercase ? message.toUpperCase(Locale.ROOT) : message;
    }

    private boolean send(String destination, String message, String kind) {
        try {
            telegramClient.sendMessage(destination, message);
            incrementCounter("weather_alerts.notifications.total", "kind", kind, "status", "success");
            return true;
        } catch (NotificationException e) {
            incrementCounter("weather_alerts.notifications.total", "kind", kind, "status", "failure");
            LOG.errorf(e, "Failed to send %s notification to %s", kind, destination);
            return false;
        }
    }

    private void forward(AlertLogEntryType entry) {
        if (!logForwarder.isEnabled()) {
            return;
        }
        try {
            logForwarder.forward(entry);
        } catch (LogForwardException e) {
            LOG.debugf("Could not forward '%s' to log sink: %s", entry.event(), e.getMessage());
        }
    }

    private static String timestamp() {
        return OffsetDateTime.now(ZoneOffset.UTC).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    private void incrementCounter(String name, String... tags) {
        Counter.builder(name).tags(tags).register(meterRegistry).increment();
    }
}
