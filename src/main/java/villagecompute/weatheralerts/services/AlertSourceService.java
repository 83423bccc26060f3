/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.services;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.api.types.AlertType;
import villagecompute.weatheralerts.config.AlertTimeType;
import villagecompute.weatheralerts.exceptions.AlertFetchException;
import villagecompute.weatheralerts.integration.nws.NwsAlertClient;
import villagecompute.weatheralerts.observability.LoggingConfig;
import villagecompute.weatheralerts.util.EventGlobMatcher;

/**
 * Fetches and filters currently active alerts for the monitored zones.
 *
 * <p>
 * For each raw NWS feature:
 * <ol>
 * <li>Drop it when {@code properties.event} is missing or matches the event blocklist (glob patterns)</li>
 * <li>Read the start/end timestamps selected by {@link AlertTimeType}, falling back to {@code expires} for the end</li>
 * <li>Drop it when either timestamp is missing or unparseable</li>
 * <li>Keep it only when {@code start <= now < end}</li>
 * <li>Resolve the destination through {@link ZoneRoutingService}</li>
 * </ol>
 *
 * <p>
 * <b>Error Handling:</b> A failed fetch for one zone is logged and that zone is skipped; the remaining zones are still
 * fetched.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code weather-alerts.blocked-events} - comma-separated glob patterns (e.g., {@code Test*,Special Weather*})</li>
 * <li>{@code weather-alerts.time-type} - {@code onset} (default) or {@code effective}</li>
 * </ul>
 */
@ApplicationScoped
public class AlertSourceService {

    private static final Logger LOG = Logger.getLogger(AlertSourceService.class);

    @Inject
    NwsAlertClient nwsClient;

    @Inject
    ZoneRoutingService zoneRouting;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "weather-alerts.blocked-events")
    Optional<List<String>> blockedEvents;

    @ConfigProperty(
            name = "weather-alerts.time-type",
            defaultValue = "onset")
    AlertTimeType timeType;

    /**
     * Fetches active alerts for every configured zone using the configured time type.
     *
     * @return active alerts across all zones, in zone order then feed order
     */
    public List<AlertType> fetchAllActive() {
        Instant now = Instant.now();
        List<AlertType> alerts = new ArrayList<>();

        for (String zone : zoneRouting.zones()) {
            LoggingConfig.setZone(zone);
            try {
                List<AlertType> zoneAlerts = fetchActive(zone, timeType, now);
                alerts.addAll(zoneAlerts);
                incrementCounter("weather_alerts.fetch.total", "status", "success");
                LOG.debugf("Zone %s has %d active alerts", zone, zoneAlerts.size());
            } catch (AlertFetchException e) {
                incrementCounter("weather_alerts.fetch.total", "status", "failure");
                LOG.errorf(e, "Fetch error for zone %s (skipping zone)", zone);
            } finally {
                LoggingConfig.clearZone();
            }
        }

        return alerts;
    }

    /**
     * Fetches active alerts for one zone.
     *
     * @param zone
     *            NWS zone code
     * @param timeType
     *            which timestamp pair defines the activity window
     * @return active alerts for the zone
     * @throws AlertFetchException
     *             if the feed request fails
     */
    public List<AlertType> fetchActive(String zone, AlertTimeType timeType) {
        return fetchActive(zone, timeType, Instant.now());
    }

    List<AlertType> fetchActive(String zone, AlertTimeType timeType, Instant now) {
        List<JsonNode> features = nwsClient.fetchActiveFeatures(zone);
        return filterActive(zone, features, timeType, now);
    }

    /**
     * Applies the blocklist, timestamp and activity-window rules to raw features.
     */
    List<AlertType> filterActive(String zone, List<JsonNode> features, AlertTimeType timeType, Instant now) {
        EventGlobMatcher blocklist = EventGlobMatcher.of(blockedEvents == null ? null : blockedEvents.orElse(null));
        String destination = zoneRouting.destinationFor(zone);
        List<AlertType> alerts = new ArrayList<>();

        for (JsonNode feature : features) {
            JsonNode properties = feature.path("properties");

            String event = text(properties.path("event"));
            if (event == null) {
                continue;
            }
            if (blocklist.matchesAny(event)) {
                LOG.debugf("Dropping blocked event '%s' for zone %s", event, zone);
                continue;
            }

            String start = text(properties.path(timeType.getStartField()));
            String end = text(properties.path(timeType.getEndField()));
            if (end == null) {
                end = text(properties.path(AlertTimeType.FALLBACK_END_FIELD));
            }
            if (start == null || end == null) {
                continue;
            }

            String id = text(feature.path("id"));
            if (id == null) {
                id = text(properties.path("id"));
            }
            if (id == null) {
                LOG.debugf("Dropping '%s' for zone %s: feature has no id", event, zone);
                continue;
            }

            Instant activeFrom;
            Instant activeUntil;
            try {
                activeFrom = parseTimestamp(start);
                activeUntil = parseTimestamp(end);
            } catch (DateTimeParseException e) {
                LOG.warnf("Dropping '%s' for zone %s: unparseable timestamp (%s)", event, zone, e.getMessage());
                continue;
            }

            String description = text(properties.path("description"));
            AlertType alert = new AlertType(id, zone, event, description == null ? "" : description.trim(),
                    activeFrom, activeUntil, destination);

            if (alert.isActiveAt(now)) {
                alerts.add(alert);
            }
        }

        return alerts;
    }

    /**
     * Parses an ISO-8601 timestamp to a UTC instant. A timestamp without an offset is read as UTC.
     *
     * @param value
     *            timestamp text (e.g., "2025-01-09T18:00:00-05:00")
     * @return instant
     * @throws DateTimeParseException
     *             if the value is not an ISO-8601 date-time
     */
    static Instant parseTimestamp(String value) {
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value.trim(), OffsetDateTime::from,
                LocalDateTime::from);
        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    private void incrementCounter(String name, String... tags) {
        Counter.builder(name).tags(tags).register(meterRegistry).increment();
    }
}
