/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.services;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.api.types.AlertLogEntryType;
import villagecompute.weatheralerts.api.types.AlertLogViewType;
import villagecompute.weatheralerts.util.EventGlobMatcher;

/**
 * In-memory event log fed by the poll loop's logging sink.
 *
 * <p>
 * Entries are kept for the current UTC day only. The first access after UTC midnight drops every entry whose timestamp
 * falls before that midnight, along with entries whose timestamp cannot be parsed. Nothing is persisted: a restart
 * starts with an empty log. Within a day the log holds at most {@code weather-alerts.event-log.max-entries} records;
 * past that the oldest are evicted first.
 *
 * <p>
 * <b>Thread Safety:</b> All access is synchronized on this bean; readers receive copies.
 */
@ApplicationScoped
public class AlertLogService {

    private static final Logger LOG = Logger.getLogger(AlertLogService.class);

    static final String UNKNOWN_COUNTY = "UNKNOWN";

    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z",
            Locale.US);

    @Inject
    ZoneRoutingService zoneRouting;

    @ConfigProperty(
            name = "weather-alerts.blocked-events")
    Optional<List<String>> blockedEvents;

    @ConfigProperty(
            name = "weather-alerts.dashboard.display-time-zone",
            defaultValue = "America/New_York")
    String displayTimeZone;

    @ConfigProperty(
            name = "weather-alerts.event-log.max-entries",
            defaultValue = "5000")
    int maxEntries;

    Clock clock = Clock.systemUTC();

    private final List<AlertLogEntryType> entries = new ArrayList<>();
    private LocalDate lastPruneDate;

    /**
     * Appends a record unless its event is blocklisted. A missing timestamp becomes the current UTC time and a missing
     * county becomes {@code UNKNOWN}.
     *
     * @param entry
     *            record received from the logging sink
     * @return true when the record was stored
     */
    public synchronized boolean record(AlertLogEntryType entry) {
        pruneIfNewDay();

        String event = entry.event() == null ? "" : entry.event();
        if (blocklist().matchesAny(event)) {
            LOG.infof("Blocked log event: %s", event);
            return false;
        }

        String timestamp = entry.timestamp() == null || entry.timestamp().isBlank()
                ? OffsetDateTime.now(clock.withZone(ZoneOffset.UTC)).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                : entry.timestamp();
        AlertLogEntryType stored = new AlertLogEntryType(timestamp,
                entry.county() == null ? UNKNOWN_COUNTY : entry.county(), event,
                entry.description() == null ? "" : entry.description());

        entries.add(stored);
        if (entries.size() > maxEntries) {
            int overflow = entries.size() - maxEntries;
            entries.subList(0, overflow).clear();
            LOG.warnf("Event log reached %d entries, evicted %d oldest", maxEntries, overflow);
        }
        LOG.infof("Received log event: %s for %s", stored.event(), stored.county());
        return true;
    }

    /**
     * Returns a copy of today's records in arrival order.
     */
    public synchronized List<AlertLogEntryType> entries() {
        pruneIfNewDay();
        return List.copyOf(entries);
    }

    /**
     * Returns today's records prepared for display: timestamps in the display time zone, zones resolved to labels.
     */
    public List<AlertLogViewType> viewEntries() {
        ZoneId zoneId = ZoneId.of(displayTimeZone);
        return entries().stream().map(entry -> new AlertLogViewType(formatTimestamp(entry.timestamp(), zoneId),
                entry.county(), zoneRouting.labelFor(entry.county()), entry.event(), entry.description())).toList();
    }

    /**
     * Returns the zones present in today's records mapped to their labels, sorted by zone code.
     */
    public Map<String, String> usedZoneLabels() {
        Map<String, String> labels = new TreeMap<>();
        for (AlertLogEntryType entry : entries()) {
            labels.put(entry.county(), zoneRouting.labelFor(entry.county()));
        }
        return labels;
    }

    private void pruneIfNewDay() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        if (lastPruneDate == null) {
            lastPruneDate = today;
            return;
        }
        if (today.equals(lastPruneDate)) {
            return;
        }

        Instant cutoff = today.atStartOfDay(ZoneOffset.UTC).toInstant();
        int before = entries.size();
        entries.removeIf(entry -> !isOnOrAfter(entry.timestamp(), cutoff));
        lastPruneDate = today;
        LOG.infof("Pruned %d event log entries older than %s", before - entries.size(), today);
    }

    private static boolean isOnOrAfter(String timestamp, Instant cutoff) {
        try {
            return !AlertSourceService.parseTimestamp(timestamp).isBefore(cutoff);
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static String formatTimestamp(String timestamp, ZoneId zoneId) {
        try {
            return AlertSourceService.parseTimestamp(timestamp).atZone(zoneId).format(DISPLAY_FORMAT);
        } catch (DateTimeParseException e) {
            return timestamp;
        }
    }

    private EventGlobMatcher blocklist() {
        return EventGlobMatcher.of(blockedEvents == null ? null : blockedEvents.orElse(null));
    }
}
