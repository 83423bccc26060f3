/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Active weather alert for a monitored zone, resolved to its notification destination.
 *
 * <p>
 * Built by {@link villagecompute.weatheralerts.services.AlertSourceService} from NWS feed features, or by
 * {@link villagecompute.weatheralerts.services.DevInjectionService} for injected test alerts (which carry no zone and
 * no activity window).
 *
 * @param id
 *            source-provided unique key (NWS feature URN or {@code inject_<destination>_<title>})
 * @param zone
 *            NWS zone code the alert was fetched for, null for injected alerts
 * @param event
 *            alert type name (e.g., "Winter Storm Warning")
 * @param description
 *            alert description, trimmed; empty when the feed omits it
 * @param activeFrom
 *            start of the activity window (inclusive), null when unbounded
 * @param activeUntil
 *            end of the activity window (exclusive), null when unbounded
 * @param destination
 *            resolved notification target (chat id)
 */
public record AlertType(String id, String zone, String event, String description,
        @JsonProperty("active_from") Instant activeFrom, @JsonProperty("active_until") Instant activeUntil,
        String destination) {

    public AlertType {
        description = description == null ? "" : description;
    }

    /**
     * Returns true when {@code activeFrom <= now < activeUntil}. Missing bounds are open.
     *
     * @param now
     *            instant to test
     * @return whether the alert is active at {@code now}
     */
    public boolean isActiveAt(Instant now) {
        boolean started = activeFrom == null || !activeFrom.isAfter(now);
        boolean notEnded = activeUntil == null || now.isBefore(activeUntil);
        return started && notEnded;
    }

    /**
     * Converts this alert to the persisted state unit.
     */
    public TrackedAlertType toTracked() {
        return new TrackedAlertType(id, destination, description, zone);
    }
}
