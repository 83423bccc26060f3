/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Last-notified state of one alert, persisted between poll cycles.
 *
 * <p>
 * JSON field names match the state file written by earlier releases ({@code id}, {@code chat_id},
 * {@code Description}), so an existing {@code last_alerts.json} keeps working after an upgrade.
 *
 * @param id
 *            alert id
 * @param destination
 *            destination the alert was sent to
 * @param description
 *            last-sent description (change-detection fingerprint)
 * @param zone
 *            zone code, null for injected alerts and for entries written by earlier releases
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrackedAlertType(@JsonProperty("id") String id, @JsonProperty("chat_id") String destination,
        @JsonProperty("Description") String description, @JsonProperty("zone") String zone) {
}
