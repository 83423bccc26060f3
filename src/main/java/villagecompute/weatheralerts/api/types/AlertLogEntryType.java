/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import jakarta.validation.constraints.Size;

/**
 * One alert event record, as forwarded by the poll loop to the logging sink and kept by the dashboard event log.
 *
 * @param timestamp
 *            ISO-8601 timestamp (UTC when produced by this service)
 * @param county
 *            zone code, or {@code "DEV"} for injected alerts and {@code "ALL"} for untracked all-clear events
 * @param event
 *            alert type name, or {@code "ALL CLEAR"}
 * @param description
 *            raw alert description
 */
@Schema(
        description = "Alert event log record")
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record AlertLogEntryType(@Schema(
        description = "ISO-8601 event timestamp",
        example = "2025-01-09T18:00:00+00:00") @Size(
                max = 64) String timestamp,

        @Schema(
                description = "Zone code, DEV or ALL",
                example = "NCC001") @Size(
                        max = 64) String county,

        @Schema(
                description = "Alert type name",
                example = "Winter Storm Warning") @Size(
                        max = 256) String event,

        @Schema(
                description = "Raw alert description") @Size(
                        max = 20000) String description) {
}
