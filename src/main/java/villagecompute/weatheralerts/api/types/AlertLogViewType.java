/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.types;

import io.quarkus.qute.TemplateData;

/**
 * Event log record prepared for the HTML log page.
 *
 * @param timestamp
 *            timestamp rendered in the display time zone, or the raw value when it cannot be parsed
 * @param county
 *            raw zone code ({@code DEV}, {@code ALL} or {@code UNKNOWN} for non-zone records)
 * @param countyLabel
 *            display label for the zone
 * @param event
 *            alert type name
 * @param description
 *            raw alert description
 */
@TemplateData
public record AlertLogViewType(String timestamp, String county, String countyLabel, String event,
        String description) {
}
