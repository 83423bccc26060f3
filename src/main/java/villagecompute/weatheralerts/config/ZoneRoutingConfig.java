/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.config;

import java.util.List;
import java.util.Map;

import io.smallrye.config.ConfigMapping;

/**
 * Monitored zones and their notification routing.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code weather-alerts.routing.zones} - NWS zone codes to poll (e.g., {@code NCC001,NCZ041})</li>
 * <li>{@code weather-alerts.routing.default-destination} - destination for zones without an explicit mapping</li>
 * <li>{@code weather-alerts.routing.destinations.<zone>} - per-zone destination</li>
 * <li>{@code weather-alerts.routing.labels.<zone>} - dashboard display label</li>
 * </ul>
 *
 * <p>
 * Values are fixed for the process lifetime; a restart picks up changes.
 *
 * @see villagecompute.weatheralerts.services.ZoneRoutingService
 */
@ConfigMapping(
        prefix = "weather-alerts.routing")
public interface ZoneRoutingConfig {

    List<String> zones();

    String defaultDestination();

    Map<String, String> destinations();

    Map<String, String> labels();
}
