/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.config;

import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Development override that replaces the live feed with a static list of fake alerts.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code weather-alerts.dev.inject} - enable injection (default: false)</li>
 * <li>{@code weather-alerts.dev.prefix-message} - text prepended to every injected description</li>
 * <li>{@code weather-alerts.dev.destinations} - restrict injected sends to these destinations</li>
 * <li>{@code weather-alerts.dev.alerts[n].title} - injected event name</li>
 * <li>{@code weather-alerts.dev.alerts[n].description} - injected description</li>
 * <li>{@code weather-alerts.dev.alerts[n].code} - zone the alert belongs to on the dashboard</li>
 * </ul>
 *
 * @see villagecompute.weatheralerts.services.DevInjectionService
 */
@ConfigMapping(
        prefix = "weather-alerts.dev")
public interface DevInjectionConfig {

    @WithDefault("false")
    boolean inject();

    Optional<String> prefixMessage();

    Optional<List<String>> destinations();

    Optional<List<InjectedAlert>> alerts();

    /**
     * One fake alert definition.
     */
    interface InjectedAlert {

        String title();

        Optional<String> description();

        Optional<String> code();
    }
}
