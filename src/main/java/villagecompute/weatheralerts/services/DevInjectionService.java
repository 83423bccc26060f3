/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.services;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.api.types.AlertType;
import villagecompute.weatheralerts.api.types.DashboardAlertType;
import villagecompute.weatheralerts.config.DevInjectionConfig;
import villagecompute.weatheralerts.config.DevInjectionConfig.InjectedAlert;

/**
 * Supplies the configured fake alerts when development injection is enabled.
 *
 * <p>
 * In the poll cycle every fake alert is sent to every target destination (the configured injection destinations, or
 * all routed destinations plus the default). On the dashboard a fake alert whose {@code code} is a monitored zone is
 * listed under that zone only; any other fake alert is listed under every zone.
 */
@ApplicationScoped
public class DevInjectionService {

    private static final Logger LOG = Logger.getLogger(DevInjectionService.class);

    @Inject
    DevInjectionConfig config;

    @Inject
    ZoneRoutingService zoneRouting;

    public boolean isEnabled() {
        return config.inject();
    }

    /**
     * Builds the alerts that replace the live feed for one poll cycle.
     *
     * @return one alert per (fake alert, destination) pair; empty when injection is disabled
     */
    public List<AlertType> injectedAlerts() {
        if (!isEnabled()) {
            return List.of();
        }

        Collection<String> targets = targetDestinations();
        List<AlertType> alerts = new ArrayList<>();
        for (InjectedAlert fake : fakeAlerts()) {
            String description = prefixed(fake.description().orElse(""));
            for (String destination : targets) {
                alerts.add(new AlertType("inject_" + destination + "_" + fake.title(), null, fake.title(), description,
                        null, null, destination));
            }
        }

        LOG.infof("Injecting %d test alerts for %d destinations", alerts.size(), targets.size());
        return alerts;
    }

    /**
     * Returns the fake alerts shown under one zone on the dashboard.
     *
     * @param zone
     *            monitored zone code
     * @return fake alerts for the zone; empty when injection is disabled
     */
    public List<DashboardAlertType> dashboardAlerts(String zone) {
        if (!isEnabled()) {
            return List.of();
        }

        List<String> zones = zoneRouting.zones();
        List<DashboardAlertType> zoneSpecific = new ArrayList<>();
        List<DashboardAlertType> global = new ArrayList<>();

        for (InjectedAlert fake : fakeAlerts()) {
            String code = fake.code().orElse(null);
            DashboardAlertType alert = new DashboardAlertType(fake.title(), prefixed(fake.description().orElse("")));
            if (code != null && zones.contains(code)) {
                if (code.equals(zone)) {
                    zoneSpecific.add(alert);
                }
            } else {
                global.add(alert);
            }
        }

        zoneSpecific.addAll(global);
        return zoneSpecific;
    }

    Collection<String> targetDestinations() {
        List<String> configured = config.destinations().orElse(List.of()).stream().filter(d -> !d.isBlank()).toList();
        if (!configured.isEmpty()) {
            return new LinkedHashSet<>(configured);
        }
        return zoneRouting.allDestinations();
    }

    private List<InjectedAlert> fakeAlerts() {
        return config.alerts().orElse(List.of());
    }

    private String prefixed(String description) {
        return config.prefixMessage().map(prefix -> prefix + description).orElse(description);
    }
}
