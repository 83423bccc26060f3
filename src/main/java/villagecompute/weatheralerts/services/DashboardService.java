/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.services;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.api.types.AlertType;
import villagecompute.weatheralerts.api.types.DashboardAlertType;
import villagecompute.weatheralerts.api.types.DashboardZoneType;
import villagecompute.weatheralerts.config.AlertTimeType;
import villagecompute.weatheralerts.exceptions.AlertFetchException;
import villagecompute.weatheralerts.util.AlertTextNormalizer;

/**
 * Builds the current-alerts view shown by the dashboard.
 *
 * <p>
 * Each monitored zone lists its injected alerts first (when development injection is enabled), then the live alerts
 * fetched from NWS. A zone whose fetch fails is shown with no live alerts.
 */
@ApplicationScoped
public class DashboardService {

    private static final Logger LOG = Logger.getLogger(DashboardService.class);

    @Inject
    AlertSourceService alertSource;

    @Inject
    DevInjectionService devInjection;

    @Inject
    ZoneRoutingService zoneRouting;

    @ConfigProperty(
            name = "weather-alerts.time-type",
            defaultValue = "onset")
    AlertTimeType timeType;

    @ConfigProperty(
            name = "weather-alerts.max-words",
            defaultValue = "150")
    int maxWords;

    /**
     * Builds one entry per monitored zone, in configuration order.
     */
    public List<DashboardZoneType> buildDashboard() {
        List<DashboardZoneType> zones = new ArrayList<>();
        for (String zone : zoneRouting.zones()) {
            List<DashboardAlertType> alerts = new ArrayList<>(devInjection.dashboardAlerts(zone));
            alerts.addAll(liveAlerts(zone));
            zones.add(new DashboardZoneType(zone, zoneRouting.labelFor(zone), List.copyOf(alerts)));
        }
        return zones;
    }

    /**
     * Same data as {@link #buildDashboard()}, keyed by zone label.
     */
    public Map<String, List<DashboardAlertType>> buildDashboardByLabel() {
        Map<String, List<DashboardAlertType>> byLabel = new LinkedHashMap<>();
        for (DashboardZoneType zone : buildDashboard()) {
            byLabel.put(zone.label(), zone.alerts());
        }
        return byLabel;
    }

    public boolean isDevMode() {
        return devInjection.isEnabled();
    }

    private List<DashboardAlertType> liveAlerts(String zone) {
        List<AlertType> active;
        try {
            active = alertSource.fetchActive(zone, timeType);
        } catch (AlertFetchException e) {
            LOG.warnf("Dashboard fetch failed for zone %s: %s", zone, e.getMessage());
            return List.of();
        }

        return active.stream().map(alert -> new DashboardAlertType(alert.event(),
                AlertTextNormalizer.normalize(alert.event() + ": " + alert.description(), maxWords))).toList();
    }
}
