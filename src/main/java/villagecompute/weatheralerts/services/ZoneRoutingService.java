/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.services;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.config.ZoneRoutingConfig;

/**
 * Resolves monitored zones to notification destinations and dashboard labels.
 *
 * <p>
 * Routing is static for the process lifetime. A zone without an explicit mapping (or mapped to a blank value) routes to
 * the default destination.
 */
@ApplicationScoped
public class ZoneRoutingService {

    @Inject
    ZoneRoutingConfig config;

    /**
     * Returns the configured zone codes in configuration order.
     */
    public List<String> zones() {
        return config.zones();
    }

    public String defaultDestination() {
        return config.defaultDestination();
    }

    /**
     * Resolves the destination for a zone, falling back to the default destination.
     *
     * @param zone
     *            zone code (null resolves to the default)
     * @return destination identifier
     */
    public String destinationFor(String zone) {
        if (zone == null) {
            return config.defaultDestination();
        }
        String destination = destinations().get(zone);
        return destination == null || destination.isBlank() ? config.defaultDestination() : destination;
    }

    /**
     * Returns the display label for a zone, or the zone code itself when none is configured.
     */
    public String labelFor(String zone) {
        if (zone == null) {
            return null;
        }
        Map<String, String> labels = config.labels();
        String label = labels == null ? null : labels.get(zone);
        return label == null || label.isBlank() ? zone : label;
    }

    /**
     * Returns every routed destination plus the default destination, de-duplicated and sorted.
     */
    public Set<String> allDestinations() {
        Set<String> destinations = new TreeSet<>();
        destinations.add(config.defaultDestination());
        destinations().values().stream().filter(d -> d != null && !d.isBlank()).forEach(destinations::add);
        return destinations;
    }

    private Map<String, String> destinations() {
        Map<String, String> destinations = config.destinations();
        return destinations == null ? Map.of() : destinations;
    }
}
