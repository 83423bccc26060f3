/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.services;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.weatheralerts.api.types.AlertType;
import villagecompute.weatheralerts.api.types.ChangeSetType;
import villagecompute.weatheralerts.api.types.TrackedAlertType;

/**
 * Compares the alerts of the current cycle against the previously tracked snapshot.
 *
 * <p>
 * An alert needs a notification when its id was not tracked before or when its description differs from the tracked
 * one. Alerts that disappeared are not reported individually; only the transition to zero alerts is (all-clear).
 */
@ApplicationScoped
public class AlertDiffService {

    /**
     * Computes the change set for one cycle.
     *
     * @param current
     *            alerts fetched this cycle
     * @param previous
     *            snapshot saved by the previous cycle
     * @return alerts to notify (in {@code current} order) and the all-clear flag
     */
    public ChangeSetType diff(List<AlertType> current, List<TrackedAlertType> previous) {
        if (current.isEmpty()) {
            return new ChangeSetType(List.of(), !previous.isEmpty());
        }

        Map<String, TrackedAlertType> previousById = new HashMap<>();
        for (TrackedAlertType tracked : previous) {
            previousById.put(tracked.id(), tracked);
        }

        List<AlertType> toNotify = new ArrayList<>();
        for (AlertType alert : current) {
            TrackedAlertType tracked = previousById.get(alert.id());
            if (tracked == null || !Objects.equals(tracked.description(), alert.description())) {
                toNotify.add(alert);
            }
        }

        return new ChangeSetType(toNotify, false);
    }

    /**
     * Picks one previous entry per distinct destination for the all-clear broadcast.
     *
     * @param previous
     *            snapshot saved by the previous cycle
     * @param defaultDestination
     *            destination used for entries without one
     * @return first entry for each destination, in first-seen order, each carrying a non-null destination
     */
    public List<TrackedAlertType> allClearTargets(List<TrackedAlertType> previous, String defaultDestination) {
        Map<String, TrackedAlertType> byDestination = new LinkedHashMap<>();
        for (TrackedAlertType tracked : previous) {
            String destination = tracked.destination() == null || tracked.destination().isBlank()
                    ? defaultDestination
                    : tracked.destination();
            byDestination.putIfAbsent(destination,
                    new TrackedAlertType(tracked.id(), destination, tracked.description(), tracked.zone()));
        }
        return List.copyOf(byDestination.values());
    }
}
