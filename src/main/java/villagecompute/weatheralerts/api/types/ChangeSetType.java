/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.types;

import java.util.List;

/**
 * Result of comparing one cycle's alerts against the previously tracked state.
 *
 * @param toNotify
 *            alerts that are new or whose description changed, in fetch order; empty on an all-clear cycle
 * @param allClear
 *            true when the current fetch is empty and the previous state was not
 */
public record ChangeSetType(List<AlertType> toNotify, boolean allClear) {

    public ChangeSetType {
        toNotify = List.copyOf(toNotify);
    }

    /**
     * Returns true when the cycle produces no outbound notification.
     */
    public boolean isEmpty() {
        return toNotify.isEmpty() && !allClear;
    }
}
