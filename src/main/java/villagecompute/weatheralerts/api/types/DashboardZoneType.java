/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.types;

import java.util.List;

import io.quarkus.qute.TemplateData;

/**
 * Current alerts for one monitored zone.
 *
 * @param zone
 *            NWS zone code
 * @param label
 *            display label (the zone code when no label is configured)
 * @param alerts
 *            injected alerts first, then live alerts
 */
@TemplateData
public record DashboardZoneType(String zone, String label, List<DashboardAlertType> alerts) {
}
