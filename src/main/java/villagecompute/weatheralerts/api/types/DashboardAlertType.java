/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.types;

import io.quarkus.qute.TemplateData;

/**
 * Alert as displayed on the dashboard.
 *
 * @param event
 *            alert type name
 * @param description
 *            normalized description (injected alerts are shown verbatim)
 */
@TemplateData
public record DashboardAlertType(String event, String description) {
}
