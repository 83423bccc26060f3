/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.rest;

import java.net.URI;
import java.util.List;
import java.util.Map;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import io.quarkus.qute.CheckedTemplate;
import io.quarkus.qute.TemplateInstance;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.weatheralerts.api.types.DashboardAlertType;
import villagecompute.weatheralerts.api.types.DashboardZoneType;
import villagecompute.weatheralerts.services.DashboardService;

/**
 * Current-alerts dashboard.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /} – redirect to {@code /weatheralerts}</li>
 * <li>{@code GET /weatheralerts} – server-rendered HTML, one section per monitored zone</li>
 * <li>{@code GET /api/alerts} – the same data as JSON keyed by zone label</li>
 * </ul>
 *
 * <p>
 * A failure building the HTML dashboard yields {@code 502 Bad Gateway}. Failures of individual zone fetches do not:
 * those zones are shown without live alerts.
 */
@Path("/")
@Tag(
        name = "Dashboard",
        description = "Current weather alerts")
public class DashboardResource {

    private static final Logger LOG = Logger.getLogger(DashboardResource.class);

    @Inject
    DashboardService dashboardService;

    /**
     * Type-safe Qute templates.
     */
    @CheckedTemplate(
            requireTypeSafeExpressions = false)
    public static class Templates {
        public static native TemplateInstance index(DashboardPageData data);
    }

    @GET
    public Response root() {
        return Response.status(Response.Status.FOUND).location(URI.create("/weatheralerts")).build();
    }

    /**
     * Renders the current alerts page.
     *
     * @return 200 with HTML, or 502 if the dashboard could not be built
     */
    @GET
    @Path("weatheralerts")
    @Produces(MediaType.TEXT_HTML)
    public Response dashboard() {
        DashboardPageData data;
        try {
            data = new DashboardPageData(dashboardService.buildDashboard(), dashboardService.isDevMode());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to build dashboard");
            return Response.status(Response.Status.BAD_GATEWAY).build();
        }
        return Response.ok(Templates.index(data).render(), MediaType.TEXT_HTML_TYPE).build();
    }

    /**
     * Returns current alerts keyed by zone label.
     */
    @GET
    @Path("api/alerts")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Current alerts",
            description = "Active alerts per monitored zone, injected alerts first, keyed by zone label")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Alerts by zone label")})
    public Map<String, List<DashboardAlertType>> alerts() {
        return dashboardService.buildDashboardByLabel();
    }

    /**
     * Template data for the dashboard page.
     *
     * @param zones
     *            zones in configuration order
     * @param dev
     *            whether development injection is active
     */
    public record DashboardPageData(List<DashboardZoneType> zones, boolean dev) {
    }
}
