/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.rest;

import java.util.List;
import java.util.Map;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.RequestBody;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import io.quarkus.qute.CheckedTemplate;
import io.quarkus.qute.TemplateInstance;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.weatheralerts.api.types.AlertLogEntryType;
import villagecompute.weatheralerts.api.types.AlertLogViewType;
import villagecompute.weatheralerts.services.AlertLogService;

/**
 * Alert event log endpoints.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code POST /weatheralerts/log} – receive an event record from the poll loop's logging sink</li>
 * <li>{@code GET /weatheralerts/logs.json} – today's records, raw UTC timestamps</li>
 * <li>{@code GET /weatheralerts/logs.html} – today's records in the display time zone</li>
 * </ul>
 */
@Path("/weatheralerts")
@Tag(
        name = "Event Log",
        description = "Alert event log operations")
public class AlertLogResource {

    @Inject
    AlertLogService alertLogService;

    /**
     * Type-safe Qute templates.
     */
    @CheckedTemplate(
            requireTypeSafeExpressions = false)
    public static class Templates {
        public static native TemplateInstance logs(LogPageData data);
    }

    /**
     * Stores one event record. Blocklisted events are accepted and discarded.
     *
     * @param entry
     *            record body (all fields optional)
     * @return 204 No Content
     */
    @POST
    @Path("log")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Log alert event",
            description = "Record an alert event; blocklisted events are ignored")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "204",
                    description = "Event accepted"),
                    @APIResponse(
                            responseCode = "400",
                            description = "A field exceeds its maximum length")})
    public Response log(@RequestBody(
            content = @Content(
                    schema = @Schema(
                            implementation = AlertLogEntryType.class))) @Valid AlertLogEntryType entry) {
        alertLogService.record(entry == null ? new AlertLogEntryType(null, null, null, null) : entry);
        return Response.noContent().build();
    }

    @GET
    @Path("logs.json")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Event log",
            description = "Today's alert events with raw UTC timestamps")
    public List<AlertLogEntryType> logsJson() {
        return alertLogService.entries();
    }

    @GET
    @Path("logs.html")
    @Produces(MediaType.TEXT_HTML)
    public String logsHtml() {
        return Templates.logs(new LogPageData(alertLogService.viewEntries(), alertLogService.usedZoneLabels()))
                .render();
    }

    /**
     * Template data for the log page.
     *
     * @param logs
     *            formatted records in arrival order
     * @param labels
     *            zone code to label, for the zones present in {@code logs}
     */
    public record LogPageData(List<AlertLogViewType> logs, Map<String, String> labels) {
    }
}
