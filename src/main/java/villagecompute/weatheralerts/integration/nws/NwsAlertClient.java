/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.integration.nws;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.exceptions.AlertFetchException;

/**
 * HTTP client for the National Weather Service active-alerts endpoint.
 *
 * <p>
 * Returns the raw GeoJSON features for a zone; filtering and mapping to {@code AlertType} happen in
 * {@link villagecompute.weatheralerts.services.AlertSourceService}. The feed is treated as untrusted: callers read every
 * field defensively.
 *
 * <h2>API Details</h2>
 * <ul>
 * <li>Endpoint: {@code GET /alerts/active?zone={zone}}</li>
 * <li>No authentication required</li>
 * <li>REQUIRES User-Agent header with contact info</li>
 * <li>Response: GeoJSON FeatureCollection, {@code features[].properties.event|onset|ends|effective|expires|description}</li>
 * </ul>
 *
 * @see <a href="https://www.weather.gov/documentation/services-web-api">NWS API Documentation</a>
 */
@ApplicationScoped
public class NwsAlertClient {

    private static final Logger LOG = Logger.getLogger(NwsAlertClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String userAgent;
    private final Duration timeout;

    @Inject
    public NwsAlertClient(ObjectMapper objectMapper, @ConfigProperty(
            name = "weather-alerts.feed.base-url",
            defaultValue = "https://api.weather.gov") String baseUrl,
            @ConfigProperty(
                    name = "weather-alerts.feed.user-agent",
                    defaultValue = "WeatherAlertsBot/1.0 (no-contact@example.com)") String userAgent,
            @ConfigProperty(
                    name = "weather-alerts.feed.timeout-seconds",
                    defaultValue = "10") int timeoutSeconds) {
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.userAgent = userAgent;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.httpClient = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(5)).build();
    }

    /**
     * Fetches active alert features for one zone.
     *
     * @param zone
     *            NWS zone code (e.g., "NCC001")
     * @return GeoJSON features (empty if the zone has no active alerts)
     * @throws AlertFetchException
     *             if the URL is invalid, the request fails or times out, the status is not 200, or the body is not
     *             JSON
     */
    public List<JsonNode> fetchActiveFeatures(String zone) {
        String url = String.format("%s/alerts/active?zone=%s", baseUrl, URLEncoder.encode(zone, StandardCharsets.UTF_8));
        LOG.debugf("Fetching NWS active alerts for zone %s", zone);

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder().uri(URI.create(url)).header("User-Agent", userAgent)
                    .header("Accept", "application/geo+json").header("Cache-Control", "no-cache").timeout(timeout)
                    .GET().build();
        } catch (IllegalArgumentException e) {
            throw new AlertFetchException("Invalid NWS request URL " + url, e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new AlertFetchException("NWS request failed for zone " + zone, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlertFetchException("NWS request interrupted for zone " + zone, e);
        }

        if (response.statusCode() != 200) {
            throw new AlertFetchException("NWS API returned status " + response.statusCode() + " for zone " + zone);
        }

        JsonNode body;
        try {
            body = objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new AlertFetchException("NWS response for zone " + zone + " is not valid JSON", e);
        }

        List<JsonNode> features = new ArrayList<>();
        JsonNode featuresNode = body == null ? null : body.path("features");
        if (featuresNode != null && featuresNode.isArray()) {
            featuresNode.forEach(features::add);
        }

        LOG.debugf("NWS returned %d features for zone %s", features.size(), zone);
        return features;
    }
}
