/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.integration.logsink;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.api.types.AlertLogEntryType;
import villagecompute.weatheralerts.exceptions.LogForwardException;

/**
 * Posts alert event records to the optional logging sink (normally the dashboard's {@code /weatheralerts/log}).
 *
 * <p>
 * Disabled when {@code weather-alerts.log-sink.endpoint} is unset. The response body is never read.
 */
@ApplicationScoped
public class AlertLogForwarder {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Optional<String> endpoint;
    private final Duration timeout;

    @Inject
    public AlertLogForwarder(ObjectMapper objectMapper, @ConfigProperty(
            name = "weather-alerts.log-sink.endpoint") Optional<String> endpoint,
            @ConfigProperty(
                    name = "weather-alerts.log-sink.timeout-seconds",
                    defaultValue = "5") int timeoutSeconds) {
        this.objectMapper = objectMapper;
        this.endpoint = endpoint.filter(e -> !e.isBlank());
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    /**
     * Returns true when a sink endpoint is configured.
     */
    public boolean isEnabled() {
        return endpoint.isPresent();
    }

    /**
     * Posts one record to the sink. Does nothing when the sink is disabled.
     *
     * @param entry
     *            event record
     * @throws LogForwardException
     *             if the endpoint is not a valid URI, the request fails, or the sink responds with a non-2xx status
     */
    public void forward(AlertLogEntryType entry) {
        if (endpoint.isEmpty()) {
            return;
        }

        String payload;
        try {
            payload = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new LogForwardException("Failed to encode log record for event " + entry.event(), e);
        }

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder().uri(URI.create(endpoint.get()))
                    .header("Content-Type", "application/json").timeout(timeout)
                    .POST(HttpRequest.BodyPublishers.ofString(payload)).build();
        } catch (IllegalArgumentException e) {
            throw new LogForwardException("Invalid log sink endpoint: " + endpoint.get(), e);
        }

        HttpResponse<Void> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
        } catch (IOException e) {
            throw new LogForwardException("Log sink request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LogForwardException("Log sink request interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new LogForwardException("Log sink returned status " + response.statusCode());
        }
    }
}
