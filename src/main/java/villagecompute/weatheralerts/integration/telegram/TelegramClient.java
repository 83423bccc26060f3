/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.integration.telegram;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.config.TelegramConfig;
import villagecompute.weatheralerts.exceptions.NotificationException;

/**
 * HTTP client for the Telegram Bot API {@code sendMessage} method.
 *
 * <p>
 * One call sends one plain-text message to one chat. There is no retry or queueing: a failed send raises
 * {@link NotificationException} and the caller decides what to do with it.
 *
 * <p>
 * The bot token is part of the request path, so it never appears in log messages or exception text produced here.
 *
 * @see <a href="https://core.telegram.org/bots/api#sendmessage">Telegram Bot API: sendMessage</a>
 */
@ApplicationScoped
public class TelegramClient {

    private static final Logger LOG = Logger.getLogger(TelegramClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String botToken;
    private final Duration timeout;

    @Inject
    public TelegramClient(TelegramConfig config, ObjectMapper objectMapper) {
        this(config.getBaseUrl(), config.getBotToken(), config.getTimeout(), objectMapper);
    }

    TelegramClient(String baseUrl, String botToken, Duration timeout, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.botToken = botToken;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    /**
     * Sends a text message to a chat.
     *
     * @param chatId
     *            destination chat id
     * @param text
     *            message text
     * @throws NotificationException
     *             if the base URL is invalid, the request fails or times out, or Telegram responds with a non-2xx
     *             status
     */
    public void sendMessage(String chatId, String text) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(Map.of("chat_id", chatId, "text", text));
        } catch (JsonProcessingException e) {
            throw new NotificationException("Failed to encode message for chat " + chatId, e);
        }

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder().uri(URI.create(baseUrl + "/bot" + botToken + "/sendMessage"))
                    .header("Content-Type", "application/json").timeout(timeout)
                    .POST(HttpRequest.BodyPublishers.ofString(payload)).build();
        } catch (IllegalArgumentException e) {
            // The message text of URI errors echoes the input, which contains the token
            throw new NotificationException("Invalid Telegram base URL " + baseUrl + " for chat " + chatId);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new NotificationException("Telegram request failed for chat " + chatId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException("Telegram request interrupted for chat " + chatId, e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new NotificationException(
                    "Telegram returned status " + response.statusCode() + " for chat " + chatId);
        }

        LOG.debugf("Telegram accepted message for chat %s", chatId);
    }
}
