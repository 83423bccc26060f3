/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.config;

import java.time.Duration;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Telegram bot settings with startup validation.
 *
 * <p>
 * The bot token is the one credential the service cannot run without. Because of {@link Startup} combined with
 * {@link PostConstruct}, a missing token fails application boot before the poll scheduler starts.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code weather-alerts.telegram.bot-token} - bot token (from WEATHER_ALERTS_TELEGRAM_BOT_TOKEN env var)</li>
 * <li>{@code weather-alerts.telegram.base-url} - Bot API base URL (default: https://api.telegram.org)</li>
 * <li>{@code weather-alerts.telegram.timeout-seconds} - per-send timeout (default: 10)</li>
 * </ul>
 *
 * @see villagecompute.weatheralerts.integration.telegram.TelegramClient
 */
@ApplicationScoped
@Startup
public class TelegramConfig {

    private static final Logger LOG = Logger.getLogger(TelegramConfig.class);

    @ConfigProperty(
            name = "weather-alerts.telegram.bot-token")
    Optional<String> botToken;

    @ConfigProperty(
            name = "weather-alerts.telegram.base-url",
            defaultValue = "https://api.telegram.org")
    String baseUrl;

    @ConfigProperty(
            name = "weather-alerts.telegram.timeout-seconds",
            defaultValue = "10")
    int timeoutSeconds;

    /**
     * Fails startup when the bot token is missing or blank.
     *
     * @throws TelegramConfigurationException
     *             if the bot token is not configured
     */
    @PostConstruct
    public void validateConfiguration() {
        if (botToken == null || botToken.isEmpty() || botToken.get().isBlank()) {
            String errorMessage = "Telegram bot token is not configured. "
                    + "Set weather-alerts.telegram.bot-token (or the WEATHER_ALERTS_TELEGRAM_BOT_TOKEN environment variable) "
                    + "and restart the application.";
            LOG.fatal(errorMessage);
            throw new TelegramConfigurationException(errorMessage);
        }
        LOG.infof("Telegram notifications configured against %s (timeout=%ds)", baseUrl, timeoutSeconds);
    }

    public String getBotToken() {
        return botToken.orElseThrow(() -> new TelegramConfigurationException("Telegram bot token is not configured"));
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Duration getTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    /**
     * Exception thrown when Telegram configuration is invalid or incomplete.
     */
    public static class TelegramConfigurationException extends RuntimeException {

        public TelegramConfigurationException(String message) {
            super(message);
        }

        public TelegramConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
