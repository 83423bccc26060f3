/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.integration.telegram;

import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.weatheralerts.WireMockTestBase;
import villagecompute.weatheralerts.exceptions.NotificationException;

/**
 * Tests for {@link TelegramClient} against a stubbed Bot API.
 */
class TelegramClientTest extends WireMockTestBase {

    private static final String TOKEN = "123456:secret-token";

    private TelegramClient client;

    @BeforeEach
    @Override
    protected void setUp() {
        super.setUp();
        client = new TelegramClient(baseUrl(), TOKEN, Duration.ofSeconds(5), new ObjectMapper());
    }

    @Test
    void testSendMessage_postsChatIdAndText() {
        stubTelegramSendMessage(TOKEN, 200);

        client.sendMessage("-100123", "Detailed alert for Wind Advisory.");

        wireMockServer.verify(postRequestedFor(urlPathEqualTo("/bot" + TOKEN + "/sendMessage")).withRequestBody(
                equalToJson("{\"chat_id\":\"-100123\",\"text\":\"Detailed alert for Wind Advisory.\"}")));
    }

    @Test
    void testSendMessage_rejectedByTelegram() {
        stubTelegramSendMessage(TOKEN, 400);

        NotificationException e = assertThrows(NotificationException.class,
                () -> client.sendMessage("-100123", "hello"));
        assertTrue(e.getMessage().contains("400"));
        assertFalse(e.getMessage().contains(TOKEN), "bot token must not leak into error messages");
    }

    @Test
    void testSendMessage_unreachable() {
        TelegramClient unreachable = new TelegramClient("http://localhost:1", TOKEN, Duration.ofSeconds(1),
                new ObjectMapper());

        NotificationException e = assertThrows(NotificationException.class,
                () -> unreachable.sendMessage("-100123", "hello"));
        assertFalse(e.getMessage().contains(TOKEN));
    }

    @Test
    void testSendMessage_invalidBaseUrl() {
        TelegramClient misconfigured = new TelegramClient("api.telegram.org", TOKEN, Duration.ofSeconds(1),
                new ObjectMapper());

        NotificationException e = assertThrows(NotificationException.class,
                () -> misconfigured.sendMessage("-100123", "hello"));
        assertFalse(e.getMessage().contains(TOKEN));
    }
}
