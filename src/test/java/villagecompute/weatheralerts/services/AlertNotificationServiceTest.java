/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.services;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static villagecompute.weatheralerts.TestFixtures.alert;
import static villagecompute.weatheralerts.TestFixtures.tracked;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.weatheralerts.api.types.AlertLogEntryType;
import villagecompute.weatheralerts.api.types.AlertType;
import villagecompute.weatheralerts.exceptions.LogForwardException;
import villagecompute.weatheralerts.exceptions.NotificationException;
import villagecompute.weatheralerts.integration.logsink.AlertLogForwarder;
import villagecompute.weatheralerts.integration.telegram.TelegramClient;

/**
 * Unit tests for {@link AlertNotificationService}.
 */
class AlertNotificationServiceTest {

    @Mock
    TelegramClient telegramClient;

    @Mock
    AlertLogForwarder logForwarder;

    @Mock
    ZoneRoutingService zoneRouting;

    @InjectMocks
    AlertNotificationService notificationService;

    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);

        meterRegistry = new SimpleMeterRegistry();
        notificationService.meterRegistry = meterRegistry;
        notificationService.maxWords = 150;
        notificationService.uppercase = false;

        when(zoneRouting.defaultDestination()).thenReturn("-999");
        when(logForwarder.isEnabled()).thenReturn(true);
    }

    @Test
    void testDispatch_formatsAndSends() {
        AlertType alert = new AlertType("A", "NCC001", "Wind Advisory", "* WHAT...Winds 25 mph.", null, null, "-100");

        assertTrue(notificationService.dispatch(alert));

        verify(telegramClient).sendMessage("-100", "Detailed alert for Wind Advisory. *WHAT: Winds 25 miles per hour.");
    }

    @Test
    void testDispatch_uppercase() {
        notificationService.uppercase = true;

        notificationService.dispatch(alert("A", "NCC001", "Heavy snow.", "-100"));

        verify(telegramClient).sendMessage("-100", "DETAILED ALERT FOR WINTER STORM WARNING. HEAVY SNOW.");
    }

    @Test
    void testDispatch_forwardsLogRecord() {
        notificationService.dispatch(alert("A", "NCC001", "Heavy snow.", "-100"));
        notificationService.dispatch(alert("inject_-100_Test", null, "Injected.", "-100"));

        ArgumentCaptor<AlertLogEntryType> captor = ArgumentCaptor.forClass(AlertLogEntryType.class);
        verify(logForwarder, times(2)).forward(captor.capture());
        assertEquals("NCC001", captor.getAllValues().get(0).county());
        assertEquals("Heavy snow.", captor.getAllValues().get(0).description());
        assertEquals("DEV", captor.getAllValues().get(1).county());
    }

    @Test
    void testDispatch_sendFailureIsContained() {
        doThrow(new NotificationException("Telegram returned status 400")).when(telegramClient)
                .sendMessage(eq("-100"), anyString());

        assertFalse(notificationService.dispatch(alert("A", "NCC001", "x", "-100")));
        assertEquals(1.0, meterRegistry
                .counter("weather_alerts.notifications.total", "kind", "alert", "status", "failure").count());
    }

    @Test
    void testDispatch_logSinkFailureIsSwallowed() {
        doThrow(new LogForwardException("Log sink returned status 500")).when(logForwarder).forward(any());

        assertTrue(notificationService.dispatch(alert("A", "NCC001", "x", "-100")));
    }

    @Test
    void testDispatch_misconfiguredLogSinkDoesNotStopLaterSends() {
        notificationService.logForwarder = new AlertLogForwarder(new ObjectMapper(),
                Optional.of("localhost:8080/weatheralerts/log"), 5);

        assertDoesNotThrow(() -> notificationService.dispatch(alert("A", "NCC001", "x", "-100")));
        assertDoesNotThrow(() -> notificationService.dispatch(alert("B", "NCC001", "y", "-100")));

        verify(telegramClient, times(2)).sendMessage(eq("-100"), anyString());
    }

    @Test
    void testDispatch_logSinkDisabled() {
        when(logForwarder.isEnabled()).thenReturn(false);

        notificationService.dispatch(alert("A", "NCC001", "x", "-100"));

        verify(logForwarder, never()).forward(any());
    }

    @Test
    void testDispatchAllClear_oncePerTarget() {
        int delivered = notificationService.dispatchAllClear(
                List.of(tracked("A", "NCC001", "x", "-100"), tracked("C", null, "z", "-200")));

        assertEquals(2, delivered);
        verify(telegramClient).sendMessage("-100", AlertNotificationService.ALL_CLEAR_MESSAGE);
        verify(telegramClient).sendMessage("-200", AlertNotificationService.ALL_CLEAR_MESSAGE);

        ArgumentCaptor<AlertLogEntryType> captor = ArgumentCaptor.forClass(AlertLogEntryType.class);
        verify(logForwarder, times(2)).forward(captor.capture());
        assertEquals("NCC001", captor.getAllValues().get(0).county());
        assertEquals("ALL CLEAR", captor.getAllValues().get(0).event());
        assertEquals("", captor.getAllValues().get(0).description());
        assertEquals("ALL", captor.getAllValues().get(1).county());
    }

    @Test
    void testDispatchAllClear_continuesAfterFailure() {
        doThrow(new NotificationException("timeout")).when(telegramClient).sendMessage(eq("-100"), anyString());

        int delivered = notificationService.dispatchAllClear(
                List.of(tracked("A", "NCC001", "x", "-100"), tracked("B", "NCC037", "y", "-200")));

        assertEquals(1, delivered);
        verify(telegramClient).sendMessage("-200", AlertNotificationService.ALL_CLEAR_MESSAGE);
    }

    @Test
    void testDispatchAllClear_uppercase() {
        notificationService.uppercase = true;

        notificationService.dispatchAllClear(List.of(tracked("A", "NCC001", "x", "-100")));

        verify(telegramClient).sendMessage("-100",
                "ALL CLEAR: THE NATIONAL WEATHER SERVICE HAS CLEARED ALL ALERTS FOR THIS AREA.");
    }
}
