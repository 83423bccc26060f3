/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Unit tests for {@link AlertPollScheduler}.
 */
class AlertPollSchedulerTest {

    @Mock
    AlertPollJobHandler jobHandler;

    @InjectMocks
    AlertPollScheduler scheduler;

    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);

        meterRegistry = new SimpleMeterRegistry();
        scheduler.meterRegistry = meterRegistry;
    }

    @Test
    void testRunOnce_returnsToIdle() {
        assertTrue(scheduler.runOnce());

        verify(jobHandler).runCycle();
        assertEquals(PollLoopState.IDLE, scheduler.getState());
    }

    @Test
    void testRunOnce_exceptionDoesNotStopLoop() {
        when(jobHandler.runCycle()).thenThrow(new IllegalStateException("boom"))
                .thenReturn(new AlertPollJobHandler.CycleResult(0, 0, false));

        assertTrue(scheduler.runOnce());
        assertEquals(PollLoopState.IDLE, scheduler.getState());
        assertTrue(scheduler.runOnce());

        verify(jobHandler, times(2)).runCycle();
        assertEquals(1.0, meterRegistry.counter("weather_alerts.poll.total", "status", "failure").count());
        assertEquals(1.0, meterRegistry.counter("weather_alerts.poll.total", "status", "success").count());
    }

    @Test
    void testRunOnce_skipsWhileRunning() {
        AtomicBoolean nestedStarted = new AtomicBoolean(true);
        when(jobHandler.runCycle()).thenAnswer(inv -> {
            assertEquals(PollLoopState.RUNNING, scheduler.getState());
            nestedStarted.set(scheduler.runOnce());
            return new AlertPollJobHandler.CycleResult(0, 0, false);
        });

        scheduler.runOnce();

        assertFalse(nestedStarted.get());
        verify(jobHandler, times(1)).runCycle();
    }

    @Test
    void testPoll_delegatesToRunOnce() {
        scheduler.poll();

        verify(jobHandler).runCycle();
        assertEquals(PollLoopState.IDLE, scheduler.getState());
    }
}
