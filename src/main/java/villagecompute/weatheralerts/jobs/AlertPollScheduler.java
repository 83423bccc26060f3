/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.jobs;

import java.util.concurrent.atomic.AtomicReference;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Drives the alert poll loop on a fixed interval.
 *
 * <p>
 * Fires every {@code weather-alerts.poll-interval} (default 5 minutes), starting right after boot. Cycles never
 * overlap: Quarkus skips a trigger while the previous execution is still running, and the loop state guards against
 * manual triggers racing the schedule. Any exception from a cycle is logged and the loop returns to {@link
 * PollLoopState#IDLE}, so the next interval still runs.
 *
 * @see AlertPollJobHandler
 */
@ApplicationScoped
public class AlertPollScheduler {

    private static final Logger LOG = Logger.getLogger(AlertPollScheduler.class);

    @Inject
    AlertPollJobHandler jobHandler;

    @Inject
    MeterRegistry meterRegistry;

    private final AtomicReference<PollLoopState> state = new AtomicReference<>(PollLoopState.IDLE);

    @Scheduled(
            identity = "weather-alert-poll",
            every = "${weather-alerts.poll-interval:300s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void poll() {
        runOnce();
    }

    /**
     * Runs a single cycle unless one is already running.
     *
     * @return true when a cycle was started
     */
    public boolean runOnce() {
        if (!state.compareAndSet(PollLoopState.IDLE, PollLoopState.RUNNING)) {
            LOG.warn("Poll cycle still running, skipping this trigger");
            return false;
        }

        try {
            jobHandler.runCycle();
            incrementCounter("weather_alerts.poll.total", "status", "success");
        } catch (Exception e) {
            incrementCounter("weather_alerts.poll.total", "status", "failure");
            LOG.errorf(e, "Unhandled exception in poll cycle");
        } finally {
            state.set(PollLoopState.IDLE);
        }
        return true;
    }

    public PollLoopState getState() {
        return state.get();
    }

    private void incrementCounter(String name, String... tags) {
        Counter.builder(name).tags(tags).register(meterRegistry).increment();
    }
}
