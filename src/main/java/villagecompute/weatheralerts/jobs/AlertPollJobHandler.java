/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.jobs;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.api.types.AlertType;
import villagecompute.weatheralerts.api.types.ChangeSetType;
import villagecompute.weatheralerts.api.types.TrackedAlertType;
import villagecompute.weatheralerts.observability.LoggingConfig;
import villagecompute.weatheralerts.services.AlertDiffService;
import villagecompute.weatheralerts.services.AlertNotificationService;
import villagecompute.weatheralerts.services.AlertSourceService;
import villagecompute.weatheralerts.services.AlertStateStore;
import villagecompute.weatheralerts.services.DevInjectionService;
import villagecompute.weatheralerts.services.ZoneRoutingService;

/**
 * Runs one poll cycle: fetch, diff against the saved snapshot, notify, persist.
 *
 * <p>
 * <b>Cycle:</b>
 * <ol>
 * <li>Load the previous snapshot from {@link AlertStateStore}</li>
 * <li>Collect current alerts (injected alerts in development mode, otherwise the live feed)</li>
 * <li>Diff current against previous via {@link AlertDiffService}</li>
 * <li>On the transition to zero alerts, broadcast the all-clear once per destination; otherwise notify every new or
 * changed alert</li>
 * <li>Replace the snapshot with the current alerts (empty after an all-clear)</li>
 * </ol>
 *
 * <p>
 * The snapshot is replaced wholesale even when some sends failed. A failed send is therefore not retried in the next
 * cycle unless the alert's description changes.
 *
 * <p>
 * <b>Telemetry:</b> span {@code job.alert_poll} with attributes {@code alerts_current}, {@code alerts_notified} and
 * {@code all_clear}; timer {@code weather_alerts.poll.duration}.
 */
@ApplicationScoped
public class AlertPollJobHandler {

    private static final Logger LOG = Logger.getLogger(AlertPollJobHandler.class);

    @Inject
    AlertStateStore stateStore;

    @Inject
    AlertSourceService alertSource;

    @Inject
    DevInjectionService devInjection;

    @Inject
    AlertDiffService diffService;

    @Inject
    AlertNotificationService notificationService;

    @Inject
    ZoneRoutingService zoneRouting;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    private final AtomicLong cycleCounter = new AtomicLong();

    /**
     * Executes one poll cycle.
     *
     * @return summary of what the cycle did
     */
    public CycleResult runCycle() {
        long cycleId = cycleCounter.incrementAndGet();
        Span span = tracer.spanBuilder("job.alert_poll").setAttribute("cycle.id", cycleId).startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setCycleId(cycleId);

            List<TrackedAlertType> previous = stateStore.load();
            List<AlertType> current = devInjection.isEnabled()
                    ? devInjection.injectedAlerts()
                    : alertSource.fetchAllActive();
            span.setAttribute("alerts_current", current.size());

            ChangeSetType changes = diffService.diff(current, previous);
            CycleResult result;

            if (changes.allClear()) {
                LOG.info("All alerts cleared, broadcasting all-clear");
                List<TrackedAlertType> targets = diffService.allClearTargets(previous,
                        zoneRouting.defaultDestination());
                int delivered = notificationService.dispatchAllClear(targets);
                stateStore.save(List.of());
                result = new CycleResult(0, delivered, true);
            } else {
                if (changes.toNotify().isEmpty()) {
                    LOG.info("No new or changed alerts.");
                }
                int delivered = 0;
                for (AlertType alert : changes.toNotify()) {
                    if (notificationService.dispatch(alert)) {
                        delivered++;
                    }
                }
                stateStore.save(current.stream().map(AlertType::toTracked).toList());
                result = new CycleResult(current.size(), delivered, false);
            }

            span.setAttribute("alerts_notified", result.notified());
            span.setAttribute("all_clear", result.allClear());
            LOG.infof("Poll cycle %d completed: %d active, %d notified%s", cycleId, result.active(), result.notified(),
                    result.allClear() ? " (all clear)" : "");
            return result;

        } catch (RuntimeException e) {
            span.recordException(e);
            LOG.errorf(e, "Poll cycle %d failed", cycleId);
            throw e;
        } finally {
            sample.stop(Timer.builder("weather_alerts.poll.duration").register(meterRegistry));
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Outcome of one poll cycle.
     *
     * @param active
     *            number of active alerts after the cycle
     * @param notified
     *            number of messages delivered
     * @param allClear
     *            whether the cycle broadcast the all-clear
     */
    public record CycleResult(int active, int notified, boolean allClear) {
    }
}
