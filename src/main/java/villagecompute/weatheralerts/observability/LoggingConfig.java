package villagecompute.weatheralerts.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching log entries with poll-cycle context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier of the current poll cycle</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code cycle_id} - Monotonic poll-cycle counter since startup</li>
 * <li>{@code zone} - NWS zone being fetched (only while a zone fetch is in progress)</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the poll cycle:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setCycleId(cycleId);
 * ...
 * LoggingConfig.clearMDC();
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Each cycle must clear MDC
 * when it finishes, since scheduler threads are reused.
 */
public final class LoggingConfig {

    /**
     * OpenTelemetry trace identifier (hexadecimal string, 32 characters).
     */
    public static final String MDC_TRACE_ID = "trace_id";

    /**
     * OpenTelemetry span identifier (hexadecimal string, 16 characters).
     */
    public static final String MDC_SPAN_ID = "span_id";

    /**
     * Poll-cycle sequence number (Long as String).
     */
    public static final String MDC_CYCLE_ID = "cycle_id";

    /**
     * NWS zone code (e.g., "NCC001").
     */
    public static final String MDC_ZONE = "zone";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. Without an active span the fields are
     * set to empty strings.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setCycleId(long cycleId) {
        MDC.put(MDC_CYCLE_ID, Long.toString(cycleId));
    }

    /**
     * Sets the zone currently being fetched.
     *
     * @param zone
     *            NWS zone code
     */
    public static void setZone(String zone) {
        if (zone != null) {
            MDC.put(MDC_ZONE, zone);
        }
    }

    public static void clearZone() {
        MDC.remove(MDC_ZONE);
    }

    /**
     * Clears all observability-related MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_CYCLE_ID);
        MDC.remove(MDC_ZONE);
    }
}
