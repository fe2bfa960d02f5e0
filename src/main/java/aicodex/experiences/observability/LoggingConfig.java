package aicodex.experiences.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

import java.util.UUID;

/**
 * MDC keys attached to every log line of a request: {@code trace_id}, {@code span_id}, {@code user_id} (once the
 * caller is resolved) and {@code request_origin} ("METHOD /path").
 *
 * <p>
 * {@link aicodex.experiences.api.filters.RequestLoggingFilter} fills the request keys on the way in and calls
 * {@link #clearMDC()} on the way out; MDC is thread-local, so a missed clear leaks into the next request.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_USER_ID = "user_id";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
    }

    /**
     * Copies the ids of the active OpenTelemetry span into MDC, or empty strings outside a span.
     */
    public static void enrichWithTraceContext() {
        SpanContext span = Span.current().getSpanContext();
        boolean valid = span.isValid();
        MDC.put(MDC_TRACE_ID, valid ? span.getTraceId() : "");
        MDC.put(MDC_SPAN_ID, valid ? span.getSpanId() : "");
    }

    public static void setUserId(UUID userId) {
        putIfPresent(MDC_USER_ID, userId != null ? userId.toString() : null);
    }

    public static void setRequestOrigin(String requestOrigin) {
        putIfPresent(MDC_REQUEST_ORIGIN, requestOrigin);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
