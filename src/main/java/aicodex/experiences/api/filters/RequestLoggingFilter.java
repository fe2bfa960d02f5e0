package aicodex.experiences.api.filters;

import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import aicodex.experiences.observability.LoggingConfig;

/**
 * JAX-RS filter that scopes MDC fields to one request and writes an access log line.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Request: copy trace/span ids into MDC, set {@code request_origin} to "METHOD /path", remember the start time</li>
 * <li>Resource runs; {@code UserService.resolveCaller} adds {@code user_id}</li>
 * <li>Response: log method, path, status and duration, then clear MDC</li>
 * </ol>
 *
 * <p>
 * Runs before authentication so that rejected requests are logged too.
 */
@Provider
@Priority(Priorities.AUTHENTICATION - 100)
public class RequestLoggingFilter implements ContainerRequestFilter, ContainerResponseFilter {

    private static final Logger LOG = Logger.getLogger(RequestLoggingFilter.class);

    private static final String START_TIME_PROPERTY = "aicodex.request.startNanos";

    @Override
    public void filter(ContainerRequestContext requestContext) {
        requestContext.setProperty(START_TIME_PROPERTY, System.nanoTime());
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setRequestOrigin(requestContext.getMethod() + " " + requestContext.getUriInfo().getPath());
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        try {
            Object start = requestContext.getProperty(START_TIME_PROPERTY);
            long durationMs = start instanceof Long startNanos ? (System.nanoTime() - startNanos) / 1_000_000 : -1;
            int status = responseContext.getStatus();
            if (status >= 500) {
                LOG.warnf("%s %s -> %d (%d ms)", requestContext.getMethod(), requestContext.getUriInfo().getPath(),
                        status, durationMs);
            } else {
                LOG.infof("%s %s -> %d (%d ms)", requestContext.getMethod(), requestContext.getUriInfo().getPath(),
                        status, durationMs);
            }
        } finally {
            LoggingConfig.clearMDC();
        }
    }
}
