package villagecompute.weatheralerts.api.filters;

import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.ext.Provider;

/**
 * Disables client and proxy caching on every response, so the dashboard and the event log always show current data.
 */
@Provider
@Priority(Priorities.HEADER_DECORATOR)
public class NoCacheFilter implements ContainerResponseFilter {

    static final String CACHE_CONTROL = "no-store, no-cache, must-revalidate, max-age=0";

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        MultivaluedMap<String, Object> headers = responseContext.getHeaders();
        headers.putSingle("Cache-Control", CACHE_CONTROL);
        headers.putSingle("Pragma", "no-cache");
        headers.putSingle("Expires", "0");
    }
}
