package com.phillippitts.providerrouter.config.logging;

import com.phillippitts.providerrouter.util.LogSanitizer;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Adds request-scoped values to Log4j2's MDC (ThreadContext) for structured logging.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from X-Request-ID header, or generated UUID</li>
 *   <li>feature: the feature segment of {@code /api/routing/features/{feature}/...} URIs</li>
 *   <li>method: HTTP method</li>
 *   <li>uri: request URI</li>
 * </ul>
 *
 * <p>The context is always cleared after the request to avoid leakage across threads.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    private static final String FEATURES_PREFIX = "/api/routing/features/";
    private static final int MAX_MDC_VALUE = 64;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                ThreadContext.put("requestId", LogSanitizer.sanitize(headerOrGenerate(http), MAX_MDC_VALUE));

                String feature = featureFromUri(http.getRequestURI());
                if (feature != null) {
                    ThreadContext.put("feature", LogSanitizer.sanitize(feature, MAX_MDC_VALUE));
                }

                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    // Package-private for tests
    static String featureFromUri(String uri) {
        if (uri == null || !uri.startsWith(FEATURES_PREFIX)) {
            return null;
        }
        String rest = uri.substring(FEATURES_PREFIX.length());
        int slash = rest.indexOf('/');
        String feature = slash >= 0 ? rest.substring(0, slash) : rest;
        return feature.isEmpty() ? null : feature;
    }

    private static String headerOrGenerate(HttpServletRequest req) {
        String v = req.getHeader(REQUEST_ID_HEADER);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
