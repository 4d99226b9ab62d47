package com.phillippitts.glasscast.config.logging;

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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags every REST call with {@code requestId}, {@code method} and {@code uri} in the Log4j2
 * ThreadContext. Calls addressed to an existing session ({@code GET} or {@code DELETE} on
 * {@code /sessions/{id}}) also carry {@code sessionId}, matching the key the session loop uses,
 * so request lines and session lines correlate in the log.
 *
 * <p>The context is cleared after every request.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    private static final Pattern SESSION_PATH = Pattern.compile("^/sessions/([^/]+)(/.*)?$");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = http.getHeader(REQUEST_ID_HEADER);
                ThreadContext.put("requestId",
                        requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId);
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
                String sessionId = sessionIdOf(http);
                if (sessionId != null) {
                    ThreadContext.put("sessionId", sessionId);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    // POST /sessions/{mode} names a mode, not a session
    static String sessionIdOf(HttpServletRequest http) {
        if ("POST".equalsIgnoreCase(http.getMethod()) || http.getRequestURI() == null) {
            return null;
        }
        Matcher m = SESSION_PATH.matcher(http.getRequestURI());
        return m.matches() ? m.group(1) : null;
    }
}
