package com.phillippitts.vani.config.logging;

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
 * Puts {@code requestId} (from {@code X-Request-ID} or generated) and the HTTP method and URI into
 * the Log4j2 ThreadContext for each REST call, so a turn's log lines can be traced back to the
 * request that caused it. The context is cleared once the request completes.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                ThreadContext.put("requestId", requestId(http));
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String requestId(HttpServletRequest request) {
        String header = request.getHeader(REQUEST_ID_HEADER);
        return (header == null || header.isBlank()) ? UUID.randomUUID().toString() : header;
    }
}
