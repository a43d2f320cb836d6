package com.phillippitts.autorecovery.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Correlates operator API calls with the recoveries they start.
 *
 * <p>Puts {@code requestId} (X-Request-ID, generated when absent), {@code operator}
 * (X-Operator-ID, optional), {@code method} and {@code uri} into the Log4j2 ThreadContext and
 * echoes the request id back on the response. Recoveries queued by the call carry these values
 * onto the worker threads through the pools' task decorator.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String OPERATOR_HEADER = "X-Operator-ID";

    static final String REQUEST_ID_KEY = "requestId";
    static final String OPERATOR_KEY = "operator";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }
        try {
            String requestId = correlate(http);
            if (response instanceof HttpServletResponse httpResponse) {
                httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String correlate(HttpServletRequest http) {
        String requestId = http.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        ThreadContext.put(REQUEST_ID_KEY, requestId);

        String operator = http.getHeader(OPERATOR_HEADER);
        if (operator != null && !operator.isBlank()) {
            ThreadContext.put(OPERATOR_KEY, operator.strip());
        }
        ThreadContext.put("method", http.getMethod());
        ThreadContext.put("uri", http.getRequestURI());
        return requestId;
    }
}
