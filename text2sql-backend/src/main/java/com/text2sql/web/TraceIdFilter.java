package com.text2sql.web;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every log line of a request with its trace id and, when sent, its customer id.
 *
 * <p>The trace id comes from {@code X-Request-Id} or is generated, and is echoed on the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter implements Filter {

    static final String TRACE_ID_HEADER = "X-Request-Id";
    static final String CUSTOMER_ID_HEADER = "X-Customer-Id";
    static final String MDC_TRACE_ID = "trace_id";
    static final String MDC_CUSTOMER_ID = "customer_id";

    private static final int MAX_HEADER_VALUE_CHARS = 128;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (request instanceof HttpServletRequest http) {
            String traceId = headerValue(http, TRACE_ID_HEADER);
            if (traceId == null) {
                traceId = UUID.randomUUID().toString();
            }
            MDC.put(MDC_TRACE_ID, traceId);

            String customerId = headerValue(http, CUSTOMER_ID_HEADER);
            if (customerId != null) {
                MDC.put(MDC_CUSTOMER_ID, customerId);
            }

            if (response instanceof HttpServletResponse httpResponse) {
                httpResponse.setHeader(TRACE_ID_HEADER, traceId);
            }
        }

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TRACE_ID);
            MDC.remove(MDC_CUSTOMER_ID);
        }
    }

    private static String headerValue(HttpServletRequest request, String name) {
        String value = request.getHeader(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        value = value.trim();
        return value.length() <= MAX_HEADER_VALUE_CHARS ? value : value.substring(0, MAX_HEADER_VALUE_CHARS);
    }
}
