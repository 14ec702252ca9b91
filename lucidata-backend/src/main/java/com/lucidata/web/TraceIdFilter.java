package com.lucidata.web;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags each request with a trace id (X-Request-Id, generated when absent) and logs its completion.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter implements Filter {

    static final String TRACE_ID_HEADER = "X-Request-Id";
    static final String MDC_TRACE_ID = "trace_id";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest httpServletRequest)) {
            chain.doFilter(request, response);
            return;
        }

        String traceId = httpServletRequest.getHeader(TRACE_ID_HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString();
        }
        MDC.put(MDC_TRACE_ID, traceId);
        if (response instanceof HttpServletResponse httpServletResponse) {
            httpServletResponse.setHeader(TRACE_ID_HEADER, traceId);
        }

        long startTime = System.currentTimeMillis();
        try {
            chain.doFilter(request, response);
        } finally {
            int status = response instanceof HttpServletResponse httpServletResponse
                    ? httpServletResponse.getStatus()
                    : 0;
            log.info("{} {} -> {} ({} ms)", httpServletRequest.getMethod(), httpServletRequest.getRequestURI(),
                    status, System.currentTimeMillis() - startTime);
            MDC.remove(MDC_TRACE_ID);
        }
    }
}
