package com.lumis.invoiceingest.config;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Logs every HTTP request and tags all log lines written while serving it with a request id,
 * so the fetch, extraction and persistence steps of one submission can be followed together.
 */
@Component
@Order(1)
public class RequestLoggingFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

    static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String MDC_KEY = "requestId";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        String requestId = httpRequest.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString().substring(0, 8);
        }
        MDC.put(MDC_KEY, requestId);
        httpResponse.setHeader(REQUEST_ID_HEADER, requestId);

        String method = httpRequest.getMethod();
        String uri = httpRequest.getRequestURI();
        log.info("Incoming request [{}]: {} {}", requestId, method, uri);
        long startTime = System.currentTimeMillis();

        try {
            chain.doFilter(request, response);
            log.info("Completed [{}] {} {} - status: {} - {}ms",
                    requestId, method, uri, httpResponse.getStatus(), System.currentTimeMillis() - startTime);
        } catch (IOException | ServletException | RuntimeException e) {
            log.error("Error processing [{}] {} {}: {}", requestId, method, uri, e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(MDC_KEY);
        }
    }
}
