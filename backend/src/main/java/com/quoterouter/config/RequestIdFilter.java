/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every API call with a request id. The id is echoed back, written to the quote decision audit
 * row and carried onto the fan-out and venue-call threads, so one quote request can be followed
 * through every venue it reached.
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {
    public static final String HEADER = "X-Request-Id";
    static final String CORRELATION_HEADER = "X-Correlation-Id";
    public static final String MDC_KEY = "requestId";

    // ids end up in log lines and the audit table
    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = accepted(request.getHeader(HEADER));
        if (requestId == null) requestId = accepted(request.getHeader(CORRELATION_HEADER));
        if (requestId == null) requestId = UUID.randomUUID().toString();

        MDC.put(MDC_KEY, requestId);
        response.setHeader(HEADER, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    static String accepted(String candidate) {
        if (candidate == null) return null;
        String id = candidate.trim();
        return ACCEPTED_ID.matcher(id).matches() ? id : null;
    }

    public static TaskDecorator requestIdPropagation() {
        return task -> {
            String requestId = MDC.get(MDC_KEY);
            if (requestId == null) return task;
            return () -> {
                String previous = MDC.get(MDC_KEY);
                MDC.put(MDC_KEY, requestId);
                try {
                    task.run();
                } finally {
                    if (previous == null) MDC.remove(MDC_KEY);
                    else MDC.put(MDC_KEY, previous);
                }
            };
        };
    }
}
