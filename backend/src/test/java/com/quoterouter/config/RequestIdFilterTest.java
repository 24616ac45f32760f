/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.config;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class RequestIdFilterTest {
    private final RequestIdFilter filter = new RequestIdFilter();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void callerIdIsUsedAndEchoed() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/quotes");
        request.addHeader(RequestIdFilter.HEADER, "desk-7:quote-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, chainRecording(seen));

        assertEquals("desk-7:quote-42", seen.get());
        assertEquals("desk-7:quote-42", response.getHeader(RequestIdFilter.HEADER));
        assertNull(MDC.get(RequestIdFilter.MDC_KEY));
    }

    @Test
    void correlationHeaderIsFallback() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/venues");
        request.addHeader(RequestIdFilter.CORRELATION_HEADER, "trace-1");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, chainRecording(new AtomicReference<>()));

        assertEquals("trace-1", response.getHeader(RequestIdFilter.HEADER));
    }

    @Test
    void unsafeIdIsReplaced() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/venues");
        request.addHeader(RequestIdFilter.HEADER, "abc\nforged log line");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, chainRecording(new AtomicReference<>()));

        String issued = response.getHeader(RequestIdFilter.HEADER);
        assertNotNull(issued);
        assertNotEquals("abc\nforged log line", issued);
        assertEquals(36, issued.length());
    }

    @Test
    void overlongIdIsReplaced() {
        assertNull(RequestIdFilter.accepted("x".repeat(65)));
        assertEquals("x".repeat(64), RequestIdFilter.accepted(" " + "x".repeat(64) + " "));
    }

    @Test
    void poolThreadsCarryTheSubmittersId() throws Exception {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setTaskDecorator(RequestIdFilter.requestIdPropagation());
        executor.initialize();
        try {
            MDC.put(RequestIdFilter.MDC_KEY, "req-1");
            Future<String> tagged = executor.submit(() -> MDC.get(RequestIdFilter.MDC_KEY));
            assertEquals("req-1", tagged.get(1, TimeUnit.SECONDS));

            MDC.remove(RequestIdFilter.MDC_KEY);
            Future<String> untagged = executor.submit(() -> MDC.get(RequestIdFilter.MDC_KEY));
            assertNull(untagged.get(1, TimeUnit.SECONDS));
        } finally {
            executor.shutdown();
        }
    }

    private static FilterChain chainRecording(AtomicReference<String> seen) {
        return (req, res) -> seen.set(MDC.get(RequestIdFilter.MDC_KEY));
    }
}
