/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class QuotingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // One task per eligible venue per quote request. Direct hand-off (queue capacity 0) so a venue
    // call never waits behind another venue's call.
    @Bean(name = "quoteFanOutExecutor")
    public ThreadPoolTaskExecutor quoteFanOutExecutor() {
        return handOffExecutor("quote-fanout-", 256);
    }

    @Bean(name = "venueCallExecutor")
    public ThreadPoolTaskExecutor venueCallExecutor() {
        return handOffExecutor("venue-call-", 256);
    }

    private static ThreadPoolTaskExecutor handOffExecutor(String prefix, int maxPoolSize) {
        int processors = Runtime.getRuntime().availableProcessors();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(8, processors));
        executor.setMaxPoolSize(Math.max(maxPoolSize, processors * 4));
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(prefix);
        executor.setTaskDecorator(RequestIdFilter.requestIdPropagation());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }
}
