/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class QuoteRouterApplication {
    public static void main(String[] args) {
        SpringApplication.run(QuoteRouterApplication.class, args);
    }
}
