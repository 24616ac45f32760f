/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application;

public class InvalidSwapRequestException extends IllegalArgumentException {
    public InvalidSwapRequestException(String message) {
        super(message);
    }
}
