/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application;

public class ExecutionRejectedException extends RuntimeException {
    private final ExecutionErrorType type;

    public ExecutionRejectedException(ExecutionErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public ExecutionErrorType getType() {
        return type;
    }
}
