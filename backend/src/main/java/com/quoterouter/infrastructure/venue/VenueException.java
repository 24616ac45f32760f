/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.infrastructure.venue;

public class VenueException extends RuntimeException {
    private final String venueId;
    private final VenueErrorType type;
    private final String safeMessage;
    private final boolean localRejection;

    public VenueException(String venueId, VenueErrorType type, String safeMessage, Throwable cause) {
        this(venueId, type, safeMessage, cause, false);
    }

    public VenueException(String venueId, VenueErrorType type, String safeMessage) {
        this(venueId, type, safeMessage, null, false);
    }

    private VenueException(String venueId, VenueErrorType type, String safeMessage, Throwable cause, boolean localRejection) {
        super(safeMessage, cause);
        this.venueId = venueId;
        this.type = type;
        this.safeMessage = safeMessage;
        this.localRejection = localRejection;
    }

    public static VenueException rejected(String venueId, VenueErrorType type, String safeMessage) {
        return new VenueException(venueId, type, safeMessage, null, true);
    }

    public String getVenueId() {
        return venueId;
    }

    public VenueErrorType getType() {
        return type;
    }

    public String getSafeMessage() {
        return safeMessage;
    }

    public boolean isLocalRejection() {
        return localRejection;
    }
}
