/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.infrastructure.venue;

import com.quoterouter.domain.model.Quote;

/**
 * Uniform quote contract for a single venue. Implementations make exactly one outbound call per
 * invocation and never retry; retries, timeouts and circuit breaking live in the resilience layer.
 */
public interface VenueQuoteAdapter {
    String venueId();

    /**
     * @throws VenueException with {@link VenueErrorType#UNSUPPORTED} when the pair or chain is not served,
     *                        or the matching transient/upstream type when the call fails
     */
    Quote quote(QuoteCommand command);
}
