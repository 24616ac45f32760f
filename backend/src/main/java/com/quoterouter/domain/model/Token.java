/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.domain.model;

import java.util.Locale;

public record Token(
        String address,
        String chainId,
        int decimals,
        String symbol
) {
    public Token {
        if (address == null || address.isBlank()) throw new IllegalArgumentException("token address is required");
        if (chainId == null || chainId.isBlank()) throw new IllegalArgumentException("token chainId is required");
        if (decimals < 0 || decimals > 36) throw new IllegalArgumentException("token decimals out of range: " + decimals);
        address = address.trim();
        chainId = chainId.trim();
    }

    public boolean sameAs(Token other) {
        return other != null
                && chainId.equals(other.chainId)
                && normalizedAddress().equals(other.normalizedAddress());
    }

    public String normalizedAddress() {
        return normalize(address);
    }

    // EVM addresses are case-insensitive (checksum casing only); other chains are compared verbatim.
    public static String normalize(String address) {
        String a = address.trim();
        return a.startsWith("0x") ? a.toLowerCase(Locale.ROOT) : a;
    }
}
