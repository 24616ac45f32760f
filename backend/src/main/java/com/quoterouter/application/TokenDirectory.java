/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.application;

import com.quoterouter.config.AppProperties;
import com.quoterouter.domain.model.Token;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Component
public class TokenDirectory {
    private final Map<String, Token> byAddress = new HashMap<>();
    private final Map<String, Token> bySymbol = new HashMap<>();
    private final Map<String, AppProperties.Chain> chains;

    public TokenDirectory(AppProperties properties) {
        this.chains = properties.chains();
        chains.forEach((chainId, chain) -> {
            if (chain.nativeToken() != null && !chain.nativeToken().isBlank()) {
                register(new Token(chain.nativeToken(), chainId, chain.nativeDecimals(), null));
            }
        });
        for (AppProperties.TokenEntry entry : properties.tokens()) {
            register(new Token(entry.address(), entry.chainId(), entry.decimals(), entry.symbol()));
        }
    }

    /**
     * @param decimals used only when the token is not configured
     * @throws InvalidSwapRequestException when the token is unknown and no decimals were supplied
     */
    public Token resolve(String reference, String chainId, Integer decimals) {
        if (reference == null || reference.isBlank()) {
            throw new InvalidSwapRequestException("Token is required");
        }
        Optional<Token> known = find(reference.trim(), chainId);
        if (known.isPresent()) return known.get();
        if (decimals == null) {
            throw new InvalidSwapRequestException("Unknown token " + reference + " on chain " + chainId + "; supply its decimals");
        }
        try {
            return new Token(reference, chainId, decimals, null);
        } catch (IllegalArgumentException e) {
            throw new InvalidSwapRequestException(e.getMessage());
        }
    }

    public Optional<Token> find(String reference, String chainId) {
        Token token = byAddress.get(key(chainId, normalize(reference)));
        if (token == null) token = bySymbol.get(key(chainId, reference.toUpperCase(Locale.ROOT)));
        return Optional.ofNullable(token);
    }

    public Optional<Token> nativeToken(String chainId) {
        AppProperties.Chain chain = chains.get(chainId);
        if (chain == null || chain.nativeToken() == null) return Optional.empty();
        return Optional.of(new Token(chain.nativeToken(), chainId, chain.nativeDecimals(), null));
    }

    public boolean isNative(Token token) {
        return nativeToken(token.chainId()).map(token::sameAs).orElse(false);
    }

    private void register(Token token) {
        byAddress.put(key(token.chainId(), token.normalizedAddress()), token);
        if (token.symbol() != null && !token.symbol().isBlank()) {
            bySymbol.put(key(token.chainId(), token.symbol().toUpperCase(Locale.ROOT)), token);
        }
    }

    private static String normalize(String address) {
        return address.startsWith("0x") ? address.toLowerCase(Locale.ROOT) : address;
    }

    private static String key(String chainId, String value) {
        return chainId + "|" + value;
    }
}
