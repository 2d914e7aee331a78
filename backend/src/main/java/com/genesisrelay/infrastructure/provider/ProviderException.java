/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.provider;

/**
 * Failure of a single provider call. The router treats it as "try the next candidate" unless a
 * chunk has already reached the caller.
 */
public class ProviderException extends RuntimeException {
    private final String providerId;
    private final ProviderErrorType type;
    private final Integer status;

    public ProviderException(String providerId, ProviderErrorType type, String safeMessage, Integer status, Throwable cause) {
        super(safeMessage, cause);
        this.providerId = providerId;
        this.type = type;
        this.status = status;
    }

    public ProviderException(String providerId, ProviderErrorType type, String safeMessage, Throwable cause) {
        this(providerId, type, safeMessage, null, cause);
    }

    public ProviderException(String providerId, ProviderErrorType type, String safeMessage) {
        this(providerId, type, safeMessage, null, null);
    }

    public String getProviderId() {
        return providerId;
    }

    public ProviderErrorType getType() {
        return type;
    }

    public Integer getStatus() {
        return status;
    }
}
