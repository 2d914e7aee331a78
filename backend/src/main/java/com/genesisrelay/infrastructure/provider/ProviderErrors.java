/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Maps transport failures of provider calls onto {@link ProviderException}.
 */
final class ProviderErrors {
    private static final Logger log = LoggerFactory.getLogger(ProviderErrors.class);

    private ProviderErrors() {
    }

    static void requireConfigured(ProviderDescriptor provider) {
        if (!provider.isConfigured()) {
            throw new ProviderException(provider.id(), ProviderErrorType.NOT_CONFIGURED, provider.id() + " is not configured");
        }
    }

    static ProviderException forStatus(String providerId, int status) {
        ProviderErrorType type;
        if (status == 429) type = ProviderErrorType.RATE_LIMITED;
        else if (status == 408 || status == 504) type = ProviderErrorType.TIMEOUT;
        else if (status >= 500) type = ProviderErrorType.HTTP_5XX;
        else type = ProviderErrorType.HTTP_4XX;

        log.warn("Provider error provider={} type={} status={}", providerId, type, status);
        return new ProviderException(providerId, type, providerId + " request failed with status " + status, status, null);
    }

    static ProviderException map(String providerId, Throwable error) {
        if (error instanceof ProviderException pe) {
            return pe;
        }
        if (error instanceof WebClientResponseException wre) {
            return forStatus(providerId, wre.getStatusCode().value());
        }
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof io.netty.handler.timeout.TimeoutException) {
                log.warn("Provider timeout provider={}", providerId);
                return new ProviderException(providerId, ProviderErrorType.TIMEOUT, providerId + " timed out", error);
            }
        }
        log.warn("Provider call failed provider={} error={}", providerId, error.toString());
        return new ProviderException(providerId, ProviderErrorType.UNKNOWN, providerId + " request failed", error);
    }
}
