/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.http;

/**
 * The source could not be reached or its answer could not be read.
 */
public class SourceTransportException extends RuntimeException {
    public SourceTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
