/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.sources;

/**
 * A data source call failed. {@code status} is the HTTP status when the source answered, or
 * {@code null} for timeouts and I/O failures.
 */
public class DependencyException extends RuntimeException {
    private final String sourceId;
    private final Integer status;

    public DependencyException(String sourceId, Integer status, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
        this.status = status;
    }

    public String getSourceId() {
        return sourceId;
    }

    public Integer getStatus() {
        return status;
    }
}
