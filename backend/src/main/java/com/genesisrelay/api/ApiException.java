/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.api;

import org.springframework.http.HttpStatus;

public class ApiException extends RuntimeException {
    private final HttpStatus status;
    private final String code;

    public ApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public ApiException(HttpStatus status, String message) {
        this(status, status.name(), message);
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }
}
