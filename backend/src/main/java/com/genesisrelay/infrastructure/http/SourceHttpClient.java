/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.http;

public interface SourceHttpClient {
    /**
     * Performs the request. Any HTTP answer is returned, whatever its status;
     * timeouts and I/O failures throw {@link SourceTransportException}.
     */
    SourceResponse exchange(SourceRequest request);
}
