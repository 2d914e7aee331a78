/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.routing;

import com.genesisrelay.domain.model.RequestType;
import com.genesisrelay.infrastructure.provider.ChunkStream;
import com.genesisrelay.infrastructure.provider.ProviderErrorType;
import com.genesisrelay.infrastructure.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.NoSuchElementException;
import java.util.function.Consumer;

/**
 * The stream of the provider that produced the first chunk. Once a chunk has been delivered the
 * request is committed to this provider: a later failure ends the stream with
 * {@link ProviderErrorType#STREAM_INTERRUPTED} and no other provider is tried.
 */
public final class RoutedResponse implements ChunkStream {
    private static final Logger log = LoggerFactory.getLogger(RoutedResponse.class);

    private final String providerId;
    private final String model;
    private final RequestType requestType;
    private final ChunkStream stream;
    private final Consumer<ProviderException> onInterrupted;

    private volatile boolean finished;

    public RoutedResponse(String providerId, String model, RequestType requestType, ChunkStream stream,
                   Consumer<ProviderException> onInterrupted) {
        this.providerId = providerId;
        this.model = model;
        this.requestType = requestType;
        this.stream = stream;
        this.onInterrupted = onInterrupted;
    }

    public String providerId() {
        return providerId;
    }

    public String model() {
        return model;
    }

    public RequestType requestType() {
        return requestType;
    }

    @Override
    public boolean hasNext() {
        if (finished) return false;
        try {
            boolean more = stream.hasNext();
            if (!more) {
                finished = true;
                stream.close();
            }
            return more;
        } catch (RuntimeException e) {
            finished = true;
            stream.close();
            ProviderException interrupted = new ProviderException(providerId, ProviderErrorType.STREAM_INTERRUPTED,
                    providerId + " stream interrupted after the first chunk", e);
            log.warn("Provider stream interrupted provider={} type={}: {}", providerId, requestType, e.getMessage());
            onInterrupted.accept(interrupted);
            throw interrupted;
        }
    }

    @Override
    public String next() {
        if (!hasNext()) throw new NoSuchElementException();
        return stream.next();
    }

    @Override
    public void close() {
        finished = true;
        stream.close();
    }
}
