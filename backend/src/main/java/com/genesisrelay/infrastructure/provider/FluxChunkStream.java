/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.provider;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Pull-side view of a reactive chunk stream. Subscribes eagerly; closing disposes the
 * subscription, which cancels the HTTP exchange.
 */
public final class FluxChunkStream implements ChunkStream {
    private static final Object COMPLETE = new Object();

    private final String providerId;
    private final BlockingQueue<Object> signals = new LinkedBlockingQueue<>();
    private final Disposable subscription;

    private String buffered;
    private volatile boolean done;

    public FluxChunkStream(String providerId, Flux<String> chunks) {
        this.providerId = providerId;
        this.subscription = chunks
                .filter(chunk -> !chunk.isEmpty())
                .subscribe(signals::add, signals::add, () -> signals.add(COMPLETE));
    }

    @Override
    public boolean hasNext() {
        if (buffered != null) return true;
        if (done) return false;

        Object signal;
        try {
            signal = signals.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new ProviderException(providerId, ProviderErrorType.TIMEOUT, "Provider stream read interrupted", e);
        }

        if (signal == COMPLETE) {
            done = true;
            return false;
        }
        if (signal instanceof ProviderException pe) {
            done = true;
            throw pe;
        }
        if (signal instanceof Throwable t) {
            done = true;
            throw new ProviderException(providerId, ProviderErrorType.UNKNOWN, "Provider stream failed", t);
        }
        buffered = (String) signal;
        return true;
    }

    @Override
    public String next() {
        if (!hasNext()) throw new NoSuchElementException();
        String chunk = buffered;
        buffered = null;
        return chunk;
    }

    @Override
    public void close() {
        done = true;
        subscription.dispose();
        signals.offer(COMPLETE);
    }
}
