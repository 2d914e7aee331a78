/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.routing;

import com.genesisrelay.infrastructure.provider.ChunkStream;
import com.genesisrelay.infrastructure.provider.ProviderErrorType;
import com.genesisrelay.infrastructure.provider.ProviderException;

import java.util.NoSuchElementException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds every pull of a provider stream by one absolute deadline. Pulls run on the provider-call
 * executor so a read blocked on the network can be abandoned; on expiry the delegate is closed.
 */
final class DeadlineChunkStream implements ChunkStream {
    private final ChunkStream delegate;
    private final ExecutorService executor;
    private final long deadlineNanos;
    private final String providerId;

    private Boolean pending;
    private volatile boolean closed;

    DeadlineChunkStream(ChunkStream delegate, ExecutorService executor, long deadlineNanos, String providerId) {
        this.delegate = delegate;
        this.executor = executor;
        this.deadlineNanos = deadlineNanos;
        this.providerId = providerId;
    }

    @Override
    public boolean hasNext() {
        if (closed) return false;
        if (pending != null) return pending;

        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            close();
            throw timeout(null);
        }

        Future<Boolean> pull = executor.submit(delegate::hasNext);
        try {
            pending = pull.get(remaining, TimeUnit.NANOSECONDS);
            return pending;
        } catch (TimeoutException e) {
            pull.cancel(true);
            close();
            throw timeout(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pull.cancel(true);
            close();
            throw new ProviderException(providerId, ProviderErrorType.TIMEOUT, providerId + " read interrupted", e);
        } catch (ExecutionException e) {
            close();
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new ProviderException(providerId, ProviderErrorType.UNKNOWN, providerId + " stream failed", cause);
        }
    }

    @Override
    public String next() {
        if (!hasNext()) throw new NoSuchElementException();
        pending = null;
        return delegate.next();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        delegate.close();
    }

    private ProviderException timeout(Throwable cause) {
        return new ProviderException(providerId, ProviderErrorType.TIMEOUT, providerId + " exceeded the call deadline", cause);
    }
}
