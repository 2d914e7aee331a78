/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.provider;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy, finite, non-restartable sequence of text chunks produced by one provider call.
 * <p>
 * {@link #hasNext()} may block until the provider sends the next chunk and throws
 * {@link ProviderException} when the call fails. {@link #close()} releases the underlying
 * transport; it is idempotent and safe to call from another thread.
 */
public interface ChunkStream extends Iterator<String>, AutoCloseable {

    @Override
    void close();

    static ChunkStream of(List<String> chunks) {
        Iterator<String> it = List.copyOf(chunks).iterator();
        return new ChunkStream() {
            private volatile boolean closed;

            @Override
            public boolean hasNext() {
                return !closed && it.hasNext();
            }

            @Override
            public String next() {
                if (!hasNext()) throw new NoSuchElementException();
                return it.next();
            }

            @Override
            public void close() {
                closed = true;
            }
        };
    }
}
