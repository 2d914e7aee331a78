/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.provider;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FluxChunkStreamTest {

    @Test
    void yieldsNonEmptyChunksInOrder() {
        FluxChunkStream stream = new FluxChunkStream("p", Flux.just("a", "", "b"));

        assertEquals("a", stream.next());
        assertEquals("b", stream.next());
        assertFalse(stream.hasNext());
        assertThrows(NoSuchElementException.class, stream::next);
    }

    @Test
    void providerErrorsPassThroughUnchanged() {
        ProviderException failure = new ProviderException("p", ProviderErrorType.HTTP_5XX, "boom");
        FluxChunkStream stream = new FluxChunkStream("p", Flux.concat(Flux.just("a"), Flux.error(failure)));

        assertEquals("a", stream.next());
        assertSame(failure, assertThrows(ProviderException.class, stream::hasNext));
        assertFalse(stream.hasNext());
    }

    @Test
    void otherErrorsAreWrapped() {
        FluxChunkStream stream = new FluxChunkStream("p", Flux.error(new IllegalStateException("decode")));

        ProviderException ex = assertThrows(ProviderException.class, stream::hasNext);
        assertEquals(ProviderErrorType.UNKNOWN, ex.getType());
        assertEquals("p", ex.getProviderId());
    }

    @Test
    void closeCancelsUpstreamAndEndsIteration() {
        Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
        AtomicBoolean cancelled = new AtomicBoolean();
        FluxChunkStream stream = new FluxChunkStream("p", sink.asFlux().doOnCancel(() -> cancelled.set(true)));
        sink.tryEmitNext("first");

        assertTrue(stream.hasNext());
        stream.next();
        stream.close();
        stream.close();

        assertFalse(stream.hasNext());
        assertTrue(cancelled.get());
    }
}
