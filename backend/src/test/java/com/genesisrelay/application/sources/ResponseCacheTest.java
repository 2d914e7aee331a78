/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.sources;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.genesisrelay.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResponseCacheTest {

    @Test
    void keyDependsOnEveryRequestPart() {
        String base = ResponseCache.keyOf("loc", "GET", "/search", Map.of("q", "a"), null);

        assertEquals(base, ResponseCache.keyOf("loc", "GET", "/search", Map.of("q", "a"), null));
        assertNotEquals(base, ResponseCache.keyOf("unesco", "GET", "/search", Map.of("q", "a"), null));
        assertNotEquals(base, ResponseCache.keyOf("loc", "POST", "/search", Map.of("q", "a"), null));
        assertNotEquals(base, ResponseCache.keyOf("loc", "GET", "/items", Map.of("q", "a"), null));
        assertNotEquals(base, ResponseCache.keyOf("loc", "GET", "/search", Map.of("q", "b"), null));
        assertNotEquals(base, ResponseCache.keyOf("loc", "GET", "/search", Map.of("q", "a"),
                JsonNodeFactory.instance.objectNode().put("x", 1)));
        assertEquals(64, base.length());
    }

    @Test
    void paramEncodingIsUnambiguous() {
        assertNotEquals(
                ResponseCache.keyOf("loc", "GET", "/search", Map.of("q", "x, y=z"), null),
                ResponseCache.keyOf("loc", "GET", "/search", Map.of("q", "x", "y", "z"), null));
        assertNotEquals(
                ResponseCache.keyOf("loc", "GET", "/search", Map.of("a", "1\"}"), null),
                ResponseCache.keyOf("loc", "GET", "/search", Map.of("a", "1", "}", ""), null));
    }

    @Test
    void storedValueIsIsolatedFromTheWriter() {
        ResponseCache cache = new ResponseCache(Duration.ofMinutes(1), 10, MutableClock.atEpochMillis(0));
        ObjectNode written = JsonNodeFactory.instance.objectNode().put("v", "orig");

        cache.put("k", written);
        written.put("v", "changed");

        assertEquals("orig", cache.get("k").orElseThrow().get("v").asText());
    }

    @Test
    void entriesExpireOnTheInjectedClock() {
        MutableClock clock = MutableClock.atEpochMillis(1_000);
        ResponseCache cache = new ResponseCache(Duration.ofSeconds(10), 100, clock);
        cache.put("k", JsonNodeFactory.instance.textNode("v"));

        clock.advance(Duration.ofSeconds(9));
        assertTrue(cache.get("k").isPresent());

        clock.advance(Duration.ofSeconds(2));
        assertTrue(cache.get("k").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void clearDropsEverything() {
        ResponseCache cache = new ResponseCache(Duration.ofMinutes(1), 10, MutableClock.atEpochMillis(0));
        cache.put("a", JsonNodeFactory.instance.nullNode());
        cache.clear();
        assertEquals(0, cache.size());
    }
}
