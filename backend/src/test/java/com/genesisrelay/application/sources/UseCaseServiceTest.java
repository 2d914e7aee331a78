/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.sources;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.genesisrelay.domain.model.AuthType;
import com.genesisrelay.domain.model.SourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UseCaseServiceTest {
    @Mock
    private RateLimitedCacheGateway gateway;

    private final SourceRegistry registry = new SourceRegistry();
    private UseCaseService service;

    @BeforeEach
    void setUp() {
        service = new UseCaseService(registry, gateway);
        registry.registerSource(source("alpha", "genealogy"));
        registry.registerSource(source("beta", "genealogy"));
        registry.registerSource(source("museum", "heritage"));
        registry.registerUseCase(new UseCase("origins", "Origins", "family origins", List.of("genealogy"),
                List.of("alpha", "beta"), "{surname} family from {region}", List.of("Smith")));
    }

    @Test
    void fillsTemplateAndSearchesMatchingSources() {
        JsonNode hit = JsonNodeFactory.instance.objectNode().put("hits", 3);
        when(gateway.call(anyString(), eq("/search"), eq(Map.of("q", "Smith family from Cork")))).thenReturn(hit);

        UseCaseService.UseCaseResult result = service.executeUseCase("origins", Map.of("surname", "Smith", "region", "Cork"));

        assertEquals("origins", result.useCaseId());
        assertEquals("Smith family from Cork", result.query());
        assertEquals(List.of("alpha", "beta"), List.copyOf(result.results().keySet()));
        verify(gateway, never()).call(eq("museum"), anyString(), eq(Map.of("q", "Smith family from Cork")));
    }

    @Test
    void failingSourcesAreLeftOut() {
        JsonNode hit = JsonNodeFactory.instance.objectNode();
        when(gateway.call(eq("alpha"), eq("/search"), eq(Map.of("q", "x"))))
                .thenThrow(new RateLimitExceededException("alpha", Duration.ofMillis(100)));
        when(gateway.call(eq("beta"), eq("/search"), eq(Map.of("q", "x"))))
                .thenThrow(new DependencyException("beta", 500, "boom", null));
        when(gateway.call(eq("museum"), eq("/search"), eq(Map.of("q", "x")))).thenReturn(hit);

        Map<String, JsonNode> results = service.multiSourceSearch("x", List.of());

        assertEquals(Map.of("museum", hit), results);
    }

    @Test
    void unknownUseCaseAndBlankQueryAreRejected() {
        assertThrows(ConfigurationException.class, () -> service.executeUseCase("nope", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> service.multiSourceSearch("  ", List.of("genealogy")));
    }

    @Test
    void templateReplacesEveryOccurrenceAndKeepsUnknownTokens() {
        assertEquals("Ada and Ada in {city}",
                UseCaseService.fillTemplate("{name} and {name} in {city}", Map.of("name", "Ada")));
        assertEquals("{name}", UseCaseService.fillTemplate("{name}", null));
    }

    private static DataSource source(String id, String category) {
        return new DataSource(id, id, SourceType.API, "https://" + id + ".example", "desc", AuthType.NONE, null,
                0, true, List.of(category), Map.of());
    }
}
