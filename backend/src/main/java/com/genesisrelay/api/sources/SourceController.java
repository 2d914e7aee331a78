/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.api.sources;

import com.fasterxml.jackson.databind.JsonNode;
import com.genesisrelay.api.ApiException;
import com.genesisrelay.application.sources.CallOptions;
import com.genesisrelay.application.sources.RateLimitedCacheGateway;
import com.genesisrelay.application.sources.SourceRegistry;
import com.genesisrelay.application.sources.UseCaseService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/sources")
public class SourceController {
    private static final Set<String> ALLOWED_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE");

    private final SourceRegistry registry;
    private final RateLimitedCacheGateway gateway;
    private final UseCaseService useCaseService;

    public SourceController(SourceRegistry registry, RateLimitedCacheGateway gateway, UseCaseService useCaseService) {
        this.registry = registry;
        this.gateway = gateway;
        this.useCaseService = useCaseService;
    }

    /**
     * All sources, or only the enabled sources of {@code category} when it is given.
     */
    @GetMapping
    public List<SourceView> list(@RequestParam(value = "category", required = false) String category) {
        var sources = category == null || category.isBlank()
                ? registry.getAllSources()
                : registry.getSourcesByCategory(category);
        return sources.stream().map(SourceView::of).toList();
    }

    @GetMapping("/{id}")
    public SourceView get(@PathVariable("id") String id) {
        return registry.getSource(id)
                .map(SourceView::of)
                .orElseThrow(() -> new ApiException(HttpStatus.NOT_FOUND, "SOURCE_NOT_FOUND", "Source " + id + " not found"));
    }

    @PostMapping("/{id}/call")
    public JsonNode call(@PathVariable("id") String id, @Valid @RequestBody SourceCallRequest request) {
        String method = request.method() == null ? "GET" : request.method().toUpperCase(Locale.ROOT);
        if (!ALLOWED_METHODS.contains(method)) {
            throw new IllegalArgumentException("Unsupported method " + request.method());
        }
        CallOptions options = new CallOptions(HttpMethod.valueOf(method), request.headers(), request.body());
        return gateway.call(id, request.endpoint(), request.params(), options);
    }

    @PostMapping("/search")
    public Map<String, JsonNode> search(@Valid @RequestBody SearchRequest request) {
        return useCaseService.multiSourceSearch(request.query(), request.categories());
    }

    public record SourceCallRequest(
            @NotBlank String endpoint,
            Map<String, String> params,
            String method,
            Map<String, String> headers,
            JsonNode body
    ) {}

    public record SearchRequest(@NotBlank String query, List<String> categories) {}
}
