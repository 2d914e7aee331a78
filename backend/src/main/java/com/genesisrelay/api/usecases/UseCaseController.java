/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.api.usecases;

import com.genesisrelay.application.sources.SourceRegistry;
import com.genesisrelay.application.sources.UseCase;
import com.genesisrelay.application.sources.UseCaseService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/use-cases")
public class UseCaseController {
    private final SourceRegistry registry;
    private final UseCaseService useCaseService;

    public UseCaseController(SourceRegistry registry, UseCaseService useCaseService) {
        this.registry = registry;
        this.useCaseService = useCaseService;
    }

    @GetMapping
    public List<UseCase> list(@RequestParam(value = "category", required = false) String category) {
        if (category == null || category.isBlank()) {
            return registry.getAllUseCases();
        }
        return registry.getUseCasesByCategory(category);
    }

    @PostMapping("/{id}/execute")
    public UseCaseService.UseCaseResult execute(
            @PathVariable("id") String id,
            @RequestBody(required = false) Map<String, String> params
    ) {
        return useCaseService.executeUseCase(id, params == null ? Map.of() : params);
    }
}
