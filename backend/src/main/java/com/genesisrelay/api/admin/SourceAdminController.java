/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.api.admin;

import com.genesisrelay.api.sources.SourceView;
import com.genesisrelay.application.sources.SourceRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/sources")
public class SourceAdminController {
    private final SourceRegistry registry;

    public SourceAdminController(SourceRegistry registry) {
        this.registry = registry;
    }

    @PatchMapping("/{id}")
    public SourceView update(@PathVariable("id") String id, @Valid @RequestBody SourceUpdate update) {
        return SourceView.of(registry.setEnabled(id, update.enabled()));
    }

    public record SourceUpdate(@NotNull Boolean enabled) {}
}
