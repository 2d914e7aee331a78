/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.api.admin;

import com.genesisrelay.application.routing.ProviderAttempt;
import com.genesisrelay.application.routing.ProviderAttemptService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/admin/attempts")
public class AttemptAdminController {
    private final ProviderAttemptService attemptService;

    public AttemptAdminController(ProviderAttemptService attemptService) {
        this.attemptService = attemptService;
    }

    @GetMapping
    public List<ProviderAttempt> search(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "providerId", required = false) String providerId,
            @RequestParam(value = "limit", defaultValue = "100") int limit
    ) {
        return attemptService.search(from, to, providerId, limit);
    }
}
