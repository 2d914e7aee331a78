/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.config;

import com.genesisrelay.application.routing.ProviderAttempt;
import com.genesisrelay.application.routing.ProviderAttemptService;
import com.genesisrelay.domain.model.AttemptOutcome;
import com.genesisrelay.domain.model.RequestType;
import com.genesisrelay.infrastructure.persistence.repository.ProviderAttemptRepository;
import jakarta.persistence.EntityManagerFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

@SpringBootTest
@ActiveProfiles("test")
class JpaContextTest {
    @Autowired
    private EntityManagerFactory entityManagerFactory;

    @Autowired
    private ProviderAttemptRepository attemptRepository;

    @Autowired
    private ProviderAttemptService attemptService;

    @Test
    void contextLoadsWithJpa() {
        assertNotNull(entityManagerFactory);
        assertNotNull(attemptRepository);
    }

    @Test
    void attemptsRoundTripThroughSqliteAndFilter() {
        // the test database file outlives the context, so scope rows by a fresh provider id
        String providerId = "audit-" + UUID.randomUUID();
        String requestId = "req-" + UUID.randomUUID();
        Instant base = Instant.parse("2025-03-01T10:00:00Z");

        attemptService.record(new ProviderAttempt(requestId, providerId, RequestType.BUSINESS,
                AttemptOutcome.FAILED, "TIMEOUT", 1200, base));
        attemptService.record(new ProviderAttempt(requestId, providerId, RequestType.BUSINESS,
                AttemptOutcome.SUCCEEDED, null, 300, base.plusSeconds(2)));
        attemptService.record(new ProviderAttempt(requestId, "other-" + providerId, RequestType.BUSINESS,
                AttemptOutcome.SKIPPED_OPEN, "CIRCUIT_OPEN", 0, base.plusSeconds(1)));

        List<ProviderAttempt> all = attemptService.search(null, null, providerId, 10);
        assertEquals(2, all.size());
        assertEquals(AttemptOutcome.SUCCEEDED, all.get(0).outcome());
        assertEquals(base.plusSeconds(2), all.get(0).createdAt());
        assertEquals("TIMEOUT", all.get(1).errorType());

        List<ProviderAttempt> early = attemptService.search(base, base.plusSeconds(1), providerId, 10);
        assertEquals(1, early.size());
        assertEquals(AttemptOutcome.FAILED, early.get(0).outcome());

        assertEquals(1, attemptService.search(null, null, providerId, 1).size());
        assertEquals(3, attemptRepository.findByRequestIdOrderByCreatedAtAsc(requestId).size());
    }

    @Test
    void invertedRangeIsRejected() {
        Instant now = Instant.parse("2025-03-01T10:00:00Z");
        assertThrows(IllegalArgumentException.class, () -> attemptService.search(now, now.minusSeconds(1), null, 10));
    }
}
