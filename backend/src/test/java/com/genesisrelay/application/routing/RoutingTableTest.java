/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.routing;

import com.genesisrelay.application.ProviderAdapterRegistry;
import com.genesisrelay.domain.model.ProviderKind;
import com.genesisrelay.domain.model.Quality;
import com.genesisrelay.domain.model.RequestType;
import com.genesisrelay.infrastructure.provider.ProviderDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.genesisrelay.application.routing.RoutingFixtures.provider;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RoutingTableTest {
    private final ProviderAdapterRegistry registry = new ProviderAdapterRegistry(List.of(new RoutingFixtures.StubAdapter()));

    @Test
    void preferredProvidersComeFirstThenTheRestByPriority() {
        RoutingTable table = table(
                provider("generalist", 1, RequestType.CHAT),
                provider("coder-2", 2, RequestType.CODING),
                provider("backup", 3),
                provider("coder-1", 1, RequestType.CODING));

        assertEquals(List.of("coder-1", "coder-2", "generalist", "backup"),
                ids(table.candidatesFor(RequestType.CODING, null, 10)));
    }

    @Test
    void premiumQualityMovesPremiumProvidersAheadKeepingOrder() {
        RoutingTable table = table(
                provider("cheap", 1, 0.000001, false, RequestType.CHAT),
                provider("opus", 2, 0.000075, true),
                provider("gpt4", 1, 0.00003, true));

        assertEquals(List.of("gpt4", "opus", "cheap"),
                ids(table.candidatesFor(RequestType.CHAT, Quality.PREMIUM, 10)));
    }

    @Test
    void fastQualityOrdersByCost() {
        RoutingTable table = table(
                provider("pricey", 1, 0.00003, true, RequestType.CHAT),
                provider("cheapest", 3, 0.000001, false),
                provider("middle", 2, 0.000007, false));

        assertEquals(List.of("cheapest", "middle", "pricey"),
                ids(table.candidatesFor(RequestType.CHAT, Quality.FAST, 10)));
    }

    @Test
    void skipsDisabledUnconfiguredUnsupportedAndTooSmallProviders() {
        ProviderDescriptor disabled = new ProviderDescriptor("disabled", "d", ProviderKind.OPENAI_COMPATIBLE,
                "http://d", "k", "m", Set.of(), 1, 0, 100_000, false, false);
        ProviderDescriptor noKey = new ProviderDescriptor("no-key", "n", ProviderKind.OPENAI_COMPATIBLE,
                "http://n", "", "m", Set.of(), 1, 0, 100_000, false, true);
        ProviderDescriptor noAdapter = new ProviderDescriptor("gemini", "g", ProviderKind.GEMINI,
                "http://g", "k", "m", Set.of(), 1, 0, 100_000, false, true);
        ProviderDescriptor tiny = new ProviderDescriptor("tiny", "t", ProviderKind.OPENAI_COMPATIBLE,
                "http://t", "k", "m", Set.of(), 1, 0, 5, false, true);
        RoutingTable table = table(disabled, noKey, noAdapter, tiny, provider("ok", 9));

        assertEquals(List.of("ok"), ids(table.candidatesFor(RequestType.CHAT, Quality.BALANCED, 6)));
        assertEquals(List.of("tiny", "ok"), ids(table.candidatesFor(RequestType.CHAT, Quality.BALANCED, 5)));
    }

    @Test
    void estimatesTokensAsCharactersOverThreePointFive() {
        assertEquals(0, RoutingTable.estimateTokens(""));
        assertEquals(1, RoutingTable.estimateTokens("abc"));
        assertEquals(2, RoutingTable.estimateTokens("abcdefg"));
        assertEquals(29, RoutingTable.estimateTokens("x".repeat(100)));
    }

    @Test
    void duplicateProviderIdsAreRejected() {
        assertThrows(IllegalStateException.class, () -> ProviderCatalog.of(List.of(provider("a", 1), provider("a", 2))));
    }

    private RoutingTable table(ProviderDescriptor... providers) {
        return new RoutingTable(ProviderCatalog.of(List.of(providers)), registry);
    }

    private static List<String> ids(List<ProviderDescriptor> providers) {
        return providers.stream().map(ProviderDescriptor::id).toList();
    }
}
