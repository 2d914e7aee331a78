/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.routing;

import com.genesisrelay.domain.model.RequestType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Keyword classification for requests that arrive without an explicit type. Groups are checked
 * in order and the first group with a hit wins.
 */
@Component
public class RequestClassifier {
    private static final List<String> BUSINESS = List.of(
            "automation", "workflow", "business", "strategy", "consulting", "efficiency",
            "process", "optimization", "revenue", "profit", "marketing", "sales"
    );
    private static final List<String> CODING = List.of(
            "code", "programming", "function", "api", "development", "debug",
            "algorithm", "software", "javascript", "python", "react"
    );
    private static final List<String> CULTURAL = List.of(
            "heritage", "tradition", "culture", "ancestry", "family", "cultural",
            "identity", "genealogy"
    );

    public RequestType classify(AiRequest request) {
        if (request.type() != null) {
            return request.type();
        }
        String text = request.prompt().toLowerCase(Locale.ROOT);
        if (containsAny(text, BUSINESS)) return RequestType.BUSINESS;
        if (containsAny(text, CODING)) return RequestType.CODING;
        if (containsAny(text, CULTURAL)) return RequestType.CULTURAL;
        return RequestType.CHAT;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) return true;
        }
        return false;
    }
}
