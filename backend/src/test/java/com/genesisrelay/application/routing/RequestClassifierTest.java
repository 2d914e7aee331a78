/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.routing;

import com.genesisrelay.domain.model.RequestType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RequestClassifierTest {
    private final RequestClassifier classifier = new RequestClassifier();

    @Test
    void explicitTypeWins() {
        AiRequest request = AiRequest.of("debug my python code").withType(RequestType.RESEARCH);
        assertEquals(RequestType.RESEARCH, classifier.classify(request));
    }

    @Test
    void classifiesByKeywords() {
        assertEquals(RequestType.BUSINESS, classifier.classify(AiRequest.of("Grow REVENUE with better marketing")));
        assertEquals(RequestType.CODING, classifier.classify(AiRequest.of("Why does this JavaScript throw?")));
        assertEquals(RequestType.CULTURAL, classifier.classify(AiRequest.of("Tell me about my Irish ancestry")));
        assertEquals(RequestType.CHAT, classifier.classify(AiRequest.of("What a lovely day")));
    }

    @Test
    void businessKeywordsTakePrecedenceOverCoding() {
        assertEquals(RequestType.BUSINESS, classifier.classify(AiRequest.of("write code to automate our sales pipeline")));
    }

    @Test
    void blankPromptIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> AiRequest.of("  "));
    }
}
