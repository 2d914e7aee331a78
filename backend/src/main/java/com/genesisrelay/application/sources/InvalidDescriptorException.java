/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.sources;

import java.util.List;

public class InvalidDescriptorException extends RuntimeException {
    private final List<String> errors;

    public InvalidDescriptorException(String descriptorId, List<String> errors) {
        super("Invalid descriptor " + (descriptorId == null ? "<no id>" : descriptorId) + ": " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
