/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class Sha256 {
    private static final HexFormat HEX = HexFormat.of();

    private Sha256() {}

    public static String hex(String input) {
        return HEX.formatHex(digest(input.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Digest of the parts joined with a unit separator, so ("ab","c") and ("a","bc") differ.
     */
    public static String hexOfParts(String... parts) {
        return hex(String.join("\u001f", parts));
    }

    private static byte[] digest(byte[] bytes) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("sha-256 unavailable", e);
        }
    }
}
