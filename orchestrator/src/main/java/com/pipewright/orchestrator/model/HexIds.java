package com.pipewright.orchestrator.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Short random identifiers for processes and tasks (8 hex chars), plus the
 * prompt hash stored on every execution record.
 */
public final class HexIds {

    private static final SecureRandom RANDOM = new SecureRandom();

    private HexIds() {}

    public static String newId() {
        byte[] bytes = new byte[4];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /** First 16 hex chars of the SHA-256 of the prompt, or null for a null prompt. */
    public static String promptHash(String prompt) {
        if (prompt == null) return null;
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(prompt.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
