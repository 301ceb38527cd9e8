package com.captainsprep.engine.service.memory;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fingerprints of question patterns: the first 12 hex characters of the MD5 of
 * {@code subject_type[_key]}, each part lower-cased with spaces replaced by underscores.
 */
public final class PatternSignatures {

    static final int LENGTH = 12;

    private PatternSignatures() {
    }

    public static String of(String subject, String questionType, String keyVariable) {
        if (subject == null || questionType == null) {
            throw new IllegalArgumentException("subject and questionType are required");
        }
        List<String> parts = new ArrayList<>();
        parts.add(part(subject));
        parts.add(part(questionType));
        if (keyVariable != null && !keyVariable.isEmpty()) {
            parts.add(part(keyVariable));
        }
        String raw = String.join("_", parts);
        return DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8)).substring(0, LENGTH);
    }

    private static String part(String value) {
        return value.toLowerCase(Locale.ROOT).replace(" ", "_");
    }
}
