package com.phillippitts.mathspeech.service.cache;

import com.phillippitts.mathspeech.domain.AudienceLevel;
import com.phillippitts.mathspeech.domain.MathDomain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives cache keys. Two requests share a key exactly when their whitespace-normalized
 * expression, audience, lower-cased context and domain are equal.
 */
public final class FingerprintGenerator {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final char SEPARATOR = '\u0000';

    private FingerprintGenerator() {
    }

    /**
     * @return 64-character lower-case hex SHA-256 digest
     */
    public static String fingerprint(String expression, AudienceLevel audience, String context, MathDomain domain) {
        String material = normalize(expression)
                + SEPARATOR + audience.tag()
                + SEPARATOR + context.trim().toLowerCase(Locale.ROOT)
                + SEPARATOR + domain.tag();
        return HexFormat.of().formatHex(sha256().digest(material.getBytes(StandardCharsets.UTF_8)));
    }

    /** Trims the expression and collapses each whitespace run to one space. */
    public static String normalize(String expression) {
        return WHITESPACE.matcher(expression.trim()).replaceAll(" ");
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
