package com.openforge.chatrouter.cache;

import com.openforge.chatrouter.classifier.QueryType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Builds response-cache keys.
 *
 * key = sha256(normalizedQuery | queryType | chatType | memoryFingerprint)
 *
 * Normalization lowercases, trims and collapses whitespace, so trivially
 * different spellings of the same question share an entry.  The memory
 * fingerprint changes whenever the owner's memories change, which retires
 * personalised entries without explicit invalidation.
 */
public final class CacheKeys {

    private CacheKeys() {}

    public static String of(String query, QueryType queryType, String chatType, String memoryFingerprint) {
        String material = String.join("|",
                normalize(query),
                queryType.name(),
                chatType == null ? "" : chatType,
                memoryFingerprint == null ? "" : memoryFingerprint);
        return sha256Hex(material);
    }

    static String normalize(String query) {
        if (query == null) return "";
        return query.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
    }

    static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
