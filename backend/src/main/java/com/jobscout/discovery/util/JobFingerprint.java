package com.jobscout.discovery.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Content identity of a posting: SHA-256 over normalized title, company and apply URL.
 */
public final class JobFingerprint {
    private static final char SEPARATOR = '|';

    private JobFingerprint() {
    }

    public static String of(String title, String company, String applyUrl) {
        String material = TextUtils.normalizeKey(title)
            + SEPARATOR
            + TextUtils.normalizeKey(company)
            + SEPARATOR
            + JobUrlUtils.normalizeForFingerprint(applyUrl);
        return sha256Hex(material);
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
