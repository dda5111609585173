package com.tokenmetadata.domain;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * SHA-256 digest of raw payload bytes. Dedup key for validated records.
 */
public record ContentFingerprint(String hex) {

    private static final String PREFIX = "sha256:";

    public ContentFingerprint {
        Objects.requireNonNull(hex, "hex");
    }

    public static ContentFingerprint of(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return new ContentFingerprint(HexFormat.of().formatHex(digest.digest(bytes)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String value() {
        return PREFIX + hex;
    }

    @Override
    public String toString() {
        return value();
    }
}
