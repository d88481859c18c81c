package com.ecoWasteEngine.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** SHA-256 content hash and the per-submitter dedup key built from it. */
public final class ContentFingerprint {

    private ContentFingerprint() {
    }

    public static String sha256Hex(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /** The same image from two different users is two different submissions. */
    public static String dedupKey(String submitterId, String contentHash) {
        return sha256Hex((submitterId + ":" + contentHash).getBytes(StandardCharsets.UTF_8));
    }
}
