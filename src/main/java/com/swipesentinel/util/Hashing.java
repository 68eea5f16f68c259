package com.swipesentinel.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** SHA-256 helpers used for fingerprints and cache keys. */
public final class Hashing {

    private Hashing() {}

    public static String sha256Hex(String text) {
        return sha256Hex((text != null ? text : "").getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(byte[] payload) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(payload != null ? payload : new byte[0]);
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
