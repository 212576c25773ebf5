package io.provtrack.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

public final class Hashing {
    private static final SecureRandom RANDOM = new SecureRandom();

    private Hashing() {
    }

    public static String sha256Hex(String value) {
        return digestHex("SHA-256", value.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha3Hex(String value) {
        return digestHex("SHA3-256", value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Hash of a file's content framed the way git frames blob objects, so a
     * working-tree file and its committed blob produce the same checksum.
     */
    public static String gitBlobSha1Hex(byte[] content) {
        return gitObjectSha1Hex("blob", content);
    }

    /** Object id git would give {@code content} stored as an object of {@code kind} ("blob", "tree"). */
    public static String gitObjectSha1Hex(String kind, byte[] content) {
        byte[] header = (kind + " " + content.length + "\0").getBytes(StandardCharsets.US_ASCII);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            digest.update(header);
            digest.update(content);
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    public static String randomHex(int bytes) {
        byte[] raw = new byte[bytes];
        RANDOM.nextBytes(raw);
        return HexFormat.of().formatHex(raw);
    }

    private static String digestHex(String algorithm, byte[] input) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            return HexFormat.of().formatHex(digest.digest(input));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
