package org.exquisite.util;

import lombok.experimental.UtilityClass;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

@UtilityClass
public class HashUtils {

    public byte[] sha256(String input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not found", e);
        }
    }

    /**
     * Lower-case hex SHA-256 of the UTF-8 bytes of {@code input}.
     */
    public String sha256Hex(String input) {
        return HexFormat.of().formatHex(sha256(input));
    }
}
