package com.gt.flashcards.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

// Checksum: fingerprint of a note's first field used by duplicate detection, the first 8 hex digits of the MD5
// digest read as a signed 32 bit integer.
public class NoteFieldUtil {

    private static final int CHECKSUM_HEX_DIGITS = 8;

    public static int firstFieldChecksum(String firstFieldValue) {
        String value = firstFieldValue == null ? "" : firstFieldValue;

        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
            String hex = HexFormat.of().formatHex(digest).substring(0, CHECKSUM_HEX_DIGITS);

            return (int) Long.parseLong(hex, 16);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("MD5 digest unavailable", ex);
        }
    }

    public static String preview(String value, int maxLength) {
        if (value == null || value.isBlank()) {
            return "(empty)";
        }

        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }
}
