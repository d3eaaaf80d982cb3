package io.mockchain.core.protocol;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashes {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Hashes(){}

    public static byte[] sha256(byte[] in){
        return newSha256().digest(in);
    }

    /** Fresh SHA-256 instance, for callers that hash in a tight loop. */
    public static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String toHex(byte[] b){
        char[] out = new char[b.length * 2];
        for (int i = 0, j = 0; i < b.length; i++) {
            int v = b[i] & 0xff;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0f];
        }
        return new String(out);
    }

    /** Strict lowercase/uppercase hex decoding; odd length or non-hex characters are rejected. */
    public static byte[] fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex string required");
        }
        String normalized = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        int len = normalized.length();
        if (len % 2 != 0) {
            throw new IllegalArgumentException("hex string must have an even length");
        }
        byte[] out = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            int hi = Character.digit(normalized.charAt(i), 16);
            int lo = Character.digit(normalized.charAt(i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("not a hexadecimal string");
            }
            out[i / 2] = (byte) ((hi << 4) + lo);
        }
        return out;
    }

    /**
     * Number of leading '0' characters the hex form of {@code hash} would have,
     * counted on the raw bytes (two nibbles per byte).
     */
    public static int leadingZeroHexDigits(byte[] hash) {
        int n = 0;
        for (byte b : hash) {
            int v = b & 0xff;
            if (v == 0) {
                n += 2;
                continue;
            }
            if ((v & 0xf0) == 0) n++;
            break;
        }
        return n;
    }
}
