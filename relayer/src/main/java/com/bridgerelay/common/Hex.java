package com.bridgerelay.common;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Hex helpers for EVM JSON-RPC quantities, addresses and 32-byte words.
 */
public final class Hex {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final Pattern WORD = Pattern.compile("^0x[0-9a-fA-F]{64}$");
    private static final Pattern QUANTITY = Pattern.compile("^0x[0-9a-fA-F]{1,16}$");

    public static final String ZERO_ADDRESS = "0x" + "0".repeat(40);

    private Hex() {
    }

    public static boolean isAddress(String value) {
        return value != null && ADDRESS.matcher(value).matches();
    }

    public static boolean isWord(String value) {
        return value != null && WORD.matcher(value).matches();
    }

    /**
     * Parses a JSON-RPC quantity such as {@code 0x1b4}. Values wider than 63 bits are rejected.
     *
     * @throws NumberFormatException if the value is not a valid quantity
     */
    public static long parseQuantity(String value) {
        if (value == null || !QUANTITY.matcher(value).matches()) {
            throw new NumberFormatException("Not a hex quantity: " + value);
        }
        long parsed = Long.parseUnsignedLong(value.substring(2), 16);
        if (parsed < 0) {
            throw new NumberFormatException("Hex quantity out of range: " + value);
        }
        return parsed;
    }

    public static String toQuantity(long value) {
        return "0x" + Long.toHexString(value);
    }

    public static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    /** Address held in the low 20 bytes of an indexed topic; null when the upper 12 bytes are not zero. */
    public static String addressFromWord(String word) {
        if (!isWord(word)) {
            return null;
        }
        String body = word.substring(2);
        if (!body.startsWith("0".repeat(24))) {
            return null;
        }
        return lower("0x" + body.substring(24));
    }

    /** Left-pads an address or unsigned integer to a 32-byte ABI word (64 hex chars, no prefix). */
    public static String padWord(String hexWithoutPrefix) {
        if (hexWithoutPrefix.length() > 64) {
            throw new IllegalArgumentException("Value wider than 32 bytes: " + hexWithoutPrefix);
        }
        return "0".repeat(64 - hexWithoutPrefix.length()) + lower(hexWithoutPrefix);
    }

    public static String padWord(BigInteger unsigned) {
        if (unsigned.signum() < 0) {
            throw new IllegalArgumentException("Negative value cannot be ABI-encoded as uint256");
        }
        return padWord(unsigned.toString(16));
    }

    public static String strip0x(String value) {
        return value != null && value.startsWith("0x") ? value.substring(2) : value;
    }

    public static String encode(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }
}
