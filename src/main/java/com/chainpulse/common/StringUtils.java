package com.chainpulse.common;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Small helpers for address and hex handling shared across modules.
 */
public final class StringUtils {

    private StringUtils() {
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /** Lower-cases an EVM address; null stays null. */
    public static String normalizeAddress(String address) {
        return address == null ? null : address.strip().toLowerCase(Locale.ROOT);
    }

    /** Parses a 0x-prefixed hex quantity; returns null for null or blank input. */
    public static BigInteger parseHexQuantity(String hex) {
        if (hex == null || hex.isBlank()) {
            return null;
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.isEmpty()) {
            return BigInteger.ZERO;
        }
        return new BigInteger(digits, 16);
    }

    public static String toHexQuantity(long value) {
        return "0x" + Long.toHexString(value);
    }
}
