package com.elara.kconfig;

import java.math.BigInteger;

/**
 * Integer parsing and formatting for int/hex values.
 *
 * Accepted forms: optional surrounding whitespace, optional sign, and for
 * base 16 an optional 0x prefix. Base 0 infers the base from a 0x/0o/0b
 * prefix and otherwise requires a plain decimal without leading zeros.
 */
final class Numbers {

    private Numbers() {}

    static boolean isBaseN(String s, int base) {
        return parse(s, base) != null;
    }

    /** Returns the parsed number, or null if {@code s} is not a number in {@code base}. */
    static BigInteger parse(String s, int base) {
        if (s == null) return null;
        String t = s.strip();
        if (t.isEmpty()) return null;

        boolean negative = false;
        if (t.charAt(0) == '+' || t.charAt(0) == '-') {
            negative = t.charAt(0) == '-';
            t = t.substring(1);
        }

        int radix = base;
        if (base == 0) {
            if (hasPrefix(t, 'x')) {
                radix = 16;
                t = t.substring(2);
            } else if (hasPrefix(t, 'o')) {
                radix = 8;
                t = t.substring(2);
            } else if (hasPrefix(t, 'b')) {
                radix = 2;
                t = t.substring(2);
            } else {
                radix = 10;
                if (t.length() > 1 && t.charAt(0) == '0' && !allZeros(t)) return null;
            }
        } else if (base == 16 && hasPrefix(t, 'x')) {
            t = t.substring(2);
        }

        if (t.isEmpty()) return null;
        for (int i = 0; i < t.length(); i++) {
            if (Character.digit(t.charAt(i), radix) < 0) return null;
        }
        BigInteger v = new BigInteger(t, radix);
        return negative ? v.negate() : v;
    }

    /** Canonical rendering: decimal for int, lowercase 0x-prefixed for hex. */
    static String format(BigInteger v, SymbolType type) {
        if (type != SymbolType.HEX) return v.toString();
        return v.signum() < 0 ? "-0x" + v.negate().toString(16) : "0x" + v.toString(16);
    }

    private static boolean hasPrefix(String t, char marker) {
        return t.length() >= 2 && t.charAt(0) == '0' && Character.toLowerCase(t.charAt(1)) == marker;
    }

    private static boolean allZeros(String t) {
        for (int i = 0; i < t.length(); i++) {
            if (t.charAt(i) != '0') return false;
        }
        return true;
    }
}
