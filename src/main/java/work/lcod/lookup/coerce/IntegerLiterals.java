package work.lcod.lookup.coerce;

import java.math.BigInteger;

/**
 * Parses integer literals with an optional sign and base prefix ({@code 0x}, {@code 0o},
 * {@code 0b}, or a leading {@code 0} for octal). Underscores may separate digits.
 */
final class IntegerLiterals {
    private IntegerLiterals() {}

    /**
     * Returns the value as a {@code long}; unsigned 64-bit values above {@link Long#MAX_VALUE} come
     * back in two's complement.
     */
    static long parse(String token, int bits, boolean unsigned) {
        String text = token;
        boolean negative = false;
        if (!text.isEmpty() && (text.charAt(0) == '+' || text.charAt(0) == '-')) {
            negative = text.charAt(0) == '-';
            text = text.substring(1);
        }
        if (negative && unsigned) {
            throw new IllegalArgumentException("invalid syntax: unsigned value cannot be negative");
        }

        int radix = 10;
        boolean prefixed = false;
        if (text.length() > 1 && text.charAt(0) == '0') {
            char marker = Character.toLowerCase(text.charAt(1));
            prefixed = true;
            switch (marker) {
                case 'x' -> {
                    radix = 16;
                    text = text.substring(2);
                }
                case 'b' -> {
                    radix = 2;
                    text = text.substring(2);
                }
                case 'o' -> {
                    radix = 8;
                    text = text.substring(2);
                }
                default -> {
                    radix = 8;
                    text = text.substring(1);
                }
            }
        }

        String digits = stripUnderscores(text, prefixed);
        if (digits.isEmpty()) {
            throw new IllegalArgumentException("invalid syntax");
        }
        for (int i = 0; i < digits.length(); i++) {
            char ch = digits.charAt(i);
            if (ch > 0x7f || Character.digit(ch, radix) < 0) {
                throw new IllegalArgumentException("invalid syntax: unexpected '" + ch + "' in base " + radix);
            }
        }

        BigInteger value = new BigInteger(digits, radix);
        if (negative) {
            value = value.negate();
        }
        BigInteger min = unsigned ? BigInteger.ZERO : BigInteger.ONE.shiftLeft(bits - 1).negate();
        BigInteger max = unsigned
            ? BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE)
            : BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
        if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
            throw new IllegalArgumentException("value out of range for " + (unsigned ? "uint" : "int") + bits);
        }
        return value.longValue();
    }

    private static String stripUnderscores(String text, boolean prefixed) {
        if (text.indexOf('_') < 0) {
            return text;
        }
        if (text.endsWith("_") || text.contains("__") || (!prefixed && text.startsWith("_"))) {
            throw new IllegalArgumentException("invalid syntax: misplaced '_'");
        }
        return text.replace("_", "");
    }
}
