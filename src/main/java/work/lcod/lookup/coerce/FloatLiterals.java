package work.lcod.lookup.coerce;

import java.util.Locale;

/**
 * Parses decimal and hexadecimal floating point literals plus {@code inf}, {@code infinity} and
 * {@code nan} in any case. Java type suffixes ({@code 1.5f}, {@code 2d}) are rejected.
 */
final class FloatLiterals {
    private FloatLiterals() {}

    static double parse(String token, int bits) {
        if (token.isEmpty()) {
            throw new IllegalArgumentException("invalid syntax");
        }
        String lower = token.toLowerCase(Locale.ROOT);
        String unsignedText = lower.startsWith("+") || lower.startsWith("-") ? lower.substring(1) : lower;
        boolean negative = lower.startsWith("-");
        if (unsignedText.equals("inf") || unsignedText.equals("infinity")) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (unsignedText.equals("nan")) {
            return Double.NaN;
        }

        char last = lower.charAt(lower.length() - 1);
        if (last == 'f' || last == 'd' || lower.indexOf('_') >= 0 || unsignedText.startsWith("infinity") || unsignedText.startsWith("nan")) {
            throw new IllegalArgumentException("invalid syntax");
        }

        double value;
        try {
            value = Double.parseDouble(token);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("invalid syntax", ex);
        }
        if (Double.isInfinite(value) || (bits == 32 && Float.isInfinite((float) value))) {
            throw new IllegalArgumentException("value out of range for float" + bits);
        }
        return value;
    }
}
