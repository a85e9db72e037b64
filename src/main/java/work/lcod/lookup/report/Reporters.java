package work.lcod.lookup.report;

import java.util.Base64;
import java.util.List;

/**
 * Standard reporter combinators.
 */
public final class Reporters {
    private static final Reporter DISCARD = (key, value) -> {};

    private Reporters() {}

    public static Reporter discard() {
        return DISCARD;
    }

    /**
     * Forwards every entry to each reporter, in order.
     */
    public static Reporter fanOut(Reporter... reporters) {
        List<Reporter> targets = List.of(reporters);
        return (key, value) -> {
            for (Reporter target : targets) {
                target.report(key, value);
            }
        };
    }

    public static Reporter redacting(Reporter delegate, String keyRegex) {
        return new RedactingReporter(delegate, keyRegex);
    }

    /**
     * String form of a reported value: {@code ""} for null, base64 for byte arrays, otherwise
     * {@link String#valueOf(Object)}. Byte arrays and complex values render in the format they
     * are read back from.
     */
    public static String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        return String.valueOf(value);
    }
}
