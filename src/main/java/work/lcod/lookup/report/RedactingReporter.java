package work.lcod.lookup.report;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Forwards entries as their string form, hiding the values of keys that match a pattern.
 * Hidden values are replaced by {@code "(empty)"} or {@code "(not empty)"}.
 */
public final class RedactingReporter implements Reporter {
    static final String EMPTY = "(empty)";
    static final String NOT_EMPTY = "(not empty)";

    private final Reporter delegate;
    private final Pattern secretKeys;

    public RedactingReporter(Reporter delegate, Pattern secretKeys) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.secretKeys = Objects.requireNonNull(secretKeys, "secretKeys");
    }

    public RedactingReporter(Reporter delegate, String secretKeysRegex) {
        this(delegate, Pattern.compile(secretKeysRegex));
    }

    @Override
    public void report(String key, Object value) {
        String text = Reporters.render(value);
        if (secretKeys.matcher(key).find()) {
            text = text.isEmpty() ? EMPTY : NOT_EMPTY;
        }
        delegate.report(key, text);
    }
}
