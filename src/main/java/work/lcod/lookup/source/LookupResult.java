package work.lcod.lookup.source;

/**
 * Outcome of a single-key lookup: the raw value, whether the key was found, and
 * the failure (if any) that prevented the source from answering.
 */
public record LookupResult(String value, boolean found, Exception error) {
    private static final LookupResult ABSENT = new LookupResult("", false, null);

    public LookupResult {
        value = value == null ? "" : value;
    }

    public static LookupResult found(String value) {
        return new LookupResult(value, true, null);
    }

    public static LookupResult absent() {
        return ABSENT;
    }

    public static LookupResult absent(String value) {
        return new LookupResult(value, false, null);
    }

    public static LookupResult failed(Exception error) {
        return new LookupResult("", false, error);
    }

    public boolean failed() {
        return error != null;
    }

    /** True when the key was found and the source did not fail. */
    public boolean hit() {
        return found && error == null;
    }
}
