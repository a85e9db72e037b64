package work.lcod.lookup.report;

/**
 * Observes every field that reaches a terminal state during a lookup pass: either set from a
 * source, or left untouched because it is optional and no source had it.
 */
@FunctionalInterface
public interface Reporter {
    void report(String key, Object value);
}
