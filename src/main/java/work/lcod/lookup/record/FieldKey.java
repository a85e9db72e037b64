package work.lcod.lookup.record;

import java.util.Objects;

/**
 * Lookup key of a field and whether a missing value is acceptable.
 */
public record FieldKey(String key, boolean optional) {
    public FieldKey {
        Objects.requireNonNull(key, "key");
    }
}
