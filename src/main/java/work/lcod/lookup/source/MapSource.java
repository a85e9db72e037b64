package work.lcod.lookup.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-memory key/value source, usually the last one in a sequence to hold defaults.
 */
public final class MapSource implements Source {
    private final Map<String, String> values;

    public MapSource(Map<String, String> values) {
        this.values = values == null || values.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static MapSource of(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must hold key/value pairs");
        }
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return new MapSource(map);
    }

    public Map<String, String> values() {
        return values;
    }

    @Override
    public LookupResult lookup(String key) {
        String value = values.get(key);
        return value == null ? LookupResult.absent() : LookupResult.found(value);
    }

    @Override
    public String toString() {
        return "map" + values.keySet();
    }
}
