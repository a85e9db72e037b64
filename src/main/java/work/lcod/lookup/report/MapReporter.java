package work.lcod.lookup.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.lookup.source.MapSource;

/**
 * Accumulates entries as key to string form, in report order. The result can serve as the
 * defaults of a later lookup.
 */
public final class MapReporter implements Reporter {
    private final Map<String, String> entries = Collections.synchronizedMap(new LinkedHashMap<>());

    @Override
    public void report(String key, Object value) {
        entries.put(key, Reporters.render(value));
    }

    public Map<String, String> asMap() {
        synchronized (entries) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }

    public MapSource asSource() {
        return new MapSource(asMap());
    }
}
