package work.lcod.lookup.runtime;

import java.util.List;
import work.lcod.lookup.source.LookupResult;
import work.lcod.lookup.source.Source;

/**
 * Queries sources in priority order and answers with the first hit.
 *
 * <p>Failures and misses of earlier sources are absorbed: only the last source's result is
 * returned verbatim when nothing hits, so a broken optional file does not hide a default.
 */
public final class SourceSequence {
    static final String DEBUG_PROPERTY = "lcod.lookup.debug";

    private final List<Source> sources;

    public SourceSequence(List<? extends Source> sources) {
        this.sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public List<Source> sources() {
        return sources;
    }

    public LookupResult resolve(String key) {
        LookupResult result = LookupResult.absent();
        for (int i = 0; i < sources.size(); i++) {
            Source source = sources.get(i);
            result = query(source, key);
            if (result.hit()) {
                return result;
            }
            if (result.failed() && i < sources.size() - 1 && Boolean.getBoolean(DEBUG_PROPERTY)) {
                System.err.printf("lookup: %s failed for %s, trying next source: %s%n", source, key, result.error().getMessage());
            }
        }
        return result;
    }

    private static LookupResult query(Source source, String key) {
        try {
            LookupResult result = source.lookup(key);
            return result == null ? LookupResult.absent() : result;
        } catch (RuntimeException ex) {
            return LookupResult.failed(ex);
        }
    }
}
