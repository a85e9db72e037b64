package work.lcod.lookup.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;

/**
 * Base class for sources answering from the top-level object of a parsed document.
 *
 * <p>The document is loaded on first lookup, once per instance. If loading fails the same failure
 * is returned by every later lookup; the document is never read again.
 */
public abstract class DocumentSource implements Source {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Object lock = new Object();
    private Map<String, Object> data;
    private Exception failure;

    /**
     * Reads the document. Returning {@code null} is the same as an empty document.
     */
    protected abstract Map<String, Object> load() throws IOException;

    @Override
    public final LookupResult lookup(String key) {
        Map<String, Object> document;
        synchronized (lock) {
            if (data == null && failure == null) {
                try {
                    Map<String, Object> loaded = load();
                    data = loaded == null ? Map.of() : loaded;
                } catch (IOException | RuntimeException ex) {
                    failure = ex;
                }
            }
            if (failure != null) {
                return LookupResult.failed(failure);
            }
            document = data;
        }
        Object value = document.get(key);
        if (value == null) {
            return LookupResult.absent();
        }
        return LookupResult.found(render(value));
    }

    /**
     * Scalars use {@link String#valueOf(Object)}; arrays and objects become compact JSON.
     * Floating point numbers without a fractional part drop it ({@code 8080.0} and {@code 1e3}
     * read as {@code 8080} and {@code 1000}) so they can fill integral fields.
     */
    static String render(Object value) {
        if (value instanceof Double number && isIntegral(number)) {
            return BigDecimal.valueOf(number).toBigInteger().toString();
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            try {
                return JSON.writeValueAsString(value);
            } catch (JsonProcessingException ex) {
                throw new IllegalStateException("Unable to render document value: " + ex.getOriginalMessage(), ex);
            }
        }
        return String.valueOf(value);
    }

    private static boolean isIntegral(double number) {
        return !Double.isInfinite(number) && number == Math.rint(number) && Math.abs(number) < 1e21;
    }
}
