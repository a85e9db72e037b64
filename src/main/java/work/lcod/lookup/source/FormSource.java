package work.lcod.lookup.source;

import com.sun.net.httpserver.HttpExchange;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads keys from HTTP form data: the URL query plus an {@code application/x-www-form-urlencoded}
 * body. Body values take precedence over query values.
 *
 * <p>A key present with only empty values (e.g. {@code ?debug} or {@code ?debug=}) reads as
 * {@code "1"}.
 */
public final class FormSource implements Source {
    static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";
    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");

    private final String rawQuery;
    private final String contentType;
    private final InputStream body;
    private final Object lock = new Object();

    private Map<String, List<String>> form;
    private Exception failure;

    private FormSource(String rawQuery, String contentType, InputStream body) {
        this.rawQuery = rawQuery == null ? "" : rawQuery;
        this.contentType = contentType;
        this.body = body;
    }

    public static FormSource ofQuery(String rawQuery) {
        return new FormSource(rawQuery, null, null);
    }

    public static FormSource of(String rawQuery, String contentType, InputStream body) {
        return new FormSource(rawQuery, contentType, body);
    }

    public static FormSource fromExchange(HttpExchange exchange) {
        String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
        InputStream body = BODY_METHODS.contains(method) ? exchange.getRequestBody() : null;
        return new FormSource(
            exchange.getRequestURI().getRawQuery(),
            exchange.getRequestHeaders().getFirst("Content-Type"),
            body
        );
    }

    @Override
    public LookupResult lookup(String key) {
        Map<String, List<String>> values;
        synchronized (lock) {
            if (form == null && failure == null) {
                try {
                    form = parseForm();
                } catch (IllegalArgumentException | UncheckedIOException ex) {
                    failure = new IllegalStateException("form parse failed: " + ex.getMessage(), ex);
                }
            }
            if (failure != null) {
                return LookupResult.failed(failure);
            }
            values = form;
        }
        List<String> entries = values.get(key);
        if (entries == null) {
            return LookupResult.absent();
        }
        for (String entry : entries) {
            if (!entry.isEmpty()) {
                return LookupResult.found(entry);
            }
        }
        return LookupResult.found("1");
    }

    private Map<String, List<String>> parseForm() {
        Map<String, List<String>> parsed = new LinkedHashMap<>();
        if (body != null && isFormContent(contentType)) {
            try (body) {
                parseInto(new String(body.readAllBytes(), StandardCharsets.UTF_8), parsed);
            } catch (IOException ex) {
                throw new UncheckedIOException("unable to read request body", ex);
            }
        }
        parseInto(rawQuery, parsed);
        return parsed;
    }

    private static boolean isFormContent(String contentType) {
        if (contentType == null) {
            return false;
        }
        int separator = contentType.indexOf(';');
        String mediaType = separator >= 0 ? contentType.substring(0, separator) : contentType;
        return FORM_CONTENT_TYPE.equals(mediaType.trim().toLowerCase(Locale.ROOT));
    }

    static void parseInto(String encoded, Map<String, List<String>> target) {
        if (encoded == null || encoded.isEmpty()) {
            return;
        }
        for (String pair : encoded.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            target.computeIfAbsent(decode(name), k -> new ArrayList<>()).add(decode(value));
        }
    }

    private static String decode(String raw) {
        return URLDecoder.decode(raw, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "form";
    }
}
