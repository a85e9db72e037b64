package work.lcod.lookup.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Objects;

/**
 * Reads keys from a JSON request body. The body is consumed and closed on the first lookup.
 */
public final class JsonRequestSource extends DocumentSource {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private final InputStream body;

    public JsonRequestSource(InputStream body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    public static JsonRequestSource fromExchange(HttpExchange exchange) {
        return new JsonRequestSource(exchange.getRequestBody());
    }

    @Override
    protected Map<String, Object> load() throws IOException {
        try (body) {
            return JSON.readValue(body, MAP_REF);
        }
    }

    @Override
    public String toString() {
        return "json-request";
    }
}
