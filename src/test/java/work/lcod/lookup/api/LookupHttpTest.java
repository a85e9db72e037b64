package work.lcod.lookup.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.lookup.record.LookupKey;
import work.lcod.lookup.report.MapReporter;
import work.lcod.lookup.source.FormSource;
import work.lcod.lookup.source.JsonRequestSource;
import work.lcod.lookup.source.MapSource;
import work.lcod.lookup.source.Source;

class LookupHttpTest {
    static class Query {
        @LookupKey("q")
        String text;

        @LookupKey("limit,optional")
        int limit = 10;

        @JsonProperty("verbose,omitempty")
        boolean verbose;
    }

    private HttpServer server;
    private HttpClient client;

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/form", exchange -> respond(exchange, FormSource.fromExchange(exchange)));
        server.createContext("/json", exchange -> respond(exchange, JsonRequestSource.fromExchange(exchange)));
        server.start();
        client = HttpClient.newHttpClient();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    @Test
    void queryParametersPopulateRecord() throws Exception {
        assertEquals("200 q=lorem limit=3 verbose=true", get("/form?q=lorem&limit=3&verbose"));
        assertEquals("200 q=lorem limit=10 verbose=false", get("/form?q=lorem"));
    }

    @Test
    void formBodyOverridesQuery() throws Exception {
        var request = HttpRequest.newBuilder(uri("/form?q=query&limit=1"))
            .header("Content-Type", "application/x-www-form-urlencoded; charset=UTF-8")
            .POST(HttpRequest.BodyPublishers.ofString("q=body+text"))
            .build();

        assertEquals("200 q=body text limit=1 verbose=false", send(request));
    }

    @Test
    void jsonBodyPopulateRecord() throws Exception {
        var request = HttpRequest.newBuilder(uri("/json"))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString("{\"q\":\"json\",\"limit\":5,\"verbose\":true}"))
            .build();

        assertEquals("200 q=json limit=5 verbose=true", send(request));
    }

    @Test
    void failuresMapToBadRequest() throws Exception {
        assertEquals("400 type_coercion_failed", get("/form?q=x&limit=many"));

        var broken = HttpRequest.newBuilder(uri("/json"))
            .POST(HttpRequest.BodyPublishers.ofString("{not json"))
            .build();
        assertEquals("400 missing_required_field", send(broken));
    }

    private static void respond(HttpExchange exchange, Source request) throws IOException {
        var defaults = MapSource.of("verbose", "false");
        int status;
        String body;
        try {
            var query = Lookup.load(new Query(), new MapReporter(), request, defaults);
            status = 200;
            body = "q=" + query.text + " limit=" + query.limit + " verbose=" + query.verbose;
        } catch (LookupException ex) {
            status = 400;
            body = ex.kind().name().toLowerCase(Locale.ROOT);
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (var out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private String get(String path) throws Exception {
        return send(HttpRequest.newBuilder(uri(path)).GET().build());
    }

    private String send(HttpRequest request) throws Exception {
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        return response.statusCode() + " " + response.body();
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
    }
}
