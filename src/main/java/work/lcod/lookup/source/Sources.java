package work.lcod.lookup.source;

import com.sun.net.httpserver.HttpExchange;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Factories for the standard sources and adapters for plain lookup functions.
 */
public final class Sources {
    private static final Source SYSTEM_PROPERTIES = noError(key -> Optional.ofNullable(System.getProperty(key)));

    private Sources() {}

    public static Source env() {
        return EnvSource.system();
    }

    public static Source env(Map<String, String> variables) {
        Map<String, String> copy = Map.copyOf(variables);
        return new EnvSource(copy::get);
    }

    public static Source env(Function<String, String> variables) {
        return new EnvSource(variables);
    }

    public static Source systemProperties() {
        return SYSTEM_PROPERTIES;
    }

    public static MapSource map(Map<String, String> defaults) {
        return new MapSource(defaults);
    }

    public static ArgsSource args(String prefix, String... args) {
        return new ArgsSource(prefix, List.of(args));
    }

    public static ArgsSource args(String prefix, List<String> args) {
        return new ArgsSource(prefix, args);
    }

    public static JsonFileSource jsonFile(Path path) {
        return JsonFileSource.json(path);
    }

    public static JsonFileSource yamlFile(Path path) {
        return JsonFileSource.yaml(path);
    }

    public static TomlFileSource tomlFile(Path path) {
        return new TomlFileSource(path);
    }

    public static JsonRequestSource jsonRequest(InputStream body) {
        return new JsonRequestSource(body);
    }

    public static FormSource form(HttpExchange exchange) {
        return FormSource.fromExchange(exchange);
    }

    /**
     * Adapts a lookup that cannot fail, such as {@code Map::get} wrapped in an {@link Optional}.
     */
    public static Source noError(Function<String, Optional<String>> lookup) {
        Objects.requireNonNull(lookup, "lookup");
        return key -> lookup.apply(key)
            .map(LookupResult::found)
            .orElseGet(LookupResult::absent);
    }

    /**
     * Adapts a lookup that returns a value or throws. A key is found iff the call did not throw.
     */
    public static Source noBool(ThrowingLookup lookup) {
        Objects.requireNonNull(lookup, "lookup");
        return key -> {
            try {
                return LookupResult.found(lookup.apply(key));
            } catch (Exception ex) {
                return LookupResult.failed(ex);
            }
        };
    }

    @FunctionalInterface
    public interface ThrowingLookup {
        String apply(String key) throws Exception;
    }
}
