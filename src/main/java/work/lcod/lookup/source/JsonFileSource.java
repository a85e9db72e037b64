package work.lcod.lookup.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Reads keys from a JSON (or YAML) file holding a single object. The file is loaded only once.
 */
public final class JsonFileSource extends DocumentSource {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private final Path path;
    private final ObjectMapper mapper;

    private JsonFileSource(Path path, ObjectMapper mapper) {
        this.path = Objects.requireNonNull(path, "path");
        this.mapper = mapper;
    }

    public static JsonFileSource json(Path path) {
        return new JsonFileSource(path, JSON_MAPPER);
    }

    public static JsonFileSource yaml(Path path) {
        return new JsonFileSource(path, YAML_MAPPER);
    }

    public Path path() {
        return path;
    }

    @Override
    protected Map<String, Object> load() throws IOException {
        try (var in = Files.newInputStream(path)) {
            return mapper.readValue(in, MAP_REF);
        }
    }

    @Override
    public String toString() {
        return "file:" + path;
    }
}
