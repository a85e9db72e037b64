package work.lcod.lookup.source;

import java.io.IOException;
import java.nio.file.Path;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads top-level keys from a TOML file. The file is parsed only once.
 */
public final class TomlFileSource extends DocumentSource {
    private final Path path;

    public TomlFileSource(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    public Path path() {
        return path;
    }

    @Override
    protected Map<String, Object> load() throws IOException {
        TomlParseResult result = Toml.parse(path);
        if (result.hasErrors()) {
            throw new IOException("toml parse error in " + path + ": " + result.errors().get(0));
        }
        return convertTable(result);
    }

    private static Map<String, Object> convertTable(TomlTable table) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            map.put(key, convertValue(table.get(List.of(key))));
        }
        return map;
    }

    private static Object convertValue(Object value) {
        if (value instanceof TomlTable table) {
            return convertTable(table);
        }
        if (value instanceof TomlArray array) {
            List<Object> list = new ArrayList<>();
            for (int i = 0; i < array.size(); i++) {
                list.add(convertValue(array.get(i)));
            }
            return list;
        }
        if (value instanceof TemporalAccessor temporal) {
            return temporal.toString();
        }
        return value;
    }

    @Override
    public String toString() {
        return "toml:" + path;
    }
}
