package work.lcod.lookup.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.lookup.api.Lookup;
import work.lcod.lookup.record.FieldDescriptor;
import work.lcod.lookup.record.FieldKeyExtractor;
import work.lcod.lookup.record.FieldTags;
import work.lcod.lookup.record.RecordSchema;
import work.lcod.lookup.record.TagSystem;
import work.lcod.lookup.report.MapReporter;
import work.lcod.lookup.report.PrintReporter;
import work.lcod.lookup.report.RedactingReporter;
import work.lcod.lookup.report.Reporter;
import work.lcod.lookup.source.ArgsSource;
import work.lcod.lookup.source.Source;
import work.lcod.lookup.source.Sources;

@CommandLine.Command(
    name = "lcod-lookup",
    description = "Resolve configuration keys from arguments, environment, documents and defaults.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class LookupCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    enum Format {
        TEXT,
        JSON
    }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-k", "--key"},
        required = true,
        paramLabel = "KEY[,optional]",
        description = "Key to resolve; append ',optional' when it may be missing."
    )
    private List<String> keys = new ArrayList<>();

    @CommandLine.Option(names = "--json", paramLabel = "FILE", description = "JSON document consulted after the environment.")
    private List<Path> jsonFiles = new ArrayList<>();

    @CommandLine.Option(names = "--yaml", paramLabel = "FILE", description = "YAML document consulted after JSON documents.")
    private List<Path> yamlFiles = new ArrayList<>();

    @CommandLine.Option(names = "--toml", paramLabel = "FILE", description = "TOML document consulted after YAML documents.")
    private List<Path> tomlFiles = new ArrayList<>();

    @CommandLine.Option(
        names = {"-D", "--default"},
        paramLabel = "KEY=VALUE",
        description = "Default value, consulted last."
    )
    private Map<String, String> defaults = new LinkedHashMap<>();

    @CommandLine.Option(names = "--arg-prefix", defaultValue = "-", description = "Prefix of KEY=VALUE arguments.")
    private String argPrefix;

    @CommandLine.Option(names = "--no-env", description = "Do not consult environment variables.")
    private boolean noEnv;

    @CommandLine.Option(
        names = "--redact",
        paramLabel = "REGEX",
        description = "Hide values of keys matching this pattern.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String redact;

    @CommandLine.Option(names = "--prefix", defaultValue = "", description = "Prefix of each text output line.")
    private String prefix;

    @CommandLine.Option(names = "--format", defaultValue = "text", description = "Output format (text|json).")
    private Format format;

    @CommandLine.Parameters(
        paramLabel = "ARG",
        description = "Arguments scanned for <prefix>KEY=VALUE; they take precedence over every other source."
    )
    private List<String> args = new ArrayList<>();

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        ArgsSource argsSource = Sources.args(argPrefix, args);
        List<Source> sources = buildSources(argsSource);

        MapReporter collected = new MapReporter();
        Reporter reporter = format == Format.JSON ? collected : new PrintReporter(out, prefix);
        if (redact != null && !redact.isBlank()) {
            reporter = new RedactingReporter(reporter, redact);
        }

        Map<String, Object> values = new LinkedHashMap<>();
        Lookup.builder()
            .sources(sources)
            .reporter(reporter)
            .build()
            .populate(values, schema());

        if (format == Format.JSON) {
            out.println(JSON_WRITER.writeValueAsString(collected.asMap()));
        }
        out.flush();
        if (!argsSource.extraArgs().isEmpty()) {
            spec.commandLine().getErr().printf("Ignoring arguments without prefix '%s': %s%n", argPrefix, argsSource.extraArgs());
        }
        return 0;
    }

    private List<Source> buildSources(ArgsSource argsSource) {
        List<Source> sources = new ArrayList<>();
        sources.add(argsSource);
        if (!noEnv) {
            sources.add(Sources.env());
        }
        sources.add(Sources.systemProperties());
        jsonFiles.forEach(path -> sources.add(Sources.jsonFile(path)));
        yamlFiles.forEach(path -> sources.add(Sources.yamlFile(path)));
        tomlFiles.forEach(path -> sources.add(Sources.tomlFile(path)));
        sources.add(Sources.map(defaults));
        return sources;
    }

    private RecordSchema schema() {
        RecordSchema.Builder builder = RecordSchema.builder(Map.class);
        for (String key : keys) {
            FieldTags tags = FieldTags.of(TagSystem.LOOKUP, key);
            String name = FieldKeyExtractor.extract("value", tags).orElseThrow().key();
            builder.field(name, String.class, tags, mapEntry(name));
        }
        return builder.build();
    }

    private static FieldDescriptor.FieldAccessor mapEntry(String name) {
        return new FieldDescriptor.FieldAccessor() {
            @Override
            public Object get(Object record) {
                return ((Map<?, ?>) record).get(name);
            }

            @Override
            @SuppressWarnings("unchecked")
            public void set(Object record, Object value) {
                ((Map<String, Object>) record).put(name, value);
            }
        };
    }
}
