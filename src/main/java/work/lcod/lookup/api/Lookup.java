package work.lcod.lookup.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.lcod.lookup.coerce.TokenParser;
import work.lcod.lookup.coerce.TypeCoercer;
import work.lcod.lookup.record.RecordSchema;
import work.lcod.lookup.report.Reporter;
import work.lcod.lookup.report.Reporters;
import work.lcod.lookup.runtime.RecordResolver;
import work.lcod.lookup.runtime.SourceSequence;
import work.lcod.lookup.source.LookupResult;
import work.lcod.lookup.source.Source;

/**
 * Public entry point: fills the annotated fields of a configuration object from a prioritized
 * list of sources.
 *
 * <pre>{@code
 * var args = Sources.args("-", argv);
 * var config = Lookup.builder()
 *     .source(args)
 *     .source(Sources.env())
 *     .source(Sources.jsonFile(Path.of("/etc/my-server.json")))
 *     .source(Sources.map(Map.of("PORT", "8080")))
 *     .reporter(new PrintReporter(System.err, "config: "))
 *     .build()
 *     .populate(new ServerConfig());
 * }</pre>
 *
 * Instances are immutable and may be shared between threads.
 */
public final class Lookup {
    private final SourceSequence sources;
    private final RecordResolver resolver;

    private Lookup(List<Source> sources, Reporter reporter, TypeCoercer coercer) {
        this.sources = new SourceSequence(sources);
        this.resolver = new RecordResolver(this.sources, coercer, reporter);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * One-shot form of {@code builder().sources(sources).reporter(reporter).build().populate(record)}.
     * {@code reporter} may be null.
     */
    public static <T> T load(T record, Reporter reporter, Source... sources) {
        return builder()
            .sources(List.of(sources))
            .reporter(reporter)
            .build()
            .populate(record);
    }

    /**
     * Resolves every annotated field of {@code record} in place and returns it.
     *
     * @throws LookupException on the first field that cannot be resolved
     */
    public <T> T populate(T record) {
        resolver.resolve(record);
        return record;
    }

    /**
     * Same as {@link #populate(Object)} with an explicit schema instead of annotations.
     */
    public <T> T populate(T record, RecordSchema schema) {
        Objects.requireNonNull(schema, "schema");
        resolver.resolve(record, schema);
        return record;
    }

    /**
     * Looks up a single key through the configured sources.
     */
    public LookupResult lookupKey(String key) {
        return sources.resolve(key);
    }

    public List<Source> sources() {
        return sources.sources();
    }

    public static final class Builder {
        private final List<Source> sources = new ArrayList<>();
        private Reporter reporter = Reporters.discard();
        private final TypeCoercer.Builder coercer = TypeCoercer.builder();

        private Builder() {}

        public Builder source(Source source) {
            sources.add(Objects.requireNonNull(source, "source"));
            return this;
        }

        public Builder sources(List<? extends Source> additional) {
            additional.forEach(this::source);
            return this;
        }

        public Builder reporter(Reporter reporter) {
            this.reporter = reporter == null ? Reporters.discard() : reporter;
            return this;
        }

        public <T> Builder parser(Class<T> type, TokenParser<? extends T> parser) {
            coercer.register(type, parser);
            return this;
        }

        public Lookup build() {
            return new Lookup(sources, reporter, coercer.build());
        }
    }
}
