package work.lcod.lookup.runtime;

import java.util.Objects;
import java.util.Optional;
import work.lcod.lookup.api.LookupException;
import work.lcod.lookup.coerce.TypeCoercer;
import work.lcod.lookup.record.FieldDescriptor;
import work.lcod.lookup.record.FieldKey;
import work.lcod.lookup.record.FieldKeyExtractor;
import work.lcod.lookup.record.FieldType;
import work.lcod.lookup.record.RecordSchema;
import work.lcod.lookup.record.RecordSchemas;
import work.lcod.lookup.report.Reporter;
import work.lcod.lookup.source.LookupResult;

/**
 * Resolves every tagged field of a record in declaration order.
 *
 * <p>Per field: extract the key, look it up through the {@link SourceSequence}, then either coerce
 * and set the value, or leave an optional field untouched. Each field that reaches one of those
 * two outcomes is reported once. The first failure aborts the pass; fields set before it stay set.
 */
public final class RecordResolver {
    private final SourceSequence sources;
    private final TypeCoercer coercer;
    private final Reporter reporter;

    public RecordResolver(SourceSequence sources, TypeCoercer coercer, Reporter reporter) {
        this.sources = Objects.requireNonNull(sources, "sources");
        this.coercer = Objects.requireNonNull(coercer, "coercer");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    public void resolve(Object record) {
        if (record == null) {
            throw LookupException.invalidRecord("lookup needs a non-null record", null);
        }
        RecordSchema schema;
        try {
            schema = RecordSchemas.of(record.getClass());
        } catch (IllegalArgumentException ex) {
            throw LookupException.invalidRecord(ex.getMessage(), ex);
        }
        resolve(record, schema);
    }

    public void resolve(Object record, RecordSchema schema) {
        if (record == null) {
            throw LookupException.invalidRecord("lookup needs a non-null record", null);
        }
        if (!schema.accepts(record)) {
            throw LookupException.invalidRecord(
                "schema for " + schema.recordType().getName() + " cannot populate " + record.getClass().getName(),
                null
            );
        }
        for (FieldDescriptor field : schema.fields()) {
            resolveField(record, field);
        }
    }

    private void resolveField(Object record, FieldDescriptor field) {
        Optional<FieldKey> extracted = FieldKeyExtractor.extract(field);
        if (extracted.isEmpty()) {
            return;
        }
        FieldKey fieldKey = extracted.get();

        LookupResult result = sources.resolve(fieldKey.key());
        if (result.failed()) {
            throw LookupException.sourceFailed(field.name(), result.error());
        }
        if (!result.found()) {
            if (!fieldKey.optional()) {
                throw LookupException.missingRequired(field.name(), fieldKey.key());
            }
            reporter.report(fieldKey.key(), result.value());
            return;
        }

        Object value;
        try {
            value = coercer.coerce(result.value(), field);
        } catch (IllegalArgumentException ex) {
            throw LookupException.coercionFailed(field.name(), result.value(), typeName(field), ex);
        }
        field.set(record, value);
        reporter.report(fieldKey.key(), reported(field.type(), value));
    }

    /**
     * Unsigned kinds are stored in two's complement; report them the way they were configured so
     * the output reads back into the same field.
     */
    static Object reported(FieldType type, Object value) {
        if (!type.unsigned() || !(value instanceof Number number)) {
            return value;
        }
        return switch (type) {
            case UINT8 -> Byte.toUnsignedInt(number.byteValue());
            case UINT16 -> Short.toUnsignedInt(number.shortValue());
            case UINT32 -> Integer.toUnsignedLong(number.intValue());
            default -> Long.toUnsignedString(number.longValue());
        };
    }

    private static String typeName(FieldDescriptor field) {
        return field.type() == FieldType.CUSTOM ? field.javaType().getSimpleName() : field.type().displayName();
    }
}
