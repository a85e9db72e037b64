package work.lcod.lookup.record;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered field list of a record type. Build one with {@link #builder(Class)} or let
 * {@link RecordSchemas#of(Class)} derive it from annotations.
 */
public final class RecordSchema {
    private final Class<?> recordType;
    private final List<FieldDescriptor> fields;

    private RecordSchema(Class<?> recordType, List<FieldDescriptor> fields) {
        this.recordType = recordType;
        this.fields = List.copyOf(fields);
    }

    public static Builder builder(Class<?> recordType) {
        return new Builder(recordType);
    }

    public Class<?> recordType() {
        return recordType;
    }

    public List<FieldDescriptor> fields() {
        return fields;
    }

    public boolean accepts(Object record) {
        return recordType.isInstance(record);
    }

    public static final class Builder {
        private final Class<?> recordType;
        private final List<FieldDescriptor> fields = new ArrayList<>();

        private Builder(Class<?> recordType) {
            this.recordType = Objects.requireNonNull(recordType, "recordType");
        }

        public Builder field(FieldDescriptor field) {
            fields.add(Objects.requireNonNull(field, "field"));
            return this;
        }

        public Builder field(String name, Class<?> javaType, FieldTags tags, FieldDescriptor.FieldAccessor accessor) {
            return field(new FieldDescriptor(name, javaType, FieldType.of(javaType, false), tags, accessor));
        }

        public Builder unsignedField(String name, Class<?> javaType, FieldTags tags, FieldDescriptor.FieldAccessor accessor) {
            return field(new FieldDescriptor(name, javaType, FieldType.of(javaType, true), tags, accessor));
        }

        public RecordSchema build() {
            return new RecordSchema(recordType, fields);
        }
    }
}
