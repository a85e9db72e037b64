package work.lcod.lookup.record;

import java.util.Objects;

/**
 * One named, typed slot of a record together with the means to read and write it.
 */
public record FieldDescriptor(String name, Class<?> javaType, FieldType type, FieldTags tags, FieldAccessor accessor) {
    public FieldDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(javaType, "javaType");
        Objects.requireNonNull(type, "type");
        tags = tags == null ? FieldTags.empty() : tags;
        Objects.requireNonNull(accessor, "accessor");
    }

    public Object get(Object record) {
        return accessor.get(record);
    }

    public void set(Object record, Object value) {
        accessor.set(record, value);
    }

    /**
     * Reads and writes the value of one field on a record instance.
     */
    public interface FieldAccessor {
        Object get(Object record);

        void set(Object record, Object value);
    }
}
