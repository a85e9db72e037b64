package work.lcod.lookup.record;

import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Derives {@link RecordSchema}s from annotated classes and caches them per class.
 *
 * <p>Only fields declared by the class itself are described, in declaration order; static and
 * synthetic fields are left out. Java records are rejected because their components are final.
 */
public final class RecordSchemas {
    private static final Map<Class<?>, RecordSchema> CACHE = new ConcurrentHashMap<>();

    private RecordSchemas() {}

    public static RecordSchema of(Class<?> type) {
        return CACHE.computeIfAbsent(type, RecordSchemas::reflect);
    }

    static RecordSchema reflect(Class<?> type) {
        if (type.isRecord()) {
            throw new IllegalArgumentException(type.getName() + " is a record; its components cannot be populated");
        }
        if (type.isPrimitive() || type.isArray() || type.isInterface()) {
            throw new IllegalArgumentException(type.getName() + " has no fields to populate");
        }
        RecordSchema.Builder builder = RecordSchema.builder(type);
        for (Field field : type.getDeclaredFields()) {
            int modifiers = field.getModifiers();
            if (Modifier.isStatic(modifiers) || field.isSynthetic()) {
                continue;
            }
            FieldTags tags = FieldTags.fromAnnotations(field);
            if (!tags.isEmpty() && Modifier.isFinal(modifiers)) {
                throw new IllegalArgumentException("field " + field.getName() + " of " + type.getName() + " is final");
            }
            boolean unsigned = field.isAnnotationPresent(Unsigned.class);
            FieldType kind = FieldType.of(field.getType(), unsigned);
            builder.field(new FieldDescriptor(field.getName(), field.getType(), kind, tags, accessor(field, tags)));
        }
        return builder.build();
    }

    private static FieldDescriptor.FieldAccessor accessor(Field field, FieldTags tags) {
        if (!tags.isEmpty()) {
            try {
                field.setAccessible(true);
            } catch (InaccessibleObjectException | SecurityException ex) {
                throw new IllegalArgumentException("field " + field.getName() + " is not accessible: " + ex.getMessage(), ex);
            }
        }
        return new FieldDescriptor.FieldAccessor() {
            @Override
            public Object get(Object record) {
                try {
                    return field.get(record);
                } catch (IllegalAccessException ex) {
                    throw new IllegalStateException("cannot read field " + field.getName(), ex);
                }
            }

            @Override
            public void set(Object record, Object value) {
                try {
                    field.set(record, value);
                } catch (IllegalAccessException ex) {
                    throw new IllegalStateException("cannot write field " + field.getName(), ex);
                }
            }
        };
    }
}
