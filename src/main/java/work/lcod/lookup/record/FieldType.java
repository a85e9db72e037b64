package work.lcod.lookup.record;

import java.util.Locale;
import work.lcod.lookup.coerce.Complex;

/**
 * Native kinds a raw string can be coerced into. Everything else is {@link #CUSTOM}.
 */
public enum FieldType {
    STRING(0, false),
    BYTES(0, false),
    BOOLEAN(0, false),
    INT8(8, false),
    INT16(16, false),
    INT32(32, false),
    INT64(64, false),
    UINT8(8, true),
    UINT16(16, true),
    UINT32(32, true),
    UINT64(64, true),
    FLOAT32(32, false),
    FLOAT64(64, false),
    COMPLEX(128, false),
    CUSTOM(0, false);

    private final int bits;
    private final boolean unsigned;

    FieldType(int bits, boolean unsigned) {
        this.bits = bits;
        this.unsigned = unsigned;
    }

    public int bits() {
        return bits;
    }

    public boolean unsigned() {
        return unsigned;
    }

    public boolean integral() {
        return this.compareTo(INT8) >= 0 && this.compareTo(UINT64) <= 0;
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a Java field type to its kind. {@code unsigned} only applies to integral types.
     */
    public static FieldType of(Class<?> type, boolean unsigned) {
        FieldType kind = signedKindOf(type);
        if (!unsigned) {
            return kind;
        }
        return switch (kind) {
            case INT8 -> UINT8;
            case INT16 -> UINT16;
            case INT32 -> UINT32;
            case INT64 -> UINT64;
            default -> throw new IllegalArgumentException("unsigned requires an integral type, got " + type.getName());
        };
    }

    private static FieldType signedKindOf(Class<?> type) {
        if (type == String.class || type == CharSequence.class) {
            return STRING;
        }
        if (type == byte[].class) {
            return BYTES;
        }
        if (type == boolean.class || type == Boolean.class) {
            return BOOLEAN;
        }
        if (type == byte.class || type == Byte.class) {
            return INT8;
        }
        if (type == short.class || type == Short.class) {
            return INT16;
        }
        if (type == int.class || type == Integer.class) {
            return INT32;
        }
        if (type == long.class || type == Long.class) {
            return INT64;
        }
        if (type == float.class || type == Float.class) {
            return FLOAT32;
        }
        if (type == double.class || type == Double.class) {
            return FLOAT64;
        }
        if (type == Complex.class) {
            return COMPLEX;
        }
        return CUSTOM;
    }
}
