package work.lcod.lookup.api;

/**
 * Fatal outcome of a lookup pass. The {@link Kind} tells which step failed; fields resolved before
 * the failure keep their new values.
 */
public final class LookupException extends RuntimeException {
    private final Kind kind;
    private final String field;
    private final String rawValue;

    private LookupException(Kind kind, String field, String rawValue, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.field = field;
        this.rawValue = rawValue;
    }

    public static LookupException invalidRecord(String message, Throwable cause) {
        return new LookupException(Kind.INVALID_RECORD_ARGUMENT, null, null, message, cause);
    }

    public static LookupException sourceFailed(String field, Throwable cause) {
        return new LookupException(
            Kind.SOURCE_LOOKUP_FAILED,
            field,
            null,
            "lookup for field \"" + field + "\" failed: " + describe(cause),
            cause
        );
    }

    public static LookupException missingRequired(String field, String key) {
        return new LookupException(
            Kind.MISSING_REQUIRED_FIELD,
            field,
            null,
            "missing value for required field \"" + field + "\" (key \"" + key + "\")",
            null
        );
    }

    public static LookupException coercionFailed(String field, String rawValue, String typeName, Throwable cause) {
        return new LookupException(
            Kind.TYPE_COERCION_FAILED,
            field,
            rawValue,
            "value \"" + rawValue + "\" for field \"" + field + "\" is not " + typeName + ": " + describe(cause),
            cause
        );
    }

    public Kind kind() {
        return kind;
    }

    /** Name of the failing field, or {@code null} when the record itself was rejected. */
    public String field() {
        return field;
    }

    /** Raw value that failed coercion, or {@code null} for other kinds. */
    public String rawValue() {
        return rawValue;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    public enum Kind {
        INVALID_RECORD_ARGUMENT,
        SOURCE_LOOKUP_FAILED,
        MISSING_REQUIRED_FIELD,
        TYPE_COERCION_FAILED
    }
}
