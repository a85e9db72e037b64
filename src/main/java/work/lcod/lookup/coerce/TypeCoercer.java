package work.lcod.lookup.coerce;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import work.lcod.lookup.record.FieldDescriptor;
import work.lcod.lookup.record.FieldType;
import work.lcod.lookup.shared.DurationParser;

/**
 * Converts raw lookup values into the native type of a field.
 *
 * <p>Strings are used verbatim and byte arrays are base64-decoded. Every other kind must consist
 * of exactly one whitespace-delimited token. Custom types are parsed by, in order: a registered
 * {@link TokenParser}, enum constant names, a public static {@code valueOf}, {@code parse} or
 * {@code of} factory taking a string, or a public string constructor.
 *
 * <p>Failures are reported as {@link IllegalArgumentException}. Instances are immutable and
 * thread-safe.
 */
public final class TypeCoercer {
    private static final List<String> FACTORY_NAMES = List.of("valueOf", "parse", "of");
    private static final TypeCoercer DEFAULTS = builder().build();

    private final Map<Class<?>, TokenParser<?>> parsers;
    private final Map<Class<?>, TokenParser<?>> discovered = new ConcurrentHashMap<>();

    private TypeCoercer(Map<Class<?>, TokenParser<?>> parsers) {
        this.parsers = Map.copyOf(parsers);
    }

    public static TypeCoercer defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Object coerce(String raw, FieldDescriptor field) {
        return coerce(raw, field.type(), field.javaType());
    }

    public Object coerce(String raw, FieldType type, Class<?> javaType) {
        Objects.requireNonNull(raw, "raw");
        return switch (type) {
            case STRING -> raw;
            case BYTES -> Base64.getDecoder().decode(raw);
            case BOOLEAN -> parseBoolean(singleToken(raw));
            case INT8 -> (byte) IntegerLiterals.parse(singleToken(raw), 8, false);
            case INT16 -> (short) IntegerLiterals.parse(singleToken(raw), 16, false);
            case INT32 -> (int) IntegerLiterals.parse(singleToken(raw), 32, false);
            case INT64 -> IntegerLiterals.parse(singleToken(raw), 64, false);
            case UINT8 -> (byte) IntegerLiterals.parse(singleToken(raw), 8, true);
            case UINT16 -> (short) IntegerLiterals.parse(singleToken(raw), 16, true);
            case UINT32 -> (int) IntegerLiterals.parse(singleToken(raw), 32, true);
            case UINT64 -> IntegerLiterals.parse(singleToken(raw), 64, true);
            case FLOAT32 -> (float) FloatLiterals.parse(singleToken(raw), 32);
            case FLOAT64 -> FloatLiterals.parse(singleToken(raw), 64);
            case COMPLEX -> parseComplex(raw);
            case CUSTOM -> parseCustom(singleToken(raw), javaType);
        };
    }

    static String singleToken(String raw) {
        String stripped = raw.strip();
        if (stripped.isEmpty()) {
            throw new IllegalArgumentException("expected a value, found no token");
        }
        for (int i = 0; i < stripped.length(); i++) {
            if (Character.isWhitespace(stripped.charAt(i))) {
                throw new IllegalArgumentException("expected a single token, found more after \"" + stripped.substring(0, i) + "\"");
            }
        }
        return stripped;
    }

    private static Boolean parseBoolean(String token) {
        switch (token.toLowerCase(Locale.ROOT)) {
            case "1", "t", "true":
                return Boolean.TRUE;
            case "0", "f", "false":
                return Boolean.FALSE;
            default:
                throw new IllegalArgumentException("invalid syntax: not a boolean");
        }
    }

    private static Complex parseComplex(String raw) {
        String[] parts = raw.split(",", -1);
        if (parts.length < 2) {
            throw new IllegalArgumentException("expected real,imaginary");
        }
        double real = FloatLiterals.parse(parts[0].strip(), 64);
        double imaginary = FloatLiterals.parse(parts[1].strip(), 64);
        return new Complex(real, imaginary);
    }

    private Object parseCustom(String token, Class<?> javaType) {
        TokenParser<?> parser = parsers.get(javaType);
        if (parser == null) {
            parser = discovered.computeIfAbsent(javaType, TypeCoercer::discover);
        }
        Object value;
        try {
            value = parser.parse(token);
        } catch (IllegalArgumentException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new IllegalArgumentException(describe(ex), ex);
        }
        if (value == null) {
            throw new IllegalArgumentException("parser for " + javaType.getName() + " returned no value");
        }
        return value;
    }

    private static TokenParser<?> discover(Class<?> type) {
        if (type.isEnum()) {
            return token -> enumConstant(type, token);
        }
        for (String name : FACTORY_NAMES) {
            Method method = findFactory(type, name);
            if (method != null) {
                return token -> invoke(() -> method.invoke(null, token));
            }
        }
        if (!Modifier.isAbstract(type.getModifiers())) {
            for (Constructor<?> constructor : type.getConstructors()) {
                if (Arrays.equals(constructor.getParameterTypes(), new Class<?>[] {String.class})) {
                    return token -> invoke(() -> constructor.newInstance(token));
                }
            }
        }
        return token -> {
            throw new IllegalArgumentException(
                "no way to parse " + type.getName() + "; register a TokenParser for it"
            );
        };
    }

    private static Method findFactory(Class<?> type, String name) {
        Method charSequenceFactory = null;
        for (Method method : type.getMethods()) {
            if (!method.getName().equals(name)
                || !Modifier.isStatic(method.getModifiers())
                || method.getParameterCount() != 1
                || !type.isAssignableFrom(method.getReturnType())) {
                continue;
            }
            Class<?> parameter = method.getParameterTypes()[0];
            if (parameter == String.class) {
                return method;
            }
            if (parameter == CharSequence.class) {
                charSequenceFactory = method;
            }
        }
        return charSequenceFactory;
    }

    private static Object enumConstant(Class<?> type, String token) {
        Object match = null;
        for (Object constant : type.getEnumConstants()) {
            String name = ((Enum<?>) constant).name();
            if (name.equals(token)) {
                return constant;
            }
            if (match == null && name.equalsIgnoreCase(token)) {
                match = constant;
            }
        }
        if (match == null) {
            throw new IllegalArgumentException("no constant " + token + " in " + type.getSimpleName());
        }
        return match;
    }

    private static Object invoke(ReflectiveCall call) throws Exception {
        try {
            return call.run();
        } catch (InvocationTargetException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw ex;
        }
    }

    private static String describe(Exception ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }

    @FunctionalInterface
    private interface ReflectiveCall {
        Object run() throws Exception;
    }

    public static final class Builder {
        private final Map<Class<?>, TokenParser<?>> parsers = new LinkedHashMap<>();

        private Builder() {
            register(Duration.class, token -> DurationParser.parse(token).orElseThrow());
            register(Path.class, Path::of);
            register(Character.class, TypeCoercer::parseChar);
            register(char.class, TypeCoercer::parseChar);
        }

        public <T> Builder register(Class<T> type, TokenParser<? extends T> parser) {
            parsers.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(parser, "parser"));
            return this;
        }

        public TypeCoercer build() {
            return new TypeCoercer(parsers);
        }
    }

    private static Character parseChar(String token) {
        if (token.length() != 1) {
            throw new IllegalArgumentException("expected a single character");
        }
        return token.charAt(0);
    }
}
