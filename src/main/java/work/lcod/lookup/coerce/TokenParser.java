package work.lcod.lookup.coerce;

/**
 * Parses a single whitespace-free token into a value of a caller-defined type.
 */
@FunctionalInterface
public interface TokenParser<T> {
    T parse(String token) throws Exception;
}
