package work.lcod.lookup.coerce;

/**
 * Complex number with double precision components. Its string form {@code real,imaginary} is the
 * same format the coercion engine reads.
 */
public record Complex(double real, double imaginary) {
    @Override
    public String toString() {
        return real + "," + imaginary;
    }
}
