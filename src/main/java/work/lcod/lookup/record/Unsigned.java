package work.lcod.lookup.record;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an integral field as unsigned. Values are range-checked against {@code [0, 2^bits)} and
 * stored in two's complement, the way {@link Integer#parseUnsignedInt(String)} does.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Unsigned {}
