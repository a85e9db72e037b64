package work.lcod.lookup.record;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the key a field is looked up with, optionally followed by {@code ",optional"}.
 *
 * <pre>{@code
 * @LookupKey("PORT") int port;
 * @LookupKey("TLS_CERT,optional") Path certificate;
 * }</pre>
 *
 * A {@link com.fasterxml.jackson.annotation.JsonProperty} on the same field takes precedence.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface LookupKey {
    String value();
}
