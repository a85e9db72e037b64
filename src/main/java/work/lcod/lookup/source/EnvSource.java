package work.lcod.lookup.source;

import java.util.Objects;
import java.util.function.Function;

/**
 * Environment variable source. The lookup function defaults to {@link System#getenv(String)};
 * tests pass their own.
 */
public final class EnvSource implements Source {
    private static final EnvSource SYSTEM = new EnvSource(System::getenv);

    private final Function<String, String> env;

    public EnvSource(Function<String, String> env) {
        this.env = Objects.requireNonNull(env, "env");
    }

    public static EnvSource system() {
        return SYSTEM;
    }

    @Override
    public LookupResult lookup(String key) {
        String value = env.apply(key);
        return value == null ? LookupResult.absent() : LookupResult.found(value);
    }

    @Override
    public String toString() {
        return "env";
    }
}
