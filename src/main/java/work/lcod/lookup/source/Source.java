package work.lcod.lookup.source;

/**
 * Answers single-key lookups. Implementations must be safe to call from any thread.
 */
@FunctionalInterface
public interface Source {
    LookupResult lookup(String key);
}
