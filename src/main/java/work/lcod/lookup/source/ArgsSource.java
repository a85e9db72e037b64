package work.lcod.lookup.source;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Looks up keys in program arguments of the form {@code <prefix><KEY>=<value>}.
 *
 * <p>{@code <prefix><KEY>} without {@code =} stores {@code "1"}, which coerces into booleans and
 * numbers alike. Arguments that do not start with the prefix are kept in {@link #extraArgs()} for
 * the program to process. Suggested prefixes: {@code "-"}, {@code "--env-"} or even {@code ""}.
 */
public final class ArgsSource implements Source {
    private final List<String> args;
    private final Pattern pattern;
    private final Object lock = new Object();

    private Map<String, String> data;
    private List<String> extraArgs = List.of();

    public ArgsSource(String prefix, List<String> args) {
        this.pattern = Pattern.compile("^" + Pattern.quote(prefix == null ? "" : prefix) + "([^=]*)(?:(=)(.*))?$");
        this.args = args == null ? List.of() : List.copyOf(args);
    }

    /**
     * Arguments not formatted for this source. Empty until the first lookup.
     */
    public List<String> extraArgs() {
        synchronized (lock) {
            return extraArgs;
        }
    }

    @Override
    public LookupResult lookup(String key) {
        String value = parsed().get(key);
        return value == null ? LookupResult.absent() : LookupResult.found(value);
    }

    private Map<String, String> parsed() {
        synchronized (lock) {
            if (data == null) {
                Map<String, String> values = new HashMap<>();
                List<String> extra = new ArrayList<>();
                for (String arg : args) {
                    Matcher matcher = pattern.matcher(arg);
                    if (!matcher.matches()) {
                        extra.add(arg);
                        continue;
                    }
                    String value = matcher.group(2) == null ? "1" : matcher.group(3);
                    values.put(matcher.group(1), value);
                }
                extraArgs = List.copyOf(extra);
                data = values;
            }
            return data;
        }
    }

    @Override
    public String toString() {
        return "args";
    }
}
