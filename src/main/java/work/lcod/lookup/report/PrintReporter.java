package work.lcod.lookup.report;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Writes one {@code <prefix><key>=<value>} line per entry.
 */
public final class PrintReporter implements Reporter {
    private final Appendable out;
    private final String prefix;

    public PrintReporter(Appendable out, String prefix) {
        this.out = Objects.requireNonNull(out, "out");
        this.prefix = prefix == null ? "" : prefix;
    }

    public PrintReporter(Appendable out) {
        this(out, "");
    }

    @Override
    public void report(String key, Object value) {
        String line = prefix + key + "=" + Reporters.render(value) + "\n";
        try {
            synchronized (out) {
                out.append(line);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("unable to write report line for " + key, ex);
        }
    }
}
