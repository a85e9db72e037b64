package work.lcod.lookup.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.lookup.source.LookupResult;
import work.lcod.lookup.source.MapSource;
import work.lcod.lookup.source.Source;

class SourceSequenceTest {
    @Test
    void stopsAtFirstHit() {
        List<String> consulted = new ArrayList<>();
        Source a = tracking("A", consulted, LookupResult.absent());
        Source b = tracking("B", consulted, LookupResult.found("x"));
        Source c = tracking("C", consulted, LookupResult.found("y"));

        var result = new SourceSequence(List.of(a, b, c)).resolve("K");

        assertEquals(LookupResult.found("x"), result);
        assertEquals(List.of("A", "B"), consulted);
    }

    @Test
    void emptySequenceIsAbsent() {
        assertEquals(LookupResult.absent(), new SourceSequence(List.of()).resolve("K"));
    }

    @Test
    void earlierFailuresAreAbsorbed() {
        Source broken = key -> LookupResult.failed(new IOException("malformed file"));
        var result = new SourceSequence(List.of(broken, MapSource.of("K", "default"))).resolve("K");
        assertEquals(LookupResult.found("default"), result);
    }

    @Test
    void lastResultIsReturnedVerbatim() {
        var failure = new IOException("last source broken");
        Source broken = key -> LookupResult.failed(failure);
        var failed = new SourceSequence(List.of(MapSource.of(), broken)).resolve("K");
        assertSame(failure, failed.error());

        Source absentWithValue = key -> LookupResult.absent("zero");
        var absent = new SourceSequence(List.of(broken, absentWithValue)).resolve("K");
        assertEquals(LookupResult.absent("zero"), absent);
    }

    @Test
    void thrownExceptionsCountAsFailures() {
        Source throwing = key -> {
            throw new IllegalStateException("boom");
        };
        var result = new SourceSequence(List.of(throwing)).resolve("K");
        assertTrue(result.failed());
        assertEquals("boom", result.error().getMessage());

        var recovered = new SourceSequence(List.of(throwing, MapSource.of("K", "v"))).resolve("K");
        assertEquals(LookupResult.found("v"), recovered);
    }

    @Test
    void foundWithErrorIsNotAHit() {
        Source inconsistent = key -> new LookupResult("stale", true, new IOException("partial read"));
        var result = new SourceSequence(List.of(inconsistent, MapSource.of("K", "fresh"))).resolve("K");
        assertEquals(LookupResult.found("fresh"), result);
    }

    private static Source tracking(String name, List<String> consulted, LookupResult answer) {
        return key -> {
            consulted.add(name);
            return answer;
        };
    }
}
