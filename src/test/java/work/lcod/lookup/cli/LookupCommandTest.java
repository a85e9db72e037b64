package work.lcod.lookup.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.lookup.support.LookupTestSupport.fixture;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class LookupCommandTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void printsResolvedKeysInOrder() {
        int exit = run(
            "--no-env",
            "-k", "PORT", "-k", "NAME", "-k", "LEVEL,optional",
            "--json", fixture("settings.json").toString(),
            "-D", "PORT=1",
            "--", "-NAME=cli"
        );

        assertEquals(0, exit, err.toString());
        assertEquals("PORT=8080\nNAME=cli\nLEVEL=\n", out.toString());
    }

    @Test
    void defaultsApplyWhenNothingElseHasTheKey() {
        int exit = run("--no-env", "-k", "PORT", "-D", "PORT=9000", "--prefix", "config: ");

        assertEquals(0, exit, err.toString());
        assertEquals("config: PORT=9000\n", out.toString());
    }

    @Test
    void readsYamlAndTomlDocuments() {
        int exit = run(
            "--no-env",
            "-k", "RATIO", "-k", "STARTED",
            "--yaml", fixture("settings.yaml").toString(),
            "--toml", fixture("settings.toml").toString()
        );

        assertEquals(0, exit, err.toString());
        assertEquals("RATIO=0.5\nSTARTED=1979-05-27T07:32Z\n", out.toString());
    }

    @Test
    void jsonFormatRedactsSecrets() throws Exception {
        int exit = run(
            "--no-env", "--format", "json", "--redact", "(?i)token",
            "-k", "NAME", "-k", "API_TOKEN", "-k", "EMPTY_TOKEN,optional",
            "-D", "NAME=edge", "-D", "API_TOKEN=hunter2"
        );

        assertEquals(0, exit, err.toString());
        Map<String, String> printed = new ObjectMapper().readValue(out.toString(), new TypeReference<>() {});
        assertEquals(
            Map.of("NAME", "edge", "API_TOKEN", "(not empty)", "EMPTY_TOKEN", "(empty)"),
            printed
        );
        assertEquals(List.of("NAME", "API_TOKEN", "EMPTY_TOKEN"), new ArrayList<>(printed.keySet()));
    }

    @Test
    void missingRequiredKeyExitsWithShortError() {
        int exit = run("--no-env", "-k", "NOT_CONFIGURED_ANYWHERE");

        assertEquals(ShortErrorHandler.LOOKUP_FAILURE_EXIT_CODE, exit);
        assertTrue(err.toString().startsWith("missing_required_field: "), err.toString());
        assertTrue(err.toString().contains("NOT_CONFIGURED_ANYWHERE"), err.toString());
        assertEquals("", out.toString());
    }

    @Test
    void warnsAboutArgumentsWithoutPrefix() {
        int exit = run("--no-env", "-k", "PORT", "-D", "PORT=1", "--", "stray");

        assertEquals(0, exit);
        assertEquals("PORT=1\n", out.toString());
        assertTrue(err.toString().contains("stray"), err.toString());
    }

    @Test
    void requiresAtLeastOneKey() {
        int exit = run("--no-env");

        assertEquals(2, exit);
        assertTrue(err.toString().contains("--key"), err.toString());
    }

    @Test
    void versionNamesProjectAndRuntime() {
        int exit = run("--version");

        assertEquals(0, exit);
        String[] lines = out.toString().split("\\R");
        assertEquals("lcod-lookup " + VersionProvider.UNRELEASED, lines[0]);
        assertTrue(lines[1].startsWith("JVM: "), lines[1]);
        assertTrue(lines[1].contains(Runtime.version().toString()), lines[1]);
    }

    private int run(String... args) {
        CommandLine commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }
}
