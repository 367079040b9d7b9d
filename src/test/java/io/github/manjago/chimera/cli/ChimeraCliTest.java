package io.github.manjago.chimera.cli;

import io.github.manjago.chimera.persistence.StateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the command line front end.
 */
@DisplayName("CLI")
class ChimeraCliTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private int execute(String... args) {
        return new CommandLine(new ChimeraCli())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("scan lists sites and the summary line")
    void testScan() throws Exception {
        Path file = tempDir.resolve("calc.clj");
        Files.writeString(file, """
                (ns calc)

                (defn add [a b]
                  (+ a b))

                (defn scale [x]
                  (* x 1))
                """);

        int exit = execute("scan", "--preset", "standard", "--equivalent", file.toString());

        assertEquals(0, exit);
        String text = stdout();
        assertTrue(text.contains("calc.clj:4"), text);
        assertTrue(text.contains("add-to-sub"), text);
        assertTrue(text.contains("equivalent  calc/scale@"), text);
        assertTrue(text.contains("3 forms, 2 sites: 1 equivalent, 0 subsumed, 1 to execute in 1 clusters (standard)"), text);
    }

    @Test
    @DisplayName("scan reports the position of a parse error")
    void testScanParseError() throws Exception {
        Path file = tempDir.resolve("broken.clj");
        Files.writeString(file, "(defn broken [x]\n  (+ x 1)\n");

        assertEquals(1, execute("scan", file.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("broken.clj:1:1"));
    }

    @Test
    @DisplayName("operators lists a preset with dominance edges")
    void testOperators() {
        assertEquals(0, execute("operators", "--preset", "thorough", "--edges"));

        String text = stdout();
        assertTrue(text.contains("lt-to-lte"));
        assertTrue(text.contains("dominates: lt-to-eq, lt-to-gte, lt-to-true"), text);
        assertTrue(text.contains("operators (thorough)"));
    }

    @Test
    @DisplayName("state summarises an existing file and rejects a missing one")
    void testState() throws Exception {
        Path file = tempDir.resolve("state.mv");
        try (StateStore store = StateStore.open(file)) {
            store.commit();
        }

        assertEquals(0, execute("state", file.toString()));
        assertFalse(stdout().isBlank());
        assertEquals(1, execute("state", tempDir.resolve("missing.mv").toString()));
    }

    @Test
    @DisplayName("info prints the preset sizes")
    void testInfo() {
        assertEquals(0, execute("info"));
        String text = stdout();
        assertTrue(text.contains("CHIMERA"));
        assertTrue(text.contains("minimal"));
    }
}
