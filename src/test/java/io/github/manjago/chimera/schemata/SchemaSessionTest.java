package io.github.manjago.chimera.schemata;

import io.github.manjago.chimera.exec.ReloadService;
import io.github.manjago.chimera.mutate.MutationApplier;
import io.github.manjago.chimera.mutate.MutationApplyException;
import io.github.manjago.chimera.operator.OperatorCatalog;
import io.github.manjago.chimera.operator.Preset;
import io.github.manjago.chimera.scan.MutationSite;
import io.github.manjago.chimera.scan.SiteScanner;
import io.github.manjago.chimera.syntax.Form;
import io.github.manjago.chimera.syntax.SourceFile;
import io.github.manjago.chimera.syntax.SyntaxParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SchemaSession.
 */
class SchemaSessionTest {

    private static final String SOURCE = "(defn f [x] (inc x))\n";

    @TempDir
    Path tempDir;

    private Path file;
    private MutationApplier applier;
    private SchemaBundle bundle;
    private final List<String> events = new ArrayList<>();

    private final MutantSwitch mutantSwitch = new MutantSwitch() {
        @Override
        public void select(int mutantId) {
            events.add("select " + mutantId);
        }

        @Override
        public void clear() {
            events.add("clear");
        }
    };

    @BeforeEach
    void setUp() throws Exception {
        file = tempDir.resolve("f.clj");
        Files.writeString(file, SOURCE);
        applier = new MutationApplier(tempDir.resolve("backups"));

        SourceFile source = SyntaxParser.parseFile(file);
        List<MutationSite> sites = new SiteScanner(OperatorCatalog.builtin().preset(Preset.STANDARD))
                .scan(source.forms());
        Map<String, Form> forms = source.forms().stream().collect(Collectors.toMap(Form::id, Function.identity()));
        SchemataCompiler compiler = new SchemataCompiler();
        bundle = compiler.compile(compiler.plan(sites, 64, forms).batches().get(0), SOURCE);
    }

    private ReloadService recordingReload() {
        return files -> {
            events.add("reload");
            return true;
        };
    }

    @Test
    @DisplayName("Session loads the compiled file once and restores it on close")
    void testLifecycle() throws Exception {
        try (SchemaSession session = SchemaSession.open(bundle, applier, recordingReload(), mutantSwitch)) {
            assertEquals(bundle.compiledText(), Files.readString(file));
            assertEquals(OptionalInt.empty(), session.activeMutant());

            session.activate(0);

            assertEquals(OptionalInt.of(0), session.activeMutant());
            assertSame(bundle, session.getBundle());
        }

        assertEquals(SOURCE, Files.readString(file));
        assertEquals(List.of("clear", "reload", "select 0", "clear", "reload"), events);
        assertFalse(applier.isMutated(file));
    }

    @Test
    @DisplayName("Unknown mutant ids are rejected")
    void testUnknownMutant() throws Exception {
        try (SchemaSession session = SchemaSession.open(bundle, applier, ReloadService.NOOP, mutantSwitch)) {
            assertThrows(IllegalArgumentException.class, () -> session.activate(42));
            assertEquals(OptionalInt.empty(), session.activeMutant());
        }
    }

    @Test
    @DisplayName("A failed reload restores the original file")
    void testReloadFailure() throws Exception {
        AtomicInteger reloads = new AtomicInteger();
        ReloadService failing = files -> reloads.incrementAndGet() > 1;

        assertThrows(MutationApplyException.class, () -> SchemaSession.open(bundle, applier, failing, mutantSwitch));

        assertEquals(SOURCE, Files.readString(file));
        assertFalse(applier.isMutated(file));
        assertEquals(2, reloads.get());
    }
}
