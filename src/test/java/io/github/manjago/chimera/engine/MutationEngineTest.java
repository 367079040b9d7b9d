package io.github.manjago.chimera.engine;

import io.github.manjago.chimera.config.EngineConfig;
import io.github.manjago.chimera.coverage.TestUnit;
import io.github.manjago.chimera.exec.ReloadService;
import io.github.manjago.chimera.exec.SiteResult;
import io.github.manjago.chimera.exec.TestOutcome;
import io.github.manjago.chimera.exec.TestRunner;
import io.github.manjago.chimera.exec.Verdict;
import io.github.manjago.chimera.mutate.MutationApplier;
import io.github.manjago.chimera.operator.OperatorCatalog;
import io.github.manjago.chimera.operator.Preset;
import io.github.manjago.chimera.persistence.StateStore;
import io.github.manjago.chimera.pipeline.ClusterKey;
import io.github.manjago.chimera.scan.MutationSite;
import io.github.manjago.chimera.scan.SiteScanner;
import io.github.manjago.chimera.schemata.SchemaBundle;
import io.github.manjago.chimera.syntax.SyntaxParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for MutationEngine against a small in-process runtime.
 */
class MutationEngineTest {

    private static final String DOCUMENTED_ADD = """
            (ns calc)

            (defn add
              "Adds two numbers."
              [a b]
              (+ a b))
            """;

    private static final String ADD = """
            (ns calc)

            (defn add [a b]
              (+ a b))
            """;

    @TempDir
    Path tempDir;

    private TinyRuntime runtime;
    private StateStore state;

    @BeforeEach
    void setUp() {
        runtime = new TinyRuntime();
        state = StateStore.inMemory();
    }

    @AfterEach
    void tearDown() {
        state.close();
    }

    private Path source(String name, String text) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, text);
        assertTrue(runtime.reload(List.of(file)));
        return file;
    }

    private EngineConfig.Builder config() {
        return EngineConfig.builder()
                .backupDir(tempDir.resolve("backups"))
                .stateFile(tempDir.resolve("state.mv"));
    }

    private static TestRunner runner(Map<String, BooleanSupplier> tests) {
        return testId -> {
            try {
                return tests.get(testId).getAsBoolean() ? TestOutcome.PASS : TestOutcome.FAIL;
            } catch (RuntimeException e) {
                return TestOutcome.THREW;
            }
        };
    }

    private MutationEngine.Builder engine(EngineConfig config, Map<String, BooleanSupplier> tests, boolean schemata) {
        return MutationEngine.builder(config)
                .testRunner(runner(tests))
                .reloadService(runtime)
                .traceOracle(runtime)
                .mutantSwitch(schemata ? runtime : null)
                .stateStore(state);
    }

    private static TestUnit unit(String id, List<Path> files, String... tests) throws Exception {
        return new TestUnit(id, TestUnit.hashOf(files), List.of(tests));
    }

    private Map<String, BooleanSupplier> addTests() {
        return Map.of("add-test", () -> Long.valueOf(5).equals(runtime.call("add", 2L, 3L)));
    }

    @ParameterizedTest(name = "schemata={0}")
    @ValueSource(booleans = {false, true})
    @DisplayName("Swapping + for - is killed by a test asserting the sum")
    void testArithmeticSwapKilled(boolean schemata) throws Exception {
        Path file = source("calc.clj", ADD);
        MutationEngine engine = engine(config().build(), addTests(), schemata).build();

        RunReport report = engine.run(List.of(file), List.of(unit("calc-test", List.of(file), "add-test")));

        assertEquals(1, report.results().size());
        SiteResult result = report.results().get(0);
        assertEquals("add-to-sub", result.site().operatorId());
        assertEquals(Verdict.KILLED, result.verdict());
        assertEquals("add-test", result.killingTest());
        assertEquals(1.0, report.score());
        assertEquals(ADD, Files.readString(file));
        assertEquals(5L, runtime.call("add", 2L, 3L));
    }

    @Test
    @DisplayName("Multiplying by one is excluded as equivalent, not counted as survived")
    void testEquivalentExcluded() throws Exception {
        Path file = source("scale.clj", "(ns scale)\n(defn scale [x] (* x 1))\n");
        Map<String, BooleanSupplier> tests = Map.of("scale-test", () -> Long.valueOf(4).equals(runtime.call("scale", 4L)));
        MutationEngine engine = engine(config().build(), tests, false).build();

        RunReport report = engine.run(List.of(file), List.of(unit("scale-test", List.of(file), "scale-test")));

        assertEquals(1, report.equivalent().size());
        assertEquals("mul-to-div", report.equivalent().get(0).site().operatorId());
        assertTrue(report.results().isEmpty());
        assertEquals(0, report.count(Verdict.SURVIVED));
        assertEquals(1.0, report.score());
    }

    @Test
    @DisplayName("Sites without covering tests get no-coverage and stay out of the score")
    void testNoCoverage() throws Exception {
        String text = """
                (ns calc)

                (defn covered [a]
                  (inc a))

                (defn lonely [a]
                  (dec a))
                """;
        Path file = source("calc.clj", text);
        Map<String, BooleanSupplier> tests = Map.of("covered-test", () -> Long.valueOf(2).equals(runtime.call("covered", 1L)));
        List<SiteResult> verdicts = new ArrayList<>();
        List<int[]> progress = new ArrayList<>();
        List<RunReport> finished = new ArrayList<>();
        EngineListener listener = new EngineListener() {
            @Override
            public void onVerdict(SiteResult result) {
                verdicts.add(result);
            }

            @Override
            public void onProgress(int done, int total) {
                progress.add(new int[]{done, total});
            }

            @Override
            public void onRunFinished(RunReport report) {
                finished.add(report);
            }
        };
        int reloadsBefore = runtime.reloadCount();
        MutationEngine engine = engine(config().schemataEnabled(false).build(), tests, false)
                .listener(listener)
                .build();

        RunReport report = engine.run(List.of(file), List.of(unit("calc-test", List.of(file), "covered-test")));

        assertEquals(1, report.count(Verdict.KILLED));
        assertEquals(1, report.count(Verdict.NO_COVERAGE));
        SiteResult lonely = report.results().stream()
                .filter(r -> r.site().formId().equals("calc/lonely")).findFirst().orElseThrow();
        assertEquals(Verdict.NO_COVERAGE, lonely.verdict());
        assertEquals(1.0, report.score());
        assertEquals(text, Files.readString(file));

        // one apply and one restore reload for the covered site only
        assertEquals(reloadsBefore + 2, runtime.reloadCount());
        assertEquals(2, verdicts.size());
        assertArrayEquals(new int[]{2, 2}, progress.get(progress.size() - 1));
        assertEquals(List.of(report), finished);
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    @DisplayName("A non-terminating mutant times out and the file is restored")
    void testTimeoutRestoresFile() throws Exception {
        String text = """
                (ns counter)

                (defn count-up [limit]
                  (loop [i 0]
                    (if (< i limit)
                      (recur (inc i))
                      i)))
                """;
        Path file = source("counter.clj", text);
        Map<String, BooleanSupplier> tests = Map.of("count-test", () -> Long.valueOf(5).equals(runtime.call("count-up", 5L)));
        OperatorCatalog onlyLtToTrue = new OperatorCatalog(List.of(OperatorCatalog.builtin().get("lt-to-true")));
        EngineConfig config = config()
                .preset(Preset.THOROUGH)
                .testTimeout(Duration.ofMillis(2000))
                .build();
        MutationEngine engine = engine(config, tests, false).catalog(onlyLtToTrue).build();

        RunReport report = engine.run(List.of(file), List.of(unit("counter-test", List.of(file), "count-test")));

        assertEquals(1, report.results().size());
        assertEquals(Verdict.TIMEOUT, report.results().get(0).verdict());
        assertEquals("count-test", report.results().get(0).killingTest());
        assertEquals(1.0, report.score());
        assertEquals(text, Files.readString(file));
        assertFalse(engine.getApplier().isMutated(file));
        assertEquals(5L, runtime.call("count-up", 5L));
    }

    @Test
    @DisplayName("Schemata batches are compiled once per file")
    void testSchemataBatch() throws Exception {
        String text = """
                (ns calc)

                (defn add [a b]
                  (+ a b))

                (defn step [n]
                  (inc n))
                """;
        Path file = source("calc.clj", text);
        Map<String, BooleanSupplier> tests = Map.of(
                "add-test", () -> Long.valueOf(5).equals(runtime.call("add", 2L, 3L)),
                "step-test", () -> Long.valueOf(8).equals(runtime.call("step", 7L)));
        List<SchemaBundle> bundles = new ArrayList<>();
        MutationEngine engine = engine(config().build(), tests, true)
                .listener(new EngineListener() {
                    @Override
                    public void onBatchCompiled(SchemaBundle bundle) {
                        bundles.add(bundle);
                    }
                })
                .build();

        RunReport report = engine.run(List.of(file),
                List.of(unit("calc-test", List.of(file), "add-test", "step-test")));

        assertEquals(1, bundles.size());
        assertEquals(2, bundles.get(0).mutants().size());
        assertEquals(2, report.count(Verdict.KILLED));
        assertEquals(text, Files.readString(file));
    }

    @Test
    @DisplayName("An unchanged rerun scans nothing and reuses stored results")
    void testIncrementalRerun() throws Exception {
        Path file = source("calc.clj", ADD);
        List<TestUnit> units = List.of(unit("calc-test", List.of(file), "add-test"));
        MutationEngine engine = engine(config().build(), addTests(), false).build();

        RunReport first = engine.run(List.of(file), units);
        RunReport second = engine.run(List.of(file), units);

        assertEquals(2, first.changedForms());
        assertEquals(1, first.scannedSites());
        assertEquals(0, second.changedForms());
        assertEquals(2, second.unchangedForms());
        assertEquals(0, second.scannedSites());
        assertEquals(1, second.reusedResults());
        assertEquals(first.results().get(0).site(), second.results().get(0).site());
        assertEquals(Verdict.KILLED, second.results().get(0).verdict());
    }

    @Test
    @DisplayName("Editing one form rescans only that form")
    void testIncrementalEdit() throws Exception {
        Path file = source("calc.clj", ADD + "\n(defn twice [x] (* 2 x))\n");
        Map<String, BooleanSupplier> tests = Map.of(
                "add-test", () -> Long.valueOf(5).equals(runtime.call("add", 2L, 3L)),
                "twice-test", () -> Long.valueOf(6).equals(runtime.call("twice", 3L)));
        MutationEngine engine = engine(config().build(), tests, false).build();
        engine.run(List.of(file), List.of(unit("calc-test", List.of(file), "add-test", "twice-test")));

        Files.writeString(file, ADD.replace("(+ a b)", "(+ b a)") + "\n(defn twice [x] (* 2 x))\n");
        assertTrue(runtime.reload(List.of(file)));
        RunReport report = engine.run(List.of(file), List.of(unit("calc-test", List.of(file), "add-test", "twice-test")));

        assertTrue(report.changedForms() >= 1);
        assertTrue(report.results().stream().anyMatch(r -> r.site().original().equals("+")));
        assertEquals(2, report.count(Verdict.KILLED));
    }

    @Test
    @DisplayName("Backups of an interrupted run are restored first")
    void testRecoversInterruptedRun() throws Exception {
        Path file = source("calc.clj", ADD);
        MutationSite site = new SiteScanner(OperatorCatalog.builtin().preset(Preset.STANDARD))
                .scan(SyntaxParser.parseFile(file).forms()).get(0);
        new MutationApplier(tempDir.resolve("backups")).apply(site);
        assertNotEquals(ADD, Files.readString(file));

        MutationEngine engine = engine(config().build(), addTests(), false).build();
        RunReport report = engine.run(List.of(file), List.of(unit("calc-test", List.of(file), "add-test")));

        assertEquals(1, report.recoveredFiles());
        assertEquals(ADD, Files.readString(file));
        assertEquals(Verdict.KILLED, report.results().get(0).verdict());
    }

    @Test
    @DisplayName("The same form id in two files is rejected")
    void testDuplicateFormId() throws Exception {
        Path first = source("a.clj", ADD);
        Path second = source("b.clj", ADD);
        MutationEngine engine = engine(config().build(), addTests(), false).build();

        assertThrows(IllegalArgumentException.class, () -> engine.run(List.of(first, second), List.of()));
    }

    @Test
    @DisplayName("A test runner and a state store are required")
    void testBuilderRequirements() {
        assertThrows(NullPointerException.class, () -> MutationEngine.builder(config().build())
                .traceOracle(runtime).stateStore(state).build());
        assertThrows(NullPointerException.class, () -> MutationEngine.builder(config().build())
                .testRunner(id -> TestOutcome.PASS).traceOracle(runtime).build());
    }

    @Test
    @DisplayName("Report counts and score")
    void testReportScore() throws Exception {
        Path file = source("calc.clj", ADD);
        Map<String, BooleanSupplier> weak = Map.of("weak-test", () -> runtime.call("add", 0L, 0L) != null);
        MutationEngine engine = engine(config().build(), weak, false).build();

        RunReport report = engine.run(List.of(file), List.of(unit("calc-test", List.of(file), "weak-test")));

        assertEquals(1, report.survivors().size());
        assertEquals(0.0, report.score());
        assertTrue(report.toString().contains("Survived:       1"));
        assertEquals(Set.of(Verdict.SURVIVED), Set.copyOf(report.results().stream().map(SiteResult::verdict).toList()));
    }

    @Test
    @DisplayName("Documented functions keep their docstring out of schemata and execution")
    void testDocstringWithSchemata() throws Exception {
        Path file = source("calc.clj", DOCUMENTED_ADD);
        List<SchemaBundle> bundles = new ArrayList<>();
        MutationEngine engine = engine(config().preset(Preset.THOROUGH).build(), addTests(), true)
                .listener(new EngineListener() {
                    @Override
                    public void onBatchCompiled(SchemaBundle bundle) {
                        bundles.add(bundle);
                    }
                })
                .build();

        RunReport report = engine.run(List.of(file), List.of(unit("calc-test", List.of(file), "add-test")));

        assertEquals(1, report.equivalent().size());
        assertEquals("string-to-empty", report.equivalent().get(0).site().operatorId());
        assertEquals("docstring", report.equivalent().get(0).reason());
        assertEquals(0, report.count(Verdict.ERROR));
        assertEquals(2, report.count(Verdict.KILLED));
        assertEquals(1, bundles.size());
        assertTrue(bundles.get(0).compiledText().contains("\"Adds two numbers.\"\n  [a b]"));
        assertEquals(DOCUMENTED_ADD, Files.readString(file));
    }

    @Test
    @DisplayName("A batch whose compiled file does not load is applied site by site")
    void testBatchFallsBackToSingleApplication() throws Exception {
        Path file = source("calc.clj", ADD);
        AtomicInteger rejected = new AtomicInteger();
        ReloadService rejectingSchemata = files -> {
            for (Path f : files) {
                try {
                    if (Files.readString(f).contains("chimera.runtime/active-mutant")) {
                        rejected.incrementAndGet();
                        return false;
                    }
                } catch (IOException e) {
                    return false;
                }
            }
            return runtime.reload(files);
        };
        MutationEngine engine = engine(config().build(), addTests(), true)
                .reloadService(rejectingSchemata)
                .build();

        RunReport report = engine.run(List.of(file), List.of(unit("calc-test", List.of(file), "add-test")));

        assertEquals(1, rejected.get());
        assertEquals(1, report.results().size());
        assertEquals(Verdict.KILLED, report.results().get(0).verdict());
        assertEquals("add-test", report.results().get(0).killingTest());
        assertEquals(ADD, Files.readString(file));
        assertFalse(engine.getApplier().isMutated(file));
    }

    @Test
    @DisplayName("Cluster members report their representative's verdict without running")
    void testClusterPropagation() throws Exception {
        String text = """
                (ns calc)

                (defn add [a b]
                  (+ a b))

                (defn add3 [a b c]
                  (+ a b c))
                """;
        Path file = source("calc.clj", text);
        List<String> runs = Collections.synchronizedList(new ArrayList<>());
        Map<String, BooleanSupplier> tests = Map.of(
                "add-test", () -> Long.valueOf(5).equals(runtime.call("add", 2L, 3L)),
                "add3-test", () -> Long.valueOf(6).equals(runtime.call("add3", 1L, 2L, 3L)));
        TestRunner countingRunner = testId -> {
            runs.add(testId);
            return runner(tests).run(testId);
        };
        List<MutationSite> started = new ArrayList<>();
        EngineConfig config = config().clusterKey(ClusterKey.OPERATOR).build();
        MutationEngine engine = engine(config, tests, false)
                .testRunner(countingRunner)
                .listener(new EngineListener() {
                    @Override
                    public void onSiteStarted(MutationSite site, Set<String> siteTests) {
                        started.add(site);
                    }
                })
                .build();

        RunReport report = engine.run(List.of(file),
                List.of(unit("calc-test", List.of(file), "add-test", "add3-test")));

        assertEquals(1, report.clusters());
        assertEquals(1, started.size());
        // one traced run per test, then only the representative's killing test
        assertEquals(3, runs.size());

        MutationSite representative = started.get(0);
        assertEquals(2, report.results().size());
        SiteResult ran = report.results().stream()
                .filter(r -> r.site().equals(representative)).findFirst().orElseThrow();
        SiteResult member = report.results().stream()
                .filter(r -> !r.site().equals(representative)).findFirst().orElseThrow();
        assertFalse(ran.isPropagated());
        assertEquals(Verdict.KILLED, ran.verdict());
        assertEquals(representative.id(), member.representativeId());
        assertEquals(ran.verdict(), member.verdict());
        assertEquals(ran.killingTest(), member.killingTest());
        assertEquals(0, member.durationMs());
        assertEquals("add-to-sub", member.site().operatorId());
    }
}
