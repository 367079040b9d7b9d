package io.github.manjago.chimera.engine;

import io.github.manjago.chimera.config.EngineConfig;
import io.github.manjago.chimera.coverage.CoverageCollector;
import io.github.manjago.chimera.coverage.CoverageIndex;
import io.github.manjago.chimera.coverage.CoverageRefresher;
import io.github.manjago.chimera.coverage.FormLocationBridge;
import io.github.manjago.chimera.coverage.FormLocator;
import io.github.manjago.chimera.coverage.TestSelector;
import io.github.manjago.chimera.coverage.TestUnit;
import io.github.manjago.chimera.coverage.TraceOracle;
import io.github.manjago.chimera.coverage.UnitTracer;
import io.github.manjago.chimera.exec.ExecutionResult;
import io.github.manjago.chimera.exec.ReloadService;
import io.github.manjago.chimera.exec.SiteResult;
import io.github.manjago.chimera.exec.TestExecutor;
import io.github.manjago.chimera.exec.TestRunner;
import io.github.manjago.chimera.exec.VerdictState;
import io.github.manjago.chimera.incremental.ChangeDetector;
import io.github.manjago.chimera.incremental.ChangeSet;
import io.github.manjago.chimera.mutate.MutationApplier;
import io.github.manjago.chimera.mutate.MutationApplyException;
import io.github.manjago.chimera.mutate.MutationHandle;
import io.github.manjago.chimera.operator.OperatorCatalog;
import io.github.manjago.chimera.persistence.StateStore;
import io.github.manjago.chimera.pipeline.Cluster;
import io.github.manjago.chimera.pipeline.ClusterSelector;
import io.github.manjago.chimera.pipeline.EquivalenceFilter;
import io.github.manjago.chimera.pipeline.SubsumptionReducer;
import io.github.manjago.chimera.scan.MutationSite;
import io.github.manjago.chimera.scan.SiteScanner;
import io.github.manjago.chimera.schemata.MutantSwitch;
import io.github.manjago.chimera.schemata.SchemaBatch;
import io.github.manjago.chimera.schemata.SchemaBundle;
import io.github.manjago.chimera.schemata.SchemaSession;
import io.github.manjago.chimera.schemata.SchemataCompiler;
import io.github.manjago.chimera.syntax.Form;
import io.github.manjago.chimera.syntax.LocationNotFoundException;
import io.github.manjago.chimera.syntax.SourceFile;
import io.github.manjago.chimera.syntax.SyntaxParseException;
import io.github.manjago.chimera.syntax.SyntaxParser;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Sequences one mutation-testing run.
 * <p>
 * Pipeline: recover backups, refresh coverage, parse, detect changes, scan
 * changed forms, filter equivalent sites, reduce by subsumption, cluster,
 * execute representatives (schemata batches where possible, single edits
 * otherwise), propagate verdicts, merge reused results and persist.
 * <p>
 * Per-site failures end up as verdicts. A failed revert aborts the run with
 * {@link io.github.manjago.chimera.mutate.RevertFailureException}.
 */
public final class MutationEngine {

    private static final Logger log = LoggerFactory.getLogger(MutationEngine.class);

    private final EngineConfig config;
    private final OperatorCatalog catalog;
    private final TestRunner runner;
    private final ReloadService reload;
    private final UnitTracer tracer;
    @Nullable
    private final FormLocationBridge bridge;
    @Nullable
    private final MutantSwitch mutantSwitch;
    private final StateStore state;
    private final EngineListener listener;
    private final MutationApplier applier;

    private MutationEngine(Builder b) {
        this.config = b.config;
        this.catalog = b.catalog;
        this.runner = Objects.requireNonNull(b.runner, "testRunner");
        this.reload = b.reload;
        this.tracer = Objects.requireNonNull(b.tracer, "traceOracle or unitTracer");
        this.bridge = b.bridge;
        this.mutantSwitch = b.mutantSwitch;
        this.state = Objects.requireNonNull(b.state, "stateStore");
        this.listener = b.listener;
        this.applier = new MutationApplier(config.backupDir());
    }

    public static Builder builder(EngineConfig config) {
        return new Builder(config);
    }

    public EngineConfig getConfig() {
        return config;
    }

    public MutationApplier getApplier() {
        return applier;
    }

    /**
     * Run the pipeline over {@code files} against {@code testUnits}.
     *
     * @throws IOException          if a file or the state store cannot be read or written
     * @throws SyntaxParseException if a source file does not parse
     */
    public RunReport run(List<Path> files, List<TestUnit> testUnits) throws IOException, SyntaxParseException {
        long startTime = System.currentTimeMillis();
        log.info("Mutation run: {} files, {} test units, preset {}",
                files.size(), testUnits.size(), config.preset());

        List<Path> recovered = applier.recover();

        // Coverage
        CoverageRefresher.Refresh refresh = new CoverageRefresher(tracer, config.coverageParallelism())
                .refresh(testUnits, state.loadUnits());
        CoverageIndex index = refresh.index();

        // Parse
        Map<Path, String> texts = new LinkedHashMap<>();
        List<Form> forms = new ArrayList<>();
        Map<String, Form> formsById = new HashMap<>();
        for (Path file : files) {
            String text = Files.readString(file, StandardCharsets.UTF_8);
            SourceFile source = SyntaxParser.parse(file, text);
            texts.put(file, text);
            for (Form form : source.forms()) {
                Form clash = formsById.putIfAbsent(form.id(), form);
                if (clash != null) {
                    throw new IllegalArgumentException(String.format(
                            "Form %s is defined in both %s and %s", form.id(), clash.file(), file));
                }
                forms.add(form);
            }
        }

        FormLocator locator = new FormLocator(bridge != null ? bridge : FormLocationBridge.ofForms(forms));
        TestSelector selector = new TestSelector(index, locator);

        // Incremental
        ChangeDetector detector = new ChangeDetector(form -> coveringTests(form, index, locator));
        ChangeSet changes = detector.detect(forms, state.loadDigests(), refresh.changedTests());
        List<Form> changedForms = forms.stream().filter(f -> changes.isChanged(f.id())).toList();

        // Scan and reduce
        List<MutationSite> scanned = new SiteScanner(catalog.preset(config.preset())).scan(changedForms);
        EquivalenceFilter.Result filtered = new EquivalenceFilter(catalog).apply(scanned, formsById);
        SubsumptionReducer.Result reduced = new SubsumptionReducer(catalog).apply(filtered.retained());
        List<Cluster> clusters = new ClusterSelector(config.clusterKey(), config.prefixDepth(), catalog)
                .select(reduced.retained(), formsById);
        log.info("Sites: {} scanned, {} equivalent, {} subsumed, {} clusters",
                scanned.size(), filtered.equivalent().size(), reduced.subsumed().size(), clusters.size());

        // Execute
        List<MutationSite> representatives = clusters.stream().map(Cluster::representative).toList();
        Map<String, SiteResult> executed;
        try (TestExecutor executor = new TestExecutor(runner, config.testTimeout(), config.testParallelism())) {
            executed = new Execution(executor, selector, texts, formsById, representatives.size())
                    .run(representatives);
        }

        // Propagate
        List<SiteResult> fresh = new ArrayList<>();
        for (Cluster cluster : clusters) {
            SiteResult representative = executed.get(cluster.representative().id());
            for (MutationSite member : cluster.members()) {
                SiteResult result = member == cluster.representative()
                        ? representative
                        : representative.propagateTo(member);
                fresh.add(result);
                if (result.isPropagated()) {
                    listener.onVerdict(result);
                }
            }
        }

        // Reuse
        List<SiteResult> reused = new ArrayList<>();
        for (Form form : forms) {
            if (!changes.isChanged(form.id())) {
                reused.addAll(state.loadResults(form.id()));
            }
        }

        persist(changes, changedForms, fresh, refresh);

        List<SiteResult> all = new ArrayList<>(fresh);
        all.addAll(reused);
        RunReport report = new RunReport(all, filtered.equivalent(), reduced.subsumed(),
                changes.changed().size(), changes.unchanged().size(), changes.removed().size(),
                scanned.size(), clusters.size(), reused.size(), recovered.size(),
                System.currentTimeMillis() - startTime);
        log.info("Run finished: score {}% ({} results)", String.format("%.1f", report.score() * 100), all.size());
        listener.onRunFinished(report);
        return report;
    }

    private static Set<String> coveringTests(Form form, CoverageIndex index, FormLocator locator) {
        if (form.file() == null) {
            return index.testsForForm(form.id());
        }
        return locator.resolve(form.file(), form.startLine()).map(index::testsForForm).orElse(Set.of());
    }

    private void persist(ChangeSet changes, List<Form> changedForms, List<SiteResult> fresh,
                         CoverageRefresher.Refresh refresh) {
        Map<String, List<SiteResult>> byForm = new LinkedHashMap<>();
        for (Form form : changedForms) {
            byForm.put(form.id(), new ArrayList<>());
        }
        for (SiteResult result : fresh) {
            byForm.computeIfAbsent(result.site().formId(), k -> new ArrayList<>()).add(result);
        }
        byForm.forEach(state::saveResults);
        changes.removed().forEach(state::removeForm);
        state.saveDigests(changes.digests().values());
        state.saveUnits(refresh.units().values());
        state.commit();
    }

    // ========== Execution ==========

    /**
     * Execution of one run's representatives. Sites without covering tests
     * never touch a file.
     */
    private final class Execution {

        private final TestExecutor executor;
        private final TestSelector selector;
        private final Map<Path, String> texts;
        private final Map<String, Form> formsById;
        private final int total;
        private final Map<String, SiteResult> results = new LinkedHashMap<>();
        private final Map<String, Set<String>> tests = new HashMap<>();

        Execution(TestExecutor executor, TestSelector selector, Map<Path, String> texts,
                  Map<String, Form> formsById, int total) {
            this.executor = executor;
            this.selector = selector;
            this.texts = texts;
            this.formsById = formsById;
            this.total = total;
        }

        Map<String, SiteResult> run(List<MutationSite> sites) {
            List<MutationSite> covered = new ArrayList<>();
            for (MutationSite site : sites) {
                Set<String> siteTests = selector.testsFor(site);
                if (siteTests.isEmpty()) {
                    listener.onSiteStarted(site, siteTests);
                    record(site, ExecutionResult.noCoverage(), 0);
                } else {
                    tests.put(site.id(), siteTests);
                    covered.add(site);
                }
            }

            if (config.schemataEnabled() && mutantSwitch != null) {
                SchemataCompiler compiler = new SchemataCompiler(config.selector());
                SchemataCompiler.Plan plan = compiler.plan(covered, config.batchSize(), formsById);
                for (SchemaBatch batch : plan.batches()) {
                    runBatch(compiler, batch);
                }
                plan.fallback().forEach(this::runSingle);
            } else {
                covered.forEach(this::runSingle);
            }

            // scan order
            Map<String, SiteResult> ordered = new LinkedHashMap<>();
            for (MutationSite site : sites) {
                ordered.put(site.id(), results.get(site.id()));
            }
            return ordered;
        }

        private void runSingle(MutationSite site) {
            Set<String> siteTests = tests.get(site.id());
            listener.onSiteStarted(site, siteTests);
            long start = System.currentTimeMillis();

            ExecutionResult result;
            boolean applied = false;
            try (MutationHandle handle = applier.apply(site)) {
                applied = true;
                log.debug("Applied {} to {}", site.id(), handle.getFile());
                result = reloadSafely(site.file())
                        ? executor.execute(siteTests)
                        : ExecutionResult.error("reload of mutated file failed");
            } catch (MutationApplyException e) {
                log.debug("Cannot apply {}: {}", site.id(), e.getMessage());
                result = ExecutionResult.error(e.getMessage());
            }
            if (applied && !reloadSafely(site.file())) {
                log.warn("Reload of restored {} failed", site.file());
            }
            record(site, result, System.currentTimeMillis() - start);
        }

        private void runBatch(SchemataCompiler compiler, SchemaBatch batch) {
            SchemaBundle bundle;
            try {
                bundle = compiler.compile(batch, texts.get(batch.file()));
            } catch (SyntaxParseException | LocationNotFoundException e) {
                log.warn("Cannot compile schemata for {}: {}", batch.file(), e.getMessage());
                batch.sites().forEach(this::runSingle);
                return;
            }
            listener.onBatchCompiled(bundle);

            try (SchemaSession session = SchemaSession.open(bundle, applier, reload, mutantSwitch)) {
                for (MutationSite site : batch.sites()) {
                    Set<String> siteTests = tests.get(site.id());
                    listener.onSiteStarted(site, siteTests);
                    long start = System.currentTimeMillis();
                    session.activate(site.ordinal());
                    record(site, executor.execute(siteTests), System.currentTimeMillis() - start);
                }
            } catch (MutationApplyException e) {
                // the session restored the file before failing
                log.warn("Schemata batch for {} failed, applying its sites one by one: {}",
                        batch.file(), e.getMessage());
                for (MutationSite site : batch.sites()) {
                    if (!results.containsKey(site.id())) {
                        runSingle(site);
                    }
                }
            }
        }

        private boolean reloadSafely(@Nullable Path file) {
            if (file == null) {
                return false;
            }
            try {
                return reload.reload(List.of(file));
            } catch (RuntimeException e) {
                log.warn("Reload service failed on {}: {}", file, e.toString());
                return false;
            }
        }

        private void record(MutationSite site, ExecutionResult result, long durationMs) {
            VerdictState verdict = new VerdictState();
            verdict.transition(result.verdict());
            SiteResult siteResult = SiteResult.of(site, result, durationMs);
            results.put(site.id(), siteResult);
            log.debug("{} -> {} ({})", site.id(), verdict.get(), result.detail());
            listener.onVerdict(siteResult);
            listener.onProgress(results.size(), total);
        }
    }

    // ========== Builder ==========

    public static final class Builder {

        private final EngineConfig config;
        private OperatorCatalog catalog = OperatorCatalog.builtin();
        private TestRunner runner;
        private ReloadService reload = ReloadService.NOOP;
        private UnitTracer tracer;
        private TraceOracle oracle;
        private FormLocationBridge bridge;
        private MutantSwitch mutantSwitch;
        private StateStore state;
        private EngineListener listener = EngineListener.NOOP;

        private Builder(EngineConfig config) {
            this.config = config;
        }

        public Builder catalog(OperatorCatalog catalog) { this.catalog = catalog; return this; }
        public Builder testRunner(TestRunner runner) { this.runner = runner; return this; }
        public Builder reloadService(ReloadService reload) { this.reload = reload; return this; }
        public Builder unitTracer(UnitTracer tracer) { this.tracer = tracer; return this; }
        public Builder formLocationBridge(FormLocationBridge bridge) { this.bridge = bridge; return this; }
        public Builder mutantSwitch(MutantSwitch mutantSwitch) { this.mutantSwitch = mutantSwitch; return this; }
        public Builder stateStore(StateStore state) { this.state = state; return this; }
        public Builder listener(EngineListener listener) { this.listener = listener; return this; }

        /**
         * Trace coverage through {@code oracle}, running tests with the configured runner.
         */
        public Builder traceOracle(TraceOracle oracle) {
            this.oracle = oracle;
            return this;
        }

        public MutationEngine build() {
            if (tracer == null && oracle != null && runner != null) {
                tracer = new CoverageCollector(oracle, runner);
            }
            return new MutationEngine(this);
        }
    }
}
