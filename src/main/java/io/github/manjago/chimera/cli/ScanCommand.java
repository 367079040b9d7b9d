package io.github.manjago.chimera.cli;

import io.github.manjago.chimera.config.EngineConfig;
import io.github.manjago.chimera.operator.OperatorCatalog;
import io.github.manjago.chimera.operator.Preset;
import io.github.manjago.chimera.pipeline.Cluster;
import io.github.manjago.chimera.pipeline.ClusterKey;
import io.github.manjago.chimera.pipeline.ClusterSelector;
import io.github.manjago.chimera.pipeline.EquivalenceFilter;
import io.github.manjago.chimera.pipeline.EquivalentSite;
import io.github.manjago.chimera.pipeline.SubsumedSite;
import io.github.manjago.chimera.pipeline.SubsumptionReducer;
import io.github.manjago.chimera.scan.MutationSite;
import io.github.manjago.chimera.scan.SiteScanner;
import io.github.manjago.chimera.syntax.Form;
import io.github.manjago.chimera.syntax.SyntaxParseException;
import io.github.manjago.chimera.syntax.SyntaxParser;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: scan
 * 
 * Runs the static half of the pipeline (parse, scan, equivalence filter,
 * subsumption, clustering) and lists the sites that would execute.
 * 
 * Usage:
 *   chimera scan src/app/core.clj
 *   chimera scan --preset minimal --cluster operator src/app/*.clj
 *   chimera scan --equivalent --subsumed src/app/core.clj
 */
@Command(
    name = "scan",
    description = "List mutation sites of source files",
    mixinStandardHelpOptions = true
)
public class ScanCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Source files")
    private List<Path> files;

    @Option(names = {"-c", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"-p", "--preset"}, description = "Operator preset (overrides config): ${COMPLETION-CANDIDATES}")
    private Preset preset;

    @Option(names = {"-k", "--cluster"}, description = "Cluster key (overrides config): ${COMPLETION-CANDIDATES}")
    private ClusterKey clusterKey;

    @Option(names = {"--equivalent"}, description = "Also list provably equivalent sites")
    private boolean showEquivalent;

    @Option(names = {"--subsumed"}, description = "Also list subsumed sites")
    private boolean showSubsumed;

    @Override
    public Integer call() {
        EngineConfig config = configFile != null ? EngineConfig.fromFile(configFile) : EngineConfig.defaults();
        Preset activePreset = preset != null ? preset : config.preset();
        ClusterKey activeKey = clusterKey != null ? clusterKey : config.clusterKey();
        OperatorCatalog catalog = OperatorCatalog.builtin();

        List<Form> forms = new ArrayList<>();
        Map<String, Form> formsById = new HashMap<>();
        for (Path file : files) {
            try {
                for (Form form : SyntaxParser.parseFile(file).forms()) {
                    forms.add(form);
                    formsById.putIfAbsent(form.id(), form);
                }
            } catch (SyntaxParseException e) {
                System.err.printf("❌ %s:%d:%d: %s%n", file, e.getLine(), e.getColumn(), e.getMessage());
                return 1;
            } catch (IOException e) {
                System.err.println("❌ Cannot read " + file + ": " + e.getMessage());
                return 1;
            }
        }

        List<MutationSite> sites = new SiteScanner(catalog.preset(activePreset)).scan(forms);
        EquivalenceFilter.Result filtered = new EquivalenceFilter(catalog).apply(sites, formsById);
        SubsumptionReducer.Result reduced = new SubsumptionReducer(catalog).apply(filtered.retained());
        List<Cluster> clusters = new ClusterSelector(activeKey, config.prefixDepth(), catalog)
                .select(reduced.retained(), formsById);

        for (Cluster cluster : clusters) {
            MutationSite rep = cluster.representative();
            System.out.printf("%s:%d  %-18s %s -> %s%s%n",
                    rep.file() != null ? rep.file().getFileName() : rep.formId(), rep.line(),
                    rep.operatorId(), abbreviate(rep.original()), abbreviate(rep.replacement()),
                    cluster.size() > 1 ? "  (+" + (cluster.size() - 1) + " clustered)" : "");
        }
        if (showEquivalent) {
            for (EquivalentSite eq : filtered.equivalent()) {
                System.out.printf("equivalent  %s  (%s)%n", eq.site().id(), eq.reason());
            }
        }
        if (showSubsumed) {
            for (SubsumedSite sub : reduced.subsumed()) {
                System.out.printf("subsumed    %s  (by %s)%n", sub.site().id(), sub.dominatorId());
            }
        }

        System.out.println();
        System.out.printf("%d forms, %d sites: %d equivalent, %d subsumed, %d to execute in %d clusters (%s)%n",
                forms.size(), sites.size(), filtered.equivalent().size(), reduced.subsumed().size(),
                reduced.retained().size(), clusters.size(), activePreset.name().toLowerCase());
        return 0;
    }

    private static String abbreviate(String text) {
        String flat = text.replaceAll("\\s+", " ");
        return flat.length() > 40 ? flat.substring(0, 37) + "..." : flat;
    }
}
