package io.github.manjago.chimera.cli;

import io.github.manjago.chimera.config.EngineConfig;
import io.github.manjago.chimera.exec.SiteResult;
import io.github.manjago.chimera.exec.Verdict;
import io.github.manjago.chimera.incremental.FormDigest;
import io.github.manjago.chimera.persistence.StateStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Show what the previous runs left in the state file.
 * 
 * Examples:
 *   chimera state                         # State file from the default config
 *   chimera state chimera-state.mv        # Explicit file
 *   chimera state --survivors             # List surviving mutants
 */
@Command(
    name = "state",
    description = "Show persisted engine state",
    mixinStandardHelpOptions = true
)
public class StateCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "State file (default: persistence.file from config)")
    private Path stateFile;

    @Option(names = {"-c", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"-s", "--survivors"}, description = "List surviving mutants")
    private boolean showSurvivors;

    @Override
    public Integer call() {
        Path file = stateFile;
        if (file == null) {
            EngineConfig config = configFile != null ? EngineConfig.fromFile(configFile) : EngineConfig.defaults();
            file = config.stateFile();
        }
        if (!Files.exists(file)) {
            System.err.println("No state file: " + file);
            return 1;
        }

        try (StateStore store = StateStore.open(file)) {
            System.out.println(store.describe());

            Map<Verdict, Integer> counts = new EnumMap<>(Verdict.class);
            for (FormDigest digest : store.loadDigests().values()) {
                for (SiteResult result : store.loadResults(digest.formId())) {
                    counts.merge(result.verdict(), 1, Integer::sum);
                    if (showSurvivors && result.verdict() == Verdict.SURVIVED) {
                        System.out.println("  survived: " + result.site());
                    }
                }
            }
            counts.forEach((verdict, count) -> System.out.printf("  %-12s %,d%n", verdict, count));
            return 0;
        } catch (IOException e) {
            System.err.println("❌ Cannot read state: " + e.getMessage());
            return 1;
        }
    }
}
