package io.github.manjago.chimera.cli;

import io.github.manjago.chimera.config.EngineConfig;
import io.github.manjago.chimera.operator.OperatorCatalog;
import io.github.manjago.chimera.operator.Preset;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Show information about Chimera.
 */
@Command(
    name = "info",
    description = "Show version and configuration info",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║              CHIMERA                  ║");
        System.out.println("║   Mutation Testing for S-expressions  ║");
        System.out.println("║          Version 1.0.0                ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();

        System.out.println("Default Configuration:");
        System.out.println(EngineConfig.defaults());

        OperatorCatalog catalog = OperatorCatalog.builtin();
        System.out.println("Operators: " + catalog.operators().size()
                + " in " + catalog.families().size() + " families");
        for (Preset preset : Preset.values()) {
            System.out.printf("  %-9s %d operators%n", preset.name().toLowerCase(), catalog.preset(preset).size());
        }
        System.out.println();

        return 0;
    }
}
