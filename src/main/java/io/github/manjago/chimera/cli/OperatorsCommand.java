package io.github.manjago.chimera.cli;

import io.github.manjago.chimera.operator.Operator;
import io.github.manjago.chimera.operator.OperatorCatalog;
import io.github.manjago.chimera.operator.Preset;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * List mutation operators.
 * 
 * Examples:
 *   chimera operators                    # Operators of the thorough preset
 *   chimera operators --preset minimal   # Only the minimal preset
 *   chimera operators --edges            # Include dominance edges
 */
@Command(
    name = "operators",
    description = "List mutation operators",
    mixinStandardHelpOptions = true
)
public class OperatorsCommand implements Callable<Integer> {

    @Option(names = {"-p", "--preset"}, description = "Preset: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
            defaultValue = "THOROUGH")
    private Preset preset;

    @Option(names = {"-e", "--edges"}, description = "Show operators each one dominates")
    private boolean showEdges;

    @Override
    public Integer call() {
        OperatorCatalog catalog = OperatorCatalog.builtin();
        List<Operator> operators = catalog.preset(preset);

        System.out.printf("%-18s %-11s %-16s %4s  %s%n", "ID", "CATEGORY", "FAMILY", "HARD", "DESCRIPTION");
        for (Operator op : operators) {
            System.out.printf("%-18s %-11s %-16s %4d  %s%n",
                    op.id(), op.category(), op.family(), op.hardness(), op.description());
            if (showEdges && !op.dominates().isEmpty()) {
                System.out.println("    dominates: " + String.join(", ", new TreeSet<>(catalog.dominatedBy(op.id()))));
            }
        }
        System.out.println();
        System.out.println(operators.size() + " operators (" + preset.name().toLowerCase() + ")");
        return 0;
    }
}
