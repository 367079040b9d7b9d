package io.github.manjago.chimera.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Chimera CLI - static side of the mutation engine.
 * 
 * Usage:
 *   chimera scan [options] <files>   - List mutation sites of source files
 *   chimera operators [options]      - List operators of a preset
 *   chimera state <file>             - Show persisted state summary
 *   chimera info                     - Show version and config
 */
@Command(
    name = "chimera",
    description = "Mutation testing for S-expression source",
    mixinStandardHelpOptions = true,
    version = "Chimera 1.0.0",
    subcommands = {
        ScanCommand.class,
        OperatorsCommand.class,
        StateCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class ChimeraCli implements Runnable {

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ChimeraCli())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
