package io.github.manjago.chimera.schemata;

import io.github.manjago.chimera.scan.MutationSite;

import java.nio.file.Path;
import java.util.Map;

/**
 * A file rewritten to embed several mutants.
 *
 * @param originalText file content before compilation
 * @param compiledText file content with every targeted expression wrapped in a selector switch
 * @param mutants      selector value → site it activates
 */
public record SchemaBundle(Path file, String originalText, String compiledText, Map<Integer, MutationSite> mutants) {

    public SchemaBundle {
        mutants = Map.copyOf(mutants);
    }
}
