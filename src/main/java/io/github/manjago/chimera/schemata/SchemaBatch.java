package io.github.manjago.chimera.schemata;

import io.github.manjago.chimera.scan.MutationSite;

import java.nio.file.Path;
import java.util.List;

/**
 * Sites of one file embedded by a single structural edit.
 */
public record SchemaBatch(Path file, List<MutationSite> sites) {

    public SchemaBatch {
        sites = List.copyOf(sites);
    }
}
