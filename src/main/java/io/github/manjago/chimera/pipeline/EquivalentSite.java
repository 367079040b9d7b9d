package io.github.manjago.chimera.pipeline;

import io.github.manjago.chimera.scan.MutationSite;

/**
 * A site excluded because a static rule proved the mutation equivalent.
 */
public record EquivalentSite(MutationSite site, String reason) {
}
