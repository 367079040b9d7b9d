package io.github.manjago.chimera.pipeline;

import io.github.manjago.chimera.scan.MutationSite;

/**
 * A site never scheduled because another operator at the same expression
 * dominates its operator.
 *
 * @param dominatorId operator whose kill implies this site's kill
 */
public record SubsumedSite(MutationSite site, String dominatorId) {
}
