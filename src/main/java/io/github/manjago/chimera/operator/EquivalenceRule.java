package io.github.manjago.chimera.operator;

import java.util.function.Predicate;

/**
 * Static proof that a mutation cannot change behaviour, judged from the
 * node's immediate context only.
 *
 * @param reason    human-readable justification reported with filtered sites
 * @param predicate true when the mutation is provably equivalent
 */
public record EquivalenceRule(String reason, Predicate<MatchContext> predicate) {

    public boolean holds(MatchContext context) {
        return predicate.test(context);
    }
}
