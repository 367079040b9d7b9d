package io.github.manjago.chimera.operator;

import org.jetbrains.annotations.Nullable;

import java.util.Set;

/**
 * Declarative mutation operator.
 *
 * @param id          unique id, e.g. {@code lt-to-lte}
 * @param category    broad group
 * @param family      comparator family; dominance edges stay inside one family
 * @param hardness    how hard the mutant is to kill (higher is harder); picks cluster representatives
 * @param matcher     applicability predicate
 * @param generator   replacement text
 * @param equivalence optional static equivalence rule
 * @param dominates   ids of operators whose mutants are killed whenever this one's is
 * @param description one-line summary
 */
public record Operator(
    String id,
    OperatorCategory category,
    String family,
    int hardness,
    NodeMatcher matcher,
    ReplacementGenerator generator,
    @Nullable EquivalenceRule equivalence,
    Set<String> dominates,
    String description
) {

    public Operator {
        dominates = Set.copyOf(dominates);
    }

    public boolean matches(MatchContext context) {
        return matcher.matches(context);
    }

    public String generate(MatchContext context) {
        return generator.generate(context);
    }

    @Override
    public String toString() {
        return "Operator[" + id + "]";
    }
}
