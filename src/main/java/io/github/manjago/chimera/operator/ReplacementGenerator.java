package io.github.manjago.chimera.operator;

/**
 * Produces the source text that replaces a matched node.
 */
@FunctionalInterface
public interface ReplacementGenerator {

    String generate(MatchContext context);
}
