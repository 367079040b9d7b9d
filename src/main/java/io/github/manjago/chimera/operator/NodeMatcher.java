package io.github.manjago.chimera.operator;

/**
 * Total, side-effect-free predicate deciding whether an operator applies to a node.
 */
@FunctionalInterface
public interface NodeMatcher {

    boolean matches(MatchContext context);
}
