package io.github.manjago.chimera.operator;

import io.github.manjago.chimera.syntax.CollectionNode;
import io.github.manjago.chimera.syntax.Coordinate;
import io.github.manjago.chimera.syntax.Cursor;
import io.github.manjago.chimera.syntax.Delimiter;
import io.github.manjago.chimera.syntax.Node;
import io.github.manjago.chimera.syntax.Token;
import io.github.manjago.chimera.syntax.TokenType;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Local syntactic context of a node, as seen by matchers, generators and
 * equivalence rules: the node, its parent and its position.
 */
public record MatchContext(Node node, @Nullable Node parent, int ordinal, Coordinate coordinate) {

    /** Definition forms whose third element, when a string, is documentation */
    private static final Set<String> DOCUMENTED_DEFINITIONS = Set.of(
            "def", "defn", "defn-", "defmacro", "defmulti", "defprotocol", "definterface", "ns");

    public static MatchContext of(Cursor cursor) {
        return new MatchContext(cursor.node(), cursor.parentNode(), cursor.ordinal(), cursor.coordinate());
    }

    /**
     * Symbol text if the node is a symbol token.
     */
    public Optional<String> symbol() {
        if (node instanceof Token t && t.type() == TokenType.SYMBOL) {
            return Optional.of(t.value());
        }
        return Optional.empty();
    }

    /**
     * True if the node is the head symbol of a list, i.e. the operator of a call.
     */
    public boolean isCallHead() {
        return ordinal == 0 && symbol().isPresent()
                && parent instanceof CollectionNode c && c.delimiter() == Delimiter.LIST;
    }

    public boolean isCallHead(String name) {
        return isCallHead() && symbol().map(name::equals).orElse(false);
    }

    /**
     * Head symbol if the node itself is a call.
     */
    public Optional<String> callHead() {
        return node instanceof CollectionNode c ? c.headSymbol() : Optional.empty();
    }

    public boolean isCall(String name) {
        return callHead().map(name::equals).orElse(false);
    }

    /**
     * Head symbol of the parent call, if the parent is one.
     */
    public Optional<String> parentHead() {
        return parent instanceof CollectionNode c ? c.headSymbol() : Optional.empty();
    }

    /**
     * Arguments of the call this node belongs to: the parent's arguments when
     * the node is a call head, the node's own arguments when it is a call.
     */
    public List<Node> callArguments() {
        if (isCallHead()) {
            List<Node> siblings = parent.children();
            return siblings.subList(1, siblings.size());
        }
        if (callHead().isPresent()) {
            List<Node> children = node.children();
            return children.subList(1, children.size());
        }
        return List.of();
    }

    public boolean isDocstring() {
        return isDocstring(node, parent, ordinal);
    }

    /**
     * True for a string in the docstring slot of a definition. {@code (def x "s")}
     * binds the string as a value, so {@code def} needs a value after it.
     */
    public static boolean isDocstring(Node node, @Nullable Node parent, int ordinal) {
        if (ordinal != 2 || !(node instanceof Token t) || t.type() != TokenType.STRING
                || !(parent instanceof CollectionNode c) || c.delimiter() != Delimiter.LIST) {
            return false;
        }
        String head = c.headSymbol().orElse("");
        if (!DOCUMENTED_DEFINITIONS.contains(head)) {
            return false;
        }
        return !head.equals("def") || c.children().size() > 3;
    }

    public boolean isTokenOf(TokenType type) {
        return node instanceof Token t && t.type() == type;
    }

    /**
     * True for a token that is a literal whose text is {@code text}.
     */
    public boolean isLiteral(String text) {
        return node instanceof Token t && t.type() == TokenType.LITERAL && t.value().equals(text);
    }

    // ========== Numeric helpers ==========

    /**
     * Numeric value of a number token, ignoring Clojure's N/M suffixes.
     * Ratios, radix and hex literals have no value here.
     */
    public static Optional<BigDecimal> numberValue(Node node) {
        if (!(node instanceof Token t) || t.type() != TokenType.NUMBER) {
            return Optional.empty();
        }
        String text = t.value();
        if (text.endsWith("N") || text.endsWith("M")) {
            text = text.substring(0, text.length() - 1);
        }
        try {
            return Optional.of(new BigDecimal(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static boolean isNumber(Node node, int value) {
        return numberValue(node).map(v -> v.compareTo(BigDecimal.valueOf(value)) == 0).orElse(false);
    }
}
