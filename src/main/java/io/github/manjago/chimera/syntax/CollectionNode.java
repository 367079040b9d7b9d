package io.github.manjago.chimera.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Delimited collection: list, vector, fn literal, map or set.
 *
 * @param open     opening text as written (differs from the delimiter only for namespaced maps)
 * @param trailing trivia between the last child and the closing delimiter
 */
public record CollectionNode(
    String prefix,
    int line,
    Delimiter delimiter,
    String open,
    List<Node> children,
    String trailing
) implements Node {

    public CollectionNode {
        children = List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return delimiter.getKind();
    }

    @Override
    public CollectionNode withPrefix(String prefix) {
        return new CollectionNode(prefix, line, delimiter, open, children, trailing);
    }

    /**
     * Copy with one child swapped; all other children are shared.
     */
    public CollectionNode withChild(int index, Node child) {
        List<Node> copy = new ArrayList<>(children);
        copy.set(index, child);
        return new CollectionNode(prefix, line, delimiter, open, copy, trailing);
    }

    public CollectionNode withChildren(List<Node> newChildren) {
        return new CollectionNode(prefix, line, delimiter, open, newChildren, trailing);
    }

    /**
     * Head symbol of a list, if the first child is a symbol token.
     */
    public Optional<String> headSymbol() {
        if (delimiter != Delimiter.LIST || children.isEmpty()) {
            return Optional.empty();
        }
        if (children.get(0) instanceof Token t && t.type() == TokenType.SYMBOL) {
            return Optional.of(t.value());
        }
        return Optional.empty();
    }

    public boolean isCall(String head) {
        return headSymbol().map(head::equals).orElse(false);
    }

    @Override
    public void render(StringBuilder out) {
        out.append(prefix).append(open);
        for (Node child : children) {
            child.render(out);
        }
        out.append(trailing).append(delimiter.getClose());
    }

    @Override
    public void renderCanonical(StringBuilder out) {
        out.append(open);
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                out.append(' ');
            }
            children.get(i).renderCanonical(out);
        }
        out.append(delimiter.getClose());
    }

    @Override
    public String toString() {
        return "Collection[" + delimiter + " size=" + children.size() + " @" + line + "]";
    }
}
