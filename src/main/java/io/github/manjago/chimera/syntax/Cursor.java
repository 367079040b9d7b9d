package io.github.manjago.chimera.syntax;

import org.jetbrains.annotations.Nullable;

/**
 * A node together with the path that led to it.
 *
 * @param ordinal index of the node among its parent's children (-1 for the root)
 */
public record Cursor(Node node, @Nullable Cursor parent, int ordinal, Coordinate coordinate) {

    public static Cursor root(Node root) {
        return new Cursor(root, null, -1, Coordinate.ROOT);
    }

    public Cursor child(int index, Segment segment) {
        return new Cursor(node.children().get(index), this, index, coordinate.child(segment));
    }

    @Nullable
    public Node parentNode() {
        return parent != null ? parent.node() : null;
    }
}
