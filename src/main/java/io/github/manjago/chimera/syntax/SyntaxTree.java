package io.github.manjago.chimera.syntax;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.function.Consumer;

/**
 * Coordinate addressing over immutable syntax trees.
 * <p>
 * {@link #decode} and {@link #encode} are inverse on one tree snapshot.
 * Map children are addressed by the digest of their key (prefixed {@code k}
 * for the key, {@code v} for the value), set elements by the digest of their
 * canonical text, everything else by 0-based ordinal.
 */
public final class SyntaxTree {

    private static final Logger log = LoggerFactory.getLogger(SyntaxTree.class);

    private SyntaxTree() {}

    /**
     * Segment of each child of {@code node}, in source order.
     */
    public static List<Segment> childSegments(Node node) {
        List<Node> children = node.children();
        List<Segment> segments = new ArrayList<>(children.size());

        switch (node.kind()) {
            case ASSOCIATIVE -> {
                for (int i = 0; i < children.size(); i++) {
                    Node key = children.get(i - i % 2);
                    String role = i % 2 == 0 ? "k" : "v";
                    segments.add(Segment.ofDigest(Digests.shortHex(role + key.canonical())));
                }
            }
            case UNORDERED -> {
                for (Node child : children) {
                    segments.add(Segment.ofDigest(Digests.shortHex("e" + child.canonical())));
                }
            }
            default -> {
                for (int i = 0; i < children.size(); i++) {
                    segments.add(Segment.ofOrdinal(i));
                }
            }
        }
        return segments;
    }

    /**
     * True if the child at {@code index} shares its digest segment with an earlier sibling.
     */
    public static boolean isShadowed(List<Segment> segments, int index) {
        Segment segment = segments.get(index);
        return segment.isDigest() && segments.indexOf(segment) < index;
    }

    // ========== Decode ==========

    public static Node decode(Node root, Coordinate coordinate) throws LocationNotFoundException {
        return locate(root, coordinate).node();
    }

    /**
     * Resolve a coordinate to a cursor (node plus parent chain).
     * A colliding digest resolves to the first matching child and is logged.
     */
    public static Cursor locate(Node root, Coordinate coordinate) throws LocationNotFoundException {
        Cursor cursor = Cursor.root(root);
        for (Segment segment : coordinate.segments()) {
            int index = childIndex(cursor.node(), segment, coordinate);
            cursor = cursor.child(index, segment);
        }
        return cursor;
    }

    private static int childIndex(Node node, Segment segment, Coordinate coordinate)
            throws LocationNotFoundException {
        List<Node> children = node.children();
        if (children.isEmpty()) {
            throw new LocationNotFoundException(coordinate, "no children below " + node);
        }
        if (node.kind().isDigestAddressed() != segment.isDigest()) {
            throw new LocationNotFoundException(coordinate,
                    "segment " + segment + " cannot address a " + node.kind() + " node");
        }
        if (!segment.isDigest()) {
            if (segment.ordinal() >= children.size()) {
                throw new LocationNotFoundException(coordinate,
                        "ordinal " + segment.ordinal() + " out of range (" + children.size() + " children)");
            }
            return segment.ordinal();
        }

        List<Segment> segments = childSegments(node);
        int first = segments.indexOf(segment);
        if (first < 0) {
            throw new LocationNotFoundException(coordinate, "no child with digest " + segment);
        }
        if (segments.lastIndexOf(segment) != first) {
            log.warn("Ambiguous location {}: several children share digest {}, using the first", coordinate, segment);
        }
        return first;
    }

    // ========== Encode ==========

    /**
     * Coordinate of {@code target} (compared by identity) within {@code root}.
     *
     * @throws LocationNotFoundException  if the node is not part of the tree
     * @throws LocationAmbiguousException if a digest on the path is shadowed by an earlier sibling
     */
    public static Coordinate encode(Node root, Node target)
            throws LocationNotFoundException, LocationAmbiguousException {
        Cursor found = find(Cursor.root(root), target);
        if (found == null) {
            throw new LocationNotFoundException(Coordinate.ROOT, "node is not part of this tree: " + target);
        }
        for (Cursor c = found; c.parent() != null; c = c.parent()) {
            List<Segment> siblings = childSegments(c.parent().node());
            if (isShadowed(siblings, c.ordinal())) {
                throw new LocationAmbiguousException(found.coordinate());
            }
        }
        return found.coordinate();
    }

    @Nullable
    private static Cursor find(Cursor cursor, Node target) {
        if (cursor.node() == target) {
            return cursor;
        }
        List<Node> children = cursor.node().children();
        if (children.isEmpty()) {
            return null;
        }
        List<Segment> segments = childSegments(cursor.node());
        for (int i = 0; i < children.size(); i++) {
            Cursor found = find(cursor.child(i, segments.get(i)), target);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    // ========== Replace ==========

    /**
     * Replace the node at {@code coordinate}. Only ancestors are rebuilt;
     * every other subtree is shared with the input. The replacement takes over
     * the replaced node's leading trivia.
     */
    public static Node replace(Node root, Coordinate coordinate, Node replacement)
            throws LocationNotFoundException {
        Cursor target = locate(root, coordinate);
        return rebuild(target, replacement.withPrefix(target.node().prefix()));
    }

    private static Node rebuild(Cursor cursor, Node newNode) {
        Cursor parent = cursor.parent();
        if (parent == null) {
            return newNode;
        }
        Node updated;
        if (parent.node() instanceof CollectionNode c) {
            updated = c.withChild(cursor.ordinal(), newNode);
        } else if (parent.node() instanceof QuotedNode q) {
            updated = q.withPayload(newNode);
        } else {
            throw new IllegalStateException("Node without children on a cursor path: " + parent.node());
        }
        return rebuild(parent, updated);
    }

    /**
     * Replace several nodes at once, keyed by node identity. Targets must not nest.
     */
    public static Node replaceAll(Node root, IdentityHashMap<Node, Node> replacements) {
        Node direct = replacements.get(root);
        if (direct != null) {
            return direct.withPrefix(root.prefix());
        }
        if (root instanceof CollectionNode c) {
            List<Node> children = new ArrayList<>(c.children().size());
            boolean changed = false;
            for (Node child : c.children()) {
                Node updated = replaceAll(child, replacements);
                changed |= updated != child;
                children.add(updated);
            }
            return changed ? c.withChildren(children) : c;
        }
        if (root instanceof QuotedNode q) {
            Node payload = replaceAll(q.payload(), replacements);
            return payload != q.payload() ? q.withPayload(payload) : q;
        }
        return root;
    }

    // ========== Traversal ==========

    /**
     * Pre-order walk over every node of the tree.
     */
    public static void walk(Node root, Consumer<Cursor> visitor) {
        walk(Cursor.root(root), visitor);
    }

    private static void walk(Cursor cursor, Consumer<Cursor> visitor) {
        visitor.accept(cursor);
        List<Node> children = cursor.node().children();
        if (children.isEmpty()) {
            return;
        }
        List<Segment> segments = childSegments(cursor.node());
        for (int i = 0; i < children.size(); i++) {
            walk(cursor.child(i, segments.get(i)), visitor);
        }
    }
}
