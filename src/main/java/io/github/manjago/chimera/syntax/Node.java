package io.github.manjago.chimera.syntax;

import java.util.List;

/**
 * Immutable, formatting-preserving syntax node.
 * <p>
 * Every node owns the trivia (whitespace, commas, comments, discarded forms,
 * metadata) that precedes it, so concatenating the renderings of a file's
 * nodes reproduces the file byte for byte.
 * <p>
 * Nodes are compared by identity when addressing: two tokens with the same
 * text are still distinct locations.
 */
public interface Node {

    NodeKind kind();

    /** Trivia preceding this node */
    String prefix();

    /** 1-based line of the node's first significant character */
    int line();

    /** Copy of this node with different leading trivia */
    Node withPrefix(String prefix);

    /** Direct children in source order; empty for tokens */
    List<Node> children();

    /** Append prefix and body to the output */
    void render(StringBuilder out);

    /** Append body without any trivia, children separated by one space */
    void renderCanonical(StringBuilder out);

    /**
     * Full rendering including leading trivia.
     */
    default String render() {
        StringBuilder sb = new StringBuilder();
        render(sb);
        return sb.toString();
    }

    /**
     * Rendering without leading trivia, formatting of the body preserved.
     */
    default String text() {
        return render().substring(prefix().length());
    }

    /**
     * Whitespace-insensitive rendering used for digests.
     */
    default String canonical() {
        StringBuilder sb = new StringBuilder();
        renderCanonical(sb);
        return sb.toString();
    }
}
