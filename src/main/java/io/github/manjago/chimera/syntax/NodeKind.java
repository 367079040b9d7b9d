package io.github.manjago.chimera.syntax;

/**
 * Closed set of syntax node kinds.
 * <p>
 * Operators match on the kind plus an extracted payload (symbol text,
 * call head, literal value), never on concrete node classes.
 */
public enum NodeKind {

    /** Symbol, keyword, number, string, character, regex or tag */
    TOKEN(false),

    /** List, vector or anonymous function literal; children addressed by ordinal */
    ORDERED(true),

    /** Map literal; children addressed by key digest */
    ASSOCIATIVE(true),

    /** Set literal; children addressed by content digest */
    UNORDERED(true),

    /** Reader-macro prefixed form ('x, `x, ~x, @x, #'x, #?(...)) */
    QUOTED(false);

    private final boolean collection;

    NodeKind(boolean collection) {
        this.collection = collection;
    }

    /**
     * @return true for kinds whose children sit between delimiters
     */
    public boolean isCollection() {
        return collection;
    }

    /**
     * @return true if child segments are content digests instead of ordinals
     */
    public boolean isDigestAddressed() {
        return this == ASSOCIATIVE || this == UNORDERED;
    }
}
