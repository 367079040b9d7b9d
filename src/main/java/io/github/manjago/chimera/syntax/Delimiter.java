package io.github.manjago.chimera.syntax;

/**
 * Collection delimiters recognised by the reader.
 */
public enum Delimiter {

    LIST("(", ')', NodeKind.ORDERED),
    VECTOR("[", ']', NodeKind.ORDERED),
    FN("#(", ')', NodeKind.ORDERED),
    MAP("{", '}', NodeKind.ASSOCIATIVE),
    /** #:ns{...}; the actual opener text is kept on the node */
    NAMESPACED_MAP("#:", '}', NodeKind.ASSOCIATIVE),
    SET("#{", '}', NodeKind.UNORDERED);

    private final String open;
    private final char close;
    private final NodeKind kind;

    Delimiter(String open, char close, NodeKind kind) {
        this.open = open;
        this.close = close;
        this.kind = kind;
    }

    public String getOpen() {
        return open;
    }

    public char getClose() {
        return close;
    }

    public NodeKind getKind() {
        return kind;
    }
}
