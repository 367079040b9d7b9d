package io.github.manjago.chimera.syntax;

/**
 * Reader macros that prefix a single form.
 * <p>
 * Each style also drives the quoting-depth state machine used while scanning:
 * quoted payloads are literal data and are never mutated.
 */
public enum QuoteStyle {

    QUOTE("'", 1),
    SYNTAX_QUOTE("`", 1),
    UNQUOTE("~", -1),
    UNQUOTE_SPLICING("~@", -1),
    DEREF("@", 0),
    VAR("#'", 0),
    READER_CONDITIONAL("#?", 0),
    READER_CONDITIONAL_SPLICING("#?@", 0);

    private final String sigil;
    private final int depthDelta;

    QuoteStyle(String sigil, int depthDelta) {
        this.sigil = sigil;
        this.depthDelta = depthDelta;
    }

    public String getSigil() {
        return sigil;
    }

    /**
     * Quoting depth inside the payload of this reader macro.
     * Unquoting never goes below zero.
     */
    public int nextDepth(int depth) {
        return Math.max(0, depth + depthDelta);
    }
}
