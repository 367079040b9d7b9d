package io.github.manjago.chimera.syntax;

/**
 * Exception while reading source text.
 */
public class SyntaxParseException extends Exception {

    private final int line;
    private final int column;

    public SyntaxParseException(String message, int line, int column) {
        super("Line " + line + ", column " + column + ": " + message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
