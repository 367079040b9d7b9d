package io.github.manjago.chimera.syntax;

import java.util.List;

/**
 * Leaf node: a single lexical token.
 */
public record Token(String prefix, int line, TokenType type, String value) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.TOKEN;
    }

    @Override
    public Token withPrefix(String prefix) {
        return new Token(prefix, line, type, value);
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public void render(StringBuilder out) {
        out.append(prefix).append(value);
    }

    @Override
    public void renderCanonical(StringBuilder out) {
        out.append(value);
    }

    @Override
    public String text() {
        return value;
    }

    public boolean isSymbol(String name) {
        return type == TokenType.SYMBOL && value.equals(name);
    }

    @Override
    public String toString() {
        return "Token[" + type + " " + value + " @" + line + "]";
    }
}
