package io.github.manjago.chimera.syntax;

import java.util.List;

/**
 * Reader-macro prefixed form. The payload keeps its own prefix, which holds any
 * trivia between the sigil and the form.
 */
public record QuotedNode(String prefix, int line, QuoteStyle style, Node payload) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.QUOTED;
    }

    @Override
    public QuotedNode withPrefix(String prefix) {
        return new QuotedNode(prefix, line, style, payload);
    }

    public QuotedNode withPayload(Node newPayload) {
        return new QuotedNode(prefix, line, style, newPayload);
    }

    @Override
    public List<Node> children() {
        return List.of(payload);
    }

    @Override
    public void render(StringBuilder out) {
        out.append(prefix).append(style.getSigil());
        payload.render(out);
    }

    @Override
    public void renderCanonical(StringBuilder out) {
        out.append(style.getSigil());
        payload.renderCanonical(out);
    }
}
