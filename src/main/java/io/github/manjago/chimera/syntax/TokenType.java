package io.github.manjago.chimera.syntax;

import java.util.regex.Pattern;

/**
 * Lexical category of a {@link Token}.
 */
public enum TokenType {
    SYMBOL,
    KEYWORD,
    NUMBER,
    STRING,
    REGEX,
    CHARACTER,
    /** nil, true, false */
    LITERAL,
    /** Tagged-literal tag (#inst) or symbolic value (##Inf) */
    TAG;

    private static final Pattern NUMBER_PATTERN =
            Pattern.compile("[+-]?\\d.*");

    /**
     * Classify a bare atom (anything that is not a string, regex, character or tag).
     */
    public static TokenType classifyAtom(String text) {
        if (text.startsWith(":")) {
            return KEYWORD;
        }
        if (text.equals("nil") || text.equals("true") || text.equals("false")) {
            return LITERAL;
        }
        if (NUMBER_PATTERN.matcher(text).matches()) {
            return NUMBER;
        }
        return SYMBOL;
    }
}
