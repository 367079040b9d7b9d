package io.github.manjago.chimera.syntax;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reader for S-expression source text.
 * <p>
 * The reader is lossless: whitespace, commas, comments, discarded forms
 * ({@code #_x}) and metadata ({@code ^x}) are kept as node prefixes or as
 * trailing trivia, so {@code parse(text).render()} equals {@code text}.
 *
 * <h2>Supported syntax:</h2>
 * <pre>
 * (list) [vector] {:map 1} #{set} #(fn %)
 * 'quote `syntax-quote ~unquote ~@splice @deref #'var
 * #?(:clj x) #?@(:clj [x]) #:ns{:a 1} #inst "..." ##Inf
 * "string" #"regex" \c \newline :keyword ::alias/kw 42 1.5M 1/2 symbol
 * ; comment   #! shebang   #_ discarded   ^{:meta true} form
 * </pre>
 */
public final class SyntaxParser {

    private static final Logger log = LoggerFactory.getLogger(SyntaxParser.class);

    private final String text;
    private int pos;
    private int line = 1;
    private int column = 1;

    private SyntaxParser(String text) {
        this.text = text;
    }

    /**
     * Parse source text that is not backed by a file.
     */
    public static SourceFile parse(String text) throws SyntaxParseException {
        return parse(null, text);
    }

    /**
     * Parse source text read from {@code file}.
     *
     * @param file origin of the text, used for form identities (may be null)
     * @param text source text
     * @return lossless tree of the whole file
     * @throws SyntaxParseException on unbalanced delimiters, unterminated literals
     *                              or odd map entry counts
     */
    public static SourceFile parse(@Nullable Path file, String text) throws SyntaxParseException {
        SyntaxParser parser = new SyntaxParser(text);
        List<Node> roots = new ArrayList<>();
        while (true) {
            String trivia = parser.readTrivia();
            if (parser.atEnd()) {
                log.debug("Parsed {} top-level forms from {}", roots.size(), file != null ? file : "<string>");
                return new SourceFile(file, roots, trivia);
            }
            if (isClosing(parser.peek())) {
                throw parser.error("Unexpected '" + parser.peek() + "'");
            }
            roots.add(parser.readForm(trivia));
        }
    }

    /**
     * Read and parse a UTF-8 source file.
     */
    public static SourceFile parseFile(Path file) throws IOException, SyntaxParseException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        return parse(file, content);
    }

    /**
     * Parse exactly one form, e.g. generated replacement text.
     * Leading and trailing trivia are dropped.
     */
    public static Node parseNode(String text) throws SyntaxParseException {
        SourceFile parsed = parse(text);
        if (parsed.roots().size() != 1) {
            throw new SyntaxParseException(
                    "Expected exactly one form, found " + parsed.roots().size(), 1, 1);
        }
        return parsed.roots().get(0).withPrefix("");
    }

    // ========== Trivia ==========

    private String readTrivia() throws SyntaxParseException {
        StringBuilder sb = new StringBuilder();
        while (!atEnd()) {
            char c = peek();
            if (Character.isWhitespace(c) || c == ',') {
                sb.append(advance());
            } else if (c == ';' || startsWith("#!")) {
                while (!atEnd() && peek() != '\n') {
                    sb.append(advance());
                }
            } else if (startsWith("#_")) {
                sb.append(consume(2));
                sb.append(readIgnoredForm("#_"));
            } else if (startsWith("#^")) {
                sb.append(consume(2));
                sb.append(readIgnoredForm("#^"));
            } else if (c == '^') {
                sb.append(advance());
                sb.append(readIgnoredForm("^"));
            } else {
                break;
            }
        }
        return sb.toString();
    }

    /**
     * Discarded forms and metadata are kept verbatim as trivia of the next node.
     */
    private String readIgnoredForm(String sigil) throws SyntaxParseException {
        String inner = readTrivia();
        requireForm(sigil);
        return readForm(inner).render();
    }

    // ========== Forms ==========

    private Node readForm(String prefix) throws SyntaxParseException {
        int startLine = line;
        char c = peek();

        if (c == '(') {
            return readCollection(prefix, startLine, Delimiter.LIST, consume(1));
        }
        if (c == '[') {
            return readCollection(prefix, startLine, Delimiter.VECTOR, consume(1));
        }
        if (c == '{') {
            return readCollection(prefix, startLine, Delimiter.MAP, consume(1));
        }
        if (c == '"') {
            return new Token(prefix, startLine, TokenType.STRING, readString());
        }
        if (c == '\\') {
            return new Token(prefix, startLine, TokenType.CHARACTER, readCharacter());
        }
        if (c == '\'') {
            return readQuoted(prefix, startLine, QuoteStyle.QUOTE);
        }
        if (c == '`') {
            return readQuoted(prefix, startLine, QuoteStyle.SYNTAX_QUOTE);
        }
        if (startsWith("~@")) {
            return readQuoted(prefix, startLine, QuoteStyle.UNQUOTE_SPLICING);
        }
        if (c == '~') {
            return readQuoted(prefix, startLine, QuoteStyle.UNQUOTE);
        }
        if (c == '@') {
            return readQuoted(prefix, startLine, QuoteStyle.DEREF);
        }
        if (c == '#') {
            return readDispatch(prefix, startLine);
        }
        if (isClosing(c)) {
            throw error("Unexpected '" + c + "'");
        }

        String atom = readAtom();
        return new Token(prefix, startLine, TokenType.classifyAtom(atom), atom);
    }

    private Node readDispatch(String prefix, int startLine) throws SyntaxParseException {
        if (startsWith("#{")) {
            return readCollection(prefix, startLine, Delimiter.SET, consume(2));
        }
        if (startsWith("#(")) {
            return readCollection(prefix, startLine, Delimiter.FN, consume(2));
        }
        if (startsWith("#\"")) {
            advance();
            return new Token(prefix, startLine, TokenType.REGEX, "#" + readString());
        }
        if (startsWith("#'")) {
            return readQuoted(prefix, startLine, QuoteStyle.VAR);
        }
        if (startsWith("#?@")) {
            return readQuoted(prefix, startLine, QuoteStyle.READER_CONDITIONAL_SPLICING);
        }
        if (startsWith("#?")) {
            return readQuoted(prefix, startLine, QuoteStyle.READER_CONDITIONAL);
        }
        if (startsWith("#:")) {
            StringBuilder open = new StringBuilder(consume(2));
            while (!atEnd() && peek() != '{') {
                char c = peek();
                if (Character.isWhitespace(c) || isClosing(c)) {
                    throw error("Malformed namespaced map prefix '" + open + "'");
                }
                open.append(advance());
            }
            if (atEnd()) {
                throw error("Unterminated namespaced map prefix '" + open + "'");
            }
            open.append(advance());
            return readCollection(prefix, startLine, Delimiter.NAMESPACED_MAP, open.toString());
        }
        if (startsWith("##")) {
            String marker = consume(2);
            return new Token(prefix, startLine, TokenType.TAG, marker + readAtom());
        }

        // Tagged literal: the tag is a token, the tagged value is the next sibling
        advance();
        if (atEnd() || isTerminator(peek())) {
            throw error("Unsupported dispatch macro");
        }
        return new Token(prefix, startLine, TokenType.TAG, "#" + readAtom());
    }

    private QuotedNode readQuoted(String prefix, int startLine, QuoteStyle style) throws SyntaxParseException {
        consume(style.getSigil().length());
        String inner = readTrivia();
        requireForm(style.getSigil());
        return new QuotedNode(prefix, startLine, style, readForm(inner));
    }

    private CollectionNode readCollection(String prefix, int startLine, Delimiter delimiter, String open)
            throws SyntaxParseException {
        int startColumn = column - open.length();
        List<Node> children = new ArrayList<>();
        String trivia;

        while (true) {
            trivia = readTrivia();
            if (atEnd()) {
                throw new SyntaxParseException(
                        "Unterminated " + delimiter.name().toLowerCase() + " starting with '" + open + "'",
                        startLine, startColumn);
            }
            char c = peek();
            if (c == delimiter.getClose()) {
                advance();
                break;
            }
            if (isClosing(c)) {
                throw error("Mismatched '" + c + "', expected '" + delimiter.getClose() + "'");
            }
            children.add(readForm(trivia));
        }

        if (delimiter.getKind() == NodeKind.ASSOCIATIVE && children.size() % 2 != 0) {
            throw new SyntaxParseException(
                    "Map literal must contain an even number of forms", startLine, startColumn);
        }
        return new CollectionNode(prefix, startLine, delimiter, open, children, trivia);
    }

    // ========== Lexical ==========

    private String readString() throws SyntaxParseException {
        int startLine = line;
        int startColumn = column;
        StringBuilder sb = new StringBuilder();
        sb.append(advance());  // opening quote
        while (true) {
            if (atEnd()) {
                throw new SyntaxParseException("Unterminated string", startLine, startColumn);
            }
            char c = advance();
            sb.append(c);
            if (c == '\\') {
                if (atEnd()) {
                    throw new SyntaxParseException("Unterminated string", startLine, startColumn);
                }
                sb.append(advance());
            } else if (c == '"') {
                return sb.toString();
            }
        }
    }

    private String readCharacter() throws SyntaxParseException {
        StringBuilder sb = new StringBuilder();
        sb.append(advance());  // backslash
        if (atEnd()) {
            throw error("Incomplete character literal");
        }
        // the first character is taken literally, so \( and \space both work
        sb.append(advance());
        while (!atEnd() && !isTerminator(peek())) {
            sb.append(advance());
        }
        return sb.toString();
    }

    private String readAtom() throws SyntaxParseException {
        StringBuilder sb = new StringBuilder();
        while (!atEnd() && !isTerminator(peek())) {
            sb.append(advance());
        }
        if (sb.length() == 0) {
            throw error(atEnd() ? "Unexpected end of input" : "Unexpected character '" + peek() + "'");
        }
        return sb.toString();
    }

    private void requireForm(String sigil) throws SyntaxParseException {
        if (atEnd() || isClosing(peek())) {
            throw error("Missing form after '" + sigil + "'");
        }
    }

    // ========== Cursor helpers ==========

    private boolean atEnd() {
        return pos >= text.length();
    }

    private char peek() {
        return text.charAt(pos);
    }

    private boolean startsWith(String s) {
        return text.startsWith(s, pos);
    }

    private char advance() {
        char c = text.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private String consume(int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            sb.append(advance());
        }
        return sb.toString();
    }

    private SyntaxParseException error(String message) {
        return new SyntaxParseException(message, line, column);
    }

    private static boolean isClosing(char c) {
        return c == ')' || c == ']' || c == '}';
    }

    private static boolean isTerminator(char c) {
        return Character.isWhitespace(c) || c == ',' || c == ';' || c == '"'
                || c == '(' || c == ')' || c == '[' || c == ']' || c == '{' || c == '}';
    }
}
