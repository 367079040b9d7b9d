package io.github.manjago.chimera.syntax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SyntaxParser.
 */
class SyntaxParserTest {

    @ParameterizedTest
    @DisplayName("Rendering a parsed file reproduces the input byte for byte")
    @ValueSource(strings = {
            "",
            "  ; only a comment\n",
            "(defn f [x] (+ x 1))",
            "(ns demo.core\n  (:require [clojure.string :as str]))\n\n(def x 1)\n",
            "{:a 1, :b [2 3] \"k\" #{1 2}}",
            "#(+ % 1) 'x `(a ~b ~@c) @atom #'var",
            "#?(:clj 1 :cljs 2) #?@(:clj [x]) #:user{:id 1}",
            "#inst \"2024-01-01\" ##Inf #\"re+\" \\a \\space \\(",
            "#_(ignored form) ^{:private true} (defn- g [] nil)",
            "#!/usr/bin/env bb\n(println \"hi\")   \n",
            "(str \"escaped \\\" quote\" 1/2 1.5M -3N)"
    })
    void testRoundTrip(String text) throws Exception {
        assertEquals(text, SyntaxParser.parse(text).render());
    }

    @Test
    @DisplayName("Parser classifies tokens")
    void testTokenTypes() throws Exception {
        SourceFile file = SyntaxParser.parse("(f :k 42 \"s\" nil true \\c #\"r\")");
        CollectionNode call = (CollectionNode) file.roots().get(0);

        assertEquals(TokenType.SYMBOL, ((Token) call.children().get(0)).type());
        assertEquals(TokenType.KEYWORD, ((Token) call.children().get(1)).type());
        assertEquals(TokenType.NUMBER, ((Token) call.children().get(2)).type());
        assertEquals(TokenType.STRING, ((Token) call.children().get(3)).type());
        assertEquals(TokenType.LITERAL, ((Token) call.children().get(4)).type());
        assertEquals(TokenType.LITERAL, ((Token) call.children().get(5)).type());
        assertEquals(TokenType.CHARACTER, ((Token) call.children().get(6)).type());
        assertEquals(TokenType.REGEX, ((Token) call.children().get(7)).type());
        assertEquals("f", call.headSymbol().orElseThrow());
    }

    @Test
    @DisplayName("Discarded forms and metadata become trivia of the next node")
    void testTriviaIsNotAChild() throws Exception {
        SourceFile file = SyntaxParser.parse("(f #_ignored ^:meta x)");
        CollectionNode call = (CollectionNode) file.roots().get(0);

        assertEquals(2, call.children().size());
        assertEquals(" #_ignored ^:meta ", call.children().get(1).prefix());
        assertEquals("x", call.children().get(1).text());
    }

    @Test
    @DisplayName("Nodes remember the line they start on")
    void testLines() throws Exception {
        SourceFile file = SyntaxParser.parse("(def a 1)\n\n(def b\n  2)\n");

        assertEquals(1, file.roots().get(0).line());
        assertEquals(3, file.roots().get(1).line());
        assertEquals(4, file.roots().get(1).children().get(2).line());
    }

    @Test
    @DisplayName("Unbalanced input fails with a position")
    void testUnterminatedList() {
        SyntaxParseException e = assertThrows(SyntaxParseException.class,
                () -> SyntaxParser.parse("(def a\n  (inc 1)"));
        assertEquals(1, e.getLine());
        assertEquals(1, e.getColumn());
        assertTrue(e.getMessage().contains("Unterminated"));
    }

    @Test
    @DisplayName("Mismatched closer is rejected")
    void testMismatchedCloser() {
        assertThrows(SyntaxParseException.class, () -> SyntaxParser.parse("(f [1 2)"));
        assertThrows(SyntaxParseException.class, () -> SyntaxParser.parse("(f) )"));
    }

    @Test
    @DisplayName("Odd map and unterminated string are rejected")
    void testMalformedLiterals() {
        assertThrows(SyntaxParseException.class, () -> SyntaxParser.parse("{:a 1 :b}"));
        assertThrows(SyntaxParseException.class, () -> SyntaxParser.parse("(str \"open)"));
        assertThrows(SyntaxParseException.class, () -> SyntaxParser.parse("(f ')"));
    }

    @Test
    @DisplayName("parseNode accepts exactly one form")
    void testParseNode() throws Exception {
        Node node = SyntaxParser.parseNode("  (inc x)  ");
        assertEquals("(inc x)", node.render());
        assertEquals("", node.prefix());

        assertThrows(SyntaxParseException.class, () -> SyntaxParser.parseNode("a b"));
        assertThrows(SyntaxParseException.class, () -> SyntaxParser.parseNode("  "));
    }

    @Test
    @DisplayName("parseFile reads UTF-8 text and keeps the path")
    void testParseFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("greeting.clj");
        Files.writeString(file, "(def hello \"привет\")\n");

        SourceFile parsed = SyntaxParser.parseFile(file);

        assertEquals(file, parsed.file());
        assertEquals("(def hello \"привет\")\n", parsed.render());
    }
}
