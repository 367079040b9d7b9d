package io.github.manjago.chimera.syntax;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

/**
 * Top-level, independently addressable source unit.
 *
 * @param id        stable identity ({@code ns/name} for definitions, {@code ns#index} otherwise)
 * @param file      file the form was read from (null for in-memory sources)
 * @param startLine 1-based line of the form's opening character
 * @param index     position among the file's top-level forms
 * @param root      root node; coordinates are relative to it
 */
public record Form(String id, @Nullable Path file, int startLine, int index, Node root) {

    /**
     * Source text of the form without leading trivia.
     */
    public String text() {
        return root.text();
    }

    /**
     * Content digest used for incremental change detection.
     */
    public String digest() {
        return Digests.sha256Hex(text());
    }

    @Override
    public String toString() {
        return String.format("Form[%s @%s:%d]", id, file != null ? file.getFileName() : "<string>", startLine);
    }
}
