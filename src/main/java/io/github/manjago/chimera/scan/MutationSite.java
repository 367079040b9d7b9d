package io.github.manjago.chimera.scan;

import io.github.manjago.chimera.syntax.Coordinate;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

/**
 * A (form, coordinate, operator) triple eligible for testing, with the
 * replacement text generated at scan time.
 *
 * @param formId      id of the form the site lives in
 * @param coordinate  location of the mutated node inside the form
 * @param operatorId  operator that produced the site
 * @param replacement text substituted for the node
 * @param file        source file (null for in-memory sources)
 * @param line        1-based line of the mutated node
 * @param original    text of the node before mutation
 * @param ordinal     position in scan order across the whole run
 * @param callHead    true when the node is the head symbol of a call
 */
public record MutationSite(
    String formId,
    Coordinate coordinate,
    String operatorId,
    String replacement,
    @Nullable Path file,
    int line,
    String original,
    int ordinal,
    boolean callHead
) {

    /**
     * Stable identity of the site within one snapshot.
     */
    public String id() {
        return formId + "@" + coordinate + ":" + operatorId;
    }

    /**
     * The expression a mutation of this site rewrites: the node itself, or the
     * enclosing call when the node is its head symbol.
     */
    public Coordinate target() {
        return callHead ? coordinate.parent() : coordinate;
    }

    public MutationSite withOrdinal(int newOrdinal) {
        return new MutationSite(formId, coordinate, operatorId, replacement, file, line, original, newOrdinal, callHead);
    }

    @Override
    public String toString() {
        return String.format("%s [%s -> %s] line %d", id(), original, replacement, line);
    }
}
