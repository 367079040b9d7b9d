package io.github.manjago.chimera.syntax;

import org.jetbrains.annotations.Nullable;

/**
 * One step of a {@link Coordinate}: a child ordinal (ordered collections and
 * quoted payloads) or a content digest (maps and sets).
 */
public record Segment(int ordinal, @Nullable String digest) {

    private static final String DIGEST_MARK = "#";

    public static Segment ofOrdinal(int ordinal) {
        if (ordinal < 0) {
            throw new IllegalArgumentException("Negative ordinal: " + ordinal);
        }
        return new Segment(ordinal, null);
    }

    public static Segment ofDigest(String digest) {
        return new Segment(-1, digest);
    }

    public boolean isDigest() {
        return digest != null;
    }

    /**
     * Parse the textual form produced by {@link #toString()}.
     */
    public static Segment parse(String text) {
        if (text.startsWith(DIGEST_MARK)) {
            return ofDigest(text.substring(DIGEST_MARK.length()));
        }
        try {
            return ofOrdinal(Integer.parseInt(text));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid coordinate segment: " + text, e);
        }
    }

    @Override
    public String toString() {
        return digest != null ? DIGEST_MARK + digest : Integer.toString(ordinal);
    }
}
