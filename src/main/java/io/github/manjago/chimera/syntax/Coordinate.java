package io.github.manjago.chimera.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Path of segments from a form's root node to one of its descendants.
 * The empty coordinate addresses the root itself.
 */
public record Coordinate(List<Segment> segments) {

    public static final Coordinate ROOT = new Coordinate(List.of());

    private static final String SEPARATOR = "/";

    public Coordinate {
        segments = List.copyOf(segments);
    }

    public static Coordinate of(Segment... segments) {
        return new Coordinate(List.of(segments));
    }

    public static Coordinate parse(String text) {
        if (text.isEmpty()) {
            return ROOT;
        }
        List<Segment> parsed = new ArrayList<>();
        for (String part : text.split(SEPARATOR)) {
            parsed.add(Segment.parse(part));
        }
        return new Coordinate(parsed);
    }

    public Coordinate child(Segment segment) {
        List<Segment> copy = new ArrayList<>(segments.size() + 1);
        copy.addAll(segments);
        copy.add(segment);
        return new Coordinate(copy);
    }

    public Coordinate parent() {
        if (segments.isEmpty()) {
            throw new IllegalStateException("Root coordinate has no parent");
        }
        return new Coordinate(segments.subList(0, segments.size() - 1));
    }

    public int depth() {
        return segments.size();
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public Segment last() {
        if (segments.isEmpty()) {
            throw new IllegalStateException("Root coordinate has no segments");
        }
        return segments.get(segments.size() - 1);
    }

    /**
     * First {@code n} segments (the whole coordinate when it is shorter).
     */
    public Coordinate prefix(int n) {
        return n >= segments.size() ? this : new Coordinate(segments.subList(0, n));
    }

    /**
     * True if this coordinate is an ancestor of, or equal to, {@code other}.
     */
    public boolean isPrefixOf(Coordinate other) {
        return other.segments.size() >= segments.size()
                && other.segments.subList(0, segments.size()).equals(segments);
    }

    @Override
    public String toString() {
        return segments.stream().map(Segment::toString).collect(Collectors.joining(SEPARATOR));
    }
}
