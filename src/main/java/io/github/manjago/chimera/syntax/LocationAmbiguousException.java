package io.github.manjago.chimera.syntax;

/**
 * A node cannot be given a coordinate of its own because its digest segment
 * collides with an earlier sibling. Decoding that coordinate resolves to the
 * earlier sibling.
 */
public class LocationAmbiguousException extends Exception {

    private final Coordinate coordinate;

    public LocationAmbiguousException(Coordinate coordinate) {
        super("Digest collision at " + coordinate + " (resolves to first match)");
        this.coordinate = coordinate;
    }

    public Coordinate getCoordinate() {
        return coordinate;
    }
}
