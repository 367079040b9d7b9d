package io.github.manjago.chimera.syntax;

/**
 * A coordinate no longer resolves against the tree it is applied to.
 * Scanning and mutation must share one snapshot of the source.
 */
public class LocationNotFoundException extends Exception {

    private final Coordinate coordinate;

    public LocationNotFoundException(Coordinate coordinate, String message) {
        super("Location " + coordinate + " not found: " + message);
        this.coordinate = coordinate;
    }

    public Coordinate getCoordinate() {
        return coordinate;
    }
}
