package org.routemap.route;

import lombok.Value;

import java.util.Optional;

/**
 * One hop of a reconstructed route: the vertex reached and the cumulative cost to reach it.
 */
@Value
public class RouteHop<V> {
    /** Label of the vertex this hop arrives at. */
    V label;
    /** Coordinates of that vertex, {@code null} when it was created without any. */
    Coordinates coordinates;
    /** Shortest distance from the route source. */
    double cumulativeCost;

    public Optional<Coordinates> coordinatesIfKnown() {
        return Optional.ofNullable(coordinates);
    }
}
