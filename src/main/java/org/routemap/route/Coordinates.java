package org.routemap.route;

/**
 * Latitude/longitude pair attached to a {@link RouteMap} vertex.
 */
public record Coordinates(double latitude, double longitude) {
}
