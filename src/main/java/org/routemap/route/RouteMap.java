package org.routemap.route;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.Reference2ObjectOpenHashMap;
import org.routemap.graph.Graph;
import org.routemap.graph.Vertex;
import org.routemap.graph.VertexNotFoundException;
import org.routemap.routing.RoutingException;
import org.routemap.routing.ShortestPath;
import org.routemap.routing.ShortestPathResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@link Graph} of map locations: every vertex may carry coordinates and labels resolve
 * to vertices in O(1) through an index.
 * <p>
 * Each {@code addVertex} call creates a distinct vertex, as in {@link Graph}; the label
 * index points at the most recently added vertex for a label.
 * </p>
 *
 * @param <V> vertex label type
 * @param <E> numeric edge cost type
 */
public class RouteMap<V, E extends Number> extends Graph<V, E> {

    static final String PROP_RENDER_MAX_VERTICES = "routemap.render.maxVertices";
    static final int DEFAULT_RENDER_MAX_VERTICES = 100;

    private final Object2ObjectOpenHashMap<V, Vertex<V>> findVertex = new Object2ObjectOpenHashMap<>();
    private final Reference2ObjectOpenHashMap<Vertex<V>, Coordinates> vertexCoords = new Reference2ObjectOpenHashMap<>();
    private final ShortestPath shortestPath;
    private final int renderMaxVertices;

    public RouteMap() {
        this(new ShortestPath());
    }

    public RouteMap(ShortestPath shortestPath) {
        this.shortestPath = Objects.requireNonNull(shortestPath, "shortestPath");
        this.renderMaxVertices = readRenderMaxVertices();
    }

    /**
     * Adds a vertex without coordinates.
     */
    @Override
    public Vertex<V> addVertex(V element) {
        return addVertex(element, null);
    }

    /**
     * Adds a vertex located at ({@code latitude}, {@code longitude}).
     */
    public Vertex<V> addVertex(V element, double latitude, double longitude) {
        return addVertex(element, new Coordinates(latitude, longitude));
    }

    private Vertex<V> addVertex(V element, Coordinates coordinates) {
        Vertex<V> v = super.addVertex(element);
        findVertex.put(element, v);
        if (coordinates != null) {
            vertexCoords.put(v, coordinates);
        }
        return v;
    }

    /**
     * Index lookup, O(1).
     */
    @Override
    public Optional<Vertex<V>> findVertexByLabel(V label) {
        return Optional.ofNullable(findVertex.get(label));
    }

    /**
     * Returns the coordinates of {@code v}, empty when it was added without any.
     *
     * @throws VertexNotFoundException if {@code v} is not in this map.
     */
    public Optional<Coordinates> coordinates(Vertex<V> v) {
        if (!containsVertex(v)) {
            throw new VertexNotFoundException("Vertex " + v + " is not in the route map");
        }
        return Optional.ofNullable(vertexCoords.get(v));
    }

    /**
     * Runs the shortest-path search from {@code sourceLabel}.
     */
    public ShortestPathResult<V> shortestPaths(V sourceLabel) {
        return shortestPath.run(this, sourceLabel);
    }

    /**
     * Computes the shortest route from {@code sourceLabel} to {@code destinationLabel}.
     * <p>
     * The predecessor chain is walked back from the destination; the walk is bounded by the
     * number of finalized vertices.
     * </p>
     *
     * @throws VertexNotFoundException if either label is unknown.
     * @throws RoutingException        with {@link RoutingException.Reason#UNREACHABLE} when the
     *                                 destination is not reachable from the source.
     */
    public RoutePath<V> path(V sourceLabel, V destinationLabel) {
        vertexByLabel(destinationLabel);
        ShortestPathResult<V> closed = shortestPaths(sourceLabel);
        if (!closed.contains(destinationLabel)) {
            throw new RoutingException(
                    RoutingException.Reason.UNREACHABLE,
                    "vertex " + destinationLabel + " is not reachable from " + sourceLabel
            );
        }

        List<RouteHop<V>> hops = new ArrayList<>();
        V w = destinationLabel;
        int remainingSteps = closed.size();
        while (!Objects.equals(w, sourceLabel)) {
            if (remainingSteps-- <= 0) {
                throw new RoutingException(
                        RoutingException.Reason.BROKEN_PREDECESSOR_CHAIN,
                        "predecessor chain from " + destinationLabel + " does not reach " + sourceLabel
                );
            }
            ShortestPathResult.Settled<V> settled = closed.entry(w).orElseThrow(() -> new RoutingException(
                    RoutingException.Reason.BROKEN_PREDECESSOR_CHAIN,
                    "predecessor chain from " + destinationLabel + " leaves the closed set"
            ));
            Coordinates coords = vertexCoords.get(vertexByLabel(w));
            hops.add(new RouteHop<>(w, coords, settled.distance()));
            w = settled.predecessor().orElse(null);
        }
        return new RoutePath<>(sourceLabel, destinationLabel, closed.distance(destinationLabel), hops);
    }

    @Override
    public String toString() {
        if (numVertices() < renderMaxVertices) {
            return super.toString();
        }
        return "Too many entries (" + numVertices() + " vertices) to render as a string";
    }

    private static int readRenderMaxVertices() {
        String raw = System.getProperty(PROP_RENDER_MAX_VERTICES);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_RENDER_MAX_VERTICES;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return DEFAULT_RENDER_MAX_VERTICES;
        }
    }
}
