package org.routemap.routing;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.routemap.graph.Edge;
import org.routemap.graph.Graph;
import org.routemap.graph.Vertex;
import org.routemap.search.AdaptablePriorityQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ConcurrentModificationException;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Single-source shortest paths (Dijkstra) over a {@link Graph}.
 * <p>
 * Tentative distances live in an {@link AdaptablePriorityQueue}; the handle of every
 * discovered but unfinalized vertex is kept so that a shorter candidate lowers its key in
 * place instead of inserting a duplicate. Runs in O((V + E) log V).
 * </p>
 * <p>
 * Edge costs must be finite and non-negative. Vertices are tracked by label, so a graph
 * with duplicate labels is searched as if those vertices were one.
 * </p>
 * <p><strong>Thread Safety:</strong> instances are stateless and may be shared; the graph
 * must not be modified while {@link #run} is in progress.</p>
 */
public final class ShortestPath {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShortestPath.class);

    private final SearchBudget searchBudget;

    /**
     * Creates a search bounded by {@link SearchBudget#defaults()}.
     */
    public ShortestPath() {
        this(SearchBudget.defaults());
    }

    public ShortestPath(SearchBudget searchBudget) {
        this.searchBudget = Objects.requireNonNull(searchBudget, "searchBudget");
    }

    /**
     * Runs Dijkstra from {@code sourceLabel}, using each edge's numeric element as its cost.
     * A {@code null} element is rejected as a non-finite cost.
     *
     * @see #run(Graph, Object, ToDoubleFunction)
     */
    public <V, E extends Number> ShortestPathResult<V> run(Graph<V, E> graph, V sourceLabel) {
        return run(graph, sourceLabel, cost -> cost == null ? Double.NaN : cost.doubleValue());
    }

    /**
     * Runs Dijkstra from {@code sourceLabel}.
     *
     * @param graph       graph to search.
     * @param sourceLabel label of the source vertex.
     * @param edgeCost    maps an edge element to a finite, non-negative cost.
     * @return the closed set of every vertex reachable from the source.
     * @throws org.routemap.graph.VertexNotFoundException if no vertex carries {@code sourceLabel}.
     * @throws RoutingException                           on a negative or non-finite edge cost, or
     *                                                    when the search budget is exceeded.
     * @throws ConcurrentModificationException           if the graph changes during the run.
     */
    public <V, E> ShortestPathResult<V> run(Graph<V, E> graph, V sourceLabel, ToDoubleFunction<? super E> edgeCost) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(edgeCost, "edgeCost");
        Vertex<V> source = graph.vertexByLabel(sourceLabel);
        int expectedModCount = graph.modificationCount();

        AdaptablePriorityQueue<Double, Vertex<V>> open = new AdaptablePriorityQueue<>();
        Object2ObjectOpenHashMap<V, AdaptablePriorityQueue.Entry<Double, Vertex<V>>> locs = new Object2ObjectOpenHashMap<>();
        Object2ObjectOpenHashMap<V, V> preds = new Object2ObjectOpenHashMap<>();
        ShortestPathResult<V> closed = new ShortestPathResult<>(sourceLabel);

        locs.put(sourceLabel, open.add(0.0d, source));
        preds.put(sourceLabel, null);

        while (!open.isEmpty()) {
            AdaptablePriorityQueue.Entry<Double, Vertex<V>> min = open.removeMin();
            Vertex<V> u = min.value();
            V label = u.element();
            double dist = min.key();
            locs.remove(label);
            closed.settle(label, dist, preds.remove(label));
            searchBudget.checkSettledVertices(closed.size());

            for (Edge<V, E> edge : graph.getEdges(u)) {
                Vertex<V> w = edge.opposite(u).orElseThrow(
                        () -> new IllegalStateException("Edge " + edge + " is not incident on " + u));
                V wLabel = w.element();
                if (closed.contains(wLabel)) {
                    continue;
                }
                double candidate = dist + checkedCost(edge, edgeCost);
                if (!Double.isFinite(candidate)) {
                    throw new RoutingException(
                            RoutingException.Reason.NON_FINITE_EDGE_COST,
                            "path distance overflowed to " + candidate + " at " + edge
                    );
                }
                AdaptablePriorityQueue.Entry<Double, Vertex<V>> handle = locs.get(wLabel);
                if (handle == null) {
                    preds.put(wLabel, label);
                    locs.put(wLabel, open.add(candidate, w));
                } else if (candidate < open.getKey(handle)) {
                    preds.put(wLabel, label);
                    open.updateKey(handle, candidate);
                }
            }

            if (graph.modificationCount() != expectedModCount) {
                throw new ConcurrentModificationException("Graph was modified during shortest-path search");
            }
        }

        LOGGER.debug("Dijkstra from {} finalized {} of {} vertices", sourceLabel, closed.size(), graph.numVertices());
        return closed;
    }

    private static <E> double checkedCost(Edge<?, E> edge, ToDoubleFunction<? super E> edgeCost) {
        double cost = edgeCost.applyAsDouble(edge.element());
        if (!Double.isFinite(cost)) {
            throw new RoutingException(
                    RoutingException.Reason.NON_FINITE_EDGE_COST,
                    "edge cost must be finite, got " + cost + " on " + edge
            );
        }
        if (cost < 0.0d) {
            throw new RoutingException(
                    RoutingException.Reason.NEGATIVE_EDGE_COST,
                    "edge cost must be >= 0, got " + cost + " on " + edge
            );
        }
        return cost;
    }
}
