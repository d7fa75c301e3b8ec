package org.routemap.graph;

import it.unimi.dsi.fastutil.objects.Reference2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Reference2ObjectMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A simple graph in adjacency-map form.
 * <p>
 * Each vertex maps to a map from neighbour to the connecting edge. A two-way edge is the
 * same {@link Edge} instance in both endpoints' maps; a one-way edge and a self-loop are
 * stored only in the start vertex's map. Maps are identity-keyed, so vertices with equal
 * elements never collide.
 * </p>
 * <p><strong>Thread Safety:</strong> not thread-safe. Structural changes bump
 * {@link #modificationCount()} so that a running search can fail fast.</p>
 *
 * @param <V> vertex element type
 * @param <E> edge element type
 */
public class Graph<V, E> {

    private final Reference2ObjectLinkedOpenHashMap<Vertex<V>, Reference2ObjectLinkedOpenHashMap<Vertex<V>, Edge<V, E>>> structure =
            new Reference2ObjectLinkedOpenHashMap<>();

    private int modificationCount;

    /**
     * Returns the number of vertices in the graph.
     */
    public int numVertices() {
        return structure.size();
    }

    /**
     * Returns the number of edges in the graph.
     * <p>
     * Two-way edges are counted once. One-way edges and self-loops are stored once and
     * counted as a full edge.
     * </p>
     */
    public int numEdges() {
        int twoWayHalves = 0;
        int singles = 0;
        for (Reference2ObjectLinkedOpenHashMap<Vertex<V>, Edge<V, E>> neighbours : structure.values()) {
            for (Edge<V, E> edge : neighbours.values()) {
                if (isStoredTwice(edge)) {
                    twoWayHalves++;
                } else {
                    singles++;
                }
            }
        }
        return twoWayHalves / 2 + singles;
    }

    /**
     * Returns all vertices in insertion order.
     */
    public List<Vertex<V>> vertices() {
        return new ArrayList<>(structure.keySet());
    }

    /**
     * Returns all edges, each exactly once.
     */
    public List<Edge<V, E>> edges() {
        List<Edge<V, E>> edgeList = new ArrayList<>();
        for (Reference2ObjectMap.Entry<Vertex<V>, Reference2ObjectLinkedOpenHashMap<Vertex<V>, Edge<V, E>>> entry
                : structure.reference2ObjectEntrySet()) {
            for (Edge<V, E> edge : entry.getValue().values()) {
                // skip the mirrored copy of a two-way edge
                if (edge.start() == entry.getKey()) {
                    edgeList.add(edge);
                }
            }
        }
        return edgeList;
    }

    /**
     * Returns whether {@code v} is a vertex of this graph.
     */
    public boolean containsVertex(Vertex<V> v) {
        return v != null && structure.containsKey(v);
    }

    /**
     * Returns all edges incident on {@code v} (outgoing for one-way edges).
     *
     * @throws VertexNotFoundException if {@code v} is not in the graph.
     */
    public List<Edge<V, E>> getEdges(Vertex<V> v) {
        return new ArrayList<>(adjacency(v).values());
    }

    /**
     * Returns the edge from {@code v} to {@code w}, if any.
     */
    public Optional<Edge<V, E>> getEdge(Vertex<V> v, Vertex<V> w) {
        if (v == null || w == null) {
            return Optional.empty();
        }
        Map<Vertex<V>, Edge<V, E>> neighbours = structure.get(v);
        if (neighbours == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(neighbours.get(w));
    }

    /**
     * Returns the number of edges stored for {@code v}.
     *
     * @throws VertexNotFoundException if {@code v} is not in the graph.
     */
    public int degree(Vertex<V> v) {
        return adjacency(v).size();
    }

    /**
     * Adds a new vertex holding {@code element}.
     * <p>
     * An existing vertex with an equal element is not reused: this always creates a
     * distinct vertex.
     * </p>
     */
    public Vertex<V> addVertex(V element) {
        Vertex<V> v = new Vertex<>(element);
        registerVertex(v);
        return v;
    }

    /**
     * Returns the vertex found by {@link #findVertexByLabel(Object)}, adding one on a miss.
     */
    public Vertex<V> addVertexIfNew(V element) {
        return findVertexByLabel(element).orElseGet(() -> addVertex(element));
    }

    /**
     * Adds a two-way edge between {@code v} and {@code w}.
     *
     * @see #addEdge(Vertex, Vertex, Object, boolean)
     */
    public Edge<V, E> addEdge(Vertex<V> v, Vertex<V> w, E element) {
        return addEdge(v, w, element, false);
    }

    /**
     * Adds an edge from {@code v} to {@code w} carrying {@code element}.
     * <p>
     * A previous edge between the same ordered pair is replaced, together with its reverse
     * entry if it was two-way. The edge is stored in {@code w}'s map too unless it is one-way
     * or a self-loop.
     * </p>
     *
     * @param oneway {@code true} to store the edge only in {@code v}'s map.
     * @return the new edge.
     * @throws VertexNotFoundException if either endpoint is not in the graph.
     */
    public Edge<V, E> addEdge(Vertex<V> v, Vertex<V> w, E element, boolean oneway) {
        Reference2ObjectLinkedOpenHashMap<Vertex<V>, Edge<V, E>> from = adjacency(v);
        Reference2ObjectLinkedOpenHashMap<Vertex<V>, Edge<V, E>> to = adjacency(w);
        Edge<V, E> edge = new Edge<>(v, w, element);
        Edge<V, E> prior = from.put(w, edge);
        if (!oneway && v != w) {
            to.put(v, edge);
        } else if (prior != null && v != w && to.get(v) == prior) {
            // the replaced edge was stored in both directions; drop its mirror
            to.remove(v);
        }
        modificationCount++;
        return edge;
    }

    /**
     * Adds every pair as a two-way edge with a {@code null} element.
     *
     * @throws VertexNotFoundException on the first pair with an absent endpoint; pairs
     * before it stay added.
     */
    public void addEdgePairs(Collection<? extends List<Vertex<V>>> pairs) {
        for (List<Vertex<V>> pair : pairs) {
            if (pair.size() != 2) {
                throw new IllegalArgumentException("edge pair must have exactly two vertices, got " + pair.size());
            }
            addEdge(pair.get(0), pair.get(1), null);
        }
    }

    /**
     * Looks up a vertex by its element.
     * <p>
     * The base implementation scans vertices in insertion order and returns the first
     * match. Subclasses with a label index override this.
     * </p>
     */
    public Optional<Vertex<V>> findVertexByLabel(V label) {
        for (Vertex<V> v : structure.keySet()) {
            if (Objects.equals(v.element(), label)) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the vertex for {@code label}.
     *
     * @throws VertexNotFoundException if no vertex carries {@code label}.
     */
    public final Vertex<V> vertexByLabel(V label) {
        return findVertexByLabel(label)
                .orElseThrow(() -> new VertexNotFoundException("No vertex labelled " + label));
    }

    /**
     * Returns a counter that changes on every structural modification.
     */
    public int modificationCount() {
        return modificationCount;
    }

    /**
     * Inserts an already-created vertex with an empty adjacency map.
     */
    protected final void registerVertex(Vertex<V> v) {
        structure.put(v, new Reference2ObjectLinkedOpenHashMap<>());
        modificationCount++;
    }

    private Reference2ObjectLinkedOpenHashMap<Vertex<V>, Edge<V, E>> adjacency(Vertex<V> v) {
        Reference2ObjectLinkedOpenHashMap<Vertex<V>, Edge<V, E>> neighbours = v == null ? null : structure.get(v);
        if (neighbours == null) {
            throw new VertexNotFoundException("Vertex " + v + " is not in the graph");
        }
        return neighbours;
    }

    private boolean isStoredTwice(Edge<V, E> edge) {
        if (edge.start() == edge.end()) {
            return false;
        }
        Map<Vertex<V>, Edge<V, E>> forward = structure.get(edge.start());
        Map<Vertex<V>, Edge<V, E>> back = structure.get(edge.end());
        return forward != null && back != null
                && forward.get(edge.end()) == edge
                && back.get(edge.start()) == edge;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("|V| = ").append(numVertices()).append("; |E| = ").append(numEdges());
        sb.append("\nVertices: ");
        for (Vertex<V> v : structure.keySet()) {
            sb.append(v).append('-');
        }
        sb.append("\nEdges: ");
        for (Edge<V, E> e : edges()) {
            sb.append(e).append(' ');
        }
        return sb.toString();
    }
}
