package org.routemap.graph;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An edge between an ordered pair of vertices, carrying an opaque element
 * (typically a weight or a label).
 *
 * @param <V> vertex element type
 * @param <E> edge element type
 */
@Accessors(fluent = true)
public final class Edge<V, E> {

    @Getter
    private final Vertex<V> start;
    @Getter
    private final Vertex<V> end;
    @Getter
    private final E element;

    Edge(Vertex<V> start, Vertex<V> end, E element) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        this.element = element;
    }

    /**
     * Returns the ordered pair of endpoints as {@code [start, end]}.
     */
    public List<Vertex<V>> vertices() {
        return List.of(start, end);
    }

    /**
     * Returns the endpoint opposite to {@code v}.
     *
     * @param v a vertex
     * @return the other endpoint, {@code v} itself for a self-loop, or empty when
     * {@code v} is not an endpoint of this edge.
     */
    public Optional<Vertex<V>> opposite(Vertex<V> v) {
        if (start == v) {
            return Optional.of(end);
        }
        if (end == v) {
            return Optional.of(start);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "(" + start + "--" + end + " : " + element + ")";
    }
}
