package org.routemap.routing;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Closed set of a single-source shortest-path run: for every finalized vertex label, its
 * shortest distance from the source and the label it was reached from.
 * <p>
 * Iteration order is finalization order, so the source comes first. Entries are fixed once
 * finalized.
 * </p>
 *
 * @param <V> vertex label type
 */
public final class ShortestPathResult<V> {

    @Getter
    @Accessors(fluent = true)
    private final V source;
    private final Object2ObjectLinkedOpenHashMap<V, Settled<V>> closed = new Object2ObjectLinkedOpenHashMap<>();

    ShortestPathResult(V source) {
        this.source = source;
    }

    void settle(V label, double distance, V predecessor) {
        if (closed.containsKey(label)) {
            throw new IllegalStateException("Vertex " + label + " is already finalized");
        }
        closed.put(label, new Settled<>(distance, predecessor));
    }

    /**
     * Returns whether {@code label} was finalized, i.e. is reachable from the source.
     */
    public boolean contains(V label) {
        return closed.containsKey(label);
    }

    /**
     * Returns the finalized entry for {@code label}, empty when unreachable.
     */
    public Optional<Settled<V>> entry(V label) {
        return Optional.ofNullable(closed.get(label));
    }

    /**
     * Returns the shortest distance to {@code label}.
     *
     * @throws RoutingException with {@link RoutingException.Reason#UNREACHABLE} if
     * {@code label} was never finalized.
     */
    public double distance(V label) {
        return require(label).distance();
    }

    /**
     * Returns the label {@code label} was reached from; empty for the source.
     *
     * @throws RoutingException with {@link RoutingException.Reason#UNREACHABLE} if
     * {@code label} was never finalized.
     */
    public Optional<V> predecessor(V label) {
        return require(label).predecessor();
    }

    /**
     * Number of finalized vertices.
     */
    public int size() {
        return closed.size();
    }

    /**
     * Read-only view of the closed table in finalization order.
     */
    public Map<V, Settled<V>> entries() {
        return Collections.unmodifiableMap(closed);
    }

    private Settled<V> require(V label) {
        Settled<V> settled = closed.get(label);
        if (settled == null) {
            throw new RoutingException(
                    RoutingException.Reason.UNREACHABLE,
                    "vertex " + label + " is not reachable from " + source
            );
        }
        return settled;
    }

    @Override
    public String toString() {
        return "ShortestPathResult{source=" + source + ", closed=" + closed + '}';
    }

    /**
     * Finalized distance and predecessor of one vertex.
     */
    public static final class Settled<V> {
        @Getter
        @Accessors(fluent = true)
        private final double distance;
        private final V predecessor;

        Settled(double distance, V predecessor) {
            this.distance = distance;
            this.predecessor = predecessor;
        }

        public Optional<V> predecessor() {
            return Optional.ofNullable(predecessor);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Settled)) return false;
            Settled<?> other = (Settled<?>) o;
            return Double.compare(distance, other.distance) == 0 && Objects.equals(predecessor, other.predecessor);
        }

        @Override
        public int hashCode() {
            return Objects.hash(distance, predecessor);
        }

        @Override
        public String toString() {
            return "(" + distance + ", " + predecessor + ")";
        }
    }
}
