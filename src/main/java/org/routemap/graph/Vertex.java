package org.routemap.graph;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * A vertex of a {@link Graph}, wrapping an opaque data element.
 * <p>
 * Vertices compare by identity. Two vertices created from equal elements are
 * distinct, which is what {@link Graph#addVertex(Object)} relies on.
 * </p>
 *
 * @param <V> element (label) type
 */
@Getter
@Accessors(fluent = true)
public final class Vertex<V> {

    /** The data or label associated with this vertex. */
    private final V element;

    Vertex(V element) {
        this.element = element;
    }

    /**
     * Orders two vertices by their elements.
     *
     * @throws ClassCastException if the elements are not mutually comparable.
     */
    @SuppressWarnings("unchecked")
    public int compareByElement(Vertex<V> other) {
        return ((Comparable<? super V>) element).compareTo(other.element);
    }

    @Override
    public String toString() {
        return String.valueOf(element);
    }
}
