package org.routemap.route;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A route reconstructed from a shortest-path run.
 *
 * <p>{@code hops} runs backwards, from the destination towards the source, and does not
 * include the source itself. A route from a vertex to itself has no hops.</p>
 */
@Value
public class RoutePath<V> {
    V source;
    V destination;
    double totalCost;
    List<RouteHop<V>> hops;

    RoutePath(V source, V destination, double totalCost, List<RouteHop<V>> hops) {
        this.source = source;
        this.destination = destination;
        this.totalCost = totalCost;
        this.hops = Collections.unmodifiableList(new ArrayList<>(hops));
    }

    /**
     * Returns the vertex labels from source to destination, both included.
     */
    public List<V> labelsFromSource() {
        List<V> labels = new ArrayList<>(hops.size() + 1);
        labels.add(source);
        for (int i = hops.size() - 1; i >= 0; i--) {
            labels.add(hops.get(i).getLabel());
        }
        return labels;
    }
}
