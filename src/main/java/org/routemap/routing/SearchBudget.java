package org.routemap.routing;

/**
 * Per-run bound on the number of vertices a shortest-path search may finalize.
 */
public final class SearchBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    static final String PROP_MAX_SETTLED = "routemap.search.maxSettledVertices";

    private final int maxSettledVertices;

    private SearchBudget(int maxSettledVertices) {
        this.maxSettledVertices = normalizeBound(maxSettledVertices);
    }

    /**
     * Creates a budget with an explicit bound; values {@code <= 0} mean unbounded.
     */
    public static SearchBudget of(int maxSettledVertices) {
        return new SearchBudget(maxSettledVertices);
    }

    public static SearchBudget unbounded() {
        return new SearchBudget(UNBOUNDED);
    }

    /**
     * Loads the bound from the {@value #PROP_MAX_SETTLED} system property.
     */
    public static SearchBudget defaults() {
        return SearchBudget.of(readBound(PROP_MAX_SETTLED));
    }

    public int maxSettledVertices() {
        return maxSettledVertices;
    }

    /**
     * Validates the finalized-vertex count against the configured bound.
     */
    void checkSettledVertices(int settled) {
        if (settled > maxSettledVertices) {
            throw new RoutingException(
                    RoutingException.Reason.BUDGET_SETTLED_EXCEEDED,
                    "settled-vertex budget exceeded: " + settled + " > " + maxSettledVertices
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }
}
