package org.routemap.routing;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Shortest-path or route failure. Callers branch on {@link #reason()}; the message is for people.
 */
@Getter
@Accessors(fluent = true)
public final class RoutingException extends RuntimeException {

    /**
     * Why a search or route reconstruction failed.
     */
    public enum Reason {
        /** The destination was never settled from the source. */
        UNREACHABLE,
        /** An edge cost was below zero. */
        NEGATIVE_EDGE_COST,
        /** An edge cost, or a distance summed from edge costs, was NaN or infinite. */
        NON_FINITE_EDGE_COST,
        /** The search settled more vertices than its {@link SearchBudget} allows. */
        BUDGET_SETTLED_EXCEEDED,
        /** A predecessor walk left the closed set or did not terminate at the source. */
        BROKEN_PREDECESSOR_CHAIN
    }

    private final Reason reason;

    public RoutingException(Reason reason, String detail) {
        super(Objects.requireNonNull(reason, "reason") + ": " + Objects.requireNonNull(detail, "detail"));
        this.reason = reason;
    }
}
