package org.routemap.search;

/**
 * Thrown when attempting to peek at or extract from an empty {@link AdaptablePriorityQueue}.
 */
public class EmptyQueueException extends IllegalStateException {
    public EmptyQueueException(String message) {
        super(message);
    }
}
