package org.routemap.search;

/**
 * Thrown when a queue operation receives an entry that is no longer in that queue,
 * either because it was removed or because another queue issued it.
 */
public class InvalidHandleException extends IllegalStateException {
    public InvalidHandleException(String message) {
        super(message);
    }
}
