package org.routemap.io;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.io.IOException;

/**
 * Thrown when a graph file does not follow the {@code Node}/{@code Edge} record format.
 */
@Getter
@Accessors(fluent = true)
public class GraphFormatException extends IOException {
    private final int lineNumber;

    public GraphFormatException(int lineNumber, String message) {
        super("line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public GraphFormatException(int lineNumber, String message, Throwable cause) {
        super("line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }
}
