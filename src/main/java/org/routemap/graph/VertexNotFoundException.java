package org.routemap.graph;

import lombok.experimental.StandardException;

/**
 * Thrown when an operation names a vertex (or a vertex label) that is not part of the graph.
 */
@StandardException
public class VertexNotFoundException extends RuntimeException {
}
