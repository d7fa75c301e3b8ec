package org.routemap.io;

import org.routemap.graph.Graph;
import org.routemap.graph.Vertex;
import org.routemap.graph.VertexNotFoundException;
import org.routemap.route.RouteMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads graphs from the line-oriented {@code Node}/{@code Edge} record format.
 * <p>
 * All node records come first, then all edge records. Each record is a keyword line
 * followed by one {@code key: value...} line per field:
 * </p>
 * <pre>
 * Node            Edge
 * id: 1           source: 1
 * coords: 53 -6   target: 2
 *                 length: 120.5
 *                 time: 14.2
 *                 oneway: False
 * </pre>
 * <p>
 * {@code coords} and {@code time} only appear in route-map files. Plain graphs use
 * {@code length} as the edge element and honour {@code oneway}; route maps use
 * {@code time} and add every edge in both directions.
 * </p>
 */
public final class GraphFileReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(GraphFileReader.class);

    static final String NODE = "Node";
    static final String EDGE = "Edge";

    private GraphFileReader() {
    }

    /**
     * Reads a plain graph file.
     *
     * @throws GraphFormatException if the file is malformed.
     * @throws IOException          if the file cannot be read.
     */
    public static Graph<Integer, Double> readGraph(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readGraph(reader);
        }
    }

    /**
     * Reads a plain graph from {@code reader}. The reader is not closed.
     */
    public static Graph<Integer, Double> readGraph(Reader reader) throws IOException {
        Graph<Integer, Double> graph = new Graph<>();
        LineCursor cursor = new LineCursor(reader);

        int nodes = 0;
        String entry = cursor.nextRecord();
        while (NODE.equals(entry)) {
            nodes++;
            graph.addVertex(cursor.intField("id"));
            entry = cursor.nextRecord();
        }
        LOGGER.info("Read {} vertices and added into the graph", nodes);

        int edges = 0;
        while (EDGE.equals(entry)) {
            edges++;
            Vertex<Integer> sv = cursor.vertex(graph, "source");
            Vertex<Integer> tv = cursor.vertex(graph, "target");
            double length = cursor.doubleField("length");
            boolean oneway = cursor.booleanField("oneway");
            graph.addEdge(sv, tv, length, oneway);
            entry = cursor.nextRecord();
        }
        cursor.requireEnd(entry);
        LOGGER.info("Read {} edges and added into the graph", edges);
        LOGGER.debug("{}", graph);
        return graph;
    }

    /**
     * Reads a route-map file.
     *
     * @throws GraphFormatException if the file is malformed.
     * @throws IOException          if the file cannot be read.
     */
    public static RouteMap<Integer, Double> readRouteMap(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readRouteMap(reader, new RouteMap<>());
        }
    }

    /**
     * Populates {@code routeMap} from {@code reader} and returns it. The reader is not closed.
     * Edges are two-way and weighted by {@code time}; {@code length} and {@code oneway} lines
     * are required but their values are ignored.
     */
    public static RouteMap<Integer, Double> readRouteMap(Reader reader, RouteMap<Integer, Double> routeMap) throws IOException {
        Objects.requireNonNull(routeMap, "routeMap");
        LineCursor cursor = new LineCursor(reader);

        int nodes = 0;
        String entry = cursor.nextRecord();
        while (NODE.equals(entry)) {
            nodes++;
            int id = cursor.intField("id");
            double[] coords = cursor.coordsField("coords");
            routeMap.addVertex(id, coords[0], coords[1]);
            entry = cursor.nextRecord();
        }
        LOGGER.info("Read {} vertices and added into the route map", nodes);

        int edges = 0;
        while (EDGE.equals(entry)) {
            edges++;
            Vertex<Integer> sv = cursor.vertex(routeMap, "source");
            Vertex<Integer> tv = cursor.vertex(routeMap, "target");
            cursor.skipField("length");
            double time = cursor.doubleField("time");
            cursor.skipField("oneway");
            routeMap.addEdge(sv, tv, time);
            entry = cursor.nextRecord();
        }
        cursor.requireEnd(entry);
        LOGGER.info("Read {} edges and added into the route map", edges);
        LOGGER.debug("{}", routeMap);
        return routeMap;
    }

    /**
     * Line reader that tracks line numbers and splits {@code key: value} fields.
     */
    private static final class LineCursor {
        private final BufferedReader reader;
        private int lineNumber;

        LineCursor(Reader reader) {
            Objects.requireNonNull(reader, "reader");
            this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        }

        /**
         * Returns the next record keyword, skipping blank lines; {@code null} at end of input.
         */
        String nextRecord() throws IOException {
            String line;
            do {
                line = reader.readLine();
                if (line == null) {
                    return null;
                }
                lineNumber++;
            } while (line.isBlank());
            return line.trim();
        }

        void requireEnd(String entry) throws GraphFormatException {
            if (entry != null) {
                throw new GraphFormatException(lineNumber, "expected '" + NODE + "' or '" + EDGE + "' record, got '" + entry + "'");
            }
        }

        int intField(String key) throws IOException {
            String raw = field(key, 1)[0];
            try {
                return Integer.parseInt(raw);
            } catch (NumberFormatException ex) {
                throw new GraphFormatException(lineNumber, "'" + key + "' is not an integer: " + raw, ex);
            }
        }

        double doubleField(String key) throws IOException {
            return parseDouble(key, field(key, 1)[0]);
        }

        double[] coordsField(String key) throws IOException {
            String[] values = field(key, 2);
            return new double[]{parseDouble(key, values[0]), parseDouble(key, values[1])};
        }

        boolean booleanField(String key) throws IOException {
            String raw = field(key, 1)[0];
            if ("true".equalsIgnoreCase(raw)) {
                return true;
            }
            if ("false".equalsIgnoreCase(raw)) {
                return false;
            }
            throw new GraphFormatException(lineNumber, "'" + key + "' must be true or false, got " + raw);
        }

        Vertex<Integer> vertex(Graph<Integer, ?> graph, String key) throws IOException {
            int id = intField(key);
            try {
                return graph.vertexByLabel(id);
            } catch (VertexNotFoundException ex) {
                throw new GraphFormatException(lineNumber, "edge refers to unknown vertex " + id, ex);
            }
        }

        /**
         * Consumes a field line whose value is not used; only its presence is required.
         */
        void skipField(String key) throws IOException {
            if (reader.readLine() == null) {
                throw new GraphFormatException(lineNumber + 1, "unexpected end of input, expected '" + key + ":'");
            }
            lineNumber++;
        }

        private double parseDouble(String key, String raw) throws GraphFormatException {
            try {
                return Double.parseDouble(raw);
            } catch (NumberFormatException ex) {
                throw new GraphFormatException(lineNumber, "'" + key + "' is not a number: " + raw, ex);
            }
        }

        private String[] field(String key, int arity) throws IOException {
            String line = reader.readLine();
            if (line == null) {
                throw new GraphFormatException(lineNumber + 1, "unexpected end of input, expected '" + key + ":'");
            }
            lineNumber++;
            String[] tokens = line.trim().split("\\s+");
            if (!tokens[0].equals(key + ":")) {
                throw new GraphFormatException(lineNumber, "expected '" + key + ":', got '" + line.trim() + "'");
            }
            if (tokens.length != arity + 1) {
                throw new GraphFormatException(lineNumber, "'" + key + "' expects " + arity + " value(s), got " + (tokens.length - 1));
            }
            String[] values = new String[arity];
            System.arraycopy(tokens, 1, values, 0, arity);
            return values;
        }
    }
}
