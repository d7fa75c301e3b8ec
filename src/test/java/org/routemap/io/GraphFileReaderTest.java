package org.routemap.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.routemap.graph.Graph;
import org.routemap.route.Coordinates;
import org.routemap.route.RouteMap;
import org.routemap.route.RouteReporter;
import org.routemap.routing.SearchBudget;
import org.routemap.routing.ShortestPath;
import org.routemap.routing.ShortestPathResult;

import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph File Reader Tests")
class GraphFileReaderTest {

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(GraphFileReaderTest.class.getResource("/graphs/" + name).toURI());
    }

    @Nested
    @DisplayName("1. Plain Graphs")
    class PlainGraphs {

        @Test
        @DisplayName("Reads vertices, edges and one-way flags")
        void testReadGraph() throws Exception {
            Graph<Integer, Double> graph = GraphFileReader.readGraph(fixture("simple_graph.txt"));

            assertEquals(4, graph.numVertices());
            assertEquals(4, graph.numEdges());
            assertEquals(4.0, graph.getEdge(graph.vertexByLabel(3), graph.vertexByLabel(1)).orElseThrow().element());
            assertTrue(graph.getEdge(graph.vertexByLabel(3), graph.vertexByLabel(4)).isPresent());
            assertTrue(graph.getEdge(graph.vertexByLabel(4), graph.vertexByLabel(3)).isEmpty());
        }

        @Test
        @DisplayName("Imported graph feeds Dijkstra")
        void testImportedShortestPaths() throws Exception {
            Graph<Integer, Double> graph = GraphFileReader.readGraph(fixture("simple_graph.txt"));
            ShortestPathResult<Integer> result = new ShortestPath(SearchBudget.unbounded()).run(graph, 1);

            assertEquals(3.0, result.distance(3));
            assertEquals(Optional.of(2), result.predecessor(3));
            assertEquals(4.5, result.distance(4));

            ShortestPathResult<Integer> fromFour = new ShortestPath(SearchBudget.unbounded()).run(graph, 4);
            assertEquals(1, fromFour.size(), "Vertex 4 only has an incoming one-way edge");
        }

        @Test
        @DisplayName("Empty input yields an empty graph")
        void testEmpty() throws IOException {
            Graph<Integer, Double> graph = GraphFileReader.readGraph(new StringReader(""));
            assertEquals(0, graph.numVertices());
        }

        @Test
        @DisplayName("Edge to an unknown vertex is a format error")
        void testUnknownVertex() {
            String text = "Node\nid: 1\nEdge\nsource: 1\ntarget: 9\nlength: 1.0\noneway: False\n";
            GraphFormatException ex = assertThrows(GraphFormatException.class,
                    () -> GraphFileReader.readGraph(new StringReader(text)));
            assertEquals(5, ex.lineNumber());
        }

        @Test
        @DisplayName("Malformed fields report their line")
        void testMalformedFields() {
            GraphFormatException badId = assertThrows(GraphFormatException.class,
                    () -> GraphFileReader.readGraph(new StringReader("Node\nid: one\n")));
            assertEquals(2, badId.lineNumber());

            GraphFormatException wrongKey = assertThrows(GraphFormatException.class,
                    () -> GraphFileReader.readGraph(new StringReader("Node\nname: 1\n")));
            assertEquals(2, wrongKey.lineNumber());

            String badFlag = "Node\nid: 1\nEdge\nsource: 1\ntarget: 1\nlength: 1.0\noneway: maybe\n";
            GraphFormatException flag = assertThrows(GraphFormatException.class,
                    () -> GraphFileReader.readGraph(new StringReader(badFlag)));
            assertEquals(7, flag.lineNumber());
        }

        @Test
        @DisplayName("Truncated record and stray keyword are format errors")
        void testTruncatedAndStray() {
            assertThrows(GraphFormatException.class,
                    () -> GraphFileReader.readGraph(new StringReader("Node\n")));
            GraphFormatException stray = assertThrows(GraphFormatException.class,
                    () -> GraphFileReader.readGraph(new StringReader("Node\nid: 1\nVertex\n")));
            assertEquals(3, stray.lineNumber());
        }

        @Test
        @DisplayName("Missing file propagates the I/O failure")
        void testMissingFile(@TempDir Path dir) {
            assertThrows(NoSuchFileException.class, () -> GraphFileReader.readGraph(dir.resolve("absent.txt")));
        }
    }

    @Nested
    @DisplayName("2. Route Maps")
    class RouteMaps {

        @Test
        @DisplayName("Reads coordinates and uses travel time as cost")
        void testReadRouteMap() throws Exception {
            RouteMap<Integer, Double> map = GraphFileReader.readRouteMap(fixture("simple_route_map.txt"));

            assertEquals(3, map.numVertices());
            assertEquals(3, map.numEdges());
            assertEquals(new Coordinates(52.2, -6.6), map.coordinates(map.vertexByLabel(200)).orElseThrow());
            assertTrue(map.getEdge(map.vertexByLabel(300), map.vertexByLabel(200)).isPresent(),
                    "Route-map edges are added in both directions");
        }

        @Test
        @DisplayName("Imported route map produces the CSV route")
        void testImportedRoute() throws Exception {
            RouteMap<Integer, Double> map = GraphFileReader.readRouteMap(fixture("simple_route_map.txt"));

            assertEquals(List.of(
                    "Type,Latitude,Longitude,element,cost",
                    "W,52.3,-6.7,300,90.0",
                    "W,52.2,-6.6,200,60.0"
            ), RouteReporter.routeLines(map.path(100, 300)));
        }

        @Test
        @DisplayName("Reads from a file written at runtime")
        void testReadFromTempFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("map.txt");
            Files.writeString(file, "Node\nid: 7\ncoords: 1.5 2.5\n");

            RouteMap<Integer, Double> map = GraphFileReader.readRouteMap(file);
            assertEquals(new Coordinates(1.5, 2.5), map.coordinates(map.vertexByLabel(7)).orElseThrow());
        }

        @Test
        @DisplayName("Length and one-way lines are consumed without being parsed")
        void testUnusedFieldsSkipped() throws IOException {
            String text = "Node\nid: 1\ncoords: 1.0 2.0\nNode\nid: 2\ncoords: 3.0 4.0\n"
                    + "Edge\nsource: 1\ntarget: 2\nlength: unknown\ntime: 12.5\noneway: yes\n";

            RouteMap<Integer, Double> map = GraphFileReader.readRouteMap(new StringReader(text), new RouteMap<>());
            assertEquals(1, map.numEdges());
            assertEquals(12.5, map.getEdge(map.vertexByLabel(2), map.vertexByLabel(1)).orElseThrow().element());
        }

        @Test
        @DisplayName("Route-map edge cut off before its one-way line is a format error")
        void testTruncatedRouteEdge() {
            String text = "Node\nid: 1\ncoords: 1.0 2.0\nEdge\nsource: 1\ntarget: 1\nlength: 1.0\ntime: 2.0\n";
            GraphFormatException ex = assertThrows(GraphFormatException.class,
                    () -> GraphFileReader.readRouteMap(new StringReader(text), new RouteMap<>()));
            assertEquals(9, ex.lineNumber());
        }

        @Test
        @DisplayName("Missing coordinate value is a format error")
        void testBadCoords() {
            RouteMap<Integer, Double> target = new RouteMap<>();
            GraphFormatException ex = assertThrows(GraphFormatException.class,
                    () -> GraphFileReader.readRouteMap(new StringReader("Node\nid: 1\ncoords: 52.0\n"), target));
            assertEquals(3, ex.lineNumber());
        }
    }
}
