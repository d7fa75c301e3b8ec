package org.routemap.route;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.routemap.graph.Vertex;
import org.routemap.routing.SearchBudget;
import org.routemap.routing.ShortestPath;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Route Reporter Tests")
class RouteReporterTest {

    private static RouteMap<Integer, Double> lineMap() {
        RouteMap<Integer, Double> map = new RouteMap<>(new ShortestPath(SearchBudget.unbounded()));
        Vertex<Integer> a = map.addVertex(10, 51.5, -0.12);
        Vertex<Integer> b = map.addVertex(20, 51.6, -0.13);
        Vertex<Integer> c = map.addVertex(30, 51.7, -0.14);
        map.addEdge(a, b, 3.0);
        map.addEdge(b, c, 4.5);
        return map;
    }

    @Test
    @DisplayName("Route CSV keeps the literal header and waypoint rows")
    void testRouteLines() {
        List<String> lines = RouteReporter.routeLines(lineMap().path(10, 30));

        assertEquals(List.of(
                "Type,Latitude,Longitude,element,cost",
                "W,51.7,-0.14,30,7.5",
                "W,51.6,-0.13,20,3.0"
        ), lines);
    }

    @Test
    @DisplayName("writeRoute appends one line per row")
    void testWriteRoute() throws IOException {
        StringBuilder out = new StringBuilder();
        RouteReporter.writeRoute(lineMap().path(10, 20), out);

        assertEquals("Type,Latitude,Longitude,element,cost\nW,51.6,-0.13,20,3.0\n", out.toString());
    }

    @Test
    @DisplayName("Missing coordinates render as empty fields")
    void testMissingCoordinates() {
        RouteHop<String> hop = new RouteHop<>("X", null, 2.0);
        assertEquals("W,,,X,2.0", RouteReporter.formatHop(hop));
    }

    @Test
    @DisplayName("Closed table lists every finalized vertex")
    void testClosedTable() throws IOException {
        RouteMap<Integer, Double> map = lineMap();
        List<String> lines = RouteReporter.closedTableLines(map.shortestPaths(10));

        assertEquals(List.of(
                "Destination vertex:10  Path length:0.0   Previous vertex:None",
                "Destination vertex:20  Path length:3.0   Previous vertex:10",
                "Destination vertex:30  Path length:7.5   Previous vertex:20"
        ), lines);

        StringBuilder out = new StringBuilder();
        RouteReporter.writeClosedTable(map.shortestPaths(10), out);
        assertEquals(3, out.toString().split("\n").length);
    }
}
