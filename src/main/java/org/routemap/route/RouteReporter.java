package org.routemap.route;

import org.routemap.routing.ShortestPathResult;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Text renderings of shortest-path results.
 * <p>
 * Routes are written as CSV with the header {@value #HEADER}; each hop becomes
 * {@code W,<lat>,<lon>,<label>,<cost>}. Missing coordinates render as empty fields.
 * </p>
 */
public final class RouteReporter {
    public static final String HEADER = "Type,Latitude,Longitude,element,cost";
    static final String WAYPOINT = "W";

    private RouteReporter() {
    }

    /**
     * Formats one hop as a CSV row.
     */
    public static String formatHop(RouteHop<?> hop) {
        Coordinates coords = hop.getCoordinates();
        String latitude = coords == null ? "" : String.valueOf(coords.latitude());
        String longitude = coords == null ? "" : String.valueOf(coords.longitude());
        return WAYPOINT + ',' + latitude + ',' + longitude + ',' + hop.getLabel() + ',' + hop.getCumulativeCost();
    }

    /**
     * Returns the header followed by one row per hop, destination first.
     */
    public static List<String> routeLines(RoutePath<?> path) {
        List<String> lines = new ArrayList<>(path.getHops().size() + 1);
        lines.add(HEADER);
        for (RouteHop<?> hop : path.getHops()) {
            lines.add(formatHop(hop));
        }
        return lines;
    }

    /**
     * Writes {@link #routeLines(RoutePath)}, one per line.
     */
    public static void writeRoute(RoutePath<?> path, Appendable out) throws IOException {
        for (String line : routeLines(path)) {
            out.append(line).append('\n');
        }
    }

    /**
     * Returns one line per finalized vertex of a shortest-path run, in finalization order.
     */
    public static <V> List<String> closedTableLines(ShortestPathResult<V> result) {
        List<String> lines = new ArrayList<>(result.size());
        for (Map.Entry<V, ShortestPathResult.Settled<V>> entry : result.entries().entrySet()) {
            ShortestPathResult.Settled<V> settled = entry.getValue();
            lines.add("Destination vertex:" + entry.getKey()
                    + "  Path length:" + settled.distance()
                    + "   Previous vertex:" + settled.predecessor().map(String::valueOf).orElse("None"));
        }
        return lines;
    }

    /**
     * Writes {@link #closedTableLines(ShortestPathResult)}, one per line.
     */
    public static void writeClosedTable(ShortestPathResult<?> result, Appendable out) throws IOException {
        for (String line : closedTableLines(result)) {
            out.append(line).append('\n');
        }
    }
}
