package co.fanki.flowviz.export.domain;

import co.fanki.flowviz.flowmd.domain.FlowGraph;
import co.fanki.flowviz.flowmd.domain.GraphEdge;
import co.fanki.flowviz.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Writes the edge list of a graph as CSV.
 *
 * <p>Output is a {@code source,target} header followed by one row per
 * edge, every value double-quoted, rows separated by CRLF. Exporting a
 * whole graph therefore yields {@code edgeCount + 1} rows.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class EdgeCsvExporter {

    /** Suggested download file name. */
    public static final String FILE_NAME = "flowviz-edges.csv";

    private static final String ROW_SEPARATOR = "\r\n";

    private EdgeCsvExporter() {
    }

    /**
     * Exports every edge of the graph.
     *
     * @param graph the graph
     * @return the CSV text
     */
    public static String export(final FlowGraph graph) {
        return export(graph, null);
    }

    /**
     * Exports the highlighted edges, or every edge when nothing is
     * highlighted.
     *
     * @param graph the graph
     * @param highlightedEdges edge keys in {@code src->dst} form, may be
     *        null or empty
     * @return the CSV text
     */
    public static String export(final FlowGraph graph,
            final Collection<String> highlightedEdges) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final List<String> rows = new ArrayList<>();
        rows.add(row("source", "target"));

        if (highlightedEdges != null && !highlightedEdges.isEmpty()) {
            for (final String key : highlightedEdges) {
                final int at = key.indexOf("->");
                if (at < 0) {
                    rows.add(row(key, ""));
                } else {
                    rows.add(row(key.substring(0, at),
                            key.substring(at + 2)));
                }
            }
        } else {
            for (final GraphEdge edge : graph.edges()) {
                rows.add(row(edge.source(), edge.target()));
            }
        }
        return String.join(ROW_SEPARATOR, rows);
    }

    private static String row(final String source, final String target) {
        return quote(source) + "," + quote(target);
    }

    private static String quote(final String value) {
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }
}
