package co.fanki.flowviz.flowmd.application;

import co.fanki.flowviz.export.domain.EdgeCsvExporter;
import co.fanki.flowviz.flowmd.domain.FlowGraph;
import co.fanki.flowviz.flowmd.domain.FlowMdException;
import co.fanki.flowviz.flowmd.domain.FlowMdParser;
import co.fanki.flowviz.flowmd.domain.GraphNode;
import co.fanki.flowviz.flowmd.domain.NodeSearch;
import co.fanki.flowviz.highlight.domain.DownstreamResult;
import co.fanki.flowviz.highlight.domain.HighlightEngine;
import co.fanki.flowviz.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;

/**
 * Entry point to the FlowMD core for the web, MCP and self-test front
 * ends.
 *
 * <p>Stateless: the configured parser only carries the default limits,
 * graphs travel with each request.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class FlowGraphService {

    private static final Logger LOG = LoggerFactory.getLogger(
            FlowGraphService.class);

    private final FlowMdParser defaultParser;

    /**
     * Creates a new FlowGraphService.
     *
     * @param theDefaultParser the parser configured with default limits
     */
    public FlowGraphService(final FlowMdParser theDefaultParser) {
        this.defaultParser = Preconditions.requireNonNull(theDefaultParser,
                "Parser is required");
    }

    /**
     * Parses FlowMD text with the configured limits.
     *
     * @param text the FlowMD source
     * @return the parsed graph
     */
    public FlowGraph parse(final String text) {
        return parse(text, null, null);
    }

    /**
     * Parses FlowMD text, optionally overriding the configured limits.
     *
     * @param text the FlowMD source
     * @param maxNodes the hard limit, null for the configured one
     * @param preferredMaxNodes the advisory limit, null for the
     *        configured one
     * @return the parsed graph
     * @throws FlowMdException if the text cannot be parsed or a limit is
     *         out of range
     */
    public FlowGraph parse(final String text, final Integer maxNodes,
            final Integer preferredMaxNodes) {

        final FlowMdParser parser = maxNodes == null
                && preferredMaxNodes == null
                ? defaultParser
                : parserWithLimits(maxNodes, preferredMaxNodes);

        final FlowGraph graph = parser.parse(text);

        LOG.info("Parsed FlowMD: {} nodes, {} edges, {} warnings,"
                        + " orientation {}",
                graph.nodeCount(), graph.edgeCount(),
                graph.meta().warnings().size(),
                graph.meta().orientation());

        if (graph.meta().degrade()) {
            LOG.info("Graph exceeds preferred size ({} > {}),"
                            + " viewer should degrade rendering",
                    graph.nodeCount(), graph.meta().preferredMaxNodes());
        }
        return graph;
    }

    private FlowMdParser parserWithLimits(final Integer maxNodes,
            final Integer preferredMaxNodes) {
        try {
            return new FlowMdParser(
                    maxNodes != null ? maxNodes : defaultParser.maxNodes(),
                    preferredMaxNodes != null ? preferredMaxNodes
                            : defaultParser.preferredMaxNodes());
        } catch (final IllegalArgumentException e) {
            throw new FlowMdException(e.getMessage(),
                    FlowMdException.INVALID_LIMITS);
        }
    }

    /**
     * Computes the downstream subgraph of a node.
     *
     * @param graph the parsed graph
     * @param startId the node to start from
     * @return the reachable nodes and edges
     */
    public DownstreamResult downstream(final FlowGraph graph,
            final String startId) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final DownstreamResult result =
                new HighlightEngine(graph).downstream(startId);

        LOG.debug("Downstream of {}: {} nodes, {} edges in {} ms",
                startId, result.nodes().size(), result.edges().size(),
                result.durationMs());
        return result;
    }

    /**
     * Finds the first node whose id equals, or whose label contains,
     * the query.
     *
     * @param graph the parsed graph
     * @param query the search text
     * @return the node, empty if none matched
     */
    public Optional<GraphNode> search(final FlowGraph graph,
            final String query) {
        Preconditions.requireNonNull(graph, "Graph is required");
        return NodeSearch.find(graph, query);
    }

    /**
     * Exports the edges of a graph as CSV.
     *
     * @param graph the parsed graph
     * @param highlightedEdges the highlighted edge keys, null or empty
     *        to export every edge
     * @return the CSV text
     */
    public String exportCsv(final FlowGraph graph,
            final Collection<String> highlightedEdges) {
        return EdgeCsvExporter.export(graph, highlightedEdges);
    }
}
