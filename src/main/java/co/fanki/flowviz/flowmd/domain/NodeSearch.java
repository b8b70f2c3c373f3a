package co.fanki.flowviz.flowmd.domain;

import java.util.Optional;

/**
 * Resolves a free-text query to a node of a parsed graph.
 *
 * <p>A node matches when its id equals the query or its label contains
 * it. The first match in node insertion order wins.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NodeSearch {

    private NodeSearch() {
    }

    /**
     * Finds the first node matching the query.
     *
     * @param graph the graph to search
     * @param query the exact id or a label fragment
     * @return the matching node, empty if none or if the query is blank
     */
    public static Optional<GraphNode> find(final FlowGraph graph,
            final String query) {
        if (graph == null || query == null || query.isBlank()) {
            return Optional.empty();
        }
        for (final GraphNode node : graph.nodes()) {
            if (node.id().equals(query)
                    || (node.label() != null
                            && node.label().contains(query))) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }
}
