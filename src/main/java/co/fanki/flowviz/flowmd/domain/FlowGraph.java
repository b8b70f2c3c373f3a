package co.fanki.flowviz.flowmd.domain;

import java.util.List;

/**
 * Result of parsing a FlowMD document.
 *
 * <p>Nodes keep insertion order, edges keep statement order. Instances
 * are independent of each other and of the parser that produced them.
 * A graph posted back by a client without its node or edge list is
 * read as having none.</p>
 *
 * @param nodes the nodes in first-mention order
 * @param edges the edges in statement order
 * @param meta the orientation, limits, warnings and groups
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FlowGraph(
        List<GraphNode> nodes,
        List<GraphEdge> edges,
        GraphMeta meta) {

    /** Replaces missing node or edge lists with empty ones. */
    public FlowGraph {
        nodes = nodes == null ? List.of() : nodes;
        edges = edges == null ? List.of() : edges;
    }

    /**
     * Returns the number of nodes.
     *
     * @return the node count
     */
    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Returns the number of edges.
     *
     * @return the edge count
     */
    public int edgeCount() {
        return edges.size();
    }
}
