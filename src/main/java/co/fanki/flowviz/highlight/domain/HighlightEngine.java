package co.fanki.flowviz.highlight.domain;

import co.fanki.flowviz.flowmd.domain.FlowGraph;
import co.fanki.flowviz.flowmd.domain.GraphEdge;
import co.fanki.flowviz.flowmd.domain.GraphNode;
import co.fanki.flowviz.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes the downstream subgraph of a node.
 *
 * <p>Builds its adjacency index once, at construction, so repeated
 * queries against the same graph share it. The index is never modified
 * afterwards and the source graph is never touched, which makes one
 * engine safe to query from several threads.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class HighlightEngine {

    private final Map<String, Set<String>> adjacency;

    /**
     * Creates an engine for a finished graph.
     *
     * @param graph the parsed graph
     */
    public HighlightEngine(final FlowGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final Map<String, Set<String>> index = new LinkedHashMap<>();
        for (final GraphNode node : graph.nodes()) {
            index.putIfAbsent(node.id(), new LinkedHashSet<>());
        }
        for (final GraphEdge edge : graph.edges()) {
            index.computeIfAbsent(edge.source(),
                    k -> new LinkedHashSet<>()).add(edge.target());
        }

        final Map<String, Set<String>> frozen = new LinkedHashMap<>();
        for (final Map.Entry<String, Set<String>> entry : index.entrySet()) {
            frozen.put(entry.getKey(),
                    Collections.unmodifiableSet(entry.getValue()));
        }
        this.adjacency = Collections.unmodifiableMap(frozen);
    }

    /**
     * Returns everything reachable from the start node.
     *
     * <p>An id that is not in the graph still comes back as the single
     * reached node, with no edges.</p>
     *
     * @param startId the node to start from
     * @return the reachable nodes and traversed edges, both sorted;
     *         empty if startId is null
     */
    public DownstreamResult downstream(final String startId) {
        if (startId == null) {
            return DownstreamResult.empty();
        }

        final long start = System.nanoTime();

        final Set<String> visited = new HashSet<>();
        final Set<String> edgeKeys = new TreeSet<>();
        final Queue<String> queue = new ArrayDeque<>();

        visited.add(startId);
        queue.add(startId);

        while (!queue.isEmpty()) {
            final String current = queue.poll();
            for (final String successor : successors(current)) {
                edgeKeys.add(current + "->" + successor);
                if (visited.add(successor)) {
                    queue.add(successor);
                }
            }
        }

        final double durationMs = (System.nanoTime() - start) / 1_000_000d;

        return new DownstreamResult(
                List.copyOf(new TreeSet<>(visited)),
                List.copyOf(edgeKeys),
                durationMs);
    }

    /**
     * Returns the direct successors of a node.
     *
     * @param nodeId the node id
     * @return the successors in edge order, empty for unknown ids
     */
    public Set<String> successors(final String nodeId) {
        return adjacency.getOrDefault(nodeId, Set.of());
    }
}
