package co.fanki.flowviz.flowmd.domain;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds simple cycles in a finished flowchart.
 *
 * <p>Runs a depth-first search from every unvisited node, in node
 * insertion order, following successors in edge order. A back edge to
 * a node on the current path closes a cycle made of the path slice
 * from that node plus the node again. Cycles are deduplicated by their
 * literal {@code a->b->a} path key only, so the same loop found from a
 * different entry point is reported again.</p>
 *
 * <p>The traversal keeps its own frame stack instead of recursing, so
 * graphs at the hard node limit cannot exhaust the call stack.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CycleDetector {

    /** Prefix of every cycle warning message. */
    public static final String CYCLE_MESSAGE = "Cycle detected: ";

    private CycleDetector() {
    }

    /**
     * Detects cycles.
     *
     * @param nodes the nodes, in insertion order
     * @param edges the edges, in statement order
     * @return every distinct cycle path, first node repeated at the end
     */
    public static List<List<String>> detect(final List<GraphNode> nodes,
            final List<GraphEdge> edges) {

        final Map<String, Set<String>> adjacency = adjacency(nodes, edges);

        final Set<String> visited = new HashSet<>();
        final Set<String> onStack = new HashSet<>();
        final List<String> path = new ArrayList<>();
        final Set<String> seen = new HashSet<>();
        final List<List<String>> cycles = new ArrayList<>();

        final Deque<Frame> stack = new ArrayDeque<>();

        for (final String root : adjacency.keySet()) {
            if (visited.contains(root)) {
                continue;
            }
            enter(root, adjacency, visited, onStack, path, stack);

            while (!stack.isEmpty()) {
                final Frame frame = stack.peek();

                if (!frame.successors.hasNext()) {
                    stack.pop();
                    onStack.remove(frame.nodeId);
                    path.remove(path.size() - 1);
                    continue;
                }

                final String successor = frame.successors.next();
                if (!visited.contains(successor)) {
                    enter(successor, adjacency, visited, onStack, path,
                            stack);
                } else if (onStack.contains(successor)) {
                    final int index = path.indexOf(successor);
                    if (index != -1) {
                        final List<String> cycle = new ArrayList<>(
                                path.subList(index, path.size()));
                        cycle.add(successor);
                        if (seen.add(String.join("->", cycle))) {
                            cycles.add(Collections.unmodifiableList(cycle));
                        }
                    }
                }
            }
        }
        return cycles;
    }

    /**
     * Formats the warning for a detected cycle.
     *
     * @param cycle the cycle path
     * @return the warning
     */
    public static GraphWarning toWarning(final List<String> cycle) {
        return GraphWarning.forNodes(
                CYCLE_MESSAGE + String.join(" -> ", cycle), cycle);
    }

    private static void enter(final String nodeId,
            final Map<String, Set<String>> adjacency,
            final Set<String> visited, final Set<String> onStack,
            final List<String> path, final Deque<Frame> stack) {
        visited.add(nodeId);
        onStack.add(nodeId);
        path.add(nodeId);
        stack.push(new Frame(nodeId, adjacency
                .getOrDefault(nodeId, Set.of()).iterator()));
    }

    private static Map<String, Set<String>> adjacency(
            final List<GraphNode> nodes, final List<GraphEdge> edges) {
        final Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        for (final GraphNode node : nodes) {
            adjacency.put(node.id(), new LinkedHashSet<>());
        }
        for (final GraphEdge edge : edges) {
            adjacency.computeIfAbsent(edge.source(),
                    k -> new LinkedHashSet<>()).add(edge.target());
        }
        return adjacency;
    }

    /** A node whose successors are still being explored. */
    private static final class Frame {

        private final String nodeId;
        private final Iterator<String> successors;

        private Frame(final String theNodeId,
                final Iterator<String> theSuccessors) {
            this.nodeId = theNodeId;
            this.successors = theSuccessors;
        }
    }
}
