package co.fanki.flowviz.flowmd.domain;

import co.fanki.flowviz.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Accumulates classified statements into a {@link FlowGraph}.
 *
 * <p>Owns the node table, the edge list, the group table and the
 * warnings of a single parse. The group context is a single slot, not
 * a stack: a {@code subgraph} line replaces the active group and any
 * {@code end} line clears it, so nested subgraphs attach their trailing
 * nodes to no group at all.</p>
 *
 * <p>Not thread-safe; create one builder per parse.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphBuilder {

    /** Warning for a {@code subgraph} line without a name. */
    public static final String EMPTY_SUBGRAPH = "Empty subgraph name";

    /** Warning for a line matching no statement shape. */
    public static final String UNRECOGNISED = "Unrecognised statement";

    private final int maxNodes;
    private final int preferredMaxNodes;

    private final Map<String, NodeDraft> nodes = new LinkedHashMap<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private final Set<String> groups = new LinkedHashSet<>();
    private final List<GraphWarning> warnings = new ArrayList<>();

    private String orientation = LineClassifier.DEFAULT_ORIENTATION;
    private String currentGroup;

    /**
     * Creates a builder with the given node limits.
     *
     * @param theMaxNodes the hard limit, parse fails above it
     * @param thePreferredMaxNodes the advisory limit, sets degrade above it
     */
    public GraphBuilder(final int theMaxNodes,
            final int thePreferredMaxNodes) {
        this.maxNodes = Preconditions.requirePositive(theMaxNodes,
                "Max nodes must be positive");
        this.preferredMaxNodes = Preconditions.requireNonNegative(
                thePreferredMaxNodes,
                "Preferred max nodes must be non-negative");
    }

    /**
     * Applies a statement to the graph under construction.
     *
     * @param statement the classified statement
     */
    public void apply(final Statement statement) {
        Preconditions.requireNonNull(statement, "Statement is required");

        switch (statement.kind()) {
            case ORIENTATION -> orientation = statement.value();
            case SUBGRAPH_OPEN -> openGroup(statement);
            case SUBGRAPH_CLOSE -> currentGroup = null;
            case EDGE -> {
                ensureNode(statement.left(), statement.line());
                ensureNode(statement.right(), statement.line());
                edges.add(new GraphEdge(statement.left().id(),
                        statement.right().id(), statement.line()));
            }
            case NODE -> ensureNode(statement.left(), statement.line());
            case UNRECOGNISED -> warnings.add(
                    GraphWarning.atLine(statement.line(), UNRECOGNISED));
            default -> throw new IllegalStateException(
                    "Unknown statement kind: " + statement.kind());
        }
    }

    /**
     * Finishes the graph: enforces the hard limit, flags degrade and
     * appends cycle warnings.
     *
     * @return the parse result
     * @throws FlowMdException if the node count exceeds the hard limit
     */
    public FlowGraph build() {
        if (nodes.size() > maxNodes) {
            throw new FlowMdException("Node count " + nodes.size()
                    + " exceeds hard limit " + maxNodes,
                    FlowMdException.NODE_LIMIT_EXCEEDED);
        }

        final List<GraphNode> nodeList = new ArrayList<>(nodes.size());
        for (final NodeDraft draft : nodes.values()) {
            nodeList.add(draft.toNode());
        }
        final List<GraphEdge> edgeList = List.copyOf(edges);

        final List<GraphWarning> allWarnings = new ArrayList<>(warnings);
        for (final List<String> cycle
                : CycleDetector.detect(nodeList, edgeList)) {
            allWarnings.add(CycleDetector.toWarning(cycle));
        }

        final GraphMeta meta = new GraphMeta(
                orientation,
                preferredMaxNodes,
                maxNodes,
                Collections.unmodifiableList(allWarnings),
                groupMembers(nodeList),
                nodeList.size() > preferredMaxNodes,
                false);

        return new FlowGraph(Collections.unmodifiableList(nodeList),
                edgeList, meta);
    }

    private void openGroup(final Statement statement) {
        final String name = statement.value();
        if (name == null || name.isEmpty()) {
            warnings.add(GraphWarning.atLine(statement.line(),
                    EMPTY_SUBGRAPH));
            currentGroup = null;
            return;
        }
        groups.add(name);
        currentGroup = name;
    }

    private void ensureNode(final NodeToken token, final int line) {
        final NodeDraft node = nodes.computeIfAbsent(token.id(),
                id -> new NodeDraft(id, line, currentGroup));
        if (node.group == null) {
            node.group = currentGroup;
        }
        if (token.hasLabel()) {
            node.label = token.label();
        }
    }

    private Map<String, List<String>> groupMembers(
            final List<GraphNode> nodeList) {
        final Map<String, List<String>> result = new LinkedHashMap<>();
        for (final String name : groups) {
            final List<String> members = new ArrayList<>();
            for (final GraphNode node : nodeList) {
                if (name.equals(node.group())) {
                    members.add(node.id());
                }
            }
            Collections.sort(members);
            result.put(name, Collections.unmodifiableList(members));
        }
        return Collections.unmodifiableMap(result);
    }

    /** Mutable node state while the statements are applied. */
    private static final class NodeDraft {

        private final String id;
        private final int line;
        private String label;
        private String group;

        private NodeDraft(final String theId, final int theLine,
                final String theGroup) {
            this.id = theId;
            this.line = theLine;
            this.label = theId;
            this.group = theGroup;
        }

        private GraphNode toNode() {
            return new GraphNode(id, label, line, group);
        }
    }
}
