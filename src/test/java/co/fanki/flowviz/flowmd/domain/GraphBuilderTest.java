package co.fanki.flowviz.flowmd.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GraphBuilder}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphBuilderTest {

    private static FlowGraph build(final int max, final int preferred,
            final String... lines) {
        final GraphBuilder builder = new GraphBuilder(max, preferred);
        builder.apply(Statement.orientation(1, "LR"));
        for (int i = 0; i < lines.length; i++) {
            builder.apply(LineClassifier.classifyLine(lines[i], i + 2));
        }
        return builder.build();
    }

    @Test
    void whenBuilding_givenRepeatedMentions_shouldKeepFirstLine() {
        final FlowGraph graph = build(10, 10, "A-->B", "B-->C", "A");

        assertEquals(3, graph.nodeCount());
        assertEquals(2, graph.nodes().get(0).line());
        assertEquals(2, graph.nodes().get(1).line());
        assertEquals(3, graph.nodes().get(2).line());
    }

    @Test
    void whenBuilding_givenLabelsOverMentions_shouldKeepLastNonEmptyLabel() {
        final FlowGraph graph = build(10, 10,
                "A[First]", "A[Second]", "A[]", "A");

        assertEquals("Second", graph.nodes().get(0).label());
    }

    @Test
    void whenBuilding_givenNoLabel_shouldUseIdAsLabel() {
        final FlowGraph graph = build(10, 10, "Solo");

        assertEquals("Solo", graph.nodes().get(0).label());
    }

    @Test
    void whenBuilding_givenNodeFirstSeenOutsideGroup_shouldAdoptLaterGroup() {
        final FlowGraph graph = build(10, 10,
                "A", "subgraph G", "A-->B", "end");

        assertEquals("G", graph.nodes().get(0).group());
        assertEquals(List.of("A", "B"), graph.meta().groups().get("G"));
    }

    @Test
    void whenBuilding_givenNodeAlreadyGrouped_shouldStickToFirstGroup() {
        final FlowGraph graph = build(10, 10,
                "subgraph G1", "A", "end", "subgraph G2", "A-->B", "end");

        assertEquals("G1", graph.nodes().get(0).group());
        assertEquals("G2", graph.nodes().get(1).group());
        assertEquals(List.of("A"), graph.meta().groups().get("G1"));
        assertEquals(List.of("B"), graph.meta().groups().get("G2"));
    }

    @Test
    void whenBuilding_givenUnnamedSubgraph_shouldWarnAndClearGroup() {
        final FlowGraph graph = build(10, 10,
                "subgraph G", "A", "subgraph", "B", "end");

        assertEquals("G", graph.nodes().get(0).group());
        assertNull(graph.nodes().get(1).group());
        assertEquals(1, graph.meta().warnings().size());
        final GraphWarning warning = graph.meta().warnings().get(0);
        assertEquals(GraphBuilder.EMPTY_SUBGRAPH, warning.message());
        assertEquals(4, warning.line());
    }

    @Test
    void whenBuilding_givenEmptyGroup_shouldStillListIt() {
        final FlowGraph graph = build(10, 10, "subgraph Empty", "end", "A");

        assertTrue(graph.meta().groups().containsKey("Empty"));
        assertTrue(graph.meta().groups().get("Empty").isEmpty());
    }

    @Test
    void whenBuilding_givenUnrecognisedLine_shouldWarnWithLine() {
        final FlowGraph graph = build(10, 10, "A-->B", "foo bar baz");

        final GraphWarning warning = graph.meta().warnings().get(0);
        assertEquals(GraphBuilder.UNRECOGNISED, warning.message());
        assertEquals(3, warning.line());
        assertNull(warning.nodes());
    }

    @Test
    void whenBuilding_givenTooManyNodes_shouldThrowLimitError() {
        final FlowMdException e = assertThrows(FlowMdException.class,
                () -> build(3, 1, "A-->B", "C-->D"));

        assertEquals(FlowMdException.NODE_LIMIT_EXCEEDED, e.getErrorCode());
        assertEquals("Node count 4 exceeds hard limit 3", e.getMessage());
    }

    @Test
    void whenBuilding_givenNodesAtHardLimit_shouldSucceed() {
        final FlowGraph graph = build(3, 1, "A-->B", "C");

        assertEquals(3, graph.nodeCount());
        assertTrue(graph.meta().degrade());
        assertFalse(graph.meta().overflow());
    }

    @Test
    void whenBuilding_givenNodesAtPreferredLimit_shouldNotDegrade() {
        final FlowGraph graph = build(10, 2, "A-->B");

        assertFalse(graph.meta().degrade());
        assertEquals(2, graph.meta().preferredMaxNodes());
        assertEquals(10, graph.meta().maxNodes());
        assertEquals("LR", graph.meta().orientation());
    }

    @Test
    void whenCreating_givenNonPositiveMax_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new GraphBuilder(0, 0));
    }
}
