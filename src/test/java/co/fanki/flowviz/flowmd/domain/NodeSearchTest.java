package co.fanki.flowviz.flowmd.domain;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link NodeSearch}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class NodeSearchTest {

    private final FlowGraph graph = new FlowMdParser().parse(
            "graph TD\nA[Receive order] --> B[Check stock]\nB --> order");

    @Test
    void whenSearching_givenExactId_shouldReturnNode() {
        assertEquals("B", NodeSearch.find(graph, "B").orElseThrow().id());
    }

    @Test
    void whenSearching_givenLabelFragment_shouldReturnFirstMatch() {
        final Optional<GraphNode> node = NodeSearch.find(graph, "order");

        assertEquals("A", node.orElseThrow().id());
    }

    @Test
    void whenSearching_givenDifferentCase_shouldNotMatch() {
        assertTrue(NodeSearch.find(graph, "STOCK").isEmpty());
    }

    @Test
    void whenSearching_givenBlankQuery_shouldReturnEmpty() {
        assertTrue(NodeSearch.find(graph, " ").isEmpty());
        assertTrue(NodeSearch.find(graph, null).isEmpty());
    }
}
