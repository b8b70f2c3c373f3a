package co.fanki.flowviz.highlight.domain;

import co.fanki.flowviz.flowmd.domain.FlowGraph;
import co.fanki.flowviz.flowmd.domain.FlowMdParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link HighlightEngine}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class HighlightEngineTest {

    private static HighlightEngine engine(final String text) {
        return new HighlightEngine(new FlowMdParser().parse(text));
    }

    @Test
    void whenQuerying_givenBranchingGraph_shouldReturnSortedReachableSet() {
        final HighlightEngine engine = engine(
                "graph TD\nA-->B\nB-->D\nB-->C\nC-->E\nX-->A");

        final DownstreamResult result = engine.downstream("B");

        assertEquals(List.of("B", "C", "D", "E"), result.nodes());
        assertEquals(List.of("B->C", "B->D", "C->E"), result.edges());
        assertTrue(result.durationMs() >= 0);
    }

    @Test
    void whenQuerying_givenCycle_shouldTerminateAndIncludeBackEdge() {
        final DownstreamResult result = engine(
                "graph TD\nA-->B\nB-->C\nC-->A").downstream("B");

        assertEquals(List.of("A", "B", "C"), result.nodes());
        assertEquals(List.of("A->B", "B->C", "C->A"), result.edges());
    }

    @Test
    void whenQuerying_givenSink_shouldReturnOnlyStart() {
        final DownstreamResult result = engine(
                "graph TD\nA-->B").downstream("B");

        assertEquals(List.of("B"), result.nodes());
        assertTrue(result.edges().isEmpty());
    }

    @Test
    void whenQuerying_givenUnknownId_shouldReturnItAlone() {
        final DownstreamResult result = engine(
                "graph TD\nA-->B").downstream("zzz");

        assertEquals(List.of("zzz"), result.nodes());
        assertTrue(result.edges().isEmpty());
    }

    @Test
    void whenQuerying_givenNullId_shouldReturnEmpty() {
        final DownstreamResult result = engine(
                "graph TD\nA-->B").downstream(null);

        assertTrue(result.nodes().isEmpty());
        assertTrue(result.edges().isEmpty());
    }

    @Test
    void whenQueryingTwice_givenSameEngine_shouldReturnSameAnswer() {
        final HighlightEngine engine = engine("graph TD\nA-->B\nA-->C");

        assertEquals(engine.downstream("A").nodes(),
                engine.downstream("A").nodes());
    }

    @Test
    void whenReadingSuccessors_givenDuplicateEdges_shouldCollapseThem() {
        final HighlightEngine engine = engine("graph TD\nA-->B\nA-->B\nA-->C");

        assertEquals(Set.of("B", "C"), engine.successors("A"));
        assertTrue(engine.successors("nope").isEmpty());
        assertThrows(UnsupportedOperationException.class,
                () -> engine.successors("A").add("Z"));
    }

    @Test
    void whenQuerying_givenGraphWithoutLists_shouldReturnStartOnly() {
        final HighlightEngine engine =
                new HighlightEngine(new FlowGraph(null, null, null));

        final DownstreamResult result = engine.downstream("A");

        assertEquals(List.of("A"), result.nodes());
        assertTrue(result.edges().isEmpty());
    }

    @Test
    void whenCreating_givenNullGraph_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new HighlightEngine((FlowGraph) null));
    }
}
