package co.fanki.flowviz.selftest.domain;

import co.fanki.flowviz.export.domain.EdgeCsvExporter;
import co.fanki.flowviz.flowmd.domain.FlowGraph;
import co.fanki.flowviz.flowmd.domain.FlowMdException;
import co.fanki.flowviz.flowmd.domain.FlowMdParser;
import co.fanki.flowviz.flowmd.domain.GraphNode;
import co.fanki.flowviz.flowmd.domain.GraphWarning;
import co.fanki.flowviz.flowmd.domain.NodeSearch;
import co.fanki.flowviz.highlight.domain.DownstreamResult;
import co.fanki.flowviz.highlight.domain.HighlightEngine;
import co.fanki.flowviz.shared.Preconditions;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs a single fixture through the parser and the graph operations
 * and compares the outcome with the fixture's expectations.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TestCaseEvaluator {

    private final FlowMdParser parser;

    /**
     * Creates a new evaluator.
     *
     * @param theParser the parser used for every case
     */
    public TestCaseEvaluator(final FlowMdParser theParser) {
        this.parser = Preconditions.requireNonNull(theParser,
                "Parser is required");
    }

    /**
     * Evaluates one case.
     *
     * @param testCase the fixture
     * @return the outcome, failed with a message when an expectation or
     *         the parse itself fails
     */
    public TestOutcome evaluate(final TestCase testCase) {
        final TestCaseType type = TestCaseType.of(testCase.type());
        if (type == null) {
            return TestOutcome.failed(testCase, "Unknown testcase type");
        }
        if (testCase.expected() == null) {
            return TestOutcome.failed(testCase, "Missing expectations");
        }

        final FlowGraph graph;
        try {
            graph = parser.parse(testCase.input());
        } catch (final FlowMdException e) {
            return TestOutcome.failed(testCase, e.getMessage());
        }

        return switch (type) {
            case PARSER -> checkParser(testCase, graph);
            case HIGHLIGHT -> checkHighlight(testCase, graph);
            case CSV -> checkCsv(testCase, graph);
            case SEARCH -> checkSearch(testCase, graph);
        };
    }

    private TestOutcome checkParser(final TestCase testCase,
            final FlowGraph graph) {
        final TestCase.Expected expected = testCase.expected();

        final boolean shapeMatches =
                Objects.equals(expected.nodeCount(), graph.nodeCount())
                && Objects.equals(expected.edgeCount(), graph.edgeCount())
                && Objects.equals(expected.orientation(),
                        graph.meta().orientation());
        if (!shapeMatches) {
            return TestOutcome.failed(testCase, "Parser expectations failed");
        }

        final List<String> fragments = expected.warningsContains() == null
                ? List.of() : expected.warningsContains();
        for (final String fragment : fragments) {
            if (!anyWarningContains(graph, fragment)) {
                return TestOutcome.failed(testCase,
                        "Expected warning '" + fragment + "' not found");
            }
        }
        return TestOutcome.passed(testCase);
    }

    private TestOutcome checkHighlight(final TestCase testCase,
            final FlowGraph graph) {
        final TestCase.Expected expected = testCase.expected();
        final DownstreamResult result =
                new HighlightEngine(graph).downstream(testCase.target());

        final List<String> mustReach = expected.highlightedNodes() == null
                ? List.of() : expected.highlightedNodes();
        if (result.nodes().containsAll(mustReach)
                && Objects.equals(expected.edgeCount(),
                        result.edges().size())) {
            return TestOutcome.passed(testCase);
        }
        return TestOutcome.failed(testCase, "Highlight expectations failed");
    }

    private TestOutcome checkCsv(final TestCase testCase,
            final FlowGraph graph) {
        final int rows = EdgeCsvExporter.export(graph)
                .split("\r\n", -1).length;
        if (Objects.equals(testCase.expected().rows(), rows)) {
            return TestOutcome.passed(testCase);
        }
        return TestOutcome.failed(testCase, "CSV row expectation failed");
    }

    private TestOutcome checkSearch(final TestCase testCase,
            final FlowGraph graph) {
        final Optional<GraphNode> match =
                NodeSearch.find(graph, testCase.query());
        if (match.isPresent()
                && match.get().id().equals(testCase.expected().id())) {
            return TestOutcome.passed(testCase);
        }
        return TestOutcome.failed(testCase, "Search expectation failed");
    }

    private static boolean anyWarningContains(final FlowGraph graph,
            final String fragment) {
        for (final GraphWarning warning : graph.meta().warnings()) {
            if (warning.message() != null
                    && warning.message().contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
