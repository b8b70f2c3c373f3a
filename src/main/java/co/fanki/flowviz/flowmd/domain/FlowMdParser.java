package co.fanki.flowviz.flowmd.domain;

import co.fanki.flowviz.shared.Preconditions;

/**
 * Parses FlowMD text into a {@link FlowGraph}.
 *
 * <p>FlowMD is a line-oriented flowchart language:</p>
 * <pre>
 * graph LR
 * %% comment
 * subgraph Checkout
 *   A[Cart] --&gt; B[Payment]
 * end
 * B --&gt; C
 * </pre>
 *
 * <p>The parser holds only its limits, so one instance can serve
 * concurrent callers; every call returns an independent result.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FlowMdParser {

    /** Default hard node limit. */
    public static final int DEFAULT_MAX_NODES = 1000;

    /** Default advisory node limit. */
    public static final int DEFAULT_PREFERRED_MAX_NODES = 300;

    private final int maxNodes;
    private final int preferredMaxNodes;

    /**
     * Creates a parser with the default limits.
     */
    public FlowMdParser() {
        this(DEFAULT_MAX_NODES, DEFAULT_PREFERRED_MAX_NODES);
    }

    /**
     * Creates a parser with the given limits.
     *
     * @param theMaxNodes the hard limit, parse fails above it
     * @param thePreferredMaxNodes the advisory limit, sets degrade above it
     */
    public FlowMdParser(final int theMaxNodes,
            final int thePreferredMaxNodes) {
        this.maxNodes = Preconditions.requirePositive(theMaxNodes,
                "Max nodes must be positive");
        this.preferredMaxNodes = Preconditions.requireNonNegative(
                thePreferredMaxNodes,
                "Preferred max nodes must be non-negative");
    }

    /**
     * Parses FlowMD text.
     *
     * @param text the FlowMD source
     * @return the parsed graph
     * @throws FlowMdException if the source is null, lacks the
     *         orientation declaration or exceeds the hard node limit
     */
    public FlowGraph parse(final String text) {
        if (text == null) {
            throw new FlowMdException("FlowMD source is required",
                    FlowMdException.INVALID_SOURCE);
        }

        final GraphBuilder builder = new GraphBuilder(maxNodes,
                preferredMaxNodes);
        for (final Statement statement : LineClassifier.classify(text)) {
            builder.apply(statement);
        }
        return builder.build();
    }

    /** Returns the hard node limit. */
    public int maxNodes() {
        return maxNodes;
    }

    /** Returns the advisory node limit. */
    public int preferredMaxNodes() {
        return preferredMaxNodes;
    }
}
