package co.fanki.flowviz.flowmd.domain;

/**
 * The shapes a FlowMD content line can take.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum StatementKind {

    /** {@code graph|flowchart [DIRECTION]}, always the first content line. */
    ORIENTATION,

    /** {@code subgraph <name>}. */
    SUBGRAPH_OPEN,

    /** {@code end}. */
    SUBGRAPH_CLOSE,

    /** {@code left <separator> right}. */
    EDGE,

    /** A lone node token. */
    NODE,

    /** Anything else; reported as a warning. */
    UNRECOGNISED
}
