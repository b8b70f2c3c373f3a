package co.fanki.flowviz.flowmd.domain;

/**
 * A classified FlowMD line.
 *
 * <p>{@code value} holds the orientation for {@link StatementKind#ORIENTATION}
 * and the (possibly empty) group name for
 * {@link StatementKind#SUBGRAPH_OPEN}. {@code left} is set for node and
 * edge statements, {@code right} and {@code separator} for edges only.</p>
 *
 * @param kind the statement kind
 * @param line the 1-based source line
 * @param value the orientation or group name, or null
 * @param left the node token, or the edge source token
 * @param right the edge target token, or null
 * @param separator the edge separator, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Statement(
        StatementKind kind,
        int line,
        String value,
        NodeToken left,
        NodeToken right,
        EdgeSeparator separator) {

    static Statement orientation(final int line, final String direction) {
        return new Statement(StatementKind.ORIENTATION, line, direction,
                null, null, null);
    }

    static Statement subgraphOpen(final int line, final String name) {
        return new Statement(StatementKind.SUBGRAPH_OPEN, line, name,
                null, null, null);
    }

    static Statement subgraphClose(final int line) {
        return new Statement(StatementKind.SUBGRAPH_CLOSE, line, null,
                null, null, null);
    }

    static Statement edge(final int line, final NodeToken source,
            final NodeToken target, final EdgeSeparator separator) {
        return new Statement(StatementKind.EDGE, line, null,
                source, target, separator);
    }

    static Statement node(final int line, final NodeToken token) {
        return new Statement(StatementKind.NODE, line, null,
                token, null, null);
    }

    static Statement unrecognised(final int line) {
        return new Statement(StatementKind.UNRECOGNISED, line, null,
                null, null, null);
    }
}
