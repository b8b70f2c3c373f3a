package co.fanki.flowviz.highlight.domain;

import java.util.List;

/**
 * Nodes and edges reachable from a start node.
 *
 * @param nodes the reachable node ids, sorted, start node included
 * @param edges the traversed edge keys ({@code src->dst}), sorted
 * @param durationMs the traversal time, for diagnostics only
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DownstreamResult(
        List<String> nodes,
        List<String> edges,
        double durationMs) {

    /** An empty result. */
    public static DownstreamResult empty() {
        return new DownstreamResult(List.of(), List.of(), 0d);
    }
}
