package co.fanki.flowviz.flowmd.domain;

import java.util.List;
import java.util.Map;

/**
 * Metadata block of a parse result.
 *
 * @param orientation the declared layout direction, {@code TB} by default
 * @param preferredMaxNodes the advisory node limit
 * @param maxNodes the hard node limit
 * @param warnings the warnings in discovery order
 * @param groups subgraph name to sorted member ids, in opening order
 * @param degrade true when the node count exceeds preferredMaxNodes
 * @param overflow always false; a graph over the hard limit is rejected
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphMeta(
        String orientation,
        int preferredMaxNodes,
        int maxNodes,
        List<GraphWarning> warnings,
        Map<String, List<String>> groups,
        boolean degrade,
        boolean overflow) {}
