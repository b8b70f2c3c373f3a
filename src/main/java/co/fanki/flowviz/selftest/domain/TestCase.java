package co.fanki.flowviz.selftest.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * A self-test fixture as stored on disk.
 *
 * @param id the case id
 * @param description what the case checks
 * @param type the fixture type name ({@code parser}, {@code highlight},
 *        {@code csv}, {@code search})
 * @param input the FlowMD source
 * @param target the start node, highlight cases only
 * @param query the search text, search cases only
 * @param expected the expected outcome
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TestCase(
        String id,
        String description,
        String type,
        String input,
        String target,
        String query,
        Expected expected) {

    /**
     * Expected outcome; only the fields of the case type are set.
     *
     * @param nodeCount parser: the node count
     * @param edgeCount parser: the edge count; highlight: the traversed
     *        edge count
     * @param orientation parser: the orientation
     * @param warningsContains parser: fragments each found in some warning
     * @param highlightedNodes highlight: nodes that must be reached
     * @param rows csv: the row count, header included
     * @param id search: the id of the node that must be found
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Expected(
            Integer nodeCount,
            Integer edgeCount,
            String orientation,
            List<String> warningsContains,
            List<String> highlightedNodes,
            Integer rows,
            String id) {}
}
