package co.fanki.flowviz.flowmd.domain;

/**
 * A node of a parsed flowchart.
 *
 * @param id the unique, case-sensitive node identifier
 * @param label the display text, the id when no label was given
 * @param line the 1-based line of the first mention
 * @param group the subgraph the node belongs to, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphNode(String id, String label, int line, String group) {}
