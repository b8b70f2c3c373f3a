package co.fanki.flowviz.flowmd.domain;

/**
 * A directed edge between two node ids.
 *
 * <p>Edges are not deduplicated: two statements linking the same pair
 * produce two entries.</p>
 *
 * @param source the source node id
 * @param target the target node id
 * @param line the 1-based line of the statement that created it
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphEdge(String source, String target, int line) {

    /**
     * Returns the edge key in {@code source->target} form.
     *
     * @return the edge key
     */
    public String key() {
        return source + "->" + target;
    }
}
