package co.fanki.flowviz.flowmd.domain;

/**
 * One side of a statement: a bare identifier plus an optional label.
 *
 * @param id the identifier, never blank
 * @param label the bracketed label text, or null when none was given
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record NodeToken(String id, String label) {

    /** Returns true if the token carries a non-empty label. */
    public boolean hasLabel() {
        return label != null && !label.isEmpty();
    }
}
