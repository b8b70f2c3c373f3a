package co.fanki.flowviz.flowmd.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Non-fatal parse finding.
 *
 * <p>Statement warnings carry the source line; cycle warnings carry the
 * node path instead.</p>
 *
 * @param line the 1-based source line, or null
 * @param message the human readable message
 * @param nodes the node ids involved, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphWarning(Integer line, String message, List<String> nodes) {

    /**
     * Creates a warning attached to a source line.
     *
     * @param line the 1-based line
     * @param message the message
     * @return the warning
     */
    public static GraphWarning atLine(final int line, final String message) {
        return new GraphWarning(line, message, null);
    }

    /**
     * Creates a warning about a node path.
     *
     * @param message the message
     * @param nodes the node ids involved
     * @return the warning
     */
    public static GraphWarning forNodes(final String message,
            final List<String> nodes) {
        return new GraphWarning(null, message, List.copyOf(nodes));
    }
}
