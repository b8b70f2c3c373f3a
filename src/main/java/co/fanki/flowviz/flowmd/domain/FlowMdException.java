package co.fanki.flowviz.flowmd.domain;

import co.fanki.flowviz.shared.DomainException;

/**
 * Fatal FlowMD parse failure.
 *
 * <p>Raised when the source lacks the orientation declaration or when
 * the finished graph holds more nodes than the hard limit. No partial
 * graph is ever produced alongside it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FlowMdException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code for a missing or malformed graph/flowchart header. */
    public static final String MISSING_ORIENTATION = "MISSING_ORIENTATION";

    /** Error code for a node count above the hard limit. */
    public static final String NODE_LIMIT_EXCEEDED = "NODE_LIMIT_EXCEEDED";

    /** Error code for a hard or advisory node limit out of range. */
    public static final String INVALID_LIMITS = "INVALID_LIMITS";

    /** Error code for a null source text. */
    public static final String INVALID_SOURCE = "INVALID_SOURCE";

    private final Integer line;

    /**
     * Creates a new exception without source position.
     *
     * @param message the error message
     * @param errorCode the error code
     */
    public FlowMdException(final String message, final String errorCode) {
        this(message, errorCode, null);
    }

    /**
     * Creates a new exception bound to a source line.
     *
     * @param message the error message
     * @param errorCode the error code
     * @param theLine the 1-based source line, may be null
     */
    public FlowMdException(final String message, final String errorCode,
            final Integer theLine) {
        super(theLine != null ? message + " (line " + theLine + ")" : message,
                errorCode);
        this.line = theLine;
    }

    /**
     * Returns the 1-based source line the failure refers to.
     *
     * @return the line, or null when the failure is not tied to a line
     */
    public Integer getLine() {
        return line;
    }

}
