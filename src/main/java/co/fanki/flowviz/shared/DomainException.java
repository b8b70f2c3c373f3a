package co.fanki.flowviz.shared;

/**
 * Failure that a front end reports to its caller instead of crashing.
 *
 * <p>Carries a machine readable error code next to the message so the
 * REST controller, the MCP tools and the self-test can report the
 * failure without parsing the text.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;

    /**
     * Creates a new exception.
     *
     * @param message the error message
     * @param theErrorCode the error code, e.g. {@code NODE_LIMIT_EXCEEDED}
     */
    public DomainException(final String message, final String theErrorCode) {
        super(message);
        this.errorCode = theErrorCode;
    }

    /**
     * Creates a new exception caused by a lower level failure.
     *
     * @param message the error message
     * @param theErrorCode the error code
     * @param cause the underlying cause
     */
    public DomainException(final String message, final String theErrorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = theErrorCode;
    }

    /**
     * Returns the error code.
     *
     * @return the error code
     */
    public String getErrorCode() {
        return errorCode;
    }
}
