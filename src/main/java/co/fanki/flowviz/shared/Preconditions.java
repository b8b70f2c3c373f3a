package co.fanki.flowviz.shared;

/**
 * Argument checks shared by the parser, the graph operations and the
 * front ends. Every check throws {@link IllegalArgumentException}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    private Preconditions() {
    }

    /**
     * Checks that a reference is set.
     *
     * @param reference the reference
     * @param message the failure message
     * @param <T> the reference type
     * @return the reference
     */
    public static <T> T requireNonNull(final T reference, final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Checks a limit that must be at least one, such as the hard node
     * limit.
     *
     * @param value the limit
     * @param message the failure message
     * @return the limit
     */
    public static int requirePositive(final int value, final String message) {
        if (value < 1) {
            throw new IllegalArgumentException(message + ": " + value);
        }
        return value;
    }

    /**
     * Checks a limit that may be zero, such as the advisory node limit.
     *
     * @param value the limit
     * @param message the failure message
     * @return the limit
     */
    public static int requireNonNegative(final int value,
            final String message) {
        if (value < 0) {
            throw new IllegalArgumentException(message + ": " + value);
        }
        return value;
    }
}
