package co.fanki.flowviz.flowmd.domain;

/**
 * Edge separator tokens in match precedence order.
 *
 * <p>Some separators are substrings of others ({@code -->} contains
 * {@code --}), so a line is split on the first constant, in declaration
 * order, that occurs anywhere in it, not on the first separator in the
 * text.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum EdgeSeparator {

    /** Arrow. */
    ARROW("-->"),
    /** Open link. */
    LINE("--"),
    /** Thick arrow. */
    THICK_ARROW("==>"),
    /** Thick open link. */
    THICK_LINE("=="),
    /** Dotted arrow. */
    DOTTED_ARROW("-.->"),
    /** Long thick arrow. */
    LONG_THICK_ARROW("===>");

    private final String token;

    EdgeSeparator(final String theToken) {
        this.token = theToken;
    }

    /** Returns the literal separator text. */
    public String token() {
        return token;
    }

    /**
     * Finds the separator that splits the given line.
     *
     * @param line the trimmed statement line
     * @return the highest precedence separator contained in the line,
     *         or null if none
     */
    public static EdgeSeparator find(final String line) {
        for (final EdgeSeparator separator : values()) {
            if (line.contains(separator.token)) {
                return separator;
            }
        }
        return null;
    }
}
