package co.fanki.flowviz.flowmd.domain;

/**
 * Splits a raw token such as {@code A[Start here]} into identifier and
 * label.
 *
 * <p>The identifier is the text before the first {@code [}; the label
 * is the text between that bracket and the last {@code ]}, so labels
 * may contain brackets themselves. Without both brackets the whole
 * token is the identifier.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TokenExtractor {

    private TokenExtractor() {
    }

    /**
     * Extracts a node token.
     *
     * @param raw the raw token, may be null
     * @return the token, or null if no valid identifier is present
     */
    public static NodeToken extract(final String raw) {
        if (raw == null) {
            return null;
        }

        String id = raw.trim();
        String label = null;

        final int open = id.indexOf('[');
        if (open >= 0 && id.indexOf(']') >= 0) {
            final String rest = id.substring(open + 1);
            final int close = rest.lastIndexOf(']');
            label = (close >= 0 ? rest.substring(0, close) : rest).trim();
            id = id.substring(0, open).trim();
        }

        if (!isValidIdentifier(id)) {
            return null;
        }
        return new NodeToken(id, label);
    }

    // Identifiers are single words: "foo bar" is not a node reference.
    private static boolean isValidIdentifier(final String id) {
        if (id.isEmpty()) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            if (Character.isWhitespace(id.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
