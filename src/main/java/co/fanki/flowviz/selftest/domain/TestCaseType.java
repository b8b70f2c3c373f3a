package co.fanki.flowviz.selftest.domain;

import java.util.Locale;

/**
 * Kinds of self-test fixtures.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum TestCaseType {

    /** Node/edge counts, orientation and expected warning fragments. */
    PARSER,

    /** Downstream node subset and exact edge count from a target node. */
    HIGHLIGHT,

    /** CSV row count, header included. */
    CSV,

    /** Node resolved by exact id or label fragment. */
    SEARCH;

    /**
     * Resolves a fixture type name.
     *
     * @param value the lowercase name used in fixture files
     * @return the type, or null if unknown
     */
    public static TestCaseType of(final String value) {
        if (value == null) {
            return null;
        }
        for (final TestCaseType type : values()) {
            if (type.name().equals(value.toUpperCase(Locale.ROOT))) {
                return type;
            }
        }
        return null;
    }
}
