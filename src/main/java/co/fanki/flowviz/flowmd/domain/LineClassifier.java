package co.fanki.flowviz.flowmd.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns FlowMD source text into a list of classified statements.
 *
 * <p>Blank lines and {@code %%} comments are dropped; every remaining
 * line keeps its original 1-based line number. The first content line
 * must be the {@code graph|flowchart [DIRECTION]} declaration, every
 * later line is classified, in this order, as subgraph open, subgraph
 * close, edge, bare node or unrecognised.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class LineClassifier {

    /** Orientation used when the declaration names no direction. */
    public static final String DEFAULT_ORIENTATION = "TB";

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private static final Pattern ORIENTATION = Pattern.compile(
            "^(?:graph|flowchart)(?:\\s+(\\S+).*)?$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern SUBGRAPH = Pattern.compile(
            "^subgraph(?:\\s+(.*))?$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final String END = "end";

    private LineClassifier() {
    }

    /**
     * Classifies every content line of the given text.
     *
     * @param text the FlowMD source, never null
     * @return the statements in source order, the first one being the
     *         orientation declaration when the text has content
     * @throws FlowMdException if the first content line is not an
     *         orientation declaration
     */
    public static List<Statement> classify(final String text) {
        final String[] lines = LINE_BREAK.split(text, -1);
        final List<Statement> statements = new ArrayList<>();

        boolean headerSeen = false;
        for (int index = 0; index < lines.length; index++) {
            final String line = lines[index].trim();
            if (line.isEmpty() || line.startsWith("%%")) {
                continue;
            }
            final int lineNumber = index + 1;

            if (!headerSeen) {
                statements.add(orientation(line, lineNumber));
                headerSeen = true;
            } else {
                statements.add(classifyLine(line, lineNumber));
            }
        }
        return statements;
    }

    private static Statement orientation(final String line,
            final int lineNumber) {
        final Matcher matcher = ORIENTATION.matcher(line);
        if (!matcher.matches()) {
            throw new FlowMdException(
                    "Missing orientation declaration: FlowMD must start"
                            + " with graph/flowchart declaration",
                    FlowMdException.MISSING_ORIENTATION, lineNumber);
        }
        final String direction = matcher.group(1);
        return Statement.orientation(lineNumber, direction == null
                ? DEFAULT_ORIENTATION
                : direction.toUpperCase(Locale.ROOT));
    }

    /**
     * Classifies a single trimmed, non-header content line.
     *
     * @param line the trimmed line
     * @param lineNumber the 1-based line number
     * @return the statement
     */
    static Statement classifyLine(final String line, final int lineNumber) {
        final Matcher subgraph = SUBGRAPH.matcher(line);
        if (subgraph.matches()) {
            final String name = subgraph.group(1);
            return Statement.subgraphOpen(lineNumber,
                    name == null ? "" : name.trim());
        }

        if (END.equalsIgnoreCase(line)) {
            return Statement.subgraphClose(lineNumber);
        }

        final EdgeSeparator separator = EdgeSeparator.find(line);
        if (separator != null) {
            final int at = line.indexOf(separator.token());
            final NodeToken source = TokenExtractor.extract(
                    line.substring(0, at));
            final NodeToken target = TokenExtractor.extract(
                    line.substring(at + separator.token().length()));
            if (source == null || target == null) {
                return Statement.unrecognised(lineNumber);
            }
            return Statement.edge(lineNumber, source, target, separator);
        }

        final NodeToken node = TokenExtractor.extract(line);
        if (node != null) {
            return Statement.node(lineNumber, node);
        }
        return Statement.unrecognised(lineNumber);
    }
}
