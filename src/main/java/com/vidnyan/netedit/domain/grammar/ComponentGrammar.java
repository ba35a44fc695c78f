package com.vidnyan.netedit.domain.grammar;

import com.vidnyan.netedit.domain.error.NetlistSyntaxException;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Grammar of one component family: node arity, value style and the
 * compiled pattern extracting the fields.
 */
public final class ComponentGrammar {

    private static final List<String> GROUP_NAMES = List.of("designator", "nodes", "value", "params");

    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private final char prefix;
    private final int minNodes;
    private final int maxNodes;
    private final ValueStyle valueStyle;
    private final boolean quotedNodes;
    private final String description;
    private final Pattern pattern;
    private final Set<String> groups;

    ComponentGrammar(char prefix, int minNodes, int maxNodes, ValueStyle valueStyle,
                     boolean quotedNodes, String description, String regex) {
        this.prefix = prefix;
        this.minNodes = minNodes;
        this.maxNodes = maxNodes;
        this.valueStyle = valueStyle;
        this.quotedNodes = quotedNodes;
        this.description = description;
        this.pattern = regex == null ? null : Pattern.compile(regex, FLAGS);
        this.groups = regex == null ? Set.of() : GROUP_NAMES.stream()
                .filter(g -> regex.contains("(?<" + g + ">"))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Extracts designator, nodes, value and parameters from a folded line.
     *
     * @throws NetlistSyntaxException when the line does not fit this grammar
     */
    public GrammarMatch match(String line) {
        int start = LineClassifier.firstNonBlank(line);
        if (valueStyle == ValueStyle.OPAQUE) {
            int end = start;
            while (end < line.length() && !Character.isWhitespace(line.charAt(end))) {
                end++;
            }
            return GrammarMatch.opaque(line, new TextSpan(start, end));
        }
        Matcher m = pattern.matcher(line);
        m.region(start, line.length());
        if (!m.matches()) {
            throw NetlistSyntaxException.grammarMismatch(line, description, pattern.pattern());
        }
        TextSpan designatorSpan = span(m, "designator");
        String designator = designatorSpan.of(line);
        boolean marked = designator.length() > 2 && (designator.charAt(1) == '§' || designator.charAt(1) == '†');
        if (marked) {
            designator = designator.charAt(0) + designator.substring(2);
        }
        TextSpan nodesSpan = span(m, "nodes");
        List<String> nodes = GrammarMatch.splitNodes(nodesSpan.of(line));
        TextSpan valueSpan = span(m, "value");
        TextSpan paramsSpan = span(m, "params");
        return new GrammarMatch(line, designator, marked, designatorSpan, List.copyOf(nodes), nodesSpan,
                valueSpan == null ? null : valueSpan.of(line), valueSpan, paramsSpan,
                List.copyOf(ParameterScanner.scan(line, paramsSpan)));
    }

    private TextSpan span(Matcher m, String group) {
        if (!groups.contains(group)) {
            return null;
        }
        int s = m.start(group);
        return s < 0 ? null : new TextSpan(s, m.end(group));
    }

    public char prefix() {
        return prefix;
    }

    public int minNodes() {
        return minNodes;
    }

    public int maxNodes() {
        return maxNodes;
    }

    public ValueStyle valueStyle() {
        return valueStyle;
    }

    public boolean quotedNodes() {
        return quotedNodes;
    }

    public String pattern() {
        return pattern == null ? "" : pattern.pattern();
    }

    public boolean acceptsParameters() {
        return valueStyle != ValueStyle.REST_OF_LINE && valueStyle != ValueStyle.COUPLING
                && valueStyle != ValueStyle.OPAQUE;
    }

    public boolean isInstance() {
        return prefix == 'X';
    }
}
