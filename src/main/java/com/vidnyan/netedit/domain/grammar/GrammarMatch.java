package com.vidnyan.netedit.domain.grammar;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Structured fields recovered from one component line, with the spans they
 * came from so that a later write can splice into exactly those places.
 */
public record GrammarMatch(
    String text,
    String designator,
    boolean designatorMarked,
    TextSpan designatorSpan,
    List<String> nodes,
    TextSpan nodesSpan,
    String value,
    TextSpan valueSpan,
    TextSpan paramsSpan,
    List<ParameterSpan> parameters
) {

    /**
     * Opaque match: only the designator is known.
     */
    public static GrammarMatch opaque(String text, TextSpan designatorSpan) {
        return new GrammarMatch(text, designatorSpan.of(text), false, designatorSpan,
                List.of(), null, null, null, null, List.of());
    }

    public boolean isOpaque() {
        return nodesSpan == null;
    }

    public boolean hasValue() {
        return valueSpan != null;
    }

    public Optional<ParameterSpan> parameter(String key) {
        return parameters.stream()
                .filter(p -> p.key().equalsIgnoreCase(key))
                .findFirst();
    }

    /**
     * Where a parameter that is not on the line yet gets appended.
     */
    public int insertionPoint() {
        if (paramsSpan != null) {
            return trimEnd(paramsSpan.end(), paramsSpan.start());
        }
        if (valueSpan != null) {
            return valueSpan.end();
        }
        if (nodesSpan != null) {
            return nodesSpan.end();
        }
        return designatorSpan.end();
    }

    static List<String> splitNodes(String nodes) {
        String trimmed = nodes.strip();
        if (trimmed.startsWith("«") && trimmed.endsWith("»")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1).strip();
        }
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(trimmed.split("\\s+"));
    }

    private int trimEnd(int end, int floor) {
        int i = end;
        while (i > floor && Character.isWhitespace(text.charAt(i - 1))) {
            i--;
        }
        return i;
    }
}
