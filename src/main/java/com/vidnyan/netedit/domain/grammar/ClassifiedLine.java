package com.vidnyan.netedit.domain.grammar;

/**
 * Classification of one line.
 *
 * @param kind    line shape
 * @param command upper-cased prefix letter for components, keyword for directives,
 *                {@code "+"} for continuations and {@code "*"} for comments
 */
public record ClassifiedLine(LineKind kind, String command) {

    public static ClassifiedLine comment() {
        return new ClassifiedLine(LineKind.COMMENT, "*");
    }

    public static ClassifiedLine continuation() {
        return new ClassifiedLine(LineKind.CONTINUATION, "+");
    }

    public boolean is(LineKind other) {
        return kind == other;
    }
}
