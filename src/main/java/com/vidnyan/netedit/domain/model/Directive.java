package com.vidnyan.netedit.domain.model;

/**
 * Dot statement that is not a scope boundary ({@code .PARAM}, {@code .MODEL},
 * {@code .TRAN}, ...). Written back verbatim unless replaced.
 *
 * @param rawText     physical lines with their terminators
 * @param logicalText continuation-folded text without terminator
 * @param command     upper-cased keyword
 */
public record Directive(String rawText, String logicalText, String command) implements Entry {

    public static Directive of(String line, String command, String terminator) {
        String text = line.strip();
        return new Directive(text + terminator, text, command);
    }

    /**
     * Same directive with new text, written as a single line.
     */
    public Directive withText(String newText, String terminator) {
        return new Directive(newText + terminator, newText, command);
    }

    /**
     * Text as compared by instruction add and remove.
     */
    public String text() {
        return logicalText.strip();
    }

    @Override
    public Entry copy() {
        return this;
    }
}
