package com.vidnyan.netedit.domain.error;

/**
 * A line does not fit any recognised shape, or a component line does not
 * match the grammar of its prefix. Always fatal to the parse.
 */
public class NetlistSyntaxException extends NetlistException {

    private final String line;
    private final String pattern;

    public NetlistSyntaxException(String message, String line, String pattern) {
        super(message);
        this.line = line;
        this.pattern = pattern;
    }

    public static NetlistSyntaxException unrecognized(String line) {
        return new NetlistSyntaxException("Unrecognized command in line: \"" + line.strip() + "\"", line, null);
    }

    public static NetlistSyntaxException unsupportedPrefix(String line) {
        return new NetlistSyntaxException("Unsupported component prefix in line: \"" + line.strip() + "\"", line, null);
    }

    public static NetlistSyntaxException grammarMismatch(String line, String description, String pattern) {
        return new NetlistSyntaxException(
                "Line \"" + line.strip() + "\" is not a valid " + description + " line, expected pattern " + pattern,
                line, pattern);
    }

    public String getLine() {
        return line;
    }

    /**
     * Pattern that failed to match, or null when no grammar applied.
     */
    public String getPattern() {
        return pattern;
    }
}
