package com.vidnyan.netedit.domain.error;

/**
 * Broken nesting: an unterminated scope or block, a stray end marker,
 * a continuation with nothing to continue, or a missing end of document.
 */
public class NetlistStructureException extends NetlistException {

    private final int lineNumber;

    public NetlistStructureException(String message, int lineNumber) {
        super(lineNumber > 0 ? message + " (line " + lineNumber + ")" : message);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
