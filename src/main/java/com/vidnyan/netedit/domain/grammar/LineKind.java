package com.vidnyan.netedit.domain.grammar;

/**
 * Shape of a physical line as decided by its first non-blank character.
 */
public enum LineKind {
    COMPONENT,
    CONTINUATION,
    DIRECTIVE,
    COMMENT,
    SUBCIRCUIT_BEGIN,
    SUBCIRCUIT_END,
    BLOCK_BEGIN,
    BLOCK_END,
    END;

    public boolean isBoundary() {
        return this == SUBCIRCUIT_BEGIN || this == SUBCIRCUIT_END
                || this == BLOCK_BEGIN || this == BLOCK_END || this == END;
    }
}
