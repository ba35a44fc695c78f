package com.vidnyan.netedit.domain.journal;

import java.util.Objects;

/**
 * One recorded mutation.
 *
 * @param name  qualified path of what changed; {@code INSTRUCTION} for directives, prefixed
 *              with the instance path when they were added inside a subcircuit
 * @param value new value, or null for removals
 * @param kind  mutation kind
 */
public record JournalEntry(String name, Object value, UpdateKind kind) {

    public static final String INSTRUCTION = "INSTRUCTION";

    /**
     * Instruction text as journaled: line breaks written as {@code \\r} and {@code \\n}.
     */
    public static String escape(String instruction) {
        return instruction.strip().replace("\r", "\\r").replace("\n", "\\n");
    }

    public static String unescape(String journaled) {
        return journaled.replace("\\r", "\r").replace("\\n", "\n");
    }

    JournalEntry withValue(Object newValue) {
        return new JournalEntry(name, newValue, kind);
    }

    boolean sameKey(String otherName, Object otherValue, UpdateKind otherKind) {
        if (kind != otherKind || !name.equals(otherName)) {
            return false;
        }
        return !kind.isInstruction() || Objects.equals(value, otherValue);
    }
}
