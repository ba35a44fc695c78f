package com.vidnyan.netedit.domain.model;

/**
 * {@code .CONTROL ... .ENDC} region. The content is never interpreted.
 */
public record ControlBlock(String rawText) implements Entry {

    /**
     * Full text from {@code .CONTROL} to {@code .ENDC}, without the final terminator.
     */
    public String content() {
        return rawText.stripTrailing();
    }

    @Override
    public Entry copy() {
        return this;
    }
}
