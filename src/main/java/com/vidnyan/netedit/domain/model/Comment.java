package com.vidnyan.netedit.domain.model;

/**
 * Comment or blank line, kept byte for byte.
 */
public record Comment(String rawText) implements Entry {

    @Override
    public Entry copy() {
        return this;
    }
}
