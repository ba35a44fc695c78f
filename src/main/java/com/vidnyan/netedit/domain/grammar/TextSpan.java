package com.vidnyan.netedit.domain.grammar;

/**
 * Half-open character range inside a logical line.
 */
public record TextSpan(int start, int end) {

    public String of(String text) {
        return text.substring(start, end);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }
}
