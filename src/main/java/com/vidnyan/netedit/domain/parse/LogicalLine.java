package com.vidnyan.netedit.domain.parse;

import com.vidnyan.netedit.domain.grammar.ClassifiedLine;
import com.vidnyan.netedit.domain.grammar.LineKind;

/**
 * One statement after continuation folding.
 *
 * @param rawText     every physical line that made it up, terminators included
 * @param logicalText first line plus folded continuations, no terminator
 * @param classified  classification of the first physical line
 * @param lineNumber  1-based number of the first physical line
 */
public record LogicalLine(String rawText, String logicalText, ClassifiedLine classified, int lineNumber) {

    public LineKind kind() {
        return classified.kind();
    }

    public String command() {
        return classified.command();
    }
}
