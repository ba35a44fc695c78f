package com.vidnyan.netedit.domain.write;

import com.vidnyan.netedit.domain.grammar.TextSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects replacements against one line and applies them right to left, so
 * that earlier spans stay valid while later ones are rewritten.
 */
class SpanSplicer {

    private record Edit(int start, int end, String replacement, int order) {
    }

    private final String line;
    private final List<Edit> edits = new ArrayList<>();

    SpanSplicer(String line) {
        this.line = line;
    }

    /**
     * Replaces a span, adding a separating blank where a neighbour would otherwise touch the new text.
     */
    SpanSplicer replace(TextSpan span, String replacement) {
        String text = replacement;
        if (!text.isEmpty()) {
            if (needsBlankBefore(span.start())) {
                text = " " + text;
            }
            if (span.end() < line.length() && !Character.isWhitespace(line.charAt(span.end()))) {
                text = text + " ";
            }
        }
        edits.add(new Edit(span.start(), span.end(), text, edits.size()));
        return this;
    }

    SpanSplicer delete(TextSpan span) {
        edits.add(new Edit(span.start(), span.end(), "", edits.size()));
        return this;
    }

    SpanSplicer insert(int position, String text) {
        edits.add(new Edit(position, position, text, edits.size()));
        return this;
    }

    String apply() {
        StringBuilder out = new StringBuilder(line);
        edits.stream()
                .sorted(Comparator.comparingInt(Edit::start).thenComparingInt(Edit::order).reversed())
                .forEach(e -> out.replace(e.start(), e.end(), e.replacement()));
        return out.toString();
    }

    private boolean needsBlankBefore(int position) {
        if (position == 0) {
            return false;
        }
        char previous = line.charAt(position - 1);
        return !Character.isWhitespace(previous) && previous != '=';
    }
}
