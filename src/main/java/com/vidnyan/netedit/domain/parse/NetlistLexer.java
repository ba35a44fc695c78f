package com.vidnyan.netedit.domain.parse;

import com.vidnyan.netedit.domain.error.NetlistStructureException;
import com.vidnyan.netedit.domain.grammar.ClassifiedLine;
import com.vidnyan.netedit.domain.grammar.LineClassifier;
import com.vidnyan.netedit.domain.grammar.LineKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits netlist text into physical lines, keeping terminators, and folds
 * {@code +} continuation lines into the statement before them.
 */
public class NetlistLexer {

    private final List<String> lines;
    private final LineClassifier classifier;
    private int position;

    public NetlistLexer(String text, LineClassifier classifier) {
        this(splitLines(text), classifier, 0);
    }

    NetlistLexer(List<String> lines, LineClassifier classifier, int start) {
        this.lines = lines;
        this.classifier = classifier;
        this.position = start;
    }

    public boolean hasNext() {
        return position < lines.size();
    }

    /**
     * Next statement with its continuations folded in.
     *
     * @throws NetlistStructureException when the statement starts with a continuation
     */
    public LogicalLine next() {
        int lineNumber = position + 1;
        String first = lines.get(position++);
        ClassifiedLine classified = classifier.classify(first);
        if (classified.is(LineKind.CONTINUATION)) {
            throw new NetlistStructureException("Continuation line without a preceding line", lineNumber);
        }
        StringBuilder raw = new StringBuilder(first);
        StringBuilder logical = new StringBuilder(stripTerminator(first));
        while (position < lines.size() && isContinuation(lines.get(position))) {
            String continuation = lines.get(position++);
            raw.append(continuation);
            String body = stripTerminator(continuation);
            logical.append(' ').append(body.substring(body.indexOf('+') + 1).stripLeading());
        }
        return new LogicalLine(raw.toString(), logical.toString(), classified, lineNumber);
    }

    /**
     * Next physical line as is, without classification.
     */
    public String nextRaw() {
        return lines.get(position++);
    }

    public int lineNumber() {
        return position;
    }

    public static List<String> splitLines(String text) {
        List<String> result = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n') {
                result.add(text.substring(start, i + 1));
                start = i + 1;
            } else if (c == '\r') {
                int end = (i + 1 < text.length() && text.charAt(i + 1) == '\n') ? i + 2 : i + 1;
                result.add(text.substring(start, end));
                start = end;
                i = end - 1;
            }
            i++;
        }
        if (start < text.length()) {
            result.add(text.substring(start));
        }
        return result;
    }

    /**
     * Terminator of the first terminated line, or the fallback for single-line text.
     */
    public static String detectTerminator(String text, String fallback) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r') {
                return i + 1 < text.length() && text.charAt(i + 1) == '\n' ? "\r\n" : "\r";
            }
            if (c == '\n') {
                return "\n";
            }
        }
        return fallback;
    }

    public static String stripTerminator(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }

    private static boolean isContinuation(String line) {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c != ' ' && c != '\t') {
                return c == '+';
            }
        }
        return false;
    }
}
