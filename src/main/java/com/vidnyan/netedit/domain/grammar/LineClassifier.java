package com.vidnyan.netedit.domain.grammar;

import com.vidnyan.netedit.domain.error.NetlistSyntaxException;

/**
 * Decides what a raw line is from its first non-blank character.
 * Never looks at scope nesting.
 */
public class LineClassifier {

    private final GrammarTable grammarTable;

    public LineClassifier(GrammarTable grammarTable) {
        this.grammarTable = grammarTable;
    }

    public ClassifiedLine classify(String line) {
        int i = firstNonBlank(line);
        if (i >= line.length()) {
            return ClassifiedLine.comment();
        }
        char ch = Character.toUpperCase(line.charAt(i));
        if (grammarTable.isKnownPrefix(ch)) {
            return new ClassifiedLine(LineKind.COMPONENT, String.valueOf(ch));
        }
        switch (ch) {
            case '+':
                return ClassifiedLine.continuation();
            case '*':
            case ';':
            case '#':
            case '\n':
            case '\r':
                return ClassifiedLine.comment();
            case '.':
                String keyword = DotKeywords.resolve(firstToken(line, i));
                return new ClassifiedLine(DotKeywords.kindOf(keyword), keyword);
            default:
                throw NetlistSyntaxException.unrecognized(line);
        }
    }

    /**
     * Command of a line the caller already knows is a dot line, upper-cased.
     */
    public static String dotCommand(String line) {
        int i = firstNonBlank(line);
        return DotKeywords.resolve(firstToken(line, i));
    }

    static int firstNonBlank(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private static String firstToken(String line, int start) {
        int j = start;
        while (j < line.length() && !Character.isWhitespace(line.charAt(j))) {
            j++;
        }
        return line.substring(start, j);
    }
}
