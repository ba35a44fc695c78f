package com.vidnyan.netedit.domain.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits the parameter region of a component line into {@code key=value}
 * pairs and bare flags, keeping the position of each.
 * <p>
 * A value runs until whitespace followed by the next {@code key=}, and may
 * contain spaces, quotes and balanced brackets. Words that are not followed
 * by {@code =} are flags.
 */
public final class ParameterScanner {

    private static final Pattern NEXT_KEY = Pattern.compile("\\s+\\w+\\s*=(?!=)", Pattern.UNICODE_CHARACTER_CLASS);

    private ParameterScanner() {
    }

    public static List<ParameterSpan> scan(String text, TextSpan region) {
        List<ParameterSpan> result = new ArrayList<>();
        if (region == null) {
            return result;
        }
        int end = region.end();
        int i = region.start();
        Matcher nextKey = NEXT_KEY.matcher(text);
        while (i < end) {
            int leadStart = i;
            while (i < end && Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            if (i >= end) {
                break;
            }
            int keyStart = i;
            if (isWordChar(text.charAt(i))) {
                while (i < end && isWordChar(text.charAt(i))) {
                    i++;
                }
            } else {
                while (i < end && !Character.isWhitespace(text.charAt(i))) {
                    i++;
                }
            }
            int keyEnd = i;
            String key = text.substring(keyStart, keyEnd);
            int j = keyEnd;
            while (j < end && Character.isWhitespace(text.charAt(j))) {
                j++;
            }
            if (j < end && text.charAt(j) == '=' && keyEnd > keyStart && isWordChar(text.charAt(keyStart))) {
                j++;
                while (j < end && Character.isWhitespace(text.charAt(j))) {
                    j++;
                }
                int valueStart = j;
                int valueEnd = scanValue(text, valueStart, end, nextKey);
                result.add(new ParameterSpan(key, new TextSpan(keyStart, keyEnd),
                        new TextSpan(valueStart, valueEnd), new TextSpan(leadStart, valueEnd)));
                i = Math.max(valueEnd, valueStart);
            } else {
                result.add(new ParameterSpan(key, new TextSpan(keyStart, keyEnd), null,
                        new TextSpan(leadStart, keyEnd)));
            }
        }
        return result;
    }

    private static int scanValue(String text, int start, int end, Matcher nextKey) {
        int depth = 0;
        char quote = 0;
        int lastSolid = start;
        int k = start;
        while (k < end) {
            char c = text.charAt(k);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '{' || c == '[') {
                depth++;
            } else if (c == ')' || c == '}' || c == ']') {
                depth = Math.max(0, depth - 1);
            } else if (Character.isWhitespace(c)) {
                if (depth == 0) {
                    nextKey.region(k, end);
                    if (nextKey.lookingAt()) {
                        break;
                    }
                }
                k++;
                continue;
            }
            k++;
            lastSolid = k;
        }
        return lastSolid;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
