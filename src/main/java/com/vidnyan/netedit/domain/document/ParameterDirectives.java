package com.vidnyan.netedit.domain.document;

import com.vidnyan.netedit.domain.model.Directive;
import com.vidnyan.netedit.domain.model.Scope;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and rewrites {@code name=value} pairs on {@code .PARAM} lines.
 */
final class ParameterDirectives {

    static final Set<String> COMMANDS = Set.of(".PARAM", ".PARAMS");

    private static final String VALUE = "(?<value>\\{[^}]*\\}|'[^']*'|[\\d.+\\-Ee]+[a-zA-Z%]*)";
    private static final Pattern ANY_PARAMETER =
            Pattern.compile("(?<![\\w.])(?<name>[A-Za-z_]\\w*)\\s*[= ]\\s*" + VALUE);

    /**
     * One pair on one directive.
     *
     * @param pairStart start of the blank run before the name
     */
    record Found(Directive directive, String name, int pairStart, int valueStart, int valueEnd) {

        String value() {
            return directive.logicalText().substring(valueStart, valueEnd);
        }

        Directive withValue(String value, String terminator) {
            String text = directive.logicalText();
            return directive.withText(text.substring(0, valueStart) + value + text.substring(valueEnd), terminator);
        }

        /**
         * Directive without this pair, or empty when nothing else is left on it.
         */
        Optional<Directive> without(String terminator) {
            String text = directive.logicalText();
            String remaining = text.substring(0, pairStart) + text.substring(valueEnd);
            if (remaining.strip().split("\\s+").length <= 1) {
                return Optional.empty();
            }
            return Optional.of(directive.withText(remaining.stripTrailing(), terminator));
        }
    }

    private ParameterDirectives() {
    }

    static Optional<Found> find(Scope scope, String name) {
        Pattern named = Pattern.compile("(?<![\\w.])(?<name>" + Pattern.quote(name) + ")\\s*[= ]\\s*" + VALUE,
                Pattern.CASE_INSENSITIVE);
        for (Directive directive : parameterLines(scope)) {
            Matcher m = named.matcher(directive.logicalText());
            if (m.find(bodyStart(directive))) {
                return Optional.of(found(directive, m));
            }
        }
        return Optional.empty();
    }

    /**
     * Upper-cased names of every parameter declared in the scope, sorted.
     */
    static List<String> names(Scope scope) {
        List<String> names = new ArrayList<>();
        for (Directive directive : parameterLines(scope)) {
            Matcher m = ANY_PARAMETER.matcher(directive.logicalText());
            m.region(bodyStart(directive), directive.logicalText().length());
            while (m.find()) {
                names.add(m.group("name").toUpperCase(Locale.ROOT));
            }
        }
        names.sort(null);
        return names;
    }

    private static List<Directive> parameterLines(Scope scope) {
        return scope.directives()
                .filter(d -> COMMANDS.contains(d.command()))
                .toList();
    }

    private static int bodyStart(Directive directive) {
        String text = directive.logicalText();
        int i = 0;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        while (i < text.length() && !Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static Found found(Directive directive, Matcher m) {
        String text = directive.logicalText();
        int pairStart = m.start("name");
        while (pairStart > 0 && Character.isWhitespace(text.charAt(pairStart - 1))) {
            pairStart--;
        }
        return new Found(directive, m.group("name"), pairStart, m.start("value"), m.end("value"));
    }
}
