package com.vidnyan.netedit.domain.grammar;

import com.vidnyan.netedit.domain.error.NetlistSyntaxException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One grammar per component prefix letter.
 * <p>
 * Patterns are built from a few shared pieces so every family agrees on
 * what a node, a value, a parameter list and an end-of-line comment look like.
 */
public final class GrammarTable {

    // Trailing "; comment", an optional line-continuation backslash and blanks.
    static final String COMMENT = "(?:\\s+;.*)?\\\\?\\s*$";

    static final String MODEL_OR_VALUE = "\\s+(?<value>[\\w.\\-{}]+)";

    static final String ANY_VALUE = "\\s+(?<value>.*?)" + COMMENT;

    static final String MAYBE_VALUE = "\\s+(?<value>.*?)";

    static final String NO_VALUE = "\\s?(?<value>)?";

    static final String PARAM_CHARS = "[\\w{}()\\-+*/%.,'\"\\s]";

    static final String PARAMS = "(?<params>(?:\\s+\\w+\\s*(?:=\\s*" + PARAM_CHARS + "+)?)*)?" + COMMENT;

    // Sources: the value is free text, every parameter has an explicit '='.
    static final String SOURCE_PARAMS = "(?<params>(?:\\s+\\w+\\s*=\\s*" + PARAM_CHARS + "+)*)" + COMMENT;

    static final String INSTANCE_PARAMS =
            "(?:\\s+(?<params>(?:\\w+\\s*=\\s*['\"{]?.*?['\"}]?\\s*)+))?" + COMMENT;

    static final String BEHAVIORAL_VALUE =
            "\\s+(?<value>[VIBR]\\s*=(?:\\s*[\\w{}()\\-+*/%.<>?:\"']+)*)";

    static final String COUPLING_VALUE = "\\s+(?<value>[+\\-]?[0-9.E+-]+[kmuµnpgt]?)";

    private static final String NODE_CHARS = "[\\w+,\\-.¥«»]";
    private static final String QUOTED_NODE_CHARS = "[\\w+,\\-.¥«´»]";

    private final Map<Character, ComponentGrammar> grammars;

    private GrammarTable(Map<Character, ComponentGrammar> grammars) {
        this.grammars = Collections.unmodifiableMap(grammars);
    }

    /**
     * Table covering SPICE, LTspice, ngspice, Xyce and QSPICE component families.
     */
    public static GrammarTable standard() {
        Builder b = new Builder();
        b.opaque('A', "special function");
        b.add('B', 2, 2, ValueStyle.BEHAVIORAL, "behavioral source", BEHAVIORAL_VALUE + PARAMS);
        b.add('C', 2, 2, ValueStyle.NUMERIC_OR_FORMULA, "capacitor", value("C", "[muµnpfgt]?F?\\d*") + PARAMS);
        b.add('D', 2, 2, ValueStyle.MODEL, "diode", MODEL_OR_VALUE + PARAMS);
        b.add('E', 2, 2, ValueStyle.REST_OF_LINE, "voltage controlled voltage source", ANY_VALUE);
        b.add('F', 2, 2, ValueStyle.REST_OF_LINE, "current controlled current source", ANY_VALUE);
        b.add('G', 2, 2, ValueStyle.REST_OF_LINE, "voltage controlled current source", ANY_VALUE);
        b.add('H', 2, 2, ValueStyle.REST_OF_LINE, "current controlled voltage source", ANY_VALUE);
        b.add('I', 2, 2, ValueStyle.OPTIONAL, "current source", MAYBE_VALUE + SOURCE_PARAMS);
        b.add('J', 3, 3, ValueStyle.MODEL, "JFET", MODEL_OR_VALUE + PARAMS);
        b.add('K', 2, 99, ValueStyle.COUPLING, "mutual inductance", COUPLING_VALUE + COMMENT);
        b.add('L', 2, 2, ValueStyle.NUMERIC_OR_FORMULA, "inductor", value("L", "(?:Meg|[kmuµnpgt])?H?\\d*") + PARAMS);
        b.add('M', 3, 4, ValueStyle.MODEL, "MOSFET", MODEL_OR_VALUE + PARAMS);
        b.add('N', 2, 99, ValueStyle.MODEL, "Verilog-A compact device", MODEL_OR_VALUE + PARAMS);
        b.add('O', 4, 4, ValueStyle.MODEL, "lossy transmission line", MODEL_OR_VALUE + PARAMS);
        b.add('P', 2, 99, ValueStyle.MODEL, "coupled multiconductor line", MODEL_OR_VALUE + PARAMS);
        b.add('Q', 3, 5, ValueStyle.MODEL, "bipolar transistor", MODEL_OR_VALUE + PARAMS);
        b.add('R', 2, 2, ValueStyle.NUMERIC_OR_FORMULA, "resistor", value("R", "(?:Meg|[kmuµnpfgt])?R?\\d*") + PARAMS);
        b.add('S', 4, 4, ValueStyle.REST_OF_LINE, "voltage controlled switch", ANY_VALUE);
        b.add('T', 4, 4, ValueStyle.NONE, "lossless transmission line", NO_VALUE + PARAMS);
        b.add('U', 3, 3, ValueStyle.MODEL, "uniform RC line", MODEL_OR_VALUE + PARAMS);
        b.add('V', 2, 2, ValueStyle.OPTIONAL, "voltage source", MAYBE_VALUE + SOURCE_PARAMS);
        b.add('W', 3, 3, ValueStyle.REST_OF_LINE, "current controlled switch", ANY_VALUE);
        b.add('X', 1, 99, ValueStyle.MODEL, "subcircuit instance", MODEL_OR_VALUE + INSTANCE_PARAMS);
        b.add('Y', 2, 4, ValueStyle.MODEL, "single lossy transmission line", MODEL_OR_VALUE + PARAMS);
        b.add('Z', 3, 3, ValueStyle.MODEL, "MESFET", MODEL_OR_VALUE + PARAMS);
        b.raw('@', 2, 2, ValueStyle.NONE, "frequency response analyzer",
                "^(?<designator>@§?\\d+)(?<nodes>(?:\\s+\\S+){2})\\s?(?<params>.*)$");
        b.add('Ã', "Ã[§†]?", 16, 16, false, ValueStyle.MODEL, "QSPICE amplifier", MODEL_OR_VALUE + PARAMS);
        b.add('¥', "¥§?", 16, 16, false, ValueStyle.MODEL, "QSPICE device", MODEL_OR_VALUE + PARAMS);
        b.add('€', "€§?", 32, 32, false, ValueStyle.MODEL, "QSPICE DAC", MODEL_OR_VALUE + PARAMS);
        b.add('£', "£§?", 64, 64, false, ValueStyle.MODEL, "QSPICE dual gate driver", MODEL_OR_VALUE + PARAMS);
        b.add('Ø', "Ø´?§?", 1, 99, true, ValueStyle.MODEL, "QSPICE DLL", MODEL_OR_VALUE + PARAMS);
        b.add('×', "×§?", 4, 100, true, ValueStyle.NONE, "QSPICE transformer", NO_VALUE + PARAMS);
        b.add('Ö', 5, 5, ValueStyle.MODEL, "LTspice OTA", MODEL_OR_VALUE + PARAMS);
        return new GrammarTable(b.grammars);
    }

    public boolean isKnownPrefix(char upperCasePrefix) {
        return grammars.containsKey(upperCasePrefix);
    }

    public Optional<ComponentGrammar> find(char prefix) {
        return Optional.ofNullable(grammars.get(Character.toUpperCase(prefix)));
    }

    /**
     * Grammar for the first non-blank character of a component line.
     *
     * @throws NetlistSyntaxException when the prefix is not in the table
     */
    public ComponentGrammar grammarFor(String line) {
        int i = LineClassifier.firstNonBlank(line);
        if (i >= line.length()) {
            throw NetlistSyntaxException.unsupportedPrefix(line);
        }
        return find(line.charAt(i)).orElseThrow(() -> NetlistSyntaxException.unsupportedPrefix(line));
    }

    public GrammarMatch match(String line) {
        return grammarFor(line).match(line);
    }

    public String prefixes() {
        StringBuilder sb = new StringBuilder();
        grammars.keySet().forEach(sb::append);
        return sb.toString();
    }

    /**
     * Value that is a number with magnitude suffix, a quoted or braced formula,
     * or a single word; optionally written as {@code R=...}.
     */
    static String value(String prefix, String numberSuffix) {
        return "\\s+(?:" + prefix + "\\s?=\\s?)?(?<value>"
                + "[-+]?[0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?" + numberSuffix
                + "|\".*\"|'.*'|\\{.*\\}|\\S*)";
    }

    static String prefixAndNodes(String designatorPrefix, int min, int max, boolean quoted) {
        String count = min == max ? String.valueOf(min) : min + "," + max;
        if (quoted) {
            return "^(?<designator>" + designatorPrefix + "\\w+)(?<nodes>\\s+«(?:\\s?"
                    + QUOTED_NODE_CHARS + "+){" + count + "}\\s*»)";
        }
        return "^(?<designator>" + designatorPrefix + "\\w+)(?<nodes>(?:\\s+" + NODE_CHARS + "+){" + count + "})";
    }

    private static final class Builder {

        private final Map<Character, ComponentGrammar> grammars = new LinkedHashMap<>();

        void add(char prefix, int min, int max, ValueStyle style, String description, String tail) {
            add(prefix, prefix + "§?", min, max, false, style, description, tail);
        }

        void add(char prefix, String designatorPrefix, int min, int max, boolean quoted,
                 ValueStyle style, String description, String tail) {
            String regex = prefixAndNodes(designatorPrefix, min, max, quoted) + tail;
            grammars.put(prefix, new ComponentGrammar(prefix, min, max, style, quoted, description, regex));
        }

        void raw(char prefix, int min, int max, ValueStyle style, String description, String regex) {
            grammars.put(prefix, new ComponentGrammar(prefix, min, max, style, false, description, regex));
        }

        void opaque(char prefix, String description) {
            grammars.put(prefix, new ComponentGrammar(prefix, 0, 0, ValueStyle.OPAQUE, false, description, null));
        }
    }
}
