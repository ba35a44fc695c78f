package com.vidnyan.netedit.domain.grammar;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Dot keywords understood by the classifier.
 */
public final class DotKeywords {

    public static final String SUBCKT = ".SUBCKT";
    public static final String ENDS = ".ENDS";
    public static final String CONTROL = ".CONTROL";
    public static final String ENDC = ".ENDC";
    public static final String END = ".END";
    public static final String PARAM = ".PARAM";
    public static final String BACKANNO = ".BACKANNO";

    public static final Set<String> KEYWORDS = Set.of(
            ".AC", ".BACKANNO", ".CONTROL", ".DC", ".END", ".ENDC", ".ENDS",
            ".FERRET", ".FOUR", ".FUNC", ".FUNCTION", ".GLOBAL", ".IC",
            ".INC", ".INCLUDE", ".LIB", ".LOADBIAS",
            ".MACHINE", ".STATE", ".RULE", ".OUTPUT", ".ENDMACHINE",
            ".MEAS", ".MEASURE", ".MODEL", ".NET", ".NODESET", ".NOISE",
            ".OP", ".OPTIONS", ".PARAM", ".PARAMS", ".SAVE", ".SAV", ".SAVEBIAS",
            ".STEP", ".SUBCKT", ".TEXT", ".TF", ".TRAN", ".WAVE");

    /** At most one of these may appear in a document. */
    public static final Set<String> UNIQUE_SIMULATION = Set.of(".AC", ".DC", ".TRAN", ".NOISE", ".TF");

    public static final Set<String> LIBRARY_REFERENCES = Set.of(".LIB", ".INC", ".INCLUDE");

    private static final Set<String> BOUNDARIES = Set.of(SUBCKT, ENDS, CONTROL, ENDC, END);

    // Longest first so that prefix resolution picks ".PARAMS" before ".PARAM".
    private static final List<String> BY_LENGTH = KEYWORDS.stream()
            .filter(k -> !BOUNDARIES.contains(k))
            .sorted(Comparator.comparingInt(String::length).reversed())
            .toList();

    private DotKeywords() {
    }

    /**
     * Resolves the first token of a dot line. Exact keyword first, then the
     * longest keyword the token starts with; boundary keywords only match exactly.
     * Unknown tokens come back upper-cased as generic directives.
     */
    public static String resolve(String token) {
        String upper = token.toUpperCase(Locale.ROOT);
        if (KEYWORDS.contains(upper)) {
            return upper;
        }
        return BY_LENGTH.stream()
                .filter(upper::startsWith)
                .findFirst()
                .orElse(upper);
    }

    public static LineKind kindOf(String keyword) {
        return switch (keyword) {
            case SUBCKT -> LineKind.SUBCIRCUIT_BEGIN;
            case ENDS -> LineKind.SUBCIRCUIT_END;
            case CONTROL -> LineKind.BLOCK_BEGIN;
            case ENDC -> LineKind.BLOCK_END;
            case END -> LineKind.END;
            default -> LineKind.DIRECTIVE;
        };
    }

    public static boolean isUniqueSimulation(String keyword) {
        return UNIQUE_SIMULATION.contains(keyword);
    }
}
