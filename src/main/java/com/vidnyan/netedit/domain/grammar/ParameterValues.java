package com.vidnyan.netedit.domain.grammar;

import java.util.regex.Pattern;

/**
 * Conversion of parameter text to typed values and back.
 */
public final class ParameterValues {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private ParameterValues() {
    }

    /**
     * Plain integers become {@link Long}, plain decimals {@link Double},
     * everything else stays trimmed text.
     */
    public static Object convert(String text) {
        String trimmed = text.strip();
        if (INTEGER.matcher(trimmed).matches()) {
            try {
                return Long.parseLong(trimmed);
            } catch (NumberFormatException e) {
                return Double.parseDouble(trimmed);
            }
        }
        if (DECIMAL.matcher(trimmed).matches()) {
            return Double.parseDouble(trimmed);
        }
        return trimmed;
    }

    public static String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Number number) {
            return EngineeringNotation.format(number);
        }
        return value.toString().strip();
    }

    /**
     * Equality as seen on the netlist: numbers compare by value, anything else by rendered text.
     */
    public static boolean same(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        Object left = a instanceof String text ? convert(text) : a;
        Object right = b instanceof String text ? convert(text) : b;
        if (left instanceof Number x && right instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
        }
        return render(a).equals(render(b));
    }
}
