package com.vidnyan.netedit.domain.grammar;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * SI-suffixed numbers as written in netlists: {@code 10k}, {@code 2.2u},
 * {@code 1Meg}, {@code 1k5}, {@code 10R2}.
 */
public final class EngineeringNotation {

    private static final String SUB_UNIT_SUFFIXES = "fpnum";

    private static final Map<Character, Double> MULTIPLIERS = Map.ofEntries(
            Map.entry('f', 1e-15),
            Map.entry('p', 1e-12),
            Map.entry('n', 1e-9),
            Map.entry('µ', 1e-6),
            Map.entry('u', 1e-6),
            Map.entry('U', 1e-6),
            Map.entry('m', 1e-3),
            Map.entry('M', 1e-3),
            Map.entry('k', 1e3),
            Map.entry('K', 1e3),
            Map.entry('g', 1e9),
            Map.entry('G', 1e9),
            Map.entry('t', 1e12),
            Map.entry('T', 1e12),
            // unit letters double as a decimal point: 10R5 is 10.5
            Map.entry('Ω', 1.0),
            Map.entry('R', 1.0),
            Map.entry('V', 1.0),
            Map.entry('A', 1.0),
            Map.entry('F', 1.0),
            Map.entry('H', 1.0),
            Map.entry('%', 0.01));

    private EngineeringNotation() {
    }

    /**
     * Formats a number with the closest SI suffix below it.
     */
    public static String format(double value) {
        if (value == 0.0) {
            return "0";
        }
        int exponent = (int) Math.floor(Math.log10(Math.abs(value)) / 3);
        String suffix;
        if (exponent >= -5 && exponent < 0) {
            suffix = String.valueOf(SUB_UNIT_SUFFIXES.charAt(SUB_UNIT_SUFFIXES.length() + exponent));
        } else if (exponent == 0) {
            return compact(value);
        } else {
            suffix = switch (exponent) {
                case 1 -> "k";
                case 2 -> "Meg";
                case 3 -> "g";
                case 4 -> "t";
                default -> null;
            };
            if (suffix == null) {
                return String.format(Locale.ROOT, "%E", value);
            }
        }
        return compact(value / Math.pow(1000, exponent)) + suffix;
    }

    /**
     * Formats integral numbers as they are, anything else in engineering notation.
     */
    public static String format(Number value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return value.toString();
        }
        return format(value.doubleValue());
    }

    /**
     * Reads a netlist number. Empty when the text does not start with a number.
     */
    public static Optional<Double> parse(String text) {
        String value = text.strip();
        int length = value.length();
        int i = 0;
        while (i < length && "0123456789.+-".indexOf(value.charAt(i)) >= 0) {
            i++;
        }
        if (i == 0) {
            return Optional.empty();
        }
        double multiplier = 1.0;
        int numberEnd;
        int fractionStart;
        int fractionEnd;
        if (i < length && (value.charAt(i) == 'e' || value.charAt(i) == 'E')) {
            // scientific notation never carries a multiplier
            i++;
            while (i < length && "0123456789+-".indexOf(value.charAt(i)) >= 0) {
                i++;
            }
            numberEnd = i;
            fractionStart = i;
            fractionEnd = i;
        } else {
            numberEnd = i;
            while (i < length && (value.charAt(i) == ' ' || value.charAt(i) == '\t')) {
                i++;
            }
            if (i < length && MULTIPLIERS.containsKey(value.charAt(i))) {
                if (value.regionMatches(true, i, "MEG", 0, 3)) {
                    multiplier = 1e6;
                    i += 3;
                } else {
                    multiplier = MULTIPLIERS.get(value.charAt(i));
                    i++;
                }
            }
            fractionStart = i;
            while (i < length && Character.isDigit(value.charAt(i))) {
                i++;
            }
            fractionEnd = i;
        }
        try {
            String number = value.substring(0, numberEnd);
            if (fractionStart < fractionEnd) {
                number = number + "." + value.substring(fractionStart, fractionEnd);
            }
            return Optional.of(Double.parseDouble(number) * multiplier);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    // Six significant digits without trailing zeros
    private static String compact(double value) {
        return new BigDecimal(value)
                .round(new MathContext(6))
                .stripTrailingZeros()
                .toPlainString();
    }
}
