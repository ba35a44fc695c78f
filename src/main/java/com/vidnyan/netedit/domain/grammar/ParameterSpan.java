package com.vidnyan.netedit.domain.grammar;

/**
 * Location of one {@code key=value} pair, or bare flag, inside a logical line.
 *
 * @param key       key as written
 * @param keySpan   span of the key
 * @param valueSpan span of the value, null for a bare flag
 * @param whole     span from the whitespace before the key to the end of the pair
 */
public record ParameterSpan(String key, TextSpan keySpan, TextSpan valueSpan, TextSpan whole) {

    public boolean isFlag() {
        return valueSpan == null;
    }
}
