package com.vidnyan.netedit.domain.grammar;

/**
 * What may stand in the value-or-model slot of a component line.
 */
public enum ValueStyle {
    /** Number with magnitude suffix, quoted formula, braced expression or single word. */
    NUMERIC_OR_FORMULA,
    /** Model or subcircuit name. */
    MODEL,
    /** Everything up to an end-of-line comment; no parameter list. */
    REST_OF_LINE,
    /** Free text up to the first {@code key=value}; used by independent sources. */
    OPTIONAL,
    /** {@code V=}, {@code I=}, {@code R=} or {@code B=} expression. */
    BEHAVIORAL,
    /** Coupling coefficient of mutual inductances. */
    COUPLING,
    /** No value at all, parameters only. */
    NONE,
    /** Designator only, the rest of the line is not interpreted. */
    OPAQUE
}
