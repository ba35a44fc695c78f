package com.vidnyan.netedit.domain.journal;

/**
 * Kind of mutation recorded in the {@link UpdateJournal}.
 */
public enum UpdateKind {
    UPDATE_PARAMETER,
    UPDATE_COMPONENT_VALUE,
    UPDATE_COMPONENT_PARAMETER,
    DELETE_PARAMETER,
    DELETE_COMPONENT,
    DELETE_COMPONENT_PARAMETER,
    DELETE_INSTRUCTION,
    ADD_PARAMETER,
    ADD_COMPONENT,
    ADD_COMPONENT_PARAMETER,
    ADD_INSTRUCTION,
    CLONE_SUBCIRCUIT;

    /**
     * Instructions coexist under one name, so their value is part of the identity.
     */
    public boolean isInstruction() {
        return this == ADD_INSTRUCTION || this == DELETE_INSTRUCTION;
    }
}
