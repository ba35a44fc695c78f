package com.vidnyan.netedit.domain.model;

/**
 * One element of a {@link Scope}, in file order.
 */
public interface Entry {

    /**
     * Copy that shares no mutable state with this entry.
     */
    Entry copy();
}
