package com.vidnyan.netedit.domain.model;

/**
 * Named subcircuit definition embedded in its enclosing scope.
 */
public record NestedScope(Scope scope) implements Entry {

    @Override
    public Entry copy() {
        return new NestedScope(scope.deepCopy());
    }
}
