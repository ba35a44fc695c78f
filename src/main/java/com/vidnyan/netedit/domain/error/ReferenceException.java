package com.vidnyan.netedit.domain.error;

/**
 * Per-call failure of a path-addressed read or write. Leaves the document
 * and its journal as they were before the call.
 */
public class ReferenceException extends NetlistException {

    public enum Kind {
        COMPONENT_NOT_FOUND,
        SUBCIRCUIT_NOT_FOUND,
        NOT_A_CONTAINER,
        PARAMETER_NOT_FOUND,
        INSTRUCTION_NOT_FOUND,
        READ_ONLY,
        ALREADY_EXISTS,
        UNSUPPORTED
    }

    private final Kind kind;
    private final String reference;

    public ReferenceException(Kind kind, String reference, String message) {
        super(message);
        this.kind = kind;
        this.reference = reference;
    }

    public static ReferenceException componentNotFound(String reference) {
        return new ReferenceException(Kind.COMPONENT_NOT_FOUND, reference,
                "Component " + reference + " not found");
    }

    public static ReferenceException subcircuitNotFound(String reference, String definition) {
        return new ReferenceException(Kind.SUBCIRCUIT_NOT_FOUND, reference,
                "Subcircuit " + definition + " referenced by " + reference + " not found");
    }

    public static ReferenceException notAContainer(String reference) {
        return new ReferenceException(Kind.NOT_A_CONTAINER, reference,
                reference + " is not a subcircuit instance");
    }

    public static ReferenceException parameterNotFound(String reference) {
        return new ReferenceException(Kind.PARAMETER_NOT_FOUND, reference,
                "Parameter " + reference + " not found");
    }

    public static ReferenceException instructionNotFound(String instruction) {
        return new ReferenceException(Kind.INSTRUCTION_NOT_FOUND, instruction,
                "Instruction \"" + instruction + "\" not found");
    }

    public static ReferenceException readOnly(String reference) {
        return new ReferenceException(Kind.READ_ONLY, reference,
                reference + " belongs to a library definition and cannot be modified");
    }

    public static ReferenceException alreadyExists(String reference) {
        return new ReferenceException(Kind.ALREADY_EXISTS, reference,
                reference + " already exists");
    }

    public static ReferenceException unsupported(String reference, String message) {
        return new ReferenceException(Kind.UNSUPPORTED, reference, message);
    }

    public Kind getKind() {
        return kind;
    }

    public String getReference() {
        return reference;
    }
}
