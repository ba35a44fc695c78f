package com.vidnyan.netedit.domain.model;

/**
 * {@code X} line: uses another scope as a black box. The target is held by
 * name and resolved through the enclosing scopes; a private shadow copy is
 * attached the first time something inside it is written.
 */
public class SubcircuitInstance extends Component {

    private Scope shadow;

    public SubcircuitInstance(String rawText, String logicalText) {
        super(rawText, logicalText);
    }

    private SubcircuitInstance(SubcircuitInstance other) {
        super(other);
        this.shadow = other.shadow == null ? null : other.shadow.deepCopy();
    }

    public String targetName() {
        return value();
    }

    public Scope shadow() {
        return shadow;
    }

    public boolean hasShadow() {
        return shadow != null;
    }

    /**
     * Attaches a private copy of the target and points this instance at it.
     */
    public void attachShadow(Scope copy) {
        this.shadow = copy;
        setValue(copy.name());
    }

    /**
     * Pointing the instance at another definition discards its shadow.
     */
    @Override
    public void setValue(String value) {
        if (shadow != null && !shadow.name().equalsIgnoreCase(value)) {
            shadow = null;
        }
        super.setValue(value);
    }

    @Override
    public SubcircuitInstance copy() {
        return new SubcircuitInstance(this);
    }
}
