package com.vidnyan.netedit.domain.model;

import com.vidnyan.netedit.domain.grammar.GrammarMatch;
import com.vidnyan.netedit.domain.grammar.GrammarTable;
import com.vidnyan.netedit.domain.grammar.ParameterSpan;
import com.vidnyan.netedit.domain.grammar.ParameterValues;

import java.util.List;
import java.util.Objects;

/**
 * Circuit element line.
 * <p>
 * The raw text is kept as read. Structured fields are filled by
 * {@link #bind(GrammarTable)} once the enclosing scope is closed, and the
 * grammar match is retained so that a write can splice into the original spans.
 */
public class Component implements Entry {

    private final String rawText;
    private final String logicalText;
    private GrammarMatch match;
    private String value;
    private ParameterMap parameters = new ParameterMap();
    private ParameterMap boundParameters = new ParameterMap();

    public Component(String rawText, String logicalText) {
        this.rawText = rawText;
        this.logicalText = logicalText;
    }

    protected Component(Component other) {
        this.rawText = other.rawText;
        this.logicalText = other.logicalText;
        this.match = other.match;
        this.value = other.value;
        this.parameters = other.parameters.copy();
        this.boundParameters = other.boundParameters;
    }

    /**
     * Runs the grammar of this line's prefix and loads the structured fields.
     */
    public void bind(GrammarTable grammarTable) {
        this.match = grammarTable.match(logicalText);
        this.value = match.value();
        this.parameters = new ParameterMap();
        for (ParameterSpan span : match.parameters()) {
            Object parsed = span.isFlag() ? "" : ParameterValues.convert(span.valueSpan().of(logicalText));
            parameters.put(span.key(), parsed);
        }
        this.boundParameters = parameters.copy();
    }

    public boolean isBound() {
        return match != null;
    }

    public String designator() {
        return match.designator();
    }

    public char prefix() {
        return Character.toUpperCase(designator().charAt(0));
    }

    public List<String> nodes() {
        return match.nodes();
    }

    /**
     * Value or model; null when the grammar has no value slot.
     */
    public String value() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public ParameterMap parameters() {
        return parameters;
    }

    public GrammarMatch match() {
        return match;
    }

    public String rawText() {
        return rawText;
    }

    public String logicalText() {
        return logicalText;
    }

    public boolean hasValueSlot() {
        return match.hasValue();
    }

    public boolean isOpaque() {
        return match.isOpaque();
    }

    public boolean isValueModified() {
        return !Objects.equals(value, match.value());
    }

    public boolean isModified() {
        if (match == null || match.isOpaque()) {
            return false;
        }
        if (isValueModified()) {
            return true;
        }
        List<ParameterMap.Parameter> bound = boundParameters.list();
        List<ParameterMap.Parameter> current = parameters.list();
        if (bound.size() != current.size()) {
            return true;
        }
        for (int i = 0; i < bound.size(); i++) {
            ParameterMap.Parameter before = bound.get(i);
            ParameterMap.Parameter after = current.get(i);
            if (!before.name().equalsIgnoreCase(after.name())
                    || !ParameterValues.same(before.value(), after.value())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether the parameter {@code name} still holds the value it had when the line was parsed.
     * A key written twice on the line counts with its last value.
     */
    public boolean isParameterUnchanged(String name) {
        Object before = boundParameters.get(name).orElse(null);
        Object after = parameters.get(name).orElse(null);
        return before != null && after != null && ParameterValues.same(before, after);
    }

    @Override
    public Component copy() {
        return new Component(this);
    }

    @Override
    public String toString() {
        return logicalText.strip();
    }
}
