package com.vidnyan.netedit.domain.write;

import com.vidnyan.netedit.domain.grammar.GrammarMatch;
import com.vidnyan.netedit.domain.grammar.ParameterSpan;
import com.vidnyan.netedit.domain.grammar.ParameterValues;
import com.vidnyan.netedit.domain.grammar.TextSpan;
import com.vidnyan.netedit.domain.model.Comment;
import com.vidnyan.netedit.domain.model.Component;
import com.vidnyan.netedit.domain.model.ControlBlock;
import com.vidnyan.netedit.domain.model.Directive;
import com.vidnyan.netedit.domain.model.Entry;
import com.vidnyan.netedit.domain.model.NestedScope;
import com.vidnyan.netedit.domain.model.ParameterMap;
import com.vidnyan.netedit.domain.model.Scope;
import com.vidnyan.netedit.domain.model.SubcircuitInstance;
import com.vidnyan.netedit.domain.parse.NetlistLexer;

/**
 * Serializes a scope tree back to netlist text.
 * <p>
 * Untouched entries are written exactly as read. A changed component is
 * rewritten by splicing its new field values into the spans the grammar
 * matched on its logical line, so spacing and comments around them survive.
 * Private copies made for instances are written just before the end marker
 * of the scope that owns the instance.
 */
public class NetlistWriter {

    private final String terminator;

    public NetlistWriter(String terminator) {
        this.terminator = terminator;
    }

    public String write(Scope root) {
        StringBuilder out = new StringBuilder();
        writeScope(root, out);
        return out.toString();
    }

    private void writeScope(Scope scope, StringBuilder out) {
        if (scope.banner() != null) {
            out.append(scope.banner()).append(terminator);
        }
        if (scope.header() != null) {
            out.append(scope.header().rawText());
        }
        for (Entry entry : scope.entries()) {
            writeEntry(entry, out);
        }
        scope.instances()
                .filter(SubcircuitInstance::hasShadow)
                .forEach(i -> writeScope(i.shadow(), out));
        if (scope.footer() != null) {
            out.append(scope.footer().rawText());
        }
        for (Entry entry : scope.trailer()) {
            writeEntry(entry, out);
        }
    }

    private void writeEntry(Entry entry, StringBuilder out) {
        if (entry instanceof Component component) {
            out.append(writeComponent(component));
        } else if (entry instanceof NestedScope nested) {
            writeScope(nested.scope(), out);
        } else if (entry instanceof Directive directive) {
            out.append(directive.rawText());
        } else if (entry instanceof ControlBlock block) {
            out.append(block.rawText());
        } else if (entry instanceof Comment comment) {
            out.append(comment.rawText());
        } else {
            throw new IllegalStateException("Unknown entry " + entry.getClass().getSimpleName());
        }
    }

    /**
     * Text of one component: as read when nothing changed, otherwise one spliced logical line.
     */
    public String writeComponent(Component component) {
        if (!component.isModified()) {
            return component.rawText();
        }
        String raw = component.rawText();
        String ending = raw.substring(NetlistLexer.stripTerminator(raw).length());
        return splice(component) + (ending.isEmpty() ? "" : terminatorOf(ending));
    }

    private String terminatorOf(String ending) {
        if (ending.endsWith("\r\n")) {
            return "\r\n";
        }
        return ending.endsWith("\r") ? "\r" : "\n";
    }

    private String splice(Component component) {
        GrammarMatch match = component.match();
        ParameterMap current = component.parameters();
        SpanSplicer splicer = new SpanSplicer(component.logicalText());

        if (component.isValueModified() && match.hasValue()) {
            splicer.replace(match.valueSpan(), component.value() == null ? "" : component.value());
        }
        for (ParameterSpan span : match.parameters()) {
            if (!current.contains(span.key())) {
                splicer.delete(span.whole());
                continue;
            }
            if (component.isParameterUnchanged(span.key())) {
                continue;
            }
            Object value = current.get(span.key()).orElse("");
            String rendered = ParameterValues.render(value);
            if (span.isFlag()) {
                splicer.insert(span.keySpan().end(), "=" + rendered);
            } else if (rendered.isEmpty()) {
                splicer.delete(new TextSpan(span.keySpan().end(), span.valueSpan().end()));
            } else {
                splicer.replace(span.valueSpan(), rendered);
            }
        }
        StringBuilder added = new StringBuilder();
        for (ParameterMap.Parameter p : current.list()) {
            if (match.parameter(p.name()).isEmpty()) {
                added.append(' ').append(p.name());
                String rendered = ParameterValues.render(p.value());
                if (!rendered.isEmpty()) {
                    added.append('=').append(rendered);
                }
            }
        }
        if (added.length() > 0) {
            splicer.insert(match.insertionPoint(), added.toString());
        }
        return splicer.apply();
    }
}
