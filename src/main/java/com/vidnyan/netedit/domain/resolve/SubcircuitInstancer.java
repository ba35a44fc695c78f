package com.vidnyan.netedit.domain.resolve;

import com.vidnyan.netedit.domain.error.ReferenceException;
import com.vidnyan.netedit.domain.journal.UpdateJournal;
import com.vidnyan.netedit.domain.journal.UpdateKind;
import com.vidnyan.netedit.domain.model.Component;
import com.vidnyan.netedit.domain.model.Scope;
import com.vidnyan.netedit.domain.model.SubcircuitInstance;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Gives an instance its own copy of the definition it uses, the first time
 * something inside it is written.
 * <p>
 * Callers validate the write against the shared tree first (see
 * {@link ReferenceResolver}); {@link #materialize} then walks the same path
 * again from the root, cloning each definition it passes through that is not
 * yet private to the instance.
 */
@Slf4j
public class SubcircuitInstancer {

    private final ReferenceResolver resolver;
    private final UpdateJournal journal;
    private final String terminator;

    public SubcircuitInstancer(ReferenceResolver resolver, UpdateJournal journal, String terminator) {
        this.resolver = resolver;
        this.journal = journal;
        this.terminator = terminator;
    }

    /**
     * Writable scope at the end of the path.
     */
    public Scope materialize(Scope root, ReferenceResolver.ScopePath path) {
        Scope scope = root;
        for (ReferenceResolver.Hop hop : path.hops()) {
            String designator = hop.instance().designator();
            Component component = scope.findComponent(designator)
                    .orElseThrow(() -> ReferenceException.componentNotFound(hop.path()));
            if (!(component instanceof SubcircuitInstance instance)) {
                throw ReferenceException.notAContainer(hop.path());
            }
            if (!instance.hasShadow()) {
                Scope target = resolver.targetOf(instance, scope, hop.path());
                ensureShadow(root, instance, target, hop.path());
            }
            scope = instance.shadow();
        }
        return scope;
    }

    /**
     * Clones the target under a fresh name, attaches it to the instance and journals both steps.
     * Does nothing when the instance already owns a shadow.
     */
    public Scope ensureShadow(Scope root, SubcircuitInstance instance, Scope target, String instancePath) {
        if (instance.hasShadow()) {
            return instance.shadow();
        }
        if (target.isEffectivelyReadOnly()) {
            throw ReferenceException.readOnly(instancePath);
        }
        String name = uniqueName(root, target.name() + "_" + instancePath.replace(ReferenceResolver.DIVIDER, "_"));
        String banner = "***** netedit: private copy of " + target.name() + " for " + instancePath + " *****";
        Scope copy = target.renamedCopy(name, banner, terminator);
        instance.attachShadow(copy);

        journal.record(instancePath, name, UpdateKind.CLONE_SUBCIRCUIT);
        journal.record(instancePath, name, UpdateKind.UPDATE_COMPONENT_VALUE);
        log.info("Cloned subcircuit {} as {} for instance {}", target.name(), name, instancePath);
        return copy;
    }

    static String uniqueName(Scope root, String candidate) {
        Set<String> taken = root.allScopeNames()
                .map(n -> n.toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
        if (!taken.contains(candidate.toUpperCase(Locale.ROOT))) {
            return candidate;
        }
        int suffix = 1;
        while (taken.contains((candidate + "_" + suffix).toUpperCase(Locale.ROOT))) {
            suffix++;
        }
        return candidate + "_" + suffix;
    }
}
