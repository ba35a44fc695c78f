package com.vidnyan.netedit.domain.resolve;

import com.vidnyan.netedit.domain.error.ReferenceException;
import com.vidnyan.netedit.domain.grammar.DotKeywords;
import com.vidnyan.netedit.domain.model.Component;
import com.vidnyan.netedit.domain.model.Directive;
import com.vidnyan.netedit.domain.model.Scope;
import com.vidnyan.netedit.domain.model.SubcircuitInstance;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns colon-delimited paths such as {@code X1:X2:R3} into elements.
 * <p>
 * Resolution never modifies the tree: an instance with a shadow resolves to
 * the shadow, otherwise to its target definition, looked up first in the
 * enclosing scopes, then in libraries named by {@code .LIB}/{@code .INC}
 * directives of those scopes, then in the library the scope itself came from.
 */
public class ReferenceResolver {

    public static final String DIVIDER = ":";

    private static final Pattern LIBRARY_DIRECTIVE =
            Pattern.compile("^\\s*\\.(?:LIB|INC|INCLUDE)\\s+(?<argument>.*)$", Pattern.CASE_INSENSITIVE);

    /**
     * One step through a subcircuit instance.
     *
     * @param instance instance stepped through
     * @param owner    scope the instance sits in
     * @param target   scope the step leads to: the shadow if there is one, else the shared definition
     * @param path     canonical path of the instance
     */
    public record Hop(SubcircuitInstance instance, Scope owner, Scope target, String path) {
    }

    /**
     * Scope reached by following instances from the root.
     */
    public record ScopePath(String path, List<Hop> hops, Scope scope) {

        public boolean isReadOnly() {
            return scope.isEffectivelyReadOnly()
                    || hops.stream().anyMatch(h -> h.target().isEffectivelyReadOnly());
        }

        public String qualify(String name) {
            return path.isEmpty() ? name : path + DIVIDER + name;
        }
    }

    /**
     * Component at the end of a path.
     */
    public record ComponentPath(ScopePath container, Component component) {

        public String path() {
            return container.qualify(component.designator());
        }

        public boolean isReadOnly() {
            return container.isReadOnly();
        }
    }

    private final LibraryCache libraryCache;
    private final Path baseDirectory;

    public ReferenceResolver(LibraryCache libraryCache, Path baseDirectory) {
        this.libraryCache = libraryCache;
        this.baseDirectory = baseDirectory;
    }

    public static List<String> split(String path) {
        return Arrays.asList(path.strip().split(DIVIDER, -1));
    }

    public ComponentPath resolveComponent(Scope root, String path) {
        List<String> segments = split(path);
        ScopePath container = resolveScope(root, segments.subList(0, segments.size() - 1));
        String designator = segments.get(segments.size() - 1);
        Component component = container.scope().findComponent(designator)
                .orElseThrow(() -> ReferenceException.componentNotFound(path));
        return new ComponentPath(container, component);
    }

    /**
     * Follows instance designators from the root.
     */
    public ScopePath resolveScope(Scope root, List<String> instanceDesignators) {
        Scope scope = root;
        String canonical = "";
        List<Hop> hops = new ArrayList<>();
        for (String designator : instanceDesignators) {
            String asked = canonical.isEmpty() ? designator : canonical + DIVIDER + designator;
            Component component = scope.findComponent(designator)
                    .orElseThrow(() -> ReferenceException.componentNotFound(asked));
            if (!(component instanceof SubcircuitInstance instance)) {
                throw ReferenceException.notAContainer(asked);
            }
            canonical = canonical.isEmpty() ? component.designator() : canonical + DIVIDER + component.designator();
            Scope target = targetOf(instance, scope, canonical);
            hops.add(new Hop(instance, scope, target, canonical));
            scope = target;
        }
        return new ScopePath(canonical, List.copyOf(hops), scope);
    }

    /**
     * Effective scope behind an instance.
     */
    public Scope targetOf(SubcircuitInstance instance, Scope owner, String path) {
        if (instance.hasShadow()) {
            return instance.shadow();
        }
        return findDefinition(owner, instance.targetName())
                .orElseThrow(() -> ReferenceException.subcircuitNotFound(path, instance.targetName()));
    }

    public Optional<Scope> findDefinition(Scope from, String name) {
        for (Scope s = from; s != null; s = s.parent()) {
            Optional<Scope> local = s.findLocalDefinition(name);
            if (local.isPresent()) {
                return local;
            }
        }
        for (Scope s = from; s != null; s = s.parent()) {
            for (Directive directive : s.directives().toList()) {
                if (!DotKeywords.LIBRARY_REFERENCES.contains(directive.command())) {
                    continue;
                }
                Optional<Scope> found = libraryArgument(directive)
                        .flatMap(library -> libraryCache.find(library, name, baseDirectory));
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        Optional<Path> sameLibrary = from.sourceLibrary();
        if (sameLibrary.isPresent()) {
            return libraryCache.find(sameLibrary.get(), name);
        }
        return Optional.empty();
    }

    /**
     * File named by a {@code .LIB}/{@code .INC} directive, quotes removed.
     */
    public static Optional<String> libraryArgument(Directive directive) {
        Matcher m = LIBRARY_DIRECTIVE.matcher(directive.logicalText());
        if (!m.find()) {
            return Optional.empty();
        }
        String argument = m.group("argument").strip();
        if (argument.isEmpty()) {
            return Optional.empty();
        }
        char first = argument.charAt(0);
        if (first == '"' || first == '\'') {
            int close = argument.indexOf(first, 1);
            return Optional.of(close > 0 ? argument.substring(1, close) : argument.substring(1));
        }
        return Optional.of(argument.split("\\s+")[0]);
    }
}
