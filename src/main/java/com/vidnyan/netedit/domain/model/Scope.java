package com.vidnyan.netedit.domain.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Ordered container of entries: either the document root or a named
 * {@code .SUBCKT} definition. A scope exclusively owns its entries.
 */
public class Scope {

    public static final Pattern SUBCKT_NAME =
            Pattern.compile("^\\s*\\.SUBCKT\\s+(?<name>[\\w.\\-]+)", Pattern.CASE_INSENSITIVE);

    private final String name;
    private final Directive header;
    private final List<Entry> entries = new ArrayList<>();
    private Directive footer;
    private final List<Entry> trailer = new ArrayList<>();
    private Scope parent;
    private boolean readOnly;
    private Path sourceLibrary;
    private String banner;

    private Scope(String name, Directive header, Scope parent) {
        this.name = name;
        this.header = header;
        this.parent = parent;
    }

    public static Scope root() {
        return new Scope(null, null, null);
    }

    /**
     * Definition opened by the given {@code .SUBCKT} line.
     */
    public static Scope definition(Directive header, Scope parent) {
        Matcher m = SUBCKT_NAME.matcher(header.logicalText());
        String name = m.find() ? m.group("name") : "";
        return new Scope(name, header, parent);
    }

    public boolean isRoot() {
        return header == null;
    }

    public String name() {
        return name;
    }

    public Directive header() {
        return header;
    }

    public Directive footer() {
        return footer;
    }

    public void close(Directive footer) {
        this.footer = footer;
    }

    public Scope parent() {
        return parent;
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<Entry> trailer() {
        return Collections.unmodifiableList(trailer);
    }

    public void add(Entry entry) {
        entries.add(entry);
    }

    public void addTrailer(Entry entry) {
        trailer.add(entry);
    }

    public void insert(int index, Entry entry) {
        entries.add(index, entry);
    }

    public void remove(Entry entry) {
        entries.remove(indexOf(entry));
    }

    public void replace(Entry existing, Entry replacement) {
        entries.set(indexOf(existing), replacement);
    }

    /**
     * Position of an entry by identity.
     */
    public int indexOf(Entry entry) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i) == entry) {
                return i;
            }
        }
        return -1;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * Read-only itself or nested under a read-only scope.
     */
    public boolean isEffectivelyReadOnly() {
        for (Scope s = this; s != null; s = s.parent) {
            if (s.readOnly) {
                return true;
            }
        }
        return false;
    }

    public void markLibrary(Path library) {
        this.readOnly = true;
        this.sourceLibrary = library;
    }

    /**
     * Library file this scope, or the nearest enclosing one, was read from.
     */
    public Optional<Path> sourceLibrary() {
        for (Scope s = this; s != null; s = s.parent) {
            if (s.sourceLibrary != null) {
                return Optional.of(s.sourceLibrary);
            }
        }
        return Optional.empty();
    }

    public String banner() {
        return banner;
    }

    public Stream<Component> components() {
        return entries.stream()
                .filter(Component.class::isInstance)
                .map(Component.class::cast);
    }

    public Stream<SubcircuitInstance> instances() {
        return components()
                .filter(SubcircuitInstance.class::isInstance)
                .map(SubcircuitInstance.class::cast);
    }

    public Stream<Directive> directives() {
        return entries.stream()
                .filter(Directive.class::isInstance)
                .map(Directive.class::cast);
    }

    public Stream<ControlBlock> controlBlocks() {
        return entries.stream()
                .filter(ControlBlock.class::isInstance)
                .map(ControlBlock.class::cast);
    }

    public Stream<Scope> nestedScopes() {
        return entries.stream()
                .filter(NestedScope.class::isInstance)
                .map(e -> ((NestedScope) e).scope());
    }

    /**
     * First component with the designator, ignoring case.
     */
    public Optional<Component> findComponent(String designator) {
        return components()
                .filter(c -> c.designator().equalsIgnoreCase(designator))
                .findFirst();
    }

    /**
     * Definition declared directly in this scope, or a shadow owned by one of its instances.
     */
    public Optional<Scope> findLocalDefinition(String definitionName) {
        Optional<Scope> nested = nestedScopes()
                .filter(s -> s.name().equalsIgnoreCase(definitionName))
                .findFirst();
        if (nested.isPresent()) {
            return nested;
        }
        return instances()
                .filter(SubcircuitInstance::hasShadow)
                .map(SubcircuitInstance::shadow)
                .filter(s -> s.name().equalsIgnoreCase(definitionName))
                .findFirst();
    }

    /**
     * This scope's name plus every definition and shadow below it.
     */
    public Stream<String> allScopeNames() {
        Stream<String> own = name == null ? Stream.empty() : Stream.of(name);
        Stream<String> nested = nestedScopes().flatMap(Scope::allScopeNames);
        Stream<String> shadows = instances()
                .filter(SubcircuitInstance::hasShadow)
                .flatMap(i -> i.shadow().allScopeNames());
        return Stream.concat(own, Stream.concat(nested, shadows));
    }

    /**
     * Deep copy with the same name and parent.
     */
    public Scope deepCopy() {
        Scope copy = new Scope(name, header, parent);
        copy.footer = footer;
        copy.readOnly = readOnly;
        copy.sourceLibrary = sourceLibrary;
        copy.banner = banner;
        copyEntriesInto(copy);
        return copy;
    }

    /**
     * Deep copy under a new name, its {@code .SUBCKT} and {@code .ENDS} lines rewritten.
     * The copy keeps this scope's parent so that names resolve the same way from inside it.
     */
    public Scope renamedCopy(String newName, String banner, String terminator) {
        Scope copy = new Scope(newName, renameHeader(newName, terminator), parent);
        copy.footer = Directive.of(".ENDS " + newName, footer.command(), terminator);
        copy.banner = banner;
        copyEntriesInto(copy);
        return copy;
    }

    private Directive renameHeader(String newName, String terminator) {
        Matcher m = SUBCKT_NAME.matcher(header.logicalText());
        if (!m.find()) {
            return header;
        }
        String text = header.logicalText();
        String renamed = text.substring(0, m.start("name")) + newName + text.substring(m.end("name"));
        return header.withText(renamed, terminator);
    }

    private void copyEntriesInto(Scope copy) {
        for (Entry entry : entries) {
            Entry e = entry.copy();
            if (e instanceof NestedScope nested) {
                nested.scope().parent = copy;
            }
            copy.entries.add(e);
        }
        trailer.forEach(copy.trailer::add);
    }

    @Override
    public String toString() {
        return isRoot() ? "<root>" : name;
    }
}
