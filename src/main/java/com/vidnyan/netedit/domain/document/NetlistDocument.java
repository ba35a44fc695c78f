package com.vidnyan.netedit.domain.document;

import com.vidnyan.netedit.domain.error.ReferenceException;
import com.vidnyan.netedit.domain.grammar.ClassifiedLine;
import com.vidnyan.netedit.domain.grammar.ComponentGrammar;
import com.vidnyan.netedit.domain.grammar.DotKeywords;
import com.vidnyan.netedit.domain.grammar.EngineeringNotation;
import com.vidnyan.netedit.domain.grammar.LineClassifier;
import com.vidnyan.netedit.domain.grammar.LineKind;
import com.vidnyan.netedit.domain.grammar.ParameterValues;
import com.vidnyan.netedit.domain.journal.JournalEntry;
import com.vidnyan.netedit.domain.journal.UpdateJournal;
import com.vidnyan.netedit.domain.journal.UpdateKind;
import com.vidnyan.netedit.domain.model.Comment;
import com.vidnyan.netedit.domain.model.Component;
import com.vidnyan.netedit.domain.model.ControlBlock;
import com.vidnyan.netedit.domain.model.Directive;
import com.vidnyan.netedit.domain.model.Entry;
import com.vidnyan.netedit.domain.model.Scope;
import com.vidnyan.netedit.domain.model.SubcircuitInstance;
import com.vidnyan.netedit.domain.parse.NetlistLexer;
import com.vidnyan.netedit.domain.resolve.ReferenceResolver;
import com.vidnyan.netedit.domain.resolve.ReferenceResolver.ComponentPath;
import com.vidnyan.netedit.domain.resolve.ReferenceResolver.ScopePath;
import com.vidnyan.netedit.domain.resolve.SubcircuitInstancer;
import com.vidnyan.netedit.domain.write.NetlistWriter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Editable netlist.
 * <p>
 * Everything is addressed by colon-delimited paths from the top of the file
 * ({@code R1}, {@code X1:R3}, {@code X1:X2:TEMP}). Reads never change the
 * tree. A write is first checked against the tree as it stands (the path
 * resolves, the value really changes, nothing on the way is read-only); only
 * then are shared definitions on the way cloned for the instances involved
 * and the change applied and journaled. A write that fails leaves both the
 * tree and the journal as they were.
 * <p>
 * Not thread safe.
 */
@Slf4j
public class NetlistDocument {

    private static final String BLANK_TITLE = "* netedit";

    private final NetlistContext context;
    private final String originalText;
    private final String terminator;
    private final UpdateJournal journal = new UpdateJournal();
    private final ReferenceResolver resolver;
    private final SubcircuitInstancer instancer;
    private final NetlistWriter writer;
    private final LineClassifier classifier;
    private Scope root;

    private NetlistDocument(String text, NetlistContext context) {
        this.context = context;
        this.originalText = text;
        this.terminator = NetlistLexer.detectTerminator(text, context.defaultTerminator());
        this.resolver = new ReferenceResolver(context.libraryCache(), context.baseDirectory());
        this.instancer = new SubcircuitInstancer(resolver, journal, terminator);
        this.writer = new NetlistWriter(terminator);
        this.classifier = new LineClassifier(context.grammarTable());
        this.root = context.builder().parseDocument(text);
    }

    /**
     * Parses a whole netlist.
     *
     * @throws com.vidnyan.netedit.domain.error.NetlistSyntaxException    on a line no grammar accepts
     * @throws com.vidnyan.netedit.domain.error.NetlistStructureException on unbalanced scopes or a missing {@code .END}
     */
    public static NetlistDocument parse(String text, NetlistContext context) {
        return new NetlistDocument(text, context);
    }

    /**
     * Empty netlist: a title comment and {@code .END}.
     */
    public static NetlistDocument blank(NetlistContext context) {
        String t = context.defaultTerminator();
        return new NetlistDocument(BLANK_TITLE + t + DotKeywords.END + t, context);
    }

    /**
     * Back to the text as parsed: edits, private copies and the journal are dropped.
     */
    public void reset() {
        root = context.builder().parseDocument(originalText);
        journal.clear();
        log.debug("Document reset");
    }

    public String render() {
        return writer.write(root);
    }

    public UpdateJournal journal() {
        return journal;
    }

    public String terminator() {
        return terminator;
    }

    public Scope root() {
        return root;
    }

    public String getComponentValue(String path) {
        Component component = resolver.resolveComponent(root, path).component();
        requireValueSlot(component, path);
        return component.value();
    }

    public String getElementModel(String path) {
        return getComponentValue(path);
    }

    /**
     * Value read as a number, engineering suffixes included ({@code 4k7}, {@code 10u}).
     */
    public double getComponentFloatValue(String path) {
        String value = getComponentValue(path);
        return EngineeringNotation.parse(value)
                .orElseThrow(() -> ReferenceException.unsupported(path, "Value '" + value + "' is not numeric"));
    }

    public List<String> getComponentNodes(String path) {
        return resolver.resolveComponent(root, path).component().nodes();
    }

    public Map<String, Object> getComponentParameters(String path) {
        return resolver.resolveComponent(root, path).component().parameters().asMap();
    }

    public Object getComponentParameter(String path, String key) {
        ComponentPath target = resolver.resolveComponent(root, path);
        return target.component().parameters().get(key)
                .orElseThrow(() -> ReferenceException.parameterNotFound(target.path() + ReferenceResolver.DIVIDER + key));
    }

    /**
     * Designators of the top-level components whose prefix is one of {@code prefixes}; all of them when none given.
     */
    public List<String> getComponents(String... prefixes) {
        String wanted = String.join("", prefixes).toUpperCase(Locale.ROOT);
        return root.components()
                .filter(c -> wanted.isEmpty() || wanted.indexOf(c.prefix()) >= 0)
                .map(Component::designator)
                .toList();
    }

    public boolean hasComponent(String path) {
        try {
            resolver.resolveComponent(root, path);
            return true;
        } catch (ReferenceException e) {
            log.debug("No component {}: {}", path, e.getMessage());
            return false;
        }
    }

    /**
     * Value text of a {@code .PARAM}, braces and quotes kept.
     */
    public String getParameter(String path) {
        List<String> segments = parameterSegments(path);
        ScopePath container = resolver.resolveScope(root, segments.subList(0, segments.size() - 1));
        String name = segments.get(segments.size() - 1);
        return ParameterDirectives.find(container.scope(), name)
                .map(ParameterDirectives.Found::value)
                .orElseThrow(() -> ReferenceException.parameterNotFound(path));
    }

    public List<String> getAllParameterNames() {
        return ParameterDirectives.names(root);
    }

    public List<String> getSubcircuitNames() {
        return root.nestedScopes().map(Scope::name).toList();
    }

    /**
     * Definition visible from the top of the file, libraries included.
     */
    public Optional<Scope> findDefinition(String name) {
        return resolver.findDefinition(root, name);
    }

    /**
     * Top-level {@code .CONTROL} sections, each from {@code .CONTROL} to {@code .ENDC}.
     */
    public List<String> getControlSections() {
        return root.controlBlocks().map(ControlBlock::content).toList();
    }

    public List<String> getInstructions() {
        return root.directives().map(Directive::text).toList();
    }

    /**
     * Every node named by a top-level component, in order of first use.
     */
    public List<String> getAllNodes() {
        Set<String> nodes = new LinkedHashSet<>();
        root.components().forEach(c -> nodes.addAll(c.nodes()));
        return new ArrayList<>(nodes);
    }

    /**
     * Sets the value or model. Numbers are written in engineering notation.
     */
    public void setComponentValue(String path, Object value) {
        ComponentPath target = resolver.resolveComponent(root, path);
        requireValueSlot(target.component(), path);
        String rendered = ParameterValues.render(value);
        if (Objects.equals(rendered, target.component().value())) {
            log.debug("{} already {}", target.path(), rendered);
            return;
        }
        requireWritable(target.container(), path);

        Component component = writable(target);
        component.setValue(rendered);
        journal.record(target.path(), rendered, UpdateKind.UPDATE_COMPONENT_VALUE);
        log.info("Component {} value set to {}", target.path(), rendered);
    }

    public void setComponentValues(Map<String, ?> values) {
        values.forEach(this::setComponentValue);
    }

    public void setElementModel(String path, String model) {
        setComponentValue(path, model);
    }

    /**
     * Sets one parameter; a null value removes it.
     */
    public void setComponentParameter(String path, String key, Object value) {
        ComponentPath target = resolver.resolveComponent(root, path);
        Component current = target.component();
        String name = target.path() + ReferenceResolver.DIVIDER + key;
        if (value == null) {
            if (!current.parameters().contains(key)) {
                throw ReferenceException.parameterNotFound(name);
            }
            requireWritable(target.container(), path);
            writable(target).parameters().remove(key);
            journal.record(name, null, UpdateKind.DELETE_COMPONENT_PARAMETER);
            log.info("Parameter {} removed", name);
            return;
        }
        if (!acceptsParameters(current)) {
            throw ReferenceException.unsupported(target.path(), "Component takes no parameters");
        }
        Object stored = value instanceof Number ? value : value.toString().strip();
        Optional<Object> existing = current.parameters().get(key);
        if (existing.isPresent() && ParameterValues.same(existing.get(), stored)) {
            log.debug("{} already {}", name, stored);
            return;
        }
        requireWritable(target.container(), path);

        writable(target).parameters().put(key, stored);
        UpdateKind kind = existing.isPresent() ? UpdateKind.UPDATE_COMPONENT_PARAMETER : UpdateKind.ADD_COMPONENT_PARAMETER;
        journal.record(name, ParameterValues.render(stored), kind);
        log.info("Parameter {} set to {}", name, ParameterValues.render(stored));
    }

    public void setComponentParameters(String path, Map<String, ?> parameters) {
        parameters.forEach((key, value) -> setComponentParameter(path, key, value));
    }

    /**
     * Adds a component line to the top of the file.
     */
    public void addComponent(String line) {
        addComponent("", line);
    }

    /**
     * Adds a component line inside the scope reached through {@code scopePath}, after its last component.
     */
    public void addComponent(String scopePath, String line) {
        ClassifiedLine classified = classifier.classify(line);
        if (!classified.is(LineKind.COMPONENT)) {
            throw ReferenceException.unsupported(line.strip(), "Not a component line");
        }
        String text = line.strip();
        Component component = "X".equals(classified.command())
                ? new SubcircuitInstance(text + terminator, text)
                : new Component(text + terminator, text);
        component.bind(context.grammarTable());

        ScopePath container = resolver.resolveScope(root, segments(scopePath));
        String path = container.qualify(component.designator());
        if (container.scope().findComponent(component.designator()).isPresent()) {
            throw ReferenceException.alreadyExists(path);
        }
        requireWritable(container, path);

        Scope scope = instancer.materialize(root, container);
        scope.insert(componentInsertionIndex(scope), component);
        journal.record(path, text, UpdateKind.ADD_COMPONENT);
        log.info("Component {} added", path);
    }

    public void removeComponent(String path) {
        ComponentPath target = resolver.resolveComponent(root, path);
        requireWritable(target.container(), path);

        Scope scope = instancer.materialize(root, target.container());
        Component component = scope.findComponent(target.component().designator())
                .orElseThrow(() -> ReferenceException.componentNotFound(path));
        scope.remove(component);
        journal.record(target.path(), null, UpdateKind.DELETE_COMPONENT);
        log.info("Component {} removed", target.path());
    }

    /**
     * Sets a {@code .PARAM}, adding {@code .PARAM name=value} when it is not declared yet.
     */
    public void setParameter(String path, Object value) {
        List<String> segments = parameterSegments(path);
        ScopePath container = resolver.resolveScope(root, segments.subList(0, segments.size() - 1));
        String name = segments.get(segments.size() - 1);
        String qualified = container.qualify(name);
        String rendered = ParameterValues.render(value);
        Optional<ParameterDirectives.Found> existing = ParameterDirectives.find(container.scope(), name);
        if (existing.isPresent() && existing.get().value().equals(rendered)) {
            log.debug("{} already {}", qualified, rendered);
            return;
        }
        requireWritable(container, qualified);

        Scope scope = instancer.materialize(root, container);
        Optional<ParameterDirectives.Found> found = ParameterDirectives.find(scope, name);
        if (found.isPresent()) {
            Directive directive = found.get().directive();
            scope.replace(directive, found.get().withValue(rendered, terminator));
            journal.record(qualified, rendered, UpdateKind.UPDATE_PARAMETER);
        } else {
            Directive directive = Directive.of(DotKeywords.PARAM + " " + name + "=" + rendered, DotKeywords.PARAM,
                    terminator);
            scope.insert(instructionInsertionIndex(scope), directive);
            journal.record(qualified, rendered, UpdateKind.ADD_PARAMETER);
        }
        log.info("Parameter {} set to {}", qualified, rendered);
    }

    public void setParameters(Map<String, ?> parameters) {
        parameters.forEach(this::setParameter);
    }

    /**
     * Drops a parameter from its {@code .PARAM} line, and the line itself once it declares nothing else.
     */
    public void removeParameter(String path) {
        List<String> segments = parameterSegments(path);
        ScopePath container = resolver.resolveScope(root, segments.subList(0, segments.size() - 1));
        String name = segments.get(segments.size() - 1);
        String qualified = container.qualify(name);
        if (ParameterDirectives.find(container.scope(), name).isEmpty()) {
            throw ReferenceException.parameterNotFound(path);
        }
        requireWritable(container, qualified);

        Scope scope = instancer.materialize(root, container);
        ParameterDirectives.Found found = ParameterDirectives.find(scope, name)
                .orElseThrow(() -> ReferenceException.parameterNotFound(path));
        Optional<Directive> remaining = found.without(terminator);
        if (remaining.isPresent()) {
            scope.replace(found.directive(), remaining.get());
        } else {
            scope.remove(found.directive());
        }
        journal.record(qualified, null, UpdateKind.DELETE_PARAMETER);
        log.info("Parameter {} removed", qualified);
    }

    /**
     * Adds a directive, or a whole {@code .CONTROL} section, to the top of the file.
     * <p>
     * A simulation command such as {@code .TRAN} replaces the one already present.
     * {@code .PARAM} is refused, use {@link #setParameter}. An instruction already
     * present is ignored.
     */
    public void addInstruction(String instruction) {
        addInstruction("", instruction);
    }

    /**
     * Adds a directive inside the scope reached through {@code scopePath}.
     * Simulation commands are only accepted at the top of the file.
     */
    public void addInstruction(String scopePath, String instruction) {
        String text = instruction.strip();
        ClassifiedLine classified = classifier.classify(text);
        String command = classified.command();
        if (ParameterDirectives.COMMANDS.contains(command)) {
            throw ReferenceException.unsupported(text, "Use setParameter to declare parameters");
        }
        if (!classified.is(LineKind.DIRECTIVE) && !classified.is(LineKind.BLOCK_BEGIN)
                && !classified.is(LineKind.COMMENT)) {
            throw ReferenceException.unsupported(text, "Not an instruction");
        }
        ScopePath container = resolver.resolveScope(root, segments(scopePath));
        boolean unique = DotKeywords.isUniqueSimulation(command);
        if (unique && !container.hops().isEmpty()) {
            throw ReferenceException.unsupported(text, "Simulation commands cannot be placed in a subcircuit");
        }
        if (findInstruction(container.scope(), text).isPresent()) {
            log.warn("Instruction \"{}\" is already present in the netlist. Ignoring addition.", text);
            return;
        }
        requireWritable(container, container.path().isEmpty() ? text : container.path());

        Scope scope = instancer.materialize(root, container);
        Entry entry = instructionEntry(classified, text);
        if (unique) {
            Optional<Directive> previous = scope.directives()
                    .filter(d -> DotKeywords.isUniqueSimulation(d.command()))
                    .findFirst();
            if (previous.isPresent()) {
                scope.replace(previous.get(), entry);
                journal.record(JournalEntry.INSTRUCTION, JournalEntry.escape(previous.get().text()),
                        UpdateKind.DELETE_INSTRUCTION);
                journal.record(JournalEntry.INSTRUCTION, JournalEntry.escape(text), UpdateKind.ADD_INSTRUCTION);
                log.info("Instruction \"{}\" replaced by \"{}\"", previous.get().text(), text);
                return;
            }
        }
        scope.insert(instructionInsertionIndex(scope), entry);
        journal.record(container.qualify(JournalEntry.INSTRUCTION), JournalEntry.escape(text),
                UpdateKind.ADD_INSTRUCTION);
        log.info("Instruction \"{}\" added", JournalEntry.escape(text));
    }

    public void addInstructions(String... instructions) {
        for (String instruction : instructions) {
            addInstruction(instruction);
        }
    }

    /**
     * Removes the top-level instruction whose text equals {@code instruction}, ignoring surrounding blanks.
     */
    public void removeInstruction(String instruction) {
        removeInstruction("", instruction);
    }

    /**
     * Removes an instruction from the scope reached through {@code scopePath}.
     */
    public void removeInstruction(String scopePath, String instruction) {
        String text = instruction.strip();
        ScopePath container = resolver.resolveScope(root, segments(scopePath));
        String name = container.qualify(JournalEntry.INSTRUCTION);
        if (findInstruction(container.scope(), text).isEmpty()) {
            log.error("Instruction \"{}\" not found", JournalEntry.escape(text));
            throw ReferenceException.instructionNotFound(JournalEntry.escape(text));
        }
        requireWritable(container, container.path().isEmpty() ? text : container.path());

        Scope scope = instancer.materialize(root, container);
        Entry entry = findInstruction(scope, text)
                .orElseThrow(() -> ReferenceException.instructionNotFound(JournalEntry.escape(text)));
        scope.remove(entry);
        journal.record(name, JournalEntry.escape(text), UpdateKind.DELETE_INSTRUCTION);
        log.info("Instruction \"{}\" removed from {}", JournalEntry.escape(text),
                container.path().isEmpty() ? "top level" : container.path());
    }

    /**
     * Removes every top-level directive whose text starts with a match of {@code regex}, ignoring case.
     *
     * @return number of directives removed
     */
    public int removeInstructionsMatching(String regex) {
        Pattern pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        List<Directive> matching = root.directives()
                .filter(d -> pattern.matcher(d.text()).lookingAt())
                .toList();
        if (matching.isEmpty()) {
            log.error("No instruction matching pattern \"{}\" was found", regex);
            throw ReferenceException.instructionNotFound(regex);
        }
        for (Directive directive : matching) {
            root.remove(directive);
            journal.record(JournalEntry.INSTRUCTION, JournalEntry.escape(directive.text()),
                    UpdateKind.DELETE_INSTRUCTION);
            log.info("Instruction \"{}\" removed", directive.text());
        }
        return matching.size();
    }

    /**
     * Adds a {@code .CONTROL ... .ENDC} section.
     */
    public void addControlSection(String section) {
        String text = section.strip();
        String upper = text.toUpperCase(Locale.ROOT);
        if (!upper.startsWith(DotKeywords.CONTROL) || !upper.endsWith(DotKeywords.ENDC)) {
            throw ReferenceException.unsupported(JournalEntry.escape(text),
                    "Control section must start with .CONTROL and end with .ENDC");
        }
        addInstruction(text);
    }

    /**
     * Removes the control section at {@code index} in {@link #getControlSections()} order.
     */
    public void removeControlSection(int index) {
        List<ControlBlock> blocks = root.controlBlocks().toList();
        if (index < 0 || index >= blocks.size()) {
            log.error("Control section {} was not found", index);
            throw ReferenceException.instructionNotFound("control section " + index);
        }
        ControlBlock block = blocks.get(index);
        root.remove(block);
        journal.record(JournalEntry.INSTRUCTION, JournalEntry.escape(block.content()), UpdateKind.DELETE_INSTRUCTION);
        log.info("Control section {} removed", index);
    }

    /**
     * Re-applies one journaled mutation. Clone entries are bookkeeping and are skipped:
     * private copies are made again on demand by the writes that need them.
     */
    public void apply(JournalEntry entry) {
        String name = entry.name();
        Object value = entry.value();
        switch (entry.kind()) {
            case UPDATE_COMPONENT_VALUE -> setComponentValue(name, value);
            case UPDATE_COMPONENT_PARAMETER, ADD_COMPONENT_PARAMETER ->
                    setComponentParameter(parentOf(name), leafOf(name), value);
            case DELETE_COMPONENT_PARAMETER -> setComponentParameter(parentOf(name), leafOf(name), null);
            case UPDATE_PARAMETER, ADD_PARAMETER -> setParameter(name, value);
            case DELETE_PARAMETER -> removeParameter(name);
            case ADD_COMPONENT -> addComponent(parentOf(name), String.valueOf(value));
            case DELETE_COMPONENT -> removeComponent(name);
            case ADD_INSTRUCTION -> addInstruction(parentOf(name), JournalEntry.unescape(String.valueOf(value)));
            case DELETE_INSTRUCTION -> removeInstruction(parentOf(name), JournalEntry.unescape(String.valueOf(value)));
            case CLONE_SUBCIRCUIT -> log.debug("Skipping clone of {}", name);
            default -> throw ReferenceException.unsupported(name, "Cannot replay " + entry.kind());
        }
    }

    private Component writable(ComponentPath target) {
        Scope scope = instancer.materialize(root, target.container());
        return scope.findComponent(target.component().designator())
                .orElseThrow(() -> ReferenceException.componentNotFound(target.path()));
    }

    private static void requireWritable(ScopePath container, String path) {
        if (container.isReadOnly()) {
            throw ReferenceException.readOnly(path);
        }
    }

    private static void requireValueSlot(Component component, String path) {
        if (component.isOpaque() || !component.hasValueSlot()) {
            throw ReferenceException.unsupported(path, "Component has no value");
        }
    }

    private boolean acceptsParameters(Component component) {
        return context.grammarTable().find(component.prefix())
                .map(ComponentGrammar::acceptsParameters)
                .orElse(false);
    }

    private Entry instructionEntry(ClassifiedLine classified, String text) {
        if (classified.is(LineKind.BLOCK_BEGIN)) {
            String raw = NetlistLexer.splitLines(text).stream()
                    .map(NetlistLexer::stripTerminator)
                    .collect(Collectors.joining(terminator, "", terminator));
            return new ControlBlock(raw);
        }
        if (classified.is(LineKind.COMMENT)) {
            return new Comment(text + terminator);
        }
        return Directive.of(text, classified.command(), terminator);
    }

    private static Optional<Entry> findInstruction(Scope scope, String text) {
        String normalized = normalize(text);
        return scope.entries().stream()
                .filter(e -> normalize(instructionText(e)).equals(normalized))
                .findFirst();
    }

    private static String instructionText(Entry entry) {
        if (entry instanceof Directive directive) {
            return directive.text();
        }
        if (entry instanceof ControlBlock block) {
            return block.content();
        }
        if (entry instanceof Comment comment) {
            return comment.rawText().strip();
        }
        return "";
    }

    private static String normalize(String text) {
        return text.strip().replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * Before {@code .BACKANNO} when present, else at the end of the scope.
     */
    private static int instructionInsertionIndex(Scope scope) {
        List<Entry> entries = scope.entries();
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i) instanceof Directive d && DotKeywords.BACKANNO.equals(d.command())) {
                return i;
            }
        }
        return entries.size();
    }

    /**
     * After the last component, else where an instruction would go.
     */
    private static int componentInsertionIndex(Scope scope) {
        List<Entry> entries = scope.entries();
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (entries.get(i) instanceof Component) {
                return i + 1;
            }
        }
        return instructionInsertionIndex(scope);
    }

    private static List<String> segments(String path) {
        if (path == null || path.isBlank()) {
            return List.of();
        }
        return ReferenceResolver.split(path);
    }

    private static List<String> parameterSegments(String path) {
        List<String> segments = segments(path);
        if (segments.isEmpty() || segments.get(segments.size() - 1).isBlank()) {
            throw ReferenceException.parameterNotFound(path == null ? "" : path);
        }
        return segments;
    }

    private static String parentOf(String path) {
        int i = path.lastIndexOf(ReferenceResolver.DIVIDER);
        return i < 0 ? "" : path.substring(0, i);
    }

    private static String leafOf(String path) {
        return path.substring(path.lastIndexOf(ReferenceResolver.DIVIDER) + 1);
    }
}
