package com.vidnyan.netedit.domain.parse;

import com.vidnyan.netedit.domain.error.NetlistStructureException;
import com.vidnyan.netedit.domain.grammar.DotKeywords;
import com.vidnyan.netedit.domain.grammar.GrammarTable;
import com.vidnyan.netedit.domain.grammar.LineClassifier;
import com.vidnyan.netedit.domain.grammar.LineKind;
import com.vidnyan.netedit.domain.model.Comment;
import com.vidnyan.netedit.domain.model.Component;
import com.vidnyan.netedit.domain.model.ControlBlock;
import com.vidnyan.netedit.domain.model.Directive;
import com.vidnyan.netedit.domain.model.NestedScope;
import com.vidnyan.netedit.domain.model.Scope;
import com.vidnyan.netedit.domain.model.SubcircuitInstance;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds the scope tree from the folded line stream.
 * <p>
 * A stack holds the open scopes: {@code .SUBCKT} pushes, {@code .ENDS} pops and
 * attaches the definition to its parent, {@code .CONTROL} swallows raw lines up
 * to {@code .ENDC}. Component fields are extracted when their scope closes.
 */
@Slf4j
public class ScopeTreeBuilder {

    private final GrammarTable grammarTable;
    private final LineClassifier classifier;

    public ScopeTreeBuilder(GrammarTable grammarTable) {
        this.grammarTable = grammarTable;
        this.classifier = new LineClassifier(grammarTable);
    }

    /**
     * Parses a whole netlist. Everything after {@code .END} is kept verbatim.
     *
     * @throws NetlistStructureException on unterminated scopes or a missing {@code .END}
     */
    public Scope parseDocument(String text) {
        NetlistLexer lexer = new NetlistLexer(text, classifier);
        Scope root = Scope.root();
        Deque<Scope> stack = new ArrayDeque<>();
        stack.push(root);

        while (lexer.hasNext()) {
            LogicalLine line = lexer.next();
            if (line.kind() == LineKind.END) {
                if (stack.size() > 1) {
                    throw unterminated(stack.peek(), line.lineNumber());
                }
                root.close(directive(line));
                bindComponents(root);
                while (lexer.hasNext()) {
                    root.addTrailer(new Comment(lexer.nextRaw()));
                }
                log.debug("Parsed netlist: {} top-level entries, {} definitions",
                        root.entries().size(), root.nestedScopes().count());
                return root;
            }
            consume(line, lexer, stack);
        }
        if (stack.size() > 1) {
            throw unterminated(stack.peek(), lexer.lineNumber());
        }
        throw new NetlistStructureException("Missing .END", lexer.lineNumber());
    }

    /**
     * Parses the single {@code .SUBCKT name ... .ENDS} block of a library file.
     * The result is read-only and remembers the library it came from.
     */
    public Optional<Scope> parseDefinition(String text, String definitionName, Path library) {
        List<String> lines = NetlistLexer.splitLines(text);
        Pattern header = Pattern.compile("^\\s*\\.SUBCKT\\s+" + Pattern.quote(definitionName) + "(?:\\s|$)",
                Pattern.CASE_INSENSITIVE);
        for (int i = 0; i < lines.size(); i++) {
            if (!header.matcher(lines.get(i)).find()) {
                continue;
            }
            NetlistLexer lexer = new NetlistLexer(lines, classifier, i);
            Scope holder = Scope.root();
            Deque<Scope> stack = new ArrayDeque<>();
            stack.push(holder);
            do {
                LogicalLine line = lexer.next();
                if (line.kind() == LineKind.END) {
                    throw unterminated(stack.peek(), line.lineNumber());
                }
                consume(line, lexer, stack);
            } while (stack.size() > 1 && lexer.hasNext());
            if (stack.size() > 1) {
                throw unterminated(stack.peek(), lexer.lineNumber());
            }
            Scope definition = holder.nestedScopes().findFirst()
                    .orElseThrow(() -> new NetlistStructureException("Empty definition " + definitionName, 0));
            definition.markLibrary(library);
            log.debug("Loaded {} from {}", definition.name(), library);
            return Optional.of(definition);
        }
        return Optional.empty();
    }

    private void consume(LogicalLine line, NetlistLexer lexer, Deque<Scope> stack) {
        Scope current = stack.peek();
        switch (line.kind()) {
            case COMPONENT -> current.add(component(line));
            case DIRECTIVE -> current.add(directive(line));
            case COMMENT -> current.add(new Comment(line.rawText()));
            case SUBCIRCUIT_BEGIN -> stack.push(Scope.definition(directive(line), current));
            case SUBCIRCUIT_END -> {
                if (stack.size() == 1) {
                    throw new NetlistStructureException(".ENDS without a matching .SUBCKT", line.lineNumber());
                }
                Scope closed = stack.pop();
                closed.close(directive(line));
                bindComponents(closed);
                stack.peek().add(new NestedScope(closed));
            }
            case BLOCK_BEGIN -> current.add(readBlock(line, lexer));
            case BLOCK_END -> throw new NetlistStructureException(".ENDC without a matching .CONTROL",
                    line.lineNumber());
            default -> throw new NetlistStructureException("Unexpected " + line.command(), line.lineNumber());
        }
    }

    private ControlBlock readBlock(LogicalLine begin, NetlistLexer lexer) {
        StringBuilder raw = new StringBuilder(begin.rawText());
        while (lexer.hasNext()) {
            String line = lexer.nextRaw();
            raw.append(line);
            if (line.strip().startsWith(".") && DotKeywords.ENDC.equals(LineClassifier.dotCommand(line))) {
                return new ControlBlock(raw.toString());
            }
        }
        throw new NetlistStructureException("Unterminated .CONTROL block", begin.lineNumber());
    }

    private void bindComponents(Scope scope) {
        Set<String> seen = new HashSet<>();
        scope.components().forEach(c -> {
            c.bind(grammarTable);
            if (!seen.add(c.designator().toUpperCase(Locale.ROOT))) {
                log.warn("Duplicate designator {} in {}; the first one is used for lookups", c.designator(), scope);
            }
        });
    }

    private static Component component(LogicalLine line) {
        if ("X".equals(line.command())) {
            return new SubcircuitInstance(line.rawText(), line.logicalText());
        }
        return new Component(line.rawText(), line.logicalText());
    }

    private static Directive directive(LogicalLine line) {
        return new Directive(line.rawText(), line.logicalText(), line.command());
    }

    private static NetlistStructureException unterminated(Scope scope, int lineNumber) {
        return new NetlistStructureException("Unterminated .SUBCKT " + scope.name(), lineNumber);
    }
}
