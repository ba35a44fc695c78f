package com.vidnyan.netedit.domain.resolve;

import com.vidnyan.netedit.domain.error.ReferenceException;
import com.vidnyan.netedit.domain.grammar.GrammarTable;
import com.vidnyan.netedit.domain.model.Directive;
import com.vidnyan.netedit.domain.model.Scope;
import com.vidnyan.netedit.domain.parse.ScopeTreeBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceResolverTest {

    private static final String NETLIST = """
            * nested
            .lib "vendor.lib"
            X1 in out AMP
            R9 in 0 1k
            .SUBCKT AMP a b
            X2 a b STAGE
            R1 a b 1k
            .ENDS AMP
            .SUBCKT STAGE p n
            C1 p n 1n
            .ENDS STAGE
            X3 in out OPAMP
            X4 in out NOWHERE
            .END
            """;

    private static final String VENDOR = """
            .SUBCKT OPAMP inp out
            R1 inp out 1Meg
            .ENDS OPAMP
            """;

    private final ScopeTreeBuilder builder = new ScopeTreeBuilder(GrammarTable.standard());
    private final ReferenceResolver resolver = new ReferenceResolver(
            new LibraryCache(new InMemoryLibraryLoader().with("vendor.lib", VENDOR), builder), null);
    private final Scope root = builder.parseDocument(NETLIST);

    @Test
    void resolveComponent_ShouldFollowInstancesThroughDefinitions() {
        // Act
        ReferenceResolver.ComponentPath path = resolver.resolveComponent(root, "x1:x2:c1");

        // Assert
        assertEquals("1n", path.component().value());
        assertEquals("X1:X2:C1", path.path());
        assertEquals(2, path.container().hops().size());
        assertEquals("STAGE", path.container().scope().name());
        assertFalse(path.isReadOnly());
    }

    @Test
    void resolveComponent_ShouldReachLibraryDefinitionsAsReadOnly() {
        ReferenceResolver.ComponentPath path = resolver.resolveComponent(root, "X3:R1");

        assertEquals("1Meg", path.component().value());
        assertTrue(path.isReadOnly());
    }

    @Test
    void resolveComponent_ShouldReportMissingPieces() {
        ReferenceException missing = assertThrows(ReferenceException.class,
                () -> resolver.resolveComponent(root, "X1:R7"));
        ReferenceException notContainer = assertThrows(ReferenceException.class,
                () -> resolver.resolveComponent(root, "R9:R1"));
        ReferenceException noDefinition = assertThrows(ReferenceException.class,
                () -> resolver.resolveComponent(root, "X4:R1"));

        assertEquals(ReferenceException.Kind.COMPONENT_NOT_FOUND, missing.getKind());
        assertEquals(ReferenceException.Kind.NOT_A_CONTAINER, notContainer.getKind());
        assertEquals(ReferenceException.Kind.SUBCIRCUIT_NOT_FOUND, noDefinition.getKind());
    }

    @Test
    void findDefinition_ShouldSearchEnclosingScopesFirst() {
        Scope amp = root.findLocalDefinition("AMP").orElseThrow();

        Optional<Scope> stage = resolver.findDefinition(amp, "STAGE");

        assertTrue(stage.isPresent());
        assertSame(root.findLocalDefinition("STAGE").orElseThrow(), stage.get());
    }

    @Test
    void libraryArgument_ShouldStripQuotesAndSection() {
        Directive quoted = Directive.of(".lib \"my models.lib\" tt", ".LIB", "\n");
        Directive plain = Directive.of(".inc models.inc", ".INC", "\n");

        assertEquals(Optional.of("my models.lib"), ReferenceResolver.libraryArgument(quoted));
        assertEquals(Optional.of("models.inc"), ReferenceResolver.libraryArgument(plain));
    }

    @Test
    void split_ShouldKeepEmptySegments() {
        assertEquals(List.of("X1", "", "R1"), ReferenceResolver.split("X1::R1"));
    }
}
