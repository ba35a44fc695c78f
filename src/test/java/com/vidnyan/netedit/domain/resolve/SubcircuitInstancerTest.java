package com.vidnyan.netedit.domain.resolve;

import com.vidnyan.netedit.domain.error.ReferenceException;
import com.vidnyan.netedit.domain.grammar.GrammarTable;
import com.vidnyan.netedit.domain.journal.JournalEntry;
import com.vidnyan.netedit.domain.journal.UpdateJournal;
import com.vidnyan.netedit.domain.journal.UpdateKind;
import com.vidnyan.netedit.domain.model.Scope;
import com.vidnyan.netedit.domain.model.SubcircuitInstance;
import com.vidnyan.netedit.domain.parse.ScopeTreeBuilder;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubcircuitInstancerTest {

    private final ScopeTreeBuilder builder = new ScopeTreeBuilder(GrammarTable.standard());

    @Test
    void materialize_ShouldCloneOncePerInstance() {
        // Arrange
        Scope root = builder.parseDocument("""
                * t
                X1 a b SUB
                X2 c d SUB
                .SUBCKT SUB p n
                R1 p n 1k
                .ENDS SUB
                .END
                """);
        UpdateJournal journal = new UpdateJournal();
        ReferenceResolver resolver = new ReferenceResolver(
                new LibraryCache(LibraryLoader.none(), builder), null);
        SubcircuitInstancer instancer = new SubcircuitInstancer(resolver, journal, "\n");
        ReferenceResolver.ScopePath path = resolver.resolveScope(root, List.of("X1"));

        // Act
        Scope first = instancer.materialize(root, path);
        Scope second = instancer.materialize(root, resolver.resolveScope(root, List.of("X1")));

        // Assert
        assertSame(first, second);
        assertEquals("SUB_X1", first.name());
        SubcircuitInstance x1 = (SubcircuitInstance) root.findComponent("X1").orElseThrow();
        SubcircuitInstance x2 = (SubcircuitInstance) root.findComponent("X2").orElseThrow();
        assertEquals("SUB_X1", x1.value());
        assertFalse(x2.hasShadow());
        assertEquals(List.of(
                new JournalEntry("X1", "SUB_X1", UpdateKind.CLONE_SUBCIRCUIT),
                new JournalEntry("X1", "SUB_X1", UpdateKind.UPDATE_COMPONENT_VALUE)), journal.entries());
    }

    @Test
    void uniqueName_ShouldAvoidExistingScopeNames() {
        Scope root = builder.parseDocument("""
                * t
                .SUBCKT SUB_X1 p
                .ENDS SUB_X1
                .SUBCKT SUB_X1_1 p
                .ENDS SUB_X1_1
                .END
                """);

        assertEquals("SUB_X1_2", SubcircuitInstancer.uniqueName(root, "SUB_X1"));
        assertEquals("SUB_X2", SubcircuitInstancer.uniqueName(root, "SUB_X2"));
    }

    @Test
    void ensureShadow_ShouldRefuseReadOnlyTargets() {
        Scope root = builder.parseDocument("* t\nX1 a b LIB\n.END\n");
        Scope library = builder.parseDefinition(".SUBCKT LIB p n\nR1 p n 1k\n.ENDS LIB\n", "LIB",
                Path.of("models.lib")).orElseThrow();
        UpdateJournal journal = new UpdateJournal();
        SubcircuitInstancer instancer = new SubcircuitInstancer(
                new ReferenceResolver(new LibraryCache(LibraryLoader.none(), builder), null), journal, "\n");
        SubcircuitInstance x1 = (SubcircuitInstance) root.findComponent("X1").orElseThrow();

        ReferenceException e = assertThrows(ReferenceException.class,
                () -> instancer.ensureShadow(root, x1, library, "X1"));

        assertEquals(ReferenceException.Kind.READ_ONLY, e.getKind());
        assertTrue(journal.isEmpty());
        assertFalse(x1.hasShadow());
    }
}
