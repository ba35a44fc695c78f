package com.vidnyan.netedit.domain.parse;

import com.vidnyan.netedit.domain.error.NetlistStructureException;
import com.vidnyan.netedit.domain.error.NetlistSyntaxException;
import com.vidnyan.netedit.domain.grammar.GrammarTable;
import com.vidnyan.netedit.domain.model.Comment;
import com.vidnyan.netedit.domain.model.Component;
import com.vidnyan.netedit.domain.model.ControlBlock;
import com.vidnyan.netedit.domain.model.Scope;
import com.vidnyan.netedit.domain.model.SubcircuitInstance;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ScopeTreeBuilderTest {

    private final ScopeTreeBuilder builder = new ScopeTreeBuilder(GrammarTable.standard());

    @Test
    void parseDocument_ShouldBuildNestedScopes() {
        // Arrange
        String text = """
                * amplifier
                X1 in out AMP
                .SUBCKT AMP a b
                R1 a b 1k
                .SUBCKT STAGE p n
                C1 p n 1n
                .ENDS STAGE
                X2 a b STAGE
                .ENDS AMP
                .tran 1m
                .END
                """;

        // Act
        Scope root = builder.parseDocument(text);

        // Assert
        assertTrue(root.isRoot());
        assertEquals(List.of("AMP"), root.nestedScopes().map(Scope::name).toList());
        Scope amp = root.findLocalDefinition("amp").orElseThrow();
        assertEquals(List.of("STAGE"), amp.nestedScopes().map(Scope::name).toList());
        assertSame(root, amp.parent());
        assertEquals("1k", amp.findComponent("R1").map(Component::value).orElseThrow());
        assertInstanceOf(SubcircuitInstance.class, root.findComponent("x1").orElseThrow());
        assertEquals(".TRAN", root.directives().findFirst().orElseThrow().command());
    }

    @Test
    void parseDocument_ShouldKeepControlBlocksAndTrailerVerbatim() {
        String text = "* t\n.control\nrun\n  print v(out)\n.endc\n.end\nleft over\n";

        Scope root = builder.parseDocument(text);

        List<ControlBlock> blocks = root.controlBlocks().toList();
        assertEquals(1, blocks.size());
        assertEquals(".control\nrun\n  print v(out)\n.endc\n", blocks.get(0).rawText());
        assertEquals(1, root.trailer().size());
        assertEquals("left over\n", ((Comment) root.trailer().get(0)).rawText());
    }

    @Test
    void parseDocument_ShouldRequireEnd() {
        NetlistStructureException e = assertThrows(NetlistStructureException.class,
                () -> builder.parseDocument("* t\nR1 a b 1k\n"));

        assertTrue(e.getMessage().contains(".END"));
    }

    @Test
    void parseDocument_ShouldRejectUnbalancedScopes() {
        assertThrows(NetlistStructureException.class,
                () -> builder.parseDocument("* t\n.SUBCKT A p\nR1 p 0 1k\n.END\n"));
        assertThrows(NetlistStructureException.class,
                () -> builder.parseDocument("* t\n.ENDS A\n.END\n"));
        assertThrows(NetlistStructureException.class,
                () -> builder.parseDocument("* t\n.endc\n.END\n"));
        assertThrows(NetlistStructureException.class,
                () -> builder.parseDocument("* t\n.control\nrun\n.END\n"));
    }

    @Test
    void parseDocument_ShouldReportComponentThatFitsNoGrammar() {
        assertThrows(NetlistSyntaxException.class, () -> builder.parseDocument("* t\nR1 a 10k\n.END\n"));
    }

    @Test
    void parseDocument_ShouldResolveDuplicateDesignatorToFirst() {
        Scope root = builder.parseDocument("* t\nR1 a b 1k\nR1 c d 2k\n.END\n");

        assertEquals("1k", root.findComponent("R1").orElseThrow().value());
        assertEquals(2, root.components().count());
    }

    @Test
    void parseDefinition_ShouldLoadSingleReadOnlyDefinition() {
        // Arrange
        String library = """
                * vendor models
                .SUBCKT OTHER a b
                R1 a b 5k
                .ENDS OTHER
                .subckt OPAMP inp inn out
                R1 inp inn 1Meg
                .ends OPAMP
                """;
        Path file = Path.of("vendor.lib");

        // Act
        Optional<Scope> opamp = builder.parseDefinition(library, "opamp", file);
        Optional<Scope> missing = builder.parseDefinition(library, "NOPE", file);

        // Assert
        assertTrue(opamp.isPresent());
        assertEquals("OPAMP", opamp.get().name());
        assertTrue(opamp.get().isReadOnly());
        assertEquals(Optional.of(file), opamp.get().sourceLibrary());
        assertEquals("1Meg", opamp.get().findComponent("R1").orElseThrow().value());
        assertTrue(missing.isEmpty());
    }
}
