package com.vidnyan.netedit.domain.document;

import com.vidnyan.netedit.domain.journal.JournalEntry;
import com.vidnyan.netedit.domain.journal.UpdateKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JournalReplayerTest {

    private static final String CIRCUIT = """
            * replay
            R1 in out 10k
            X1 out a SUB
            X2 out b SUB
            .SUBCKT SUB p n
            R1 p n 1k
            .ENDS SUB
            .PARAM gain=10
            .END
            """;

    @Test
    void replay_ShouldReproduceEditsOnFreshDocument() {
        // Arrange
        NetlistDocument edited = NetlistDocument.parse(CIRCUIT, NetlistContext.standalone());
        edited.setComponentValue("X1:R1", "2k");
        edited.setComponentParameter("R1", "tc", "0.001");
        edited.setParameter("gain", 20);
        edited.addInstruction(".op");
        NetlistDocument fresh = NetlistDocument.parse(CIRCUIT, NetlistContext.standalone());

        // Act
        int applied = JournalReplayer.replay(edited.journal(), fresh);

        // Assert
        assertEquals(4, applied);
        assertEquals(edited.render(), fresh.render());
        assertEquals(edited.journal().entries(), fresh.journal().entries());
    }

    @Test
    void replay_ShouldKeepInstructionsInsideInstanceCopy() {
        // Arrange
        NetlistDocument edited = NetlistDocument.parse(CIRCUIT, NetlistContext.standalone());
        edited.addInstruction("X1", ".model DX D(Is=1n)");
        NetlistDocument fresh = NetlistDocument.parse(CIRCUIT, NetlistContext.standalone());

        // Act
        int applied = JournalReplayer.replay(edited.journal().snapshot(), fresh);

        // Assert
        assertEquals(1, applied);
        assertEquals(new JournalEntry("X1:INSTRUCTION", ".model DX D(Is=1n)", UpdateKind.ADD_INSTRUCTION),
                edited.journal().entries().get(edited.journal().size() - 1));
        assertEquals("""
                * replay
                R1 in out 10k
                X1 out a SUB_X1
                X2 out b SUB
                .SUBCKT SUB p n
                R1 p n 1k
                .ENDS SUB
                .PARAM gain=10
                ***** netedit: private copy of SUB for X1 *****
                .SUBCKT SUB_X1 p n
                R1 p n 1k
                .model DX D(Is=1n)
                .ENDS SUB_X1
                .END
                """, fresh.render());
        assertEquals(edited.render(), fresh.render());
        assertEquals(edited.journal().entries(), fresh.journal().entries());
    }

    @Test
    void replay_ShouldRemoveInstructionFromInstanceCopy() {
        NetlistDocument edited = NetlistDocument.parse(CIRCUIT, NetlistContext.standalone());
        edited.addInstruction("X1", ".model DX D(Is=1n)");
        NetlistDocument target = NetlistDocument.parse(CIRCUIT, NetlistContext.standalone());
        JournalReplayer.replay(edited.journal().snapshot(), target);

        JournalReplayer.replay(List.of(
                new JournalEntry("X1:INSTRUCTION", ".model DX D(Is=1n)", UpdateKind.DELETE_INSTRUCTION)), target);

        assertFalse(target.render().contains(".model DX"));
        assertTrue(target.render().contains(".SUBCKT SUB_X1 p n\nR1 p n 1k\n.ENDS SUB_X1\n"));
    }

    @Test
    void replay_ShouldApplyRemovals() {
        NetlistDocument fresh = NetlistDocument.parse(CIRCUIT, NetlistContext.standalone());
        List<JournalEntry> entries = List.of(
                new JournalEntry("gain", null, UpdateKind.DELETE_PARAMETER),
                new JournalEntry("X2:R1", null, UpdateKind.DELETE_COMPONENT),
                new JournalEntry("X1:R5", "R5 p 0 5k", UpdateKind.ADD_COMPONENT));

        JournalReplayer.replay(entries, fresh);

        assertFalse(fresh.render().contains(".PARAM"));
        assertFalse(fresh.hasComponent("X2:R1"));
        assertEquals("5k", fresh.getComponentValue("X1:R5"));
    }
}
