package com.vidnyan.netedit.domain.journal;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UpdateJournalTest {

    @Test
    void record_ShouldOverwriteValueInPlace() {
        // Arrange
        UpdateJournal journal = new UpdateJournal();
        journal.record("R1", "2k", UpdateKind.UPDATE_COMPONENT_VALUE);
        journal.record("gain", "20", UpdateKind.UPDATE_PARAMETER);

        // Act
        journal.record("R1", "3k", UpdateKind.UPDATE_COMPONENT_VALUE);

        // Assert
        assertEquals(2, journal.size());
        assertEquals(new JournalEntry("R1", "3k", UpdateKind.UPDATE_COMPONENT_VALUE), journal.entries().get(0));
        assertEquals("3k", journal.value("R1").orElseThrow());
    }

    @Test
    void record_ShouldKeepDifferentKindsApart() {
        UpdateJournal journal = new UpdateJournal();

        journal.record("X1:R1:tc", "1m", UpdateKind.ADD_COMPONENT_PARAMETER);
        journal.record("X1:R1:tc", null, UpdateKind.DELETE_COMPONENT_PARAMETER);

        assertEquals(2, journal.size());
    }

    @Test
    void record_ShouldTreatEachInstructionTextSeparately() {
        UpdateJournal journal = new UpdateJournal();

        journal.record(JournalEntry.INSTRUCTION, ".op", UpdateKind.ADD_INSTRUCTION);
        journal.record(JournalEntry.INSTRUCTION, ".save all", UpdateKind.ADD_INSTRUCTION);
        journal.record(JournalEntry.INSTRUCTION, ".op", UpdateKind.ADD_INSTRUCTION);

        List<JournalEntry> added = journal.byKind(UpdateKind.ADD_INSTRUCTION);
        assertEquals(2, added.size());
        assertEquals(".op", added.get(0).value());
        assertEquals(".save all", added.get(1).value());
    }

    @Test
    void parameter_ShouldFindAddedOrUpdatedParameters() {
        UpdateJournal journal = new UpdateJournal();
        journal.record("vdd", "3.3", UpdateKind.ADD_PARAMETER);

        assertEquals("3.3", journal.parameter("vdd").orElseThrow());
        assertTrue(journal.parameter("gain").isEmpty());
    }

    @Test
    void snapshot_ShouldNotFollowLaterRecords() {
        UpdateJournal journal = new UpdateJournal();
        journal.record("R1", "2k", UpdateKind.UPDATE_COMPONENT_VALUE);

        List<JournalEntry> snapshot = journal.snapshot();
        journal.record("R2", "1k", UpdateKind.UPDATE_COMPONENT_VALUE);
        journal.clear();

        assertEquals(1, snapshot.size());
        assertTrue(journal.isEmpty());
    }

    @Test
    void escape_ShouldFlattenMultiLineInstructions() {
        String escaped = JournalEntry.escape(".control\r\nrun\n.endc\n");

        assertEquals(".control\\r\\nrun\\n.endc", escaped);
        assertEquals(".control\r\nrun\n.endc", JournalEntry.unescape(escaped));
    }
}
