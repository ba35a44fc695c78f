package com.vidnyan.netedit.adapter.out.journal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.netedit.domain.journal.JournalEntry;
import com.vidnyan.netedit.domain.journal.UpdateKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonJournalExporterTest {

    @TempDir
    Path tempDir;

    private final JsonJournalExporter exporter = new JsonJournalExporter(new ObjectMapper());

    private final List<JournalEntry> journal = List.of(
            new JournalEntry("X1", "SUB_X1", UpdateKind.CLONE_SUBCIRCUIT),
            new JournalEntry("X1:R1", "2k", UpdateKind.UPDATE_COMPONENT_VALUE),
            new JournalEntry("C1:ic", null, UpdateKind.DELETE_COMPONENT_PARAMETER),
            new JournalEntry(JournalEntry.INSTRUCTION, ".tran 10m", UpdateKind.ADD_INSTRUCTION));

    @Test
    void export_ShouldWriteNameValueAndKind() {
        String json = exporter.export(journal);

        assertTrue(json.startsWith("["));
        assertTrue(json.contains("\"name\":\"X1:R1\""));
        assertTrue(json.contains("\"value\":\"2k\""));
        assertTrue(json.contains("\"kind\":\"CLONE_SUBCIRCUIT\""));
        assertTrue(json.contains("\"value\":null"));
    }

    @Test
    void load_ShouldReadBackExportedFile() {
        // Arrange
        Path file = tempDir.resolve("journal.json");

        // Act
        exporter.export(journal, file);
        List<JournalEntry> loaded = exporter.load(file);

        // Assert
        assertEquals(journal, loaded);
    }
}
