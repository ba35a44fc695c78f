package com.vidnyan.netedit.application.port.out;

import com.vidnyan.netedit.domain.journal.JournalEntry;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for handing the update journal to other tools.
 */
public interface JournalExporter {

    String export(List<JournalEntry> journal);

    void export(List<JournalEntry> journal, Path target);

    /**
     * Read back a journal written by {@link #export(List, Path)}.
     */
    List<JournalEntry> load(Path source);
}
