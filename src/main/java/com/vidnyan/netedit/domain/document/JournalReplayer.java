package com.vidnyan.netedit.domain.document;

import com.vidnyan.netedit.domain.journal.JournalEntry;
import com.vidnyan.netedit.domain.journal.UpdateKind;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Re-applies a recorded journal to another document, typically a fresh parse
 * of the same file handed to a separate worker.
 * <p>
 * Clone entries and the instance rewiring that follows each of them are
 * skipped; the target document makes its own private copies when the
 * replayed writes reach into shared definitions.
 */
@Slf4j
public final class JournalReplayer {

    private JournalReplayer() {
    }

    /**
     * @return number of entries applied
     */
    public static int replay(Iterable<JournalEntry> entries, NetlistDocument document) {
        List<JournalEntry> clones = new ArrayList<>();
        entries.forEach(e -> {
            if (e.kind() == UpdateKind.CLONE_SUBCIRCUIT) {
                clones.add(e);
            }
        });
        int applied = 0;
        for (JournalEntry entry : entries) {
            if (entry.kind() == UpdateKind.CLONE_SUBCIRCUIT || isRewire(entry, clones)) {
                continue;
            }
            document.apply(entry);
            applied++;
        }
        log.info("Replayed {} journal entries", applied);
        return applied;
    }

    private static boolean isRewire(JournalEntry entry, List<JournalEntry> clones) {
        return entry.kind() == UpdateKind.UPDATE_COMPONENT_VALUE
                && clones.stream().anyMatch(c -> c.name().equals(entry.name()) && Objects.equals(c.value(), entry.value()));
    }
}
