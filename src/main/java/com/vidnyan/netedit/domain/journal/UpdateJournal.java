package com.vidnyan.netedit.domain.journal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, deduplicating log of every mutation applied to a document.
 * <p>
 * Recording an entry whose (name, kind) already exists overwrites that
 * entry's value where it stands; instruction kinds also compare the value.
 * Entries are never reordered and only {@link #clear()} removes them.
 */
public class UpdateJournal implements Iterable<JournalEntry> {

    private final List<JournalEntry> entries = new ArrayList<>();

    public void record(String name, Object value, UpdateKind kind) {
        for (int i = 0; i < entries.size(); i++) {
            JournalEntry existing = entries.get(i);
            if (existing.sameKey(name, value, kind)) {
                entries.set(i, existing.withValue(value));
                return;
            }
        }
        entries.add(new JournalEntry(name, value, kind));
    }

    /**
     * Latest component value recorded for the name.
     */
    public Optional<Object> value(String name) {
        return find(name, UpdateKind.UPDATE_COMPONENT_VALUE).map(JournalEntry::value);
    }

    /**
     * Latest document parameter value recorded for the name, updated or added.
     */
    public Optional<Object> parameter(String name) {
        return entries.stream()
                .filter(e -> e.name().equals(name))
                .filter(e -> e.kind() == UpdateKind.UPDATE_PARAMETER || e.kind() == UpdateKind.ADD_PARAMETER)
                .map(JournalEntry::value)
                .findFirst();
    }

    public Optional<JournalEntry> find(String name, UpdateKind kind) {
        return entries.stream()
                .filter(e -> e.kind() == kind && e.name().equals(name))
                .findFirst();
    }

    public List<JournalEntry> byKind(UpdateKind kind) {
        return entries.stream()
                .filter(e -> e.kind() == kind)
                .toList();
    }

    public List<JournalEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * Immutable copy of the current entries.
     */
    public List<JournalEntry> snapshot() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Only used when the document goes back to its parsed state.
     */
    public void clear() {
        entries.clear();
    }

    @Override
    public Iterator<JournalEntry> iterator() {
        return entries().iterator();
    }
}
