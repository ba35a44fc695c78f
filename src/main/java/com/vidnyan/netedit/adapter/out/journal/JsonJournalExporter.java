package com.vidnyan.netedit.adapter.out.journal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.netedit.application.port.out.JournalExporter;
import com.vidnyan.netedit.domain.journal.JournalEntry;
import com.vidnyan.netedit.domain.journal.UpdateKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Writes the update journal as a JSON array of {@code {name, value, kind}} objects.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonJournalExporter implements JournalExporter {

    private final ObjectMapper objectMapper;

    @Override
    public String export(List<JournalEntry> journal) {
        try {
            return objectMapper.writeValueAsString(toDtos(journal));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize journal", e);
        }
    }

    @Override
    public void export(List<JournalEntry> journal, Path target) {
        try {
            objectMapper.writeValue(target.toFile(), toDtos(journal));
            log.info("Exported {} journal entries to {}", journal.size(), target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write journal " + target, e);
        }
    }

    @Override
    public List<JournalEntry> load(Path source) {
        try {
            JournalEntryDto[] dtos = objectMapper.readValue(source.toFile(), JournalEntryDto[].class);
            return Arrays.stream(dtos)
                    .map(dto -> new JournalEntry(dto.name, dto.value, UpdateKind.valueOf(dto.kind)))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read journal " + source, e);
        }
    }

    private static List<JournalEntryDto> toDtos(List<JournalEntry> journal) {
        return journal.stream().map(JournalEntryDto::of).toList();
    }

    // DTO class for JSON (de)serialization
    static class JournalEntryDto {
        public String name;
        public Object value;
        public String kind;

        static JournalEntryDto of(JournalEntry entry) {
            JournalEntryDto dto = new JournalEntryDto();
            dto.name = entry.name();
            dto.value = entry.value();
            dto.kind = entry.kind().name();
            return dto;
        }
    }
}
