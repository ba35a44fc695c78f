package com.vidnyan.netedit.application.service;

import com.vidnyan.netedit.application.port.in.EditNetlistUseCase;
import com.vidnyan.netedit.application.port.out.JournalExporter;
import com.vidnyan.netedit.application.port.out.NetlistStore;
import com.vidnyan.netedit.domain.document.NetlistContext;
import com.vidnyan.netedit.domain.document.NetlistDocument;
import com.vidnyan.netedit.domain.error.NetlistException;
import com.vidnyan.netedit.domain.journal.JournalEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Application service that parses a netlist, runs the edit commands against
 * it one by one and serializes the result. Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NetlistEditService implements EditNetlistUseCase {

    private final NetlistContext netlistContext;
    private final NetlistStore netlistStore;
    private final JournalExporter journalExporter;

    @Override
    public EditResult edit(EditRequest request) {
        Instant startTime = Instant.now();

        // Step 1: Parse netlist
        log.info("Step 1: Parsing netlist...");
        NetlistContext context = request.baseDirectory() != null
                ? netlistContext.withBaseDirectory(request.baseDirectory())
                : netlistContext;
        NetlistDocument document = NetlistDocument.parse(request.text(), context);
        int components = (int) document.root().components().count();
        int subcircuits = document.getSubcircuitNames().size();
        log.info("Parsed: {} components, {} subcircuits", components, subcircuits);

        // Step 2: Apply commands
        log.info("Step 2: Applying {} commands...", request.commands().size());
        List<EditOutcome> outcomes = new ArrayList<>();
        for (EditCommand command : request.commands()) {
            outcomes.add(apply(document, command));
        }

        // Step 3: Serialize
        log.info("Step 3: Writing netlist...");
        String text = document.render();

        Duration totalDuration = Duration.between(startTime, Instant.now());
        EditStats stats = new EditStats(
                components,
                subcircuits,
                (int) outcomes.stream().filter(o -> o.status() == EditOutcome.Status.APPLIED).count(),
                document.journal().size(),
                totalDuration.toMillis()
        );
        log.info("Edit complete: {} journal entries in {}ms", stats.journalEntries(), stats.totalDurationMs());

        return new EditResult(text, document.journal().snapshot(), outcomes, stats);
    }

    @Override
    public EditResult editFile(FileEditRequest request) {
        log.info("Editing: {}", request.input());
        NetlistStore.StoredNetlist stored = netlistStore.read(request.input());
        Path baseDirectory = request.input().toAbsolutePath().getParent();

        EditResult result = edit(new EditRequest(stored.text(), request.commands(), baseDirectory));

        netlistStore.write(request.target(), result.text(), stored.charset(), stored.byteOrderMark());
        log.info("Written: {}", request.target());
        if (request.journal() != null) {
            journalExporter.export(result.journal(), request.journal());
            log.info("Journal written: {}", request.journal());
        }
        return result;
    }

    private EditOutcome apply(NetlistDocument document, EditCommand command) {
        log.info("  Applying: {}", command.describe());
        List<JournalEntry> before = document.journal().snapshot();
        try {
            execute(document, command);
        } catch (NetlistException | IllegalArgumentException e) {
            log.error("Command {} failed: {}", command.describe(), e.getMessage());
            return EditOutcome.failed(command, e.getMessage());
        }
        if (document.journal().entries().equals(before)) {
            return EditOutcome.skipped(command, "No change");
        }
        return EditOutcome.applied(command, document.journal().size() - before.size());
    }

    private void execute(NetlistDocument document, EditCommand command) {
        switch (command.op()) {
            case SET_VALUE -> document.setComponentValue(command.target(), command.value());
            case SET_MODEL -> document.setElementModel(command.target(), String.valueOf(command.value()));
            case SET_COMPONENT_PARAMETER -> document.setComponentParameter(command.target(), command.key(), command.value());
            case REMOVE_COMPONENT_PARAMETER -> document.setComponentParameter(command.target(), command.key(), null);
            case SET_PARAMETER -> document.setParameter(command.target(), command.value());
            case REMOVE_PARAMETER -> document.removeParameter(command.target());
            case ADD_INSTRUCTION -> document.addInstruction(command.target());
            case REMOVE_INSTRUCTION -> document.removeInstruction(command.target());
            case REMOVE_INSTRUCTIONS_MATCHING -> document.removeInstructionsMatching(command.target());
            case ADD_CONTROL_SECTION -> document.addControlSection(command.target());
            case REMOVE_CONTROL_SECTION -> document.removeControlSection(Integer.parseInt(command.target().strip()));
            case ADD_COMPONENT -> document.addComponent(command.target() == null ? "" : command.target(), command.key());
            case REMOVE_COMPONENT -> document.removeComponent(command.target());
        }
    }
}
