package com.vidnyan.netedit.application.port.in;

import com.vidnyan.netedit.domain.journal.JournalEntry;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: apply a batch of edits to a netlist.
 * Each command succeeds or fails on its own; a failed command leaves the
 * document as the previous commands left it.
 */
public interface EditNetlistUseCase {

    /**
     * Edit netlist text held in memory.
     */
    EditResult edit(EditRequest request);

    /**
     * Edit a netlist file, writing the result and optionally the journal.
     */
    EditResult editFile(FileEditRequest request);

    /**
     * In-memory edit request.
     */
    record EditRequest(
        String text,
        List<EditCommand> commands,
        Path baseDirectory    // Where .LIB/.INC files are searched; may be null
    ) {
        public static EditRequest of(String text, List<EditCommand> commands) {
            return new EditRequest(text, commands, null);
        }
    }

    /**
     * File edit request.
     */
    record FileEditRequest(
        Path input,
        Path output,          // Null = overwrite input
        List<EditCommand> commands,
        Path journal          // Null = no journal file
    ) {
        public Path target() {
            return output != null ? output : input;
        }
    }

    /**
     * One edit, addressed by path.
     *
     * @param op     what to do
     * @param target component or parameter path, instruction text, or scope path for additions
     * @param key    component parameter name; for additions the line to add
     * @param value  new value; null removes a component parameter
     */
    record EditCommand(Op op, String target, String key, Object value) {

        public enum Op {
            SET_VALUE,
            SET_MODEL,
            SET_COMPONENT_PARAMETER,
            REMOVE_COMPONENT_PARAMETER,
            SET_PARAMETER,
            REMOVE_PARAMETER,
            ADD_INSTRUCTION,
            REMOVE_INSTRUCTION,
            REMOVE_INSTRUCTIONS_MATCHING,
            ADD_CONTROL_SECTION,
            REMOVE_CONTROL_SECTION,
            ADD_COMPONENT,
            REMOVE_COMPONENT
        }

        public static EditCommand setValue(String path, Object value) {
            return new EditCommand(Op.SET_VALUE, path, null, value);
        }

        public static EditCommand setComponentParameter(String path, String key, Object value) {
            return new EditCommand(Op.SET_COMPONENT_PARAMETER, path, key, value);
        }

        public static EditCommand setParameter(String path, Object value) {
            return new EditCommand(Op.SET_PARAMETER, path, null, value);
        }

        public static EditCommand addInstruction(String instruction) {
            return new EditCommand(Op.ADD_INSTRUCTION, instruction, null, null);
        }

        public static EditCommand removeInstruction(String instruction) {
            return new EditCommand(Op.REMOVE_INSTRUCTION, instruction, null, null);
        }

        public String describe() {
            StringBuilder sb = new StringBuilder(op.name()).append(' ').append(target);
            if (key != null) {
                sb.append(' ').append(key);
            }
            if (value != null) {
                sb.append(" = ").append(value);
            }
            return sb.toString();
        }
    }

    /**
     * What happened to one command.
     */
    record EditOutcome(EditCommand command, Status status, String message) {

        public enum Status {
            APPLIED,
            FAILED,
            SKIPPED
        }

        public static EditOutcome applied(EditCommand command, int journalEntries) {
            return new EditOutcome(command, Status.APPLIED, journalEntries + " journal entries");
        }

        public static EditOutcome failed(EditCommand command, String message) {
            return new EditOutcome(command, Status.FAILED, message);
        }

        public static EditOutcome skipped(EditCommand command, String reason) {
            return new EditOutcome(command, Status.SKIPPED, reason);
        }
    }

    /**
     * Edit result.
     */
    record EditResult(
        String text,
        List<JournalEntry> journal,
        List<EditOutcome> outcomes,
        EditStats stats
    ) {
        public boolean hasFailures() {
            return outcomes.stream().anyMatch(o -> o.status() == EditOutcome.Status.FAILED);
        }

        public int count(EditOutcome.Status status) {
            return (int) outcomes.stream()
                    .filter(o -> o.status() == status)
                    .count();
        }
    }

    /**
     * Edit statistics.
     */
    record EditStats(
        int components,
        int subcircuits,
        int commandsApplied,
        int journalEntries,
        long totalDurationMs
    ) {}
}
