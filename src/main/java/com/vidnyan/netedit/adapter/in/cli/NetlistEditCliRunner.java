package com.vidnyan.netedit.adapter.in.cli;

import com.vidnyan.netedit.application.port.in.EditNetlistUseCase;
import com.vidnyan.netedit.application.port.in.EditNetlistUseCase.EditCommand;
import com.vidnyan.netedit.application.port.in.EditNetlistUseCase.EditOutcome;
import com.vidnyan.netedit.application.port.in.EditNetlistUseCase.EditResult;
import com.vidnyan.netedit.application.port.in.EditNetlistUseCase.FileEditRequest;
import com.vidnyan.netedit.application.port.out.EditCommandRepository;
import com.vidnyan.netedit.domain.journal.JournalEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * CLI Runner for batch netlist editing.
 * Runs when the netedit.edit.input property is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NetlistEditCliRunner implements CommandLineRunner {

    private final EditNetlistUseCase editNetlistUseCase;
    private final EditCommandRepository editCommandRepository;
    private final ConfigurableApplicationContext context;

    @Value("${netedit.edit.input:}")
    private String inputPath;

    @Value("${netedit.edit.output:}")
    private String outputPath;

    @Value("${netedit.edit.commands:}")
    private String commandsPath;

    @Value("${netedit.edit.journal:}")
    private String journalPath;

    @Override
    public void run(String... args) throws Exception {
        if (inputPath == null || inputPath.isBlank()) {
            log.info("No netlist specified. Set netedit.edit.input property.");
            return;
        }

        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║                  NETEDIT - Netlist Editor                    ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Editing: {}", truncatePath(inputPath, 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            List<EditCommand> commands = commandsPath == null || commandsPath.isBlank()
                    ? List.of()
                    : editCommandRepository.load(Path.of(commandsPath));

            FileEditRequest request = new FileEditRequest(
                    Path.of(inputPath),
                    outputPath == null || outputPath.isBlank() ? null : Path.of(outputPath),
                    commands,
                    journalPath == null || journalPath.isBlank() ? null : Path.of(journalPath));
            EditResult result = editNetlistUseCase.editFile(request);

            printResults(result);

            log.info("");
            log.info("Edit complete!");
        } finally {
            // Ensure application shuts down after editing
            SpringApplication.exit(context, () -> 0);
        }
    }

    private void printResults(EditResult result) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" EDIT RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Components:       {}", result.stats().components());
        log.info(" Subcircuits:      {}", result.stats().subcircuits());
        log.info(" Commands applied: {}", result.stats().commandsApplied());
        log.info(" Journal entries:  {}", result.stats().journalEntries());
        log.info(" Duration:         {}ms", result.stats().totalDurationMs());
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" COMMANDS:");
        log.info("   Applied: {}", result.count(EditOutcome.Status.APPLIED));
        log.info("   Skipped: {}", result.count(EditOutcome.Status.SKIPPED));
        log.info("   Failed:  {}", result.count(EditOutcome.Status.FAILED));
        log.info("═══════════════════════════════════════════════════════════════");

        if (result.hasFailures()) {
            log.info("");
            log.info(" FAILURES:");
            log.info("───────────────────────────────────────────────────────────────");
            result.outcomes().stream()
                    .filter(o -> o.status() == EditOutcome.Status.FAILED)
                    .forEach(o -> log.info(" {} -> {}", o.command().describe(), o.message()));
        }

        if (!result.journal().isEmpty()) {
            log.info("");
            log.info(" JOURNAL:");
            log.info("───────────────────────────────────────────────────────────────");
            for (JournalEntry entry : result.journal()) {
                log.info(" {} {} = {}", entry.kind(), entry.name(), entry.value());
            }
        }
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
