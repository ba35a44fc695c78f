package com.vidnyan.netedit.adapter.in.web;

import com.vidnyan.netedit.application.port.in.EditNetlistUseCase;
import com.vidnyan.netedit.application.port.in.EditNetlistUseCase.EditCommand;
import com.vidnyan.netedit.application.port.in.EditNetlistUseCase.EditOutcome;
import com.vidnyan.netedit.application.port.in.EditNetlistUseCase.EditResult;
import com.vidnyan.netedit.application.port.in.EditNetlistUseCase.EditStats;
import com.vidnyan.netedit.domain.error.NetlistException;
import com.vidnyan.netedit.domain.error.NetlistStructureException;
import com.vidnyan.netedit.domain.journal.JournalEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for editing netlists held by the caller.
 */
@RestController
@RequestMapping("/api/netlist")
public class NetlistEditController {

    private static final Logger log = LoggerFactory.getLogger(NetlistEditController.class);

    private final EditNetlistUseCase editNetlistUseCase;

    public NetlistEditController(EditNetlistUseCase editNetlistUseCase) {
        this.editNetlistUseCase = editNetlistUseCase;
    }

    @PostMapping("/edit")
    public EditResponse edit(@RequestBody EditRequestBody request) {
        if (request.netlist() == null || request.netlist().isBlank()) {
            throw new NetlistStructureException("Empty netlist", 0);
        }
        List<EditCommand> commands = request.commands() != null ? request.commands() : List.of();
        log.info("Received edit request");
        log.info("  Netlist: {} chars", request.netlist().length());
        log.info("  Commands: {}", commands.size());

        EditResult result = editNetlistUseCase.edit(EditNetlistUseCase.EditRequest.of(request.netlist(), commands));

        return new EditResponse(
            result.text(),
            result.journal(),
            result.outcomes(),
            result.stats()
        );
    }

    @GetMapping("/health")
    public String health() {
        return "OK - netedit";
    }

    @ExceptionHandler(NetlistException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleNetlistError(NetlistException e) {
        log.warn("Rejected netlist: {}", e.getMessage());
        return new ErrorResponse(e.getClass().getSimpleName(), e.getMessage());
    }

    public record EditRequestBody(
        String netlist,              // Full netlist text
        List<EditCommand> commands
    ) {}

    public record EditResponse(
        String netlist,
        List<JournalEntry> journal,
        List<EditOutcome> outcomes,
        EditStats stats
    ) {}

    public record ErrorResponse(
        String error,
        String message
    ) {}
}
