package com.vidnyan.netedit.adapter.out.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.netedit.application.port.in.EditNetlistUseCase.EditCommand;
import com.vidnyan.netedit.application.port.out.EditCommandRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Loads edit commands from a JSON array such as
 * {@code [{"op": "set-value", "target": "X1:R1", "value": "2k"}]}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonEditCommandRepository implements EditCommandRepository {

    private final ObjectMapper objectMapper;

    @Override
    public List<EditCommand> load(Path file) {
        try {
            CommandDto[] dtos = objectMapper.readValue(file.toFile(), CommandDto[].class);
            List<EditCommand> commands = Arrays.stream(dtos).map(this::mapToCommand).toList();
            log.info("Loaded {} commands from {}", commands.size(), file);
            return commands;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read commands " + file, e);
        }
    }

    private EditCommand mapToCommand(CommandDto dto) {
        EditCommand.Op op = mapOp(dto.op);
        if (op == EditCommand.Op.ADD_COMPONENT) {
            return new EditCommand(op, dto.scope != null ? dto.scope : "", dto.line, null);
        }
        return new EditCommand(op, dto.target, dto.key, dto.value);
    }

    private EditCommand.Op mapOp(String op) {
        if (op == null) {
            throw new IllegalArgumentException("Command without op");
        }
        return switch (op.toUpperCase(Locale.ROOT).replace("-", "_").replace(" ", "_")) {
            case "SET_VALUE", "VALUE" -> EditCommand.Op.SET_VALUE;
            case "SET_MODEL", "MODEL" -> EditCommand.Op.SET_MODEL;
            case "SET_COMPONENT_PARAMETER", "COMPONENT_PARAMETER" -> EditCommand.Op.SET_COMPONENT_PARAMETER;
            case "REMOVE_COMPONENT_PARAMETER" -> EditCommand.Op.REMOVE_COMPONENT_PARAMETER;
            case "SET_PARAMETER", "PARAMETER", "PARAM" -> EditCommand.Op.SET_PARAMETER;
            case "REMOVE_PARAMETER" -> EditCommand.Op.REMOVE_PARAMETER;
            case "ADD_INSTRUCTION", "INSTRUCTION" -> EditCommand.Op.ADD_INSTRUCTION;
            case "REMOVE_INSTRUCTION" -> EditCommand.Op.REMOVE_INSTRUCTION;
            case "REMOVE_INSTRUCTIONS_MATCHING", "REMOVE_XINSTRUCTION" -> EditCommand.Op.REMOVE_INSTRUCTIONS_MATCHING;
            case "ADD_CONTROL_SECTION" -> EditCommand.Op.ADD_CONTROL_SECTION;
            case "REMOVE_CONTROL_SECTION" -> EditCommand.Op.REMOVE_CONTROL_SECTION;
            case "ADD_COMPONENT" -> EditCommand.Op.ADD_COMPONENT;
            case "REMOVE_COMPONENT" -> EditCommand.Op.REMOVE_COMPONENT;
            default -> throw new IllegalArgumentException("Unknown command op: " + op);
        };
    }

    // DTO class for JSON deserialization
    static class CommandDto {
        public String op;
        public String target;
        public String key;
        public Object value;
        public String scope;
        public String line;
    }
}
