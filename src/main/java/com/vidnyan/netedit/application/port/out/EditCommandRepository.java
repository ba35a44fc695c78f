package com.vidnyan.netedit.application.port.out;

import com.vidnyan.netedit.application.port.in.EditNetlistUseCase.EditCommand;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for loading batches of edit commands.
 */
public interface EditCommandRepository {

    List<EditCommand> load(Path file);
}
