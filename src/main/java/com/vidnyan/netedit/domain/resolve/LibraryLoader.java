package com.vidnyan.netedit.domain.resolve;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Finds and reads library files named by {@code .LIB} and {@code .INC} directives.
 */
public interface LibraryLoader {

    /**
     * Resolves a library reference as written in the netlist.
     *
     * @param library       file name or path from the directive
     * @param baseDirectory directory of the netlist being edited, may be null
     */
    Optional<Path> locate(String library, Path baseDirectory);

    /**
     * Decoded text of a located library.
     */
    String read(Path library);

    /**
     * Loader that never finds anything.
     */
    static LibraryLoader none() {
        return new LibraryLoader() {
            @Override
            public Optional<Path> locate(String library, Path baseDirectory) {
                return Optional.empty();
            }

            @Override
            public String read(Path library) {
                throw new IllegalStateException("No library loader configured");
            }
        };
    }
}
