package com.vidnyan.netedit.domain.resolve;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Library loader over a map of file name to text, counting reads.
 */
public class InMemoryLibraryLoader implements LibraryLoader {

    private final Map<String, String> libraries = new HashMap<>();
    private int reads;

    public InMemoryLibraryLoader with(String name, String text) {
        libraries.put(name, text);
        return this;
    }

    public int reads() {
        return reads;
    }

    @Override
    public Optional<Path> locate(String library, Path baseDirectory) {
        return libraries.containsKey(library) ? Optional.of(Path.of(library)) : Optional.empty();
    }

    @Override
    public String read(Path library) {
        reads++;
        return libraries.get(library.toString());
    }
}
