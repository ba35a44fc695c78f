package com.vidnyan.netedit.domain.resolve;

import com.vidnyan.netedit.domain.model.Scope;
import com.vidnyan.netedit.domain.parse.ScopeTreeBuilder;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide cache of definitions read from library files, keyed by
 * (library, definition name). Misses are cached too. Nothing watches the
 * files: call {@link #invalidate()} after a library changes on disk.
 */
@Slf4j
public class LibraryCache {

    private record LocationKey(String library, Path baseDirectory) {
    }

    private record DefinitionKey(Path library, String definition) {
    }

    private final LibraryLoader loader;
    private final ScopeTreeBuilder builder;
    private final Map<LocationKey, Optional<Path>> locations = new ConcurrentHashMap<>();
    private final Map<DefinitionKey, Optional<Scope>> definitions = new ConcurrentHashMap<>();

    public LibraryCache(LibraryLoader loader, ScopeTreeBuilder builder) {
        this.loader = loader;
        this.builder = builder;
    }

    /**
     * Definition named {@code definition} inside the library referenced as {@code library}.
     */
    public Optional<Scope> find(String library, String definition, Path baseDirectory) {
        Optional<Path> path = locations.computeIfAbsent(new LocationKey(library, baseDirectory),
                key -> loader.locate(key.library(), key.baseDirectory()));
        if (path.isEmpty()) {
            log.debug("Library {} not found", library);
            return Optional.empty();
        }
        return find(path.get(), definition);
    }

    /**
     * Definition inside an already located library file.
     */
    public Optional<Scope> find(Path library, String definition) {
        return definitions.computeIfAbsent(new DefinitionKey(library, definition.toUpperCase(Locale.ROOT)),
                key -> load(key.library(), definition));
    }

    public void invalidate() {
        log.info("Clearing library cache ({} definitions)", definitions.size());
        locations.clear();
        definitions.clear();
    }

    public int size() {
        return definitions.size();
    }

    private Optional<Scope> load(Path library, String definition) {
        log.debug("Searching {} for {}", library, definition);
        Optional<Scope> found = builder.parseDefinition(loader.read(library), definition, library);
        if (found.isEmpty()) {
            log.debug("{} does not define {}", library, definition);
        }
        return found;
    }
}
