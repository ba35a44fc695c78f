package com.vidnyan.netedit.domain.resolve;

import com.vidnyan.netedit.domain.grammar.GrammarTable;
import com.vidnyan.netedit.domain.model.Scope;
import com.vidnyan.netedit.domain.parse.ScopeTreeBuilder;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LibraryCacheTest {

    private static final String LIBRARY = """
            * models
            .SUBCKT LIBSUB p n
            R1 p n 3k
            .ENDS LIBSUB
            """;

    @Test
    void find_ShouldReadEachDefinitionOnce() {
        // Arrange
        InMemoryLibraryLoader loader = new InMemoryLibraryLoader().with("models.lib", LIBRARY);
        LibraryCache cache = new LibraryCache(loader, new ScopeTreeBuilder(GrammarTable.standard()));

        // Act
        Optional<Scope> first = cache.find("models.lib", "LIBSUB", null);
        Optional<Scope> second = cache.find("models.lib", "libsub", null);

        // Assert
        assertTrue(first.isPresent());
        assertSame(first.get(), second.get());
        assertTrue(first.get().isReadOnly());
        assertEquals(1, loader.reads());
        assertEquals(1, cache.size());
    }

    @Test
    void find_ShouldCacheMisses() {
        InMemoryLibraryLoader loader = new InMemoryLibraryLoader().with("models.lib", LIBRARY);
        LibraryCache cache = new LibraryCache(loader, new ScopeTreeBuilder(GrammarTable.standard()));

        assertTrue(cache.find("models.lib", "OTHER", null).isEmpty());
        assertTrue(cache.find("models.lib", "OTHER", null).isEmpty());
        assertTrue(cache.find("absent.lib", "LIBSUB", null).isEmpty());

        assertEquals(1, loader.reads());
    }

    @Test
    void invalidate_ShouldForceReload() {
        InMemoryLibraryLoader loader = new InMemoryLibraryLoader().with("models.lib", LIBRARY);
        LibraryCache cache = new LibraryCache(loader, new ScopeTreeBuilder(GrammarTable.standard()));
        cache.find("models.lib", "LIBSUB", null);

        cache.invalidate();
        cache.find("models.lib", "LIBSUB", null);

        assertEquals(2, loader.reads());
    }
}
