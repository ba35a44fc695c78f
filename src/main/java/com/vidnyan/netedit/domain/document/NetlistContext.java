package com.vidnyan.netedit.domain.document;

import com.vidnyan.netedit.domain.grammar.GrammarTable;
import com.vidnyan.netedit.domain.parse.ScopeTreeBuilder;
import com.vidnyan.netedit.domain.resolve.LibraryCache;
import com.vidnyan.netedit.domain.resolve.LibraryLoader;

import java.nio.file.Path;

/**
 * Collaborators a document is parsed and edited with.
 *
 * @param grammarTable      component grammars
 * @param builder           scope tree builder sharing the same grammars
 * @param libraryCache      process-wide cache of library definitions
 * @param baseDirectory     directory of the netlist file, used to find libraries; may be null
 * @param defaultTerminator line terminator used when the text has none
 */
public record NetlistContext(
    GrammarTable grammarTable,
    ScopeTreeBuilder builder,
    LibraryCache libraryCache,
    Path baseDirectory,
    String defaultTerminator
) {

    /**
     * Standard grammars and no library search.
     */
    public static NetlistContext standalone() {
        GrammarTable table = GrammarTable.standard();
        ScopeTreeBuilder builder = new ScopeTreeBuilder(table);
        return new NetlistContext(table, builder, new LibraryCache(LibraryLoader.none(), builder), null, "\n");
    }

    public NetlistContext withBaseDirectory(Path directory) {
        return new NetlistContext(grammarTable, builder, libraryCache, directory, defaultTerminator);
    }
}
