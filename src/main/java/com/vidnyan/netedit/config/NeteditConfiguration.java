package com.vidnyan.netedit.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.netedit.domain.document.NetlistContext;
import com.vidnyan.netedit.domain.grammar.GrammarTable;
import com.vidnyan.netedit.domain.parse.ScopeTreeBuilder;
import com.vidnyan.netedit.domain.resolve.LibraryCache;
import com.vidnyan.netedit.domain.resolve.LibraryLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for netedit components.
 * Wires the framework-free domain objects into the application.
 */
@Slf4j
@Configuration
public class NeteditConfiguration {

    /**
     * ObjectMapper for JSON parsing.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public GrammarTable grammarTable() {
        GrammarTable table = GrammarTable.standard();
        log.info("Registered component grammars for prefixes: {}", table.prefixes());
        return table;
    }

    @Bean
    public ScopeTreeBuilder scopeTreeBuilder(GrammarTable grammarTable) {
        return new ScopeTreeBuilder(grammarTable);
    }

    /**
     * Process-wide library cache. Stale once library files change on disk.
     */
    @Bean
    public LibraryCache libraryCache(LibraryLoader libraryLoader, ScopeTreeBuilder scopeTreeBuilder) {
        return new LibraryCache(libraryLoader, scopeTreeBuilder);
    }

    @Bean
    public NetlistContext netlistContext(GrammarTable grammarTable, ScopeTreeBuilder scopeTreeBuilder,
                                         LibraryCache libraryCache, NeteditProperties properties) {
        return new NetlistContext(grammarTable, scopeTreeBuilder, libraryCache, null,
                properties.getLineTerminator());
    }
}
