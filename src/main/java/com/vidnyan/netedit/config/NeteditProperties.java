package com.vidnyan.netedit.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for netlist editing.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "netedit")
public class NeteditProperties {

    /**
     * Directories searched, recursively, for files named by .LIB and .INC.
     * The netlist's own directory and the working directory are always searched first.
     */
    private List<String> libraryPaths = new ArrayList<>();

    /**
     * Encodings tried, in order, when reading a netlist.
     */
    private List<String> encodings = new ArrayList<>();

    /**
     * Encoding used when none of the candidates fits.
     */
    private String defaultEncoding = "UTF-8";

    /**
     * Number of leading bytes decoded per candidate.
     */
    private int probeLength = 128;

    /**
     * Pattern a decoded netlist must start with.
     */
    private String expectedPattern = "^\\*";

    /**
     * Pattern a decoded library file must start with.
     */
    private String libraryPattern = "[\\* a-zA-Z.]";

    /**
     * Line terminator for files that have none.
     */
    private String lineTerminator = "\n";

    @PostConstruct
    public void init() {
        // Set default encodings if not configured
        if (encodings.isEmpty()) {
            encodings.add("UTF-8");
            encodings.add("UTF-16");
            encodings.add("windows-1252");
            encodings.add("UTF-16LE");
            encodings.add("windows-1250");
            encodings.add("Shift_JIS");
        }
    }

    public List<Charset> candidateCharsets() {
        return encodings.stream()
                .filter(Charset::isSupported)
                .map(Charset::forName)
                .toList();
    }
}
