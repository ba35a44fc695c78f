package com.vidnyan.netedit.adapter.out.library;

import com.vidnyan.netedit.adapter.out.file.EncodingDetector;
import com.vidnyan.netedit.config.NeteditProperties;
import com.vidnyan.netedit.domain.resolve.LibraryLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Finds library files named by {@code .LIB}/{@code .INC} directives.
 * <p>
 * Search order: the path as written when absolute, the netlist's directory,
 * the working directory, then each configured library path. Configured paths
 * and the netlist's directory are searched recursively, matching the file
 * name without regard to case.
 */
@Slf4j
@Component
public class FileSystemLibraryLoader implements LibraryLoader {

    private final List<Path> libraryPaths;
    private final EncodingDetector encodingDetector;

    @Autowired
    public FileSystemLibraryLoader(NeteditProperties properties) {
        this(properties.getLibraryPaths().stream().map(Path::of).toList(),
                new EncodingDetector(
                        properties.candidateCharsets(),
                        Charset.forName(properties.getDefaultEncoding()),
                        properties.getProbeLength(),
                        Pattern.compile(properties.getLibraryPattern())));
    }

    public FileSystemLibraryLoader(List<Path> libraryPaths, EncodingDetector encodingDetector) {
        this.libraryPaths = List.copyOf(libraryPaths);
        this.encodingDetector = encodingDetector;
    }

    @Override
    public Optional<Path> locate(String library, Path baseDirectory) {
        Path written = Path.of(library);
        if (written.isAbsolute()) {
            return Files.isRegularFile(written) ? Optional.of(written) : Optional.empty();
        }

        List<Path> direct = new ArrayList<>();
        if (baseDirectory != null) {
            direct.add(baseDirectory);
        }
        direct.add(Path.of("").toAbsolutePath());
        direct.addAll(libraryPaths);
        for (Path directory : direct) {
            Path candidate = directory.resolve(written);
            if (Files.isRegularFile(candidate)) {
                log.debug("Found library {} at {}", library, candidate);
                return Optional.of(candidate);
            }
        }

        List<Path> recursive = new ArrayList<>();
        if (baseDirectory != null) {
            recursive.add(baseDirectory);
        }
        recursive.addAll(libraryPaths);
        String fileName = written.getFileName().toString();
        for (Path directory : recursive) {
            Optional<Path> found = searchTree(directory, fileName);
            if (found.isPresent()) {
                log.debug("Found library {} at {}", library, found.get());
                return found;
            }
        }
        log.warn("Library {} not found", library);
        return Optional.empty();
    }

    @Override
    public String read(Path library) {
        try {
            byte[] content = Files.readAllBytes(library);
            Charset charset = encodingDetector.detect(content, library.toString());
            String text = new String(content, charset);
            return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read library " + library, e);
        }
    }

    private Optional<Path> searchTree(Path directory, String fileName) {
        if (!Files.isDirectory(directory)) {
            return Optional.empty();
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().equalsIgnoreCase(fileName))
                    .findFirst();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to search " + directory, e);
        }
    }
}
