package com.vidnyan.netedit.adapter.out.file;

import com.vidnyan.netedit.application.port.out.NetlistStore;
import com.vidnyan.netedit.config.NeteditProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Netlist files on the local file system, encoding detected on read.
 */
@Slf4j
@Component
public class FileNetlistStore implements NetlistStore {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final EncodingDetector encodingDetector;

    @Autowired
    public FileNetlistStore(NeteditProperties properties) {
        this.encodingDetector = new EncodingDetector(
                properties.candidateCharsets(),
                Charset.forName(properties.getDefaultEncoding()),
                properties.getProbeLength(),
                Pattern.compile(properties.getExpectedPattern()));
    }

    FileNetlistStore(EncodingDetector encodingDetector) {
        this.encodingDetector = encodingDetector;
    }

    @Override
    public StoredNetlist read(Path file) {
        try {
            byte[] content = Files.readAllBytes(file);
            Charset charset = withByteOrder(encodingDetector.detect(content, file.toString()), content);
            String text = new String(content, charset);
            boolean byteOrderMark = !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK;
            if (byteOrderMark) {
                text = text.substring(1);
            }
            log.info("Read {} ({} chars, {}{})", file, text.length(), charset.name(), byteOrderMark ? " with BOM" : "");
            return new StoredNetlist(file, text, charset, byteOrderMark);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read netlist " + file, e);
        }
    }

    @Override
    public void write(Path file, String text, Charset charset, boolean byteOrderMark) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, byteOrderMark ? BYTE_ORDER_MARK + text : text, withByteOrder(charset, null));
            log.info("Wrote {} ({} chars, {})", file, text.length(), charset.name());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write netlist " + file, e);
        }
    }

    /**
     * Replaces the byte-order-neutral UTF-16 by the order the file uses, big-endian when it has no mark.
     * The UTF-16 encoder would otherwise always prepend a big-endian mark.
     */
    static Charset withByteOrder(Charset charset, byte[] content) {
        if (!StandardCharsets.UTF_16.equals(charset)) {
            return charset;
        }
        boolean littleEndian = content != null && content.length >= 2
                && (content[0] & 0xFF) == 0xFF && (content[1] & 0xFF) == 0xFE;
        return littleEndian ? StandardCharsets.UTF_16LE : StandardCharsets.UTF_16BE;
    }
}
