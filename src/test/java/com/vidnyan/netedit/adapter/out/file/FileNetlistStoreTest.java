package com.vidnyan.netedit.adapter.out.file;

import com.vidnyan.netedit.application.port.out.NetlistStore.StoredNetlist;
import com.vidnyan.netedit.config.NeteditProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileNetlistStoreTest {

    @TempDir
    Path tempDir;

    private FileNetlistStore store() {
        NeteditProperties properties = new NeteditProperties();
        properties.init();
        return new FileNetlistStore(properties);
    }

    @Test
    void read_ShouldDecodeAndStripByteOrderMark() throws IOException {
        // Arrange
        Path file = tempDir.resolve("bom.net");
        Files.write(file, "\uFEFF* title\n.END\n".getBytes(StandardCharsets.UTF_8));

        // Act
        StoredNetlist netlist = store().read(file);

        // Assert
        assertEquals("* title\n.END\n", netlist.text());
        assertEquals(StandardCharsets.UTF_8, netlist.charset());
        assertTrue(netlist.byteOrderMark());
        assertEquals(file, netlist.file());
    }

    @Test
    void readThenWrite_ShouldKeepLittleEndianUtf16BytesWithMark() throws IOException {
        // Arrange
        Path file = tempDir.resolve("ltspice.net");
        byte[] original = "\uFEFF* ltspice\r\nR1 a b 1k\r\n.end\r\n".getBytes(StandardCharsets.UTF_16LE);
        Files.write(file, original);
        Path copy = tempDir.resolve("copy.net");

        // Act
        StoredNetlist netlist = store().read(file);
        store().write(copy, netlist.text(), netlist.charset(), netlist.byteOrderMark());

        // Assert
        assertEquals((byte) 0xFF, original[0]);
        assertEquals(StandardCharsets.UTF_16LE, netlist.charset());
        assertEquals("* ltspice\r\nR1 a b 1k\r\n.end\r\n", netlist.text());
        assertArrayEquals(original, Files.readAllBytes(copy));
    }

    @Test
    void readThenWrite_ShouldKeepUtf8ByteOrderMark() throws IOException {
        Path file = tempDir.resolve("marked.net");
        byte[] original = "\uFEFF* marked\n.END\n".getBytes(StandardCharsets.UTF_8);
        Files.write(file, original);

        StoredNetlist netlist = store().read(file);
        store().write(file, netlist.text(), netlist.charset(), netlist.byteOrderMark());

        assertArrayEquals(original, Files.readAllBytes(file));
    }

    @Test
    void readThenWrite_ShouldNotAddMarkToPlainUtf8() throws IOException {
        Path file = tempDir.resolve("plain.net");
        byte[] original = "* plain\n.END\n".getBytes(StandardCharsets.UTF_8);
        Files.write(file, original);

        StoredNetlist netlist = store().read(file);
        store().write(file, netlist.text(), netlist.charset(), netlist.byteOrderMark());

        assertFalse(netlist.byteOrderMark());
        assertArrayEquals(original, Files.readAllBytes(file));
    }

    @Test
    void write_ShouldUseGivenCharsetAndCreateDirectories() throws IOException {
        Path file = tempDir.resolve("out/sub/edited.net");

        store().write(file, "* title\n.END\n", StandardCharsets.UTF_16LE);

        assertArrayEquals("* title\n.END\n".getBytes(StandardCharsets.UTF_16LE), Files.readAllBytes(file));
        assertEquals(StandardCharsets.UTF_16LE, store().read(file).charset());
    }

    @Test
    void read_ShouldWrapMissingFile() {
        assertThrows(UncheckedIOException.class, () -> store().read(tempDir.resolve("missing.net")));
    }
}
