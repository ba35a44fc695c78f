package com.vidnyan.netedit.application.port.out;

import java.nio.charset.Charset;
import java.nio.file.Path;

/**
 * Port for reading and writing netlist files.
 */
public interface NetlistStore {

    /**
     * Read a netlist, detecting its encoding.
     */
    StoredNetlist read(Path file);

    /**
     * Write a netlist in the given encoding, starting with a byte order mark when asked.
     */
    void write(Path file, String text, Charset charset, boolean byteOrderMark);

    default void write(Path file, String text, Charset charset) {
        write(file, text, charset, false);
    }

    /**
     * Decoded file content. The charset names a fixed byte order and the
     * byte order mark, if the file had one, is not part of the text.
     */
    record StoredNetlist(Path file, String text, Charset charset, boolean byteOrderMark) {}
}
