package com.vidnyan.netedit.adapter.out.file;

import com.vidnyan.netedit.domain.error.EncodingDetectException;
import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Guesses the encoding of a netlist by trial-decoding its first bytes with
 * each candidate in turn. A candidate is accepted when the prefix decodes
 * cleanly and starts with the expected pattern.
 */
@Slf4j
public class EncodingDetector {

    private final List<Charset> candidates;
    private final Charset fallback;
    private final int probeLength;
    private final Pattern expected;

    /**
     * @param fallback used when no candidate fits; null makes that an error
     * @param expected pattern the decoded text must start with; null accepts anything
     */
    public EncodingDetector(List<Charset> candidates, Charset fallback, int probeLength, Pattern expected) {
        this.candidates = List.copyOf(candidates);
        this.fallback = fallback;
        this.probeLength = probeLength;
        this.expected = expected;
    }

    public Charset detect(byte[] content, String source) {
        int length = Math.min(content.length, probeLength);
        for (Charset charset : candidates) {
            String probe = decode(charset, content, length);
            if (probe == null || probe.isEmpty()) {
                continue;
            }
            if (probe.charAt(0) == '\uFEFF') {
                probe = probe.substring(1);
            }
            if (expected != null && !expected.matcher(probe).lookingAt()) {
                continue;
            }
            // Single-byte decoders read UTF-16LE text as characters separated by NULs
            if (probe.indexOf('\0') >= 0) {
                continue;
            }
            log.debug("Detected {} for {}", charset.name(), source);
            return charset;
        }
        if (fallback != null) {
            log.warn("Unable to detect encoding of {}, using {}", source, fallback.name());
            return fallback;
        }
        throw new EncodingDetectException(expected != null
                ? "Expected pattern \"" + expected.pattern() + "\" not found in file: " + source
                : "Unable to detect encoding of file: " + source);
    }

    private static String decode(Charset charset, byte[] content, int length) {
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        CharBuffer out = CharBuffer.allocate(length * 2 + 2);
        // A multi-byte sequence cut by the probe end is not an error
        CoderResult result = decoder.decode(ByteBuffer.wrap(content, 0, length), out, false);
        if (result.isError()) {
            return null;
        }
        out.flip();
        return out.toString();
    }
}
