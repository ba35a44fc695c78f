package com.vidnyan.netedit.domain.parse;

import com.vidnyan.netedit.domain.error.NetlistStructureException;
import com.vidnyan.netedit.domain.grammar.GrammarTable;
import com.vidnyan.netedit.domain.grammar.LineClassifier;
import com.vidnyan.netedit.domain.grammar.LineKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NetlistLexerTest {

    private final LineClassifier classifier = new LineClassifier(GrammarTable.standard());

    @Test
    void splitLines_ShouldKeepEachTerminator() {
        List<String> lines = NetlistLexer.splitLines("a\r\nb\nc\rd");

        assertEquals(List.of("a\r\n", "b\n", "c\r", "d"), lines);
    }

    @Test
    void detectTerminator_ShouldUseFirstLineEnding() {
        assertEquals("\r\n", NetlistLexer.detectTerminator("* t\r\n.END\n", "\n"));
        assertEquals("\n", NetlistLexer.detectTerminator("* t\n.END\r\n", "\r\n"));
        assertEquals("\r\n", NetlistLexer.detectTerminator("* t", "\r\n"));
    }

    @Test
    void next_ShouldFoldContinuationLines() {
        // Arrange
        NetlistLexer lexer = new NetlistLexer("R1 a b 10k\n+ tc=0.001\n  + m=2\n.END\n", classifier);

        // Act
        LogicalLine line = lexer.next();

        // Assert
        assertEquals(LineKind.COMPONENT, line.kind());
        assertEquals("R1 a b 10k\n+ tc=0.001\n  + m=2\n", line.rawText());
        assertEquals("R1 a b 10k tc=0.001 m=2", line.logicalText());
        assertEquals(1, line.lineNumber());
        assertEquals(LineKind.END, lexer.next().kind());
        assertFalse(lexer.hasNext());
    }

    @Test
    void next_ShouldRejectLeadingContinuation() {
        NetlistLexer lexer = new NetlistLexer("+ tc=1\n.END\n", classifier);

        NetlistStructureException e = assertThrows(NetlistStructureException.class, lexer::next);

        assertEquals(1, e.getLineNumber());
    }
}
