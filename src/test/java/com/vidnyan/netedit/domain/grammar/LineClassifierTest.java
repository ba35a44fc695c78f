package com.vidnyan.netedit.domain.grammar;

import com.vidnyan.netedit.domain.error.NetlistSyntaxException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineClassifierTest {

    private final LineClassifier classifier = new LineClassifier(GrammarTable.standard());

    @Test
    void classify_ShouldRecognizeComponentsByPrefix() {
        ClassifiedLine resistor = classifier.classify("R1 a b 10k");
        ClassifiedLine lowerCase = classifier.classify("  c3 out 0 1u");

        assertEquals(LineKind.COMPONENT, resistor.kind());
        assertEquals("R", resistor.command());
        assertEquals(LineKind.COMPONENT, lowerCase.kind());
        assertEquals("C", lowerCase.command());
    }

    @Test
    void classify_ShouldTreatCommentsAndBlankLinesAsComments() {
        assertTrue(classifier.classify("* title").is(LineKind.COMMENT));
        assertTrue(classifier.classify("; note").is(LineKind.COMMENT));
        assertTrue(classifier.classify("# note").is(LineKind.COMMENT));
        assertTrue(classifier.classify("   ").is(LineKind.COMMENT));
        assertTrue(classifier.classify("").is(LineKind.COMMENT));
    }

    @Test
    void classify_ShouldRecognizeContinuation() {
        assertTrue(classifier.classify("+ tc=0.001").is(LineKind.CONTINUATION));
    }

    @Test
    void classify_ShouldMapBoundaryKeywords() {
        assertEquals(LineKind.SUBCIRCUIT_BEGIN, classifier.classify(".subckt AMP in out").kind());
        assertEquals(LineKind.SUBCIRCUIT_END, classifier.classify(".ENDS AMP").kind());
        assertEquals(LineKind.BLOCK_BEGIN, classifier.classify(".control").kind());
        assertEquals(LineKind.BLOCK_END, classifier.classify(".endc").kind());
        assertEquals(LineKind.END, classifier.classify(".end").kind());
    }

    @Test
    void classify_ShouldPreferLongestKeyword() {
        assertEquals(".PARAMS", classifier.classify(".params a=1").command());
        assertEquals(".PARAM", classifier.classify(".param a=1").command());
        assertEquals(".TRAN", classifier.classify(".tranx 1m").command());
    }

    @Test
    void classify_ShouldMatchBoundaryKeywordsOnlyExactly() {
        ClassifiedLine line = classifier.classify(".endsxyz");

        assertEquals(LineKind.DIRECTIVE, line.kind());
        assertEquals(".ENDSXYZ", line.command());
    }

    @Test
    void classify_ShouldKeepUnknownDirectivesAsGeneric() {
        ClassifiedLine line = classifier.classify(".backanno");
        ClassifiedLine unknown = classifier.classify(".probe v(out)");

        assertEquals(".BACKANNO", line.command());
        assertEquals(LineKind.DIRECTIVE, unknown.kind());
        assertEquals(".PROBE", unknown.command());
    }

    @Test
    void classify_ShouldRejectUnknownFirstCharacter() {
        NetlistSyntaxException e = assertThrows(NetlistSyntaxException.class, () -> classifier.classify("?1 a b"));

        assertEquals("?1 a b", e.getLine());
    }
}
