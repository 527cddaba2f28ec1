package org.proofmin.proof;

import org.junit.Before;
import org.junit.Test;
import org.proofmin.Fixtures;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class SuperpositionAnnotatorTest {

    private Extraction extraction;
    private final SuperpositionAnnotator annotator = new SuperpositionAnnotator();

    @Before
    public void setUp() {
        ProofStepParser parser = new ProofStepParser();
        ParsedProof proof = parser.parse(Fixtures.read("equation2892_vampire.proof"));
        extraction = parser.extract(proof, new NamedFormula("single_lemma_0011", "op(X0,op(X1,X2)) = op(X0,X2)"))
                .orElseThrow();
    }

    @Test
    public void testAnnotatedText() {
        SuperpositionAnnotator.Annotation annotation = annotator.annotate(extraction, List.of(), "single_lemma_0011");

        String expected = SuperpositionAnnotator.HEADER + "\n"
                + "% lemma_0001: op(op(op(X3,X0),X2),X2) = X3 | deps: a1, a1\n"
                + "% single_lemma_0011: op(X0,op(X1,X2)) = op(X0,X2)"
                + " | deps: lemma_0001: op(op(op(X3,X0),X2),X2) = X3, a1\n"
                + "\n";
        assertEquals(expected, annotation.text());
        assertEquals(Map.of(1, "lemma_0001", 2, "single_lemma_0011"), annotation.renaming());
    }

    @Test
    public void testNumberingContinuesAfterExistingDependencies() {
        List<NamedFormula> existing = List.of(new NamedFormula("lemma_0004", "op(X0,X0) = X0"));

        SuperpositionAnnotator.Annotation annotation = annotator.annotate(extraction, existing, null);

        assertEquals("lemma_0005", annotation.renaming().get(1));
        assertEquals("lemma_0006", annotation.renaming().get(2));
    }

    @Test
    public void testExtendAccumulatesRenamedSteps() {
        SuperpositionAnnotator.Annotation annotation = annotator.annotate(extraction, List.of(), "single_lemma_0011");
        ExtraDependencies extra = new ExtraDependencies();

        extra.extend(extraction, annotation.renaming());

        assertEquals(2, extra.size());
        assertEquals(new NamedFormula("single_lemma_0011", "op(X0,op(X1,X2)) = op(X0,X2)"), extra.entries().get(1));
        assertEquals(11, extra.lastLemmaIndex());
    }
}
