package org.proofmin.proof;

import org.junit.Before;
import org.junit.Test;
import org.proofmin.Fixtures;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;

import static org.junit.Assert.*;

public class ProofStepParserTest {

    private ProofStepParser parser;
    private String proof;

    @Before
    public void setUp() {
        parser = new ProofStepParser();
        proof = Fixtures.read("equation2892_vampire.proof");
    }

    //region PARSING

    @Test
    public void testParseAllKeepsOriginalIndices() {
        SortedMap<Integer, SuperpositionStep> all = parser.parseAll(proof);

        assertEquals(15, all.size());
        assertEquals(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 13, 14, 20, 21, 30, 39), List.copyOf(all.keySet()));

        SuperpositionStep step = all.get(20);
        assertEquals("sK0 != op(op(op(sK0,sK1),sK0),sK1)", step.formula());
        assertEquals("backward", step.rule());
        assertEquals("backward demodulation 8,13", step.inference());
        assertEquals(List.of(new SuperpositionStep.Dependency(8, 8), new SuperpositionStep.Dependency(13, 13)), step.deps());
        assertTrue(all.get(3).negatedConjecture());
        assertFalse(all.get(9).negatedConjecture());
    }

    @Test
    public void testParseStartsAtFirstDerivation() {
        ParsedProof parsed = parser.parse(proof);

        assertEquals(7, parsed.steps().size());
        assertEquals("op(op(op(X3,X0),X2),X2) = X3", parsed.steps().get(1).formula());
        assertEquals("$false", parsed.steps().get(7).formula());

        SuperpositionStep step = parsed.steps().get(4);
        assertEquals(List.of(new SuperpositionStep.Dependency(8, SuperpositionStep.EXTERNAL),
                new SuperpositionStep.Dependency(13, 2)), step.deps());
        assertTrue(step.deps().get(0).isExternal());
    }

    @Test
    public void testUnnamedInputFallsBackToDefaultAxiom() {
        ParsedProof parsed = parser.parse(proof);

        assertEquals(ParsedProof.DEFAULT_AXIOM, parsed.externalName(7));
        assertEquals(ParsedProof.DEFAULT_AXIOM, parsed.externalName(8));
    }

    @Test
    public void testNamedInputIsTracedBack() {
        String text = """
                1. op(X0,X1) = X0 [input left_zero]
                2. op(X0,X1) = X0 [cnf transformation 1]
                3. op(X0,op(X0,X1)) = X0 [superposition 2,2]
                4. $false [subsumption resolution 3,2]
                """;
        ParsedProof parsed = parser.parse(text);

        assertEquals(2, parsed.steps().size());
        assertEquals("left_zero", parsed.externalName(2));
    }

    @Test
    public void testNoDerivation() {
        assertTrue(parser.parse("1. op(X0,X1) = X0 [input]\n% commento\n").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parseAll("testo senza passi numerati").isEmpty());
    }

    //endregion

    //region CHIUSURA ED ESTRAZIONE

    @Test
    public void testDependencyClosure() {
        ParsedProof parsed = parser.parse(proof);

        Set<Integer> closure = ProofStepParser.dependencyClosure(parsed.steps(), 6);

        assertEquals(Set.of(1, 2, 3, 4, 6), closure);
        assertFalse(closure.contains(SuperpositionStep.EXTERNAL));
    }

    @Test
    public void testDependencyClosureIsIdempotent() {
        ParsedProof parsed = parser.parse(proof);
        Set<Integer> closure = ProofStepParser.dependencyClosure(parsed.steps(), 7);

        assertEquals(closure, ProofStepParser.dependencyClosure(parsed.steps(), closure));
    }

    @Test
    public void testLocate() {
        ParsedProof parsed = parser.parse(proof);

        assertEquals(Optional.of(2), parser.locate(parsed.steps(), "op(X0,op(X1,X2)) = op(X0,X2)"));
        assertEquals(Optional.empty(), parser.locate(parsed.steps(), "f(X0) = X0"));
    }

    @Test
    public void testExtract() {
        ParsedProof parsed = parser.parse(proof);
        NamedFormula target = new NamedFormula("single_lemma_0011", "! [X0,X1,X2] : op(X0,op(X1,X2)) = op(X0,X2)");

        Extraction extraction = parser.extract(parsed, target).orElseThrow();

        assertEquals(2, extraction.stepCount());
        assertEquals(2, extraction.derivedIndex());
        assertEquals("single_lemma_0011", extraction.derivedName());
        assertEquals(Set.of(1, 2), extraction.proof().steps().keySet());
    }

    @Test
    public void testExtractSkipsMissingTargets() {
        ParsedProof parsed = parser.parse(proof);
        List<NamedFormula> targets = List.of(
                new NamedFormula("missing", "f(X0) = X0"),
                new NamedFormula("found", "op(X0,op(X1,X2)) = op(X0,X2)"));

        Extraction extraction = parser.extract(parsed, targets).orElseThrow();

        assertEquals("found", extraction.derivedName());
        assertFalse(parser.extract(parsed, targets.subList(0, 1)).isPresent());
    }

    //endregion
}
