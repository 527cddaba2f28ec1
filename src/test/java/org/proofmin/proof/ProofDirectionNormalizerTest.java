package org.proofmin.proof;

import org.junit.Before;
import org.junit.Test;
import org.proofmin.Fixtures;

import java.util.List;
import java.util.SortedMap;

import static org.junit.Assert.*;

public class ProofDirectionNormalizerTest {

    private ProofStepParser parser;
    private ProofDirectionNormalizer normalizer;

    @Before
    public void setUp() {
        parser = new ProofStepParser();
        normalizer = new ProofDirectionNormalizer();
    }

    @Test
    public void testNegatedConjectureChain() {
        SortedMap<Integer, SuperpositionStep> steps = parser.parseAll(Fixtures.read("equation2892_vampire.proof"));

        assertEquals(List.of(3, 4, 6, 8, 20, 30, 39), normalizer.negatedConjectureChain(steps));
    }

    @Test
    public void testTurnaroundNeeded() {
        SortedMap<Integer, SuperpositionStep> steps = parser.parseAll(Fixtures.read("equation2892_vampire.proof"));

        assertTrue(normalizer.needsTurnaround(steps));
    }

    @Test
    public void testTurnaroundRewritesChain() {
        SortedMap<Integer, SuperpositionStep> steps = parser.parseAll(Fixtures.read("equation2892_vampire.proof"));

        SortedMap<Integer, SuperpositionStep> normalized = normalizer.normalize(steps);

        assertEquals(steps.keySet(), normalized.keySet());
        assertEquals("$true", normalized.get(8).formula());
        assertEquals("X0 = op(op(op(X0,X1),X12),X1)", normalized.get(20).formula());
        assertEquals("X0 = op(op(op(X0,X1),X0),X1)", normalized.get(30).formula());
        assertEquals("X0 = op(op(op(X0,X1),op(X2,X0)),X1)", normalized.get(39).formula());

        // i passi fuori dalla catena e le dipendenze restano invariati
        assertEquals(steps.get(13), normalized.get(13));
        assertEquals(steps.get(20).deps(), normalized.get(20).deps());
        assertEquals(steps.get(20).inference(), normalized.get(20).inference());
    }

    @Test
    public void testNoTurnaroundWhenFalsumFollows() {
        SortedMap<Integer, SuperpositionStep> steps = parser.parseAll(Fixtures.read("equation650_vampire.proof"));

        assertEquals(List.of(3, 71, 73, 75, 158, 159), normalizer.negatedConjectureChain(steps));
        assertFalse(normalizer.needsTurnaround(steps));
        assertEquals(steps, normalizer.normalize(steps));
    }

    @Test
    public void testTurnaroundWithLongChain() {
        SortedMap<Integer, SuperpositionStep> steps = parser.parseAll(Fixtures.read("equation4417_vampire.proof"));

        assertTrue(normalizer.needsTurnaround(steps));

        SortedMap<Integer, SuperpositionStep> normalized = normalizer.normalize(steps);
        assertEquals(ProofDirectionNormalizer.VERUM, normalized.get(9).formula());
        assertEquals("op(X0,op(X0,X1)) = op(X48,op(X48,X50))", normalized.get(16).formula());
        assertEquals("op(X0,op(X0,X1)) = op(op(X2,X3),X2)", normalized.get(15184).formula());
        assertEquals(steps.get(7), normalized.get(7));
    }

    @Test
    public void testRewrite() {
        assertEquals("X1 = op(X1,X0)", ProofDirectionNormalizer.rewrite("sK0 != op(sK0,X0)"));
        assertEquals("op(X0,X1) = X1", ProofDirectionNormalizer.rewrite("op(X0,X1) = X1"));
    }

    @Test
    public void testEmptyProof() {
        assertFalse(normalizer.needsTurnaround(parser.parseAll("")));
    }
}
