package org.proofmin.proof;

import org.junit.Test;

import static org.junit.Assert.*;

public class ProofUsageTest {

    @Test
    public void testCompletionAxiom() {
        String proof = "Axiom 2 (history_lemma_0012): op(X, X) = X.\nProof:\n  x\n= { by axiom 2 (history_lemma_0012) }\n  x\n";

        assertTrue(ProofUsage.uses(proof, "history_lemma_0012"));
        assertFalse(ProofUsage.uses(proof, "history_lemma_0001"));
    }

    @Test
    public void testCompletionStepOnly() {
        assertTrue(ProofUsage.uses("= { by axiom 4 (single_lemma_0003) R->L }", "single_lemma_0003"));
    }

    @Test
    public void testRefuterInputTag() {
        String proof = "12. op(X0,X1) = X0 [input single_lemma_0005]\n";

        assertTrue(ProofUsage.uses(proof, "single_lemma_0005"));
        assertFalse(ProofUsage.uses(proof, "single_lemma_000"));
    }

    @Test
    public void testAnnotatedDependencies() {
        String proof = SuperpositionAnnotator.HEADER + "\n"
                + "% lemma_0001: op(X0,X1) = X0 | deps: a1, history_lemma_0012: op(X0,X0) = X0\n";

        assertTrue(ProofUsage.uses(proof, "history_lemma_0012"));
        assertFalse(ProofUsage.uses(proof, "lemma_0012"));
    }

    @Test
    public void testMentionOutsideReferenceIsIgnored() {
        assertFalse(ProofUsage.uses("Goal 1 (history_lemma_0016): op(X, X) = X.", "history_lemma_0016"));
        assertFalse(ProofUsage.uses(null, "a1"));
        assertFalse(ProofUsage.uses("Axiom 1 (a1): x = x.", ""));
    }
}
