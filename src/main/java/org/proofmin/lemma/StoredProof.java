package org.proofmin.lemma;

import org.proofmin.prover.Prover;

/**
 * Prova canonica (la più corta) memorizzata per un lemma.
 */
public record StoredProof(String lemmaName, Prover prover, int steps, String text) {
}
