package org.proofmin.prover;

/**
 * Segmento di prova ottenuto ridimostrando un lemma.
 *
 * @param prover prover che ha prodotto la prova
 * @param text testo grezzo del prover oppure passi annotati
 * @param steps numero di passi del segmento
 * @param annotated true se il testo è il blocco di passi di superposizione
 */
public record ReProof(Prover prover, String text, int steps, boolean annotated) {
}
