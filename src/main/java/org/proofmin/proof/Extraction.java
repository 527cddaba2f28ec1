package org.proofmin.proof;

/**
 * Passi estratti da una prova per dedurre un fatto bersaglio.
 *
 * @param proof sottoinsieme dei passi (con i nomi degli input esterni)
 * @param derivedIndex indice sequenziale del passo che deduce il bersaglio
 * @param derivedName nome del lemma bersaglio
 */
public record Extraction(ParsedProof proof, int derivedIndex, String derivedName) {

    public int stepCount() {
        return proof.steps().size();
    }
}
