package org.proofmin.minimize;

import java.util.Optional;

/**
 * Combinazione valutata di radice, lemma di supporto e prova assemblata.
 *
 * @param rootLemma lemma radice
 * @param supportLemma lemma storico, singolo o astratto usato come supporto; null per la sola radice
 * @param kind strategia con cui il candidato è stato costruito
 * @param proofText prova combinata annotata
 * @param totalSteps somma dei passi dei soli segmenti mantenuti
 * @param lemmaCount numero di nodi del grafo delle dipendenze della radice
 */
public record Candidate(String rootLemma,
                        String supportLemma,
                        Kind kind,
                        String proofText,
                        int totalSteps,
                        int lemmaCount) {

    public enum Kind {
        HISTORY,
        SINGLE,
        ABSTRACT,
        ROOT_ONLY
    }

    public Optional<String> support() {
        return Optional.ofNullable(supportLemma);
    }

    /**
     * Ordine lessicografico su (passi totali, numero di lemmi); solo un valore
     * strettamente minore sostituisce il migliore corrente.
     */
    public boolean isBetterThan(Candidate other) {
        if (other == null) {
            return true;
        }
        if (totalSteps != other.totalSteps) {
            return totalSteps < other.totalSteps;
        }
        return lemmaCount < other.lemmaCount;
    }
}
