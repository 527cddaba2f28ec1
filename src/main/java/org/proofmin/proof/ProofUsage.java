package org.proofmin.proof;

import java.util.regex.Pattern;

/**
 * Verifica testuale dell'uso di un lemma in una prova.
 *
 * Un lemma è usato se il suo nome compare in una posizione di riferimento:
 * - riga {@code Axiom N (nome):} o giustificazione {@code by axiom N (nome)} del prover a completamento
 * - etichetta {@code [input nome]} del prover per refutazione
 * - elenco {@code deps:} di un segmento di passi di superposizione annotato
 */
public final class ProofUsage {

    private ProofUsage() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param proof testo della prova (grezzo o annotato)
     * @param lemmaName nome del lemma
     * @return true se la prova fa riferimento al lemma
     */
    public static boolean uses(String proof, String lemmaName) {
        if (proof == null || lemmaName == null || lemmaName.isBlank()) {
            return false;
        }
        String name = Pattern.quote(lemmaName);
        String word = "(?<![\\w])" + name + "(?![\\w])";

        Pattern completionAxiom = Pattern.compile("Axiom\\s+\\d+\\s+\\(" + name + "\\)\\s*:");
        Pattern completionStep = Pattern.compile("by\\s+axiom\\s+\\d+\\s+\\(" + name + "\\)");
        Pattern refuterInput = Pattern.compile("\\[input\\S*\\s+" + name + "\\]");
        Pattern annotatedDeps = Pattern.compile("\\|\\s*deps:.*" + word);

        for (String line : proof.split("\n")) {
            if (completionAxiom.matcher(line).find()
                    || completionStep.matcher(line).find()
                    || refuterInput.matcher(line).find()
                    || (line.startsWith("%") && annotatedDeps.matcher(line).find())) {
                return true;
            }
        }
        return false;
    }
}
