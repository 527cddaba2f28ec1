package org.proofmin.proof;

import java.util.List;
import java.util.Set;

/**
 * Passo di una prova per refutazione.
 *
 * @param formula formula dedotta, come testo
 * @param deps dipendenze come coppie (indice originale, indice sequenziale);
 *             l'indice sequenziale 0 indica un assioma esterno
 * @param negatedConjecture true se il passo introduce la congettura negata
 * @param rule primo termine dell'etichetta di inferenza
 * @param inference etichetta di inferenza completa, senza parentesi quadre
 */
public record SuperpositionStep(String formula, List<Dependency> deps, boolean negatedConjecture,
                                String rule, String inference) {

    /** Regole che derivano davvero nuovi fatti, contrapposte alle trasformazioni sintattiche */
    public static final Set<String> DERIVATION_RULES = Set.of(
            "demodulation", "superposition", "resolution", "inequality",
            "backward", "forward", "subsumption");

    /** Indice riservato agli assiomi esterni */
    public static final int EXTERNAL = 0;

    public SuperpositionStep {
        deps = List.copyOf(deps);
    }

    /**
     * Dipendenza di un passo.
     */
    public record Dependency(int originalIndex, int sequentialIndex) {

        public boolean isExternal() {
            return sequentialIndex == EXTERNAL;
        }
    }

    public boolean isDerivation() {
        return DERIVATION_RULES.contains(rule);
    }

    public SuperpositionStep withFormula(String newFormula) {
        return new SuperpositionStep(newFormula, deps, negatedConjecture, rule, inference);
    }

    @Override
    public String toString() {
        return formula + " [" + inference + "]";
    }
}
