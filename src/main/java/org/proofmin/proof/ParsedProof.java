package org.proofmin.proof;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Prova rinumerata: passi per indice sequenziale e nomi degli input da cui
 * provengono le dipendenze esterne, indicizzati per indice originale.
 */
public record ParsedProof(SortedMap<Integer, SuperpositionStep> steps, Map<Integer, String> externalNames) {

    /** Nome usato quando un assioma esterno non ha nome nella prova */
    public static final String DEFAULT_AXIOM = "a1";

    public ParsedProof {
        steps = Collections.unmodifiableSortedMap(new TreeMap<>(steps));
        externalNames = Map.copyOf(externalNames);
    }

    public static ParsedProof empty() {
        return new ParsedProof(new TreeMap<>(), Map.of());
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public String externalName(int originalIndex) {
        return externalNames.getOrDefault(originalIndex, DEFAULT_AXIOM);
    }
}
