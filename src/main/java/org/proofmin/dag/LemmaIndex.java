package org.proofmin.dag;

import org.proofmin.proof.NamedFormula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Indice precalcolato dei lemmi: formula e dipendenze di ogni lemma con prova
 * memorizzata, più i fatti dedotti in modo indipendente dal prover a
 * completamento (candidati duplicati).
 */
public class LemmaIndex {

    /**
     * Formula di un lemma e dipendenze lette dalla sua prova.
     */
    public record LemmaInfo(String formula, List<NamedFormula> dependencies) {

        public LemmaInfo {
            dependencies = List.copyOf(dependencies);
        }
    }

    /**
     * Fatto dedotto all'interno delle prove di uno o più lemmi (i genitori).
     */
    public record DuplicateCandidate(String name, String formula, List<String> parents) {

        public DuplicateCandidate {
            parents = List.copyOf(parents);
        }
    }

    private final Map<String, LemmaInfo> lemmas;
    private final List<DuplicateCandidate> duplicateCandidates;

    public LemmaIndex(Map<String, LemmaInfo> lemmas, List<DuplicateCandidate> duplicateCandidates) {
        this.lemmas = Collections.unmodifiableMap(new TreeMap<>(lemmas));
        this.duplicateCandidates = Collections.unmodifiableList(new ArrayList<>(duplicateCandidates));
    }

    public Optional<LemmaInfo> lemma(String name) {
        return Optional.ofNullable(lemmas.get(name));
    }

    public Map<String, LemmaInfo> lemmas() {
        return lemmas;
    }

    public List<DuplicateCandidate> duplicateCandidates() {
        return duplicateCandidates;
    }

    public boolean isDuplicateCandidate(String name) {
        return duplicateCandidates.stream().anyMatch(c -> c.name().equals(name));
    }
}
