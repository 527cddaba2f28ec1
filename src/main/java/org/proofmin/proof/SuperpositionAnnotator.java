package org.proofmin.proof;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Rende leggibile un insieme di passi estratti come blocco di commenti:
 * <pre>
 * % === Superposition Steps ===
 * % lemma_0004: formula | deps: a1, lemma_0003: formula
 * </pre>
 * Il passo dedotto prende il nome del lemma bersaglio; gli altri ricevono nomi
 * {@code lemma_NNNN} che proseguono la numerazione delle dipendenze esistenti.
 */
public class SuperpositionAnnotator {

    public static final String HEADER = "% === Superposition Steps ===";

    /**
     * Testo annotato e rinomina indice locale → nome globale.
     */
    public record Annotation(String text, SortedMap<Integer, String> renaming) {
    }

    /**
     * @param extraction passi da rendere
     * @param existing dipendenze già note, usate per la numerazione e per le formule degli assiomi
     * @param derivedName nome da dare al passo dedotto; se null, riceve un nome numerato
     */
    public Annotation annotate(Extraction extraction, List<NamedFormula> existing, String derivedName) {
        SortedMap<Integer, SuperpositionStep> steps = extraction.proof().steps();
        int next = ExtraDependencies.lastLemmaIndex(existing) + 1;

        SortedMap<Integer, String> renaming = new TreeMap<>();
        for (int index : steps.keySet()) {
            if (index == extraction.derivedIndex() && derivedName != null) {
                renaming.put(index, derivedName);
            } else {
                renaming.put(index, String.format("lemma_%04d", next++));
            }
        }

        StringBuilder text = new StringBuilder(HEADER).append('\n');
        for (Map.Entry<Integer, SuperpositionStep> entry : steps.entrySet()) {
            SuperpositionStep step = entry.getValue();
            List<String> deps = new ArrayList<>();

            for (SuperpositionStep.Dependency dep : step.deps()) {
                if (dep.isExternal()) {
                    deps.add(describeExternal(extraction.proof().externalName(dep.originalIndex()), existing));
                } else {
                    String name = renaming.getOrDefault(dep.sequentialIndex(),
                            String.format("lemma_%04d", dep.sequentialIndex()));
                    SuperpositionStep source = steps.get(dep.sequentialIndex());
                    deps.add(name + ": " + (source != null ? source.formula() : "UNKNOWN_FORMULA"));
                }
            }

            text.append("% ").append(renaming.get(entry.getKey())).append(": ").append(step.formula())
                    .append(" | deps: ").append(String.join(", ", deps)).append('\n');
        }
        text.append('\n');

        return new Annotation(text.toString(), renaming);
    }

    private String describeExternal(String name, List<NamedFormula> existing) {
        Optional<NamedFormula> known = existing.stream().filter(f -> f.name().equals(name)).findFirst();
        if (known.isEmpty() || ParsedProof.DEFAULT_AXIOM.equals(name)) {
            return name;
        }
        return name + ": " + known.get().formula();
    }
}
