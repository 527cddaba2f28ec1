package org.proofmin.dag;

import org.proofmin.lemma.LemmaNames;
import org.proofmin.lemma.LemmaNotFoundException;
import org.proofmin.matching.FormulaMatcher;
import org.proofmin.proof.NamedFormula;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * COSTRUTTORE DEL DAG - Grafo minimo delle dipendenze di una radice candidata
 *
 * Visita in ampiezza a partire dalla radice. Assiomi e congetture chiudono la
 * visita senza aggiungere archi. Prima di collegare un lemma si verifica se la
 * sua formula è alfa-equivalente (nei due sensi) a un candidato duplicato: in
 * quel caso il lemma è rediretto sul genitore con indice più piccolo del
 * candidato, che prende il suo posto nel grafo e da cui la visita prosegue.
 * La radice non viene mai rediretta.
 *
 * La mappa di redirezione punta sempre verso lemmi con indice strettamente
 * minore, quindi il grafo resta aciclico.
 */
public class DependencyGraphBuilder {

    private static final Logger LOGGER = Logger.getLogger(DependencyGraphBuilder.class.getName());

    private final FormulaMatcher matcher;

    public DependencyGraphBuilder(FormulaMatcher matcher) {
        this.matcher = matcher;
    }

    /**
     * Lemma riconosciuto come duplicato di un candidato e rediretto.
     */
    public record Duplication(String lemma, String candidate, String redirectedTo) {
    }

    /**
     * Grafo costruito, formule dei suoi nodi e duplicazioni registrate.
     */
    public record Result(DependencyGraph graph, SortedMap<String, String> formulas, List<Duplication> duplications) {

        public Result {
            formulas = Collections.unmodifiableSortedMap(new TreeMap<>(formulas));
            duplications = List.copyOf(duplications);
        }

        public int lemmaCount() {
            return graph.nodeCount();
        }
    }

    /**
     * @param root lemma radice
     * @param index indice precalcolato dei lemmi
     * @throws LemmaNotFoundException se la radice (o un lemma senza formula nota) manca dall'indice
     */
    public Result build(String root, LemmaIndex index) throws LemmaNotFoundException {
        DependencyGraph graph = new DependencyGraph();
        Map<String, String> formulas = new TreeMap<>();
        Map<String, String> knownFormulas = new HashMap<>();
        Map<String, String> redirects = new HashMap<>();
        List<Duplication> duplications = new ArrayList<>();

        Deque<String> queue = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        queue.add(root);

        while (!queue.isEmpty()) {
            String lemma = queue.poll();
            if (LemmaNames.isTerminal(lemma) || !seen.add(lemma)) continue;

            Optional<LemmaIndex.LemmaInfo> info = index.lemma(lemma);
            if (info.isEmpty()) {
                String formula = knownFormulas.get(lemma);
                if (formula == null) {
                    throw new LemmaNotFoundException(lemma, "Lemma assente dall'indice: " + lemma);
                }
                LOGGER.warning("Lemma " + lemma + " senza prova indicizzata: aggiunto come foglia");
                graph.addNode(lemma);
                formulas.put(lemma, formula);
                continue;
            }

            Optional<String> target = lemma.equals(root)
                    ? Optional.empty()
                    : redirectTarget(lemma, info.get().formula(), index, redirects, duplications);
            if (target.isPresent()) {
                LOGGER.fine("Lemma " + lemma + " rediretto su " + target.get());
                queue.add(target.get());
                continue;
            }

            graph.addNode(lemma);
            formulas.put(lemma, info.get().formula());

            for (NamedFormula dep : info.get().dependencies()) {
                String name = dep.name();
                if (LemmaNames.isTerminal(name) || index.isDuplicateCandidate(name)) continue;

                knownFormulas.putIfAbsent(name, dep.formula());
                String child = redirectTarget(name, dep.formula(), index, redirects, duplications).orElse(name);
                if (child.equals(lemma)) continue;

                graph.addEdge(lemma, child);
                queue.add(child);
            }
        }

        LOGGER.info("DAG per " + root + ": " + graph.nodeCount() + " lemmi, " + duplications.size() + " duplicati");
        return new Result(graph, new TreeMap<>(formulas), duplications);
    }

    /**
     * Destinazione della redirezione di un lemma, calcolata una sola volta per lemma.
     */
    private Optional<String> redirectTarget(String lemma, String formula, LemmaIndex index,
                                            Map<String, String> redirects, List<Duplication> duplications) {
        if (redirects.containsKey(lemma)) {
            return Optional.of(redirects.get(lemma));
        }

        int lemmaIndex = LemmaNames.index(lemma);
        for (LemmaIndex.DuplicateCandidate candidate : index.duplicateCandidates()) {
            Optional<String> smallest = candidate.parents().stream()
                    .filter(p -> !p.equals(lemma))
                    .filter(p -> LemmaNames.index(p) >= 0 && LemmaNames.index(p) < lemmaIndex)
                    .min(Comparator.comparingInt(LemmaNames::index));
            if (smallest.isEmpty()) continue;

            if (matcher.equivalent(formula, candidate.formula())) {
                redirects.put(lemma, smallest.get());
                duplications.add(new Duplication(lemma, candidate.name(), smallest.get()));
                return smallest;
            }
        }
        return Optional.empty();
    }
}
