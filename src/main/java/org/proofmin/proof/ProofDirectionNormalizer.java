package org.proofmin.proof;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * NORMALIZZATORE DI DIREZIONE - Da catena refutazionale a derivazione costruttiva
 *
 * La catena della congettura negata è l'insieme dei passi raggiungibili in avanti
 * dalle radici marcate come congettura negata, ordinato per indice. Se il primo
 * passo di derivazione genuina della catena non è seguito direttamente da
 * {@code $false}, la catena deriva una disuguaglianza che va riletta in positivo.
 *
 * RISCRITTURA (post-ordine, a partire dal passo che precede la prima derivazione):
 * 1. {@code !=} diventa {@code =}
 * 2. ogni costante di Skolem {@code sK<cifre>} diventa una variabile nuova X&lt;k&gt;
 * L'ordine di visita invertito rinumera i passi: il contenuto si sposta nella
 * posizione speculare ed eredita regola e dipendenze di chi la occupava.
 */
public class ProofDirectionNormalizer {

    private static final Logger LOGGER = Logger.getLogger(ProofDirectionNormalizer.class.getName());

    private static final Pattern SKOLEM = Pattern.compile("\\bsK\\d+\\b");
    private static final Pattern X_VARIABLE = Pattern.compile("\\bX(\\d+)\\b");

    public static final String FALSUM = "$false";
    public static final String VERUM = "$true";

    //region ANALISI DELLA CATENA

    /**
     * Adiacenza in avanti: indice → passi che lo usano come premessa.
     */
    public Map<Integer, List<Integer>> forwardDependencies(SortedMap<Integer, SuperpositionStep> steps) {
        Map<Integer, List<Integer>> forward = new LinkedHashMap<>();
        for (Map.Entry<Integer, SuperpositionStep> entry : steps.entrySet()) {
            for (SuperpositionStep.Dependency dep : entry.getValue().deps()) {
                if (dep.isExternal()) continue;
                forward.computeIfAbsent(dep.sequentialIndex(), k -> new ArrayList<>()).add(entry.getKey());
            }
        }
        return forward;
    }

    /**
     * Raggiungibilità in avanti da tutte le congetture negate, ordinata per indice.
     */
    public List<Integer> negatedConjectureChain(SortedMap<Integer, SuperpositionStep> steps) {
        Map<Integer, List<Integer>> forward = forwardDependencies(steps);
        Set<Integer> reached = new TreeSet<>();
        Deque<Integer> queue = new ArrayDeque<>();

        steps.forEach((index, step) -> {
            if (step.negatedConjecture()) queue.add(index);
        });

        while (!queue.isEmpty()) {
            int current = queue.poll();
            if (!reached.add(current)) continue;
            queue.addAll(forward.getOrDefault(current, List.of()));
        }
        return new ArrayList<>(reached);
    }

    /**
     * Posizione nella catena del primo passo di derivazione genuina, -1 se assente.
     */
    private static int firstDerivationPosition(List<Integer> chain, SortedMap<Integer, SuperpositionStep> steps) {
        for (int i = 0; i < chain.size(); i++) {
            SuperpositionStep step = steps.get(chain.get(i));
            if (step != null && step.isDerivation()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Decide se la catena deve essere rigirata.
     *
     * @return false se manca una derivazione, se questa chiude la catena o se
     *         è seguita direttamente da {@code $false}; true altrimenti
     */
    public boolean needsTurnaround(SortedMap<Integer, SuperpositionStep> steps) {
        List<Integer> chain = negatedConjectureChain(steps);
        int p = firstDerivationPosition(chain, steps);

        if (p < 0 || p == chain.size() - 1) {
            return false;
        }
        return !FALSUM.equals(steps.get(chain.get(p + 1)).formula().strip());
    }

    //endregion

    //region RISCRITTURA

    /**
     * Rigira la catena quando necessario.
     *
     * @param steps passi della prova
     * @return nuova mappa dei passi; una copia invariata se non serve rigirare
     */
    public SortedMap<Integer, SuperpositionStep> normalize(SortedMap<Integer, SuperpositionStep> steps) {
        SortedMap<Integer, SuperpositionStep> result = new TreeMap<>(steps);
        if (!needsTurnaround(steps)) {
            return result;
        }

        List<Integer> chain = negatedConjectureChain(steps);
        int p = firstDerivationPosition(chain, steps);
        if (p == 0) {
            LOGGER.fine("Nessun passo precede la prima derivazione: catena lasciata invariata");
            return result;
        }

        Set<Integer> members = new HashSet<>(chain);
        Map<Integer, List<Integer>> forward = forwardDependencies(steps);
        List<Integer> order = new ArrayList<>();
        Map<Integer, String> rewritten = new LinkedHashMap<>();

        postOrder(chain.get(p - 1), forward, members, new HashSet<>(), order);
        for (int index : order) {
            rewritten.put(index, rewrite(steps.get(index).formula()));
        }

        List<Integer> reversed = new ArrayList<>(order);
        Collections.reverse(reversed);

        for (int i = 0; i < order.size(); i++) {
            int source = order.get(i);
            int target = reversed.get(i);
            String formula = rewritten.get(source);
            if (FALSUM.equals(formula.strip())) {
                formula = VERUM;
            }
            result.put(target, steps.get(target).withFormula(formula));
        }

        LOGGER.fine("Catena rigirata su " + order.size() + " passi");
        return result;
    }

    private static void postOrder(int index, Map<Integer, List<Integer>> forward, Set<Integer> members,
                                  Set<Integer> visited, List<Integer> order) {
        if (!visited.add(index)) return;
        for (int next : forward.getOrDefault(index, List.of())) {
            if (members.contains(next)) {
                postOrder(next, forward, members, visited, order);
            }
        }
        order.add(index);
    }

    /**
     * Contrapposizione e sostituzione delle costanti di Skolem in un singolo passo.
     */
    static String rewrite(String formula) {
        String positive = formula.replace("!=", "=");

        Set<Integer> used = new HashSet<>();
        Matcher existing = X_VARIABLE.matcher(positive);
        while (existing.find()) {
            used.add(Integer.parseInt(existing.group(1)));
        }

        Map<String, String> fresh = new LinkedHashMap<>();
        Matcher skolem = SKOLEM.matcher(positive);
        int next = 0;
        while (skolem.find()) {
            if (fresh.containsKey(skolem.group())) continue;
            while (used.contains(next)) next++;
            fresh.put(skolem.group(), "X" + next);
            used.add(next);
        }
        if (fresh.isEmpty()) {
            return positive;
        }
        return SKOLEM.matcher(positive).replaceAll(m -> fresh.get(m.group()));
    }

    //endregion
}
