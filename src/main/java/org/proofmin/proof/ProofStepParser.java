package org.proofmin.proof;

import org.proofmin.matching.FormulaMatcher;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PARSER DEI PASSI DI REFUTAZIONE - Da testo lineare a grafo di passi rinumerato
 *
 * Ogni riga utile ha la forma {@code <idx>. <formula> [<regola> <dip>, <dip>, ...]}.
 * La sequenza inizia alla prima riga la cui etichetta contiene una parola chiave
 * di derivazione; le righe precedenti (formule di input e preprocessing) sono
 * escluse. Da lì i passi ricevono indici sequenziali da 1 e le dipendenze
 * originali sono tradotte tramite la tabella originale → sequenziale; quelle
 * antecedenti all'inizio diventano 0 (assioma esterno).
 */
public class ProofStepParser {

    private static final Logger LOGGER = Logger.getLogger(ProofStepParser.class.getName());

    /** Parole chiave che segnano l'inizio della derivazione vera e propria */
    private static final List<String> SEQUENCE_KEYWORDS = List.of(
            "demodulation", "superposition", "resolution", "inequality");

    private static final Pattern STEP_LINE = Pattern.compile("^\\s*(\\d+)\\.\\s*(.*?)\\s*\\[([^\\[\\]]*)\\]\\s*$");
    private static final Pattern NUMBER = Pattern.compile("\\b\\d+\\b");
    private static final Pattern INPUT_TAG = Pattern.compile("^input\\S*\\s+(\\S+)$");

    private final FormulaMatcher matcher;

    public ProofStepParser() {
        this(new FormulaMatcher());
    }

    public ProofStepParser(FormulaMatcher matcher) {
        if (matcher == null) {
            throw new IllegalArgumentException("Matcher non può essere null");
        }
        this.matcher = matcher;
    }

    //region PARSING

    /**
     * Legge e rinumera una prova per refutazione.
     *
     * @param text testo prodotto dal prover
     * @return prova rinumerata, vuota se nessuna riga di derivazione è riconosciuta
     */
    public ParsedProof parse(String text) {
        return sequence(parseAll(text));
    }

    /**
     * Legge una prova, la rigira se la catena della congettura negata lo
     * richiede e poi la rinumera.
     */
    public ParsedProof parseNormalized(String text, ProofDirectionNormalizer normalizer) {
        return sequence(normalizer.normalize(parseAll(text)));
    }

    /**
     * Legge tutte le righe numerate mantenendo gli indici originali; ogni
     * dipendenza ha indice originale e sequenziale coincidenti.
     */
    public SortedMap<Integer, SuperpositionStep> parseAll(String text) {
        SortedMap<Integer, SuperpositionStep> steps = new TreeMap<>();
        if (text == null) {
            return steps;
        }

        for (String line : text.split("\n")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("%")) continue;

            Matcher m = STEP_LINE.matcher(trimmed);
            if (!m.matches()) {
                LOGGER.finest("Riga ignorata: " + trimmed);
                continue;
            }

            int index = Integer.parseInt(m.group(1));
            String inference = m.group(3).strip();
            String rule = inference.isEmpty() ? "" : inference.split("\\s+")[0];

            List<SuperpositionStep.Dependency> deps = new ArrayList<>();
            Matcher numbers = NUMBER.matcher(inference);
            while (numbers.find()) {
                int dep = Integer.parseInt(numbers.group());
                deps.add(new SuperpositionStep.Dependency(dep, dep));
            }

            steps.put(index, new SuperpositionStep(m.group(2).strip(), deps,
                    inference.contains("negated conjecture"), rule, inference));
        }

        LOGGER.fine("Lette " + steps.size() + " righe numerate");
        return steps;
    }

    /**
     * Rinumera i passi a partire dalla prima derivazione.
     *
     * @param all passi con indici originali
     */
    public ParsedProof sequence(SortedMap<Integer, SuperpositionStep> all) {
        Optional<Integer> start = all.entrySet().stream()
                .filter(e -> SEQUENCE_KEYWORDS.stream().anyMatch(e.getValue().inference()::contains))
                .map(Map.Entry::getKey)
                .findFirst();

        if (start.isEmpty()) {
            LOGGER.fine("Nessuna riga di derivazione riconosciuta");
            return ParsedProof.empty();
        }

        Map<Integer, Integer> sequential = new HashMap<>();
        Map<Integer, String> externalNames = new HashMap<>();
        SortedMap<Integer, SuperpositionStep> steps = new TreeMap<>();
        int next = 1;

        for (Map.Entry<Integer, SuperpositionStep> entry : all.tailMap(start.get()).entrySet()) {
            SuperpositionStep step = entry.getValue();
            sequential.put(entry.getKey(), next);

            List<SuperpositionStep.Dependency> deps = new ArrayList<>();
            for (SuperpositionStep.Dependency dep : step.deps()) {
                int seq = sequential.getOrDefault(dep.originalIndex(), SuperpositionStep.EXTERNAL);
                if (seq == SuperpositionStep.EXTERNAL) {
                    externalNames.computeIfAbsent(dep.originalIndex(), i -> inputName(all, i));
                }
                deps.add(new SuperpositionStep.Dependency(dep.originalIndex(), seq));
            }

            steps.put(next, new SuperpositionStep(step.formula(), deps, step.negatedConjecture(),
                    step.rule(), step.inference()));
            next++;
        }

        return new ParsedProof(steps, externalNames);
    }

    /**
     * Risale le dipendenze fino a una riga di input con nome.
     */
    private static String inputName(SortedMap<Integer, SuperpositionStep> all, int originalIndex) {
        Deque<Integer> queue = new ArrayDeque<>();
        Set<Integer> visited = new HashSet<>();
        queue.add(originalIndex);

        while (!queue.isEmpty()) {
            int current = queue.poll();
            if (!visited.add(current)) continue;

            SuperpositionStep step = all.get(current);
            if (step == null) continue;

            Matcher input = INPUT_TAG.matcher(step.inference());
            if (input.matches()) {
                return input.group(1);
            }
            for (SuperpositionStep.Dependency dep : step.deps()) {
                queue.add(dep.originalIndex());
            }
        }
        return ParsedProof.DEFAULT_AXIOM;
    }

    //endregion

    //region RICERCA E CHIUSURA

    /**
     * Primo passo la cui formula è un'istanza di {@code targetFormula}.
     */
    public Optional<Integer> locate(SortedMap<Integer, SuperpositionStep> steps, String targetFormula) {
        for (Map.Entry<Integer, SuperpositionStep> entry : steps.entrySet()) {
            if (matcher.match(targetFormula, wrap(entry.getValue().formula()))) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    private static String wrap(String formula) {
        String trimmed = formula.strip();
        return trimmed.startsWith("!") || trimmed.startsWith("?") ? trimmed : "(" + trimmed + ")";
    }

    /**
     * Chiusura transitiva delle dipendenze a partire da un passo; l'indice 0
     * non è mai incluso.
     */
    public static Set<Integer> dependencyClosure(SortedMap<Integer, SuperpositionStep> steps, int startIndex) {
        return dependencyClosure(steps, List.of(startIndex));
    }

    /**
     * Chiusura transitiva a partire da un insieme di passi.
     */
    public static Set<Integer> dependencyClosure(SortedMap<Integer, SuperpositionStep> steps, Collection<Integer> startIndices) {
        Set<Integer> visited = new TreeSet<>();
        Deque<Integer> stack = new ArrayDeque<>(startIndices);

        while (!stack.isEmpty()) {
            int current = stack.pop();
            if (current == SuperpositionStep.EXTERNAL || !visited.add(current)) continue;

            SuperpositionStep step = steps.get(current);
            if (step == null) continue;
            for (SuperpositionStep.Dependency dep : step.deps()) {
                if (!dep.isExternal()) {
                    stack.push(dep.sequentialIndex());
                }
            }
        }
        return visited;
    }

    //endregion

    //region ESTRAZIONE

    /**
     * Passi necessari a dedurre un singolo fatto.
     */
    public Optional<Extraction> extract(ParsedProof proof, NamedFormula target) {
        return extract(proof, List.of(target));
    }

    /**
     * Unione delle chiusure dei passi che deducono ciascun bersaglio trovato.
     * Il primo bersaglio trovato dà nome al passo dedotto.
     *
     * @return vuoto se nessun bersaglio compare nella prova
     */
    public Optional<Extraction> extract(ParsedProof proof, List<NamedFormula> targets) {
        Set<Integer> relevant = new TreeSet<>();
        Integer derivedIndex = null;
        String derivedName = null;

        for (NamedFormula target : targets) {
            Optional<Integer> located = locate(proof.steps(), target.formula());
            if (located.isEmpty()) {
                LOGGER.fine("Formula di " + target.name() + " non trovata nella prova");
                continue;
            }
            if (derivedIndex == null) {
                derivedIndex = located.get();
                derivedName = target.name();
            }
            relevant.addAll(dependencyClosure(proof.steps(), located.get()));
        }

        if (derivedIndex == null) {
            return Optional.empty();
        }

        SortedMap<Integer, SuperpositionStep> subset = new TreeMap<>();
        for (int index : relevant) {
            subset.put(index, proof.steps().get(index));
        }
        return Optional.of(new Extraction(new ParsedProof(subset, proof.externalNames()), derivedIndex, derivedName));
    }

    //endregion
}
