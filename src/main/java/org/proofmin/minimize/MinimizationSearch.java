package org.proofmin.minimize;

import org.proofmin.dag.DependencyGraphBuilder;
import org.proofmin.dag.LemmaIndex;
import org.proofmin.dag.LemmaIndexBuilder;
import org.proofmin.lemma.LemmaCategory;
import org.proofmin.lemma.LemmaNames;
import org.proofmin.lemma.LemmaNotFoundException;
import org.proofmin.lemma.LemmaRepository;
import org.proofmin.matching.FormulaMatcher;
import org.proofmin.proof.NamedFormula;
import org.proofmin.proof.ParsedProof;
import org.proofmin.proof.ProofLength;
import org.proofmin.proof.ProofStepParser;
import org.proofmin.prover.ExternalProver;
import org.proofmin.prover.Prover;
import org.proofmin.prover.ReProver;
import org.proofmin.prover.TheoremProver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * RICERCA DELLA PROVA MINIMA - Controllore della minimizzazione di un problema
 *
 * ALGORITMO:
 * 1. Lettura dell'indice riassuntivo e costruzione dell'indice dei lemmi
 * 2. Scansione delle radici dall'indice più alto verso il basso, fino al numero
 *    massimo di radici accettate; le radici con costanti di Skolem sono scartate
 * 3. Per ogni radice: grafo delle dipendenze e candidati storici con indice
 *    precedente; in mancanza, lemmi singoli e astratti; in mancanza anche di
 *    questi, la sola radice
 * 4. Migliore locale per radice e migliore globale per (passi, numero di lemmi)
 * 5. Scrittura di grafo, lemmi e prova annotata del vincitore
 *
 * La ricerca è sequenziale; ogni ridimostrazione lavora su una copia privata del problema.
 */
public class MinimizationSearch {

    private static final Logger LOGGER = Logger.getLogger(MinimizationSearch.class.getName());

    private static final Pattern SKOLEM = Pattern.compile("\\bsK\\d+\\b");

    static final String NO_CANDIDATE = "No valid root/history candidate combination found.";

    private final MinimizationConfiguration config;
    private final LemmaRepository repository;
    private final ProofStepParser parser;
    private final LemmaIndexBuilder indexBuilder;
    private final DependencyGraphBuilder graphBuilder;
    private final CandidateEvaluator evaluator;

    public MinimizationSearch(MinimizationConfiguration config) {
        this(config, List.of(
                ExternalProver.twee(config.getTweeExecutable(), config.getReproveTimeoutSeconds()),
                ExternalProver.vampire(config.getVampireExecutable(), config.getReproveTimeoutSeconds())));
    }

    /**
     * @param provers prover usati per le ridimostrazioni
     */
    public MinimizationSearch(MinimizationConfiguration config, List<TheoremProver> provers) {
        this.config = config;
        FormulaMatcher matcher = new FormulaMatcher(config.getPermutationBound());
        this.repository = new LemmaRepository(config.getLemmasDir(), config.getProofsDir());
        this.parser = new ProofStepParser(matcher);
        this.indexBuilder = new LemmaIndexBuilder(repository, matcher);
        this.graphBuilder = new DependencyGraphBuilder(matcher);
        ReProver reProver = new ReProver(provers, config.getTemporaryDir(), parser);
        this.evaluator = new CandidateEvaluator(repository, new StartSegmentPlanner(repository, parser), reProver, parser);
    }

    //region RICERCA

    /**
     * @param problem problema TPTP originale
     * @param refuterProof prova per refutazione del problema
     * @param summaryFile indice riassuntivo prodotto dalla raccolta delle prove
     * @return candidato vincente e artefatti scritti
     * @throws MinimizationException per input illeggibili o corrotti, output non scrivibile,
     *                               o se nessun candidato ha successo
     */
    public MinimizationResult minimize(Path problem, Path refuterProof, Path summaryFile) throws MinimizationException {
        String inputText = read(problem, "problema");
        SummaryIndex summary = SummaryIndex.read(summaryFile);
        if (summary.isEmpty()) {
            throw new MinimizationException("Indice riassuntivo vuoto: " + summaryFile);
        }

        String refuterText = read(refuterProof, "prova per refutazione");
        ParsedProof refutation = parser.parse(refuterText);
        int initialSteps = ProofLength.count(Prover.VAMPIRE, refuterText);

        LemmaIndex index;
        try {
            index = indexBuilder.build(config.getCompletionProofsDir());
        } catch (IOException e) {
            throw new MinimizationException("Costruzione dell'indice dei lemmi fallita: " + e.getMessage(), e);
        }

        Candidate globalBest = null;
        DependencyGraphBuilder.Result bestDag = null;
        int accepted = 0;

        for (SummaryIndex.Entry entry : summary.descending()) {
            if (accepted >= config.getMaxRootCandidates()) break;

            String rootName = LemmaNames.stripProverSuffix(entry.lemmaName());
            String rootFormula;
            try {
                rootFormula = repository.load(rootName).formula();
            } catch (LemmaNotFoundException e) {
                LOGGER.warning("Radice " + rootName + " saltata: " + e.getMessage());
                continue;
            }
            if (SKOLEM.matcher(rootFormula).find()) {
                LOGGER.info("Radice " + rootName + " scartata per costanti di Skolem: " + rootFormula);
                continue;
            }
            accepted++;
            LOGGER.info("Radice " + rootName + " (" + accepted + "/" + config.getMaxRootCandidates() + ")");

            DependencyGraphBuilder.Result dag;
            try {
                dag = graphBuilder.build(rootName, index);
            } catch (LemmaNotFoundException e) {
                LOGGER.warning("Grafo della radice " + rootName + " non costruibile: " + e.getMessage());
                continue;
            }
            dag.duplications().forEach(d ->
                    LOGGER.fine("Duplicato " + d.lemma() + " ~ " + d.candidate() + " -> " + d.redirectedTo()));

            CandidateEvaluator.RootContext context = new CandidateEvaluator.RootContext(
                    problem, inputText, new NamedFormula(rootName, rootFormula), dag, refutation);
            Candidate localBest = evaluateRoot(context);

            if (localBest != null && localBest.isBetterThan(globalBest)) {
                globalBest = localBest;
                bestDag = dag;
                LOGGER.info("Nuovo migliore globale: radice " + rootName + ", "
                        + globalBest.totalSteps() + " passi, " + globalBest.lemmaCount() + " lemmi");
            }
        }

        if (globalBest == null) {
            throw new MinimizationException(NO_CANDIDATE);
        }
        return persist(problem, globalBest, bestDag, initialSteps);
    }

    /**
     * Migliore candidato della radice, null se nessuno ha successo.
     */
    private Candidate evaluateRoot(CandidateEvaluator.RootContext context) throws MinimizationException {
        String root = context.root().name();
        int rootIndex = LemmaNames.index(root);

        List<String> histories = context.dag().graph().nodes().stream()
                .filter(n -> !n.equals(root))
                .filter(n -> LemmaCategory.of(n).orElse(null) == LemmaCategory.HISTORY)
                .filter(n -> LemmaNames.index(n) < rootIndex)
                .toList();

        Candidate localBest = null;
        try {
            if (!histories.isEmpty()) {
                for (String history : histories) {
                    LOGGER.info("Candidato storico " + history + " per la radice " + root);
                    localBest = better(localBest, evaluateSafely(() -> evaluator.evaluateHistory(context, history), history));
                }
                return localBest;
            }

            List<String> fallbacks = context.dag().graph().nodes().stream()
                    .filter(n -> !n.equals(root))
                    .filter(n -> {
                        LemmaCategory category = LemmaCategory.of(n).orElse(null);
                        return category == LemmaCategory.SINGLE || category == LemmaCategory.ABSTRACT;
                    })
                    .toList();

            if (!fallbacks.isEmpty()) {
                LOGGER.info("Nessun lemma storico per " + root + ": " + fallbacks.size() + " candidati singoli/astratti");
                for (String fallback : fallbacks) {
                    boolean single = LemmaCategory.of(fallback).orElse(null) == LemmaCategory.SINGLE;
                    localBest = better(localBest, evaluateSafely(() -> single
                            ? evaluator.evaluateSingle(context, fallback)
                            : evaluator.evaluateAbstract(context, fallback), fallback));
                }
                return localBest;
            }

            LOGGER.info("Nessun candidato di supporto per " + root + ": prova della sola radice");
            return evaluateSafely(() -> evaluator.evaluateRootOnly(context), root).orElse(null);

        } catch (IOException e) {
            throw new MinimizationException("Ridimostrazione impossibile per la radice " + root + ": " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface Evaluation {
        Optional<Candidate> run() throws LemmaNotFoundException, StructuralInconsistencyException, IOException;
    }

    /**
     * Esegue la valutazione di un candidato; lemmi mancanti e incoerenze
     * strutturali scartano solo quel candidato.
     */
    private Optional<Candidate> evaluateSafely(Evaluation evaluation, String candidate) throws IOException {
        try {
            Optional<Candidate> result = evaluation.run();
            if (result.isEmpty()) {
                LOGGER.info("Candidato " + candidate + " scartato: ridimostrazione fallita");
            }
            return result;
        } catch (LemmaNotFoundException e) {
            LOGGER.warning("Candidato " + candidate + " scartato, lemma mancante " + e.getLemmaName() + ": " + e.getMessage());
        } catch (StructuralInconsistencyException e) {
            LOGGER.warning("Candidato " + candidate + " scartato per incoerenza strutturale: " + e.getMessage());
        }
        return Optional.empty();
    }

    private static Candidate better(Candidate current, Optional<Candidate> challenger) {
        if (challenger.isPresent() && challenger.get().isBetterThan(current)) {
            return challenger.get();
        }
        return current;
    }

    //endregion

    //region PERSISTENZA

    private MinimizationResult persist(Path problem, Candidate best, DependencyGraphBuilder.Result dag, int initialSteps)
            throws MinimizationException {
        Path outputDir = config.outputDirFor(problem);
        String stem = problemStem(problem);
        Path dagFile = outputDir.resolve(stem + "_dag.txt");
        Path lemmasFile = outputDir.resolve(stem + "_lemmas.p");
        Path proofFile = outputDir.resolve(stem + "_minimized.proof");

        try {
            Files.createDirectories(outputDir);
            dag.graph().write(dagFile);
            Files.writeString(lemmasFile, renderLemmas(dag.formulas()), StandardCharsets.UTF_8);
            Files.writeString(proofFile, best.proofText(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Scrittura dei risultati fallita in " + outputDir, e);
            throw new MinimizationException("Impossibile scrivere i risultati in " + outputDir, e);
        }

        LOGGER.info("Risultati scritti in " + outputDir);
        return new MinimizationResult(best, dag, initialSteps, dagFile, lemmasFile, proofFile);
    }

    /**
     * Un blocco {@code fof(nome, lemma, formula).} per ogni lemma del grafo.
     */
    static String renderLemmas(SortedMap<String, String> formulas) {
        StringBuilder text = new StringBuilder();
        for (Map.Entry<String, String> entry : formulas.entrySet()) {
            text.append("fof(").append(entry.getKey()).append(", lemma,\n    ")
                    .append(entry.getValue()).append("\n).\n\n");
        }
        return text.toString();
    }

    static String problemStem(Path problem) {
        String name = problem.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String read(Path file, String description) throws MinimizationException {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MinimizationException("Impossibile leggere " + description + " " + file, e);
        }
    }

    //endregion
}
