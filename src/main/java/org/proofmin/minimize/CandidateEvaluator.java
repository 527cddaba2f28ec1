package org.proofmin.minimize;

import org.proofmin.dag.DependencyGraphBuilder;
import org.proofmin.lemma.LemmaCategory;
import org.proofmin.lemma.LemmaNotFoundException;
import org.proofmin.lemma.LemmaRepository;
import org.proofmin.lemma.StoredProof;
import org.proofmin.proof.ExtraDependencies;
import org.proofmin.proof.Extraction;
import org.proofmin.proof.NamedFormula;
import org.proofmin.proof.ParsedProof;
import org.proofmin.proof.ProofStepParser;
import org.proofmin.proof.ProofUsage;
import org.proofmin.proof.SuperpositionAnnotator;
import org.proofmin.prover.ReProof;
import org.proofmin.prover.ReProver;
import org.proofmin.prover.Prover;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * VALUTAZIONE DEI CANDIDATI - Dalla combinazione radice + supporto alla prova assemblata
 *
 * STRATEGIE:
 * 1. Storico: segmento iniziale, poi lemma storico, radice e congettura
 * 2. Singolo: segmento iniziale dal lemma singolo, poi radice e congettura
 * 3. Astratto: prova memorizzata del lemma astratto, poi radice e congettura
 * 4. Sola radice: prova memorizzata della radice, poi congettura
 *
 * Ogni candidato usa le proprie dipendenze accumulate. I segmenti dei lemmi che
 * la prova finale non cita vengono scartati e non contano nei passi totali.
 * Una ridimostrazione fallita elimina solo il candidato (risultato vuoto).
 */
public class CandidateEvaluator {

    private static final Logger LOGGER = Logger.getLogger(CandidateEvaluator.class.getName());

    static final String INPUT_HEADER = "% === Input Problem ===";

    private final LemmaRepository repository;
    private final StartSegmentPlanner planner;
    private final ReProver reProver;
    private final ProofStepParser parser;
    private final SuperpositionAnnotator annotator = new SuperpositionAnnotator();

    public CandidateEvaluator(LemmaRepository repository, StartSegmentPlanner planner,
                              ReProver reProver, ProofStepParser parser) {
        this.repository = repository;
        this.planner = planner;
        this.reProver = reProver;
        this.parser = parser;
    }

    /**
     * Tutto ciò che serve per valutare i candidati di una radice.
     *
     * @param input problema originale
     * @param inputText contenuto del problema
     * @param root radice con la sua formula
     * @param dag grafo delle dipendenze della radice
     * @param refutation prova per refutazione del problema, rinumerata
     */
    public record RootContext(Path input, String inputText, NamedFormula root,
                              DependencyGraphBuilder.Result dag, ParsedProof refutation) {
    }

    //region STORICO

    public Optional<Candidate> evaluateHistory(RootContext context, String history)
            throws LemmaNotFoundException, StructuralInconsistencyException, IOException {

        ExtraDependencies extra = new ExtraDependencies();
        StartSegmentPlanner.Plan plan = planner.plan(history, context.dag().graph(), context.refutation());
        if (plan.dependencies().contains(history)) {
            throw new StructuralInconsistencyException(history,
                    "Il lemma storico " + history + " compare tra le proprie dipendenze");
        }
        StartSegment start = planner.choose(plan, extra);

        NamedFormula historyFormula = new NamedFormula(history, repository.load(history).formula());
        NamedFormula root = context.root();

        Optional<ReProof> historyProof = reProver.prove(context.input(), List.of(historyFormula),
                historyFormula, start.axioms(), extra);
        if (historyProof.isEmpty()) {
            return Optional.empty();
        }
        // Il segmento iniziale deriva già il lemma storico: la sua ridimostrazione serve solo se più corta
        boolean useProvedHistory = plan.provedHistory() && historyProof.get().steps() > plan.superpositionSteps();

        Optional<ReProof> rootProof = reProver.prove(context.input(), List.of(historyFormula, root),
                root, start.axioms(), extra);
        if (rootProof.isEmpty()) {
            return Optional.empty();
        }

        Optional<ReProof> conjectureProof = reProver.prove(context.input(), List.of(historyFormula, root),
                null, start.axioms(), extra);
        if (conjectureProof.isEmpty()) {
            return Optional.empty();
        }

        String conjectureText = conjectureProof.get().text();
        boolean rootUsed = ProofUsage.uses(conjectureText, root.name());
        boolean historyUsed;
        if (useProvedHistory) {
            historyUsed = false;
        } else if (rootUsed) {
            historyUsed = ProofUsage.uses(rootProof.get().text(), history) || ProofUsage.uses(conjectureText, history);
        } else {
            historyUsed = ProofUsage.uses(conjectureText, history);
        }

        if (!rootUsed) {
            LOGGER.info("Radice " + root.name() + " non usata nella prova della congettura");
        }
        if (!historyUsed) {
            LOGGER.info("Lemma storico " + history + " non usato nella prova");
        }

        Assembly assembly = new Assembly(context.inputText())
                .add(start.text(), start.steps())
                .addIf(historyUsed, historyProof.get())
                .addIf(rootUsed, rootProof.get())
                .add(conjectureProof.get());

        LOGGER.info("Radice " + root.name() + " con storico " + history + ": " + assembly.steps
                + " passi totali, " + start.steps() + " nel segmento iniziale");
        return Optional.of(assembly.toCandidate(context, history, Candidate.Kind.HISTORY));
    }

    //endregion

    //region RIPIEGHI

    /**
     * Il lemma singolo viene derivato dal segmento iniziale; la radice e la
     * congettura sono ridimostrate a partire da esso.
     */
    public Optional<Candidate> evaluateSingle(RootContext context, String single)
            throws LemmaNotFoundException, IOException {

        ExtraDependencies extra = new ExtraDependencies();
        StartSegmentPlanner.Plan plan = planner.plan(single, context.dag().graph(), context.refutation());
        StartSegment start = planner.choose(plan, extra);
        NamedFormula root = context.root();

        Optional<ReProof> rootProof = reProver.prove(context.input(), List.of(root), root, start.axioms(), extra);
        if (rootProof.isEmpty()) {
            return Optional.empty();
        }
        Optional<ReProof> conjectureProof = reProver.prove(context.input(), List.of(root), null, start.axioms(), extra);
        if (conjectureProof.isEmpty()) {
            return Optional.empty();
        }

        boolean rootUsed = ProofUsage.uses(conjectureProof.get().text(), root.name());
        Assembly assembly = new Assembly(context.inputText())
                .add(start.text(), start.steps())
                .addIf(rootUsed, rootProof.get())
                .add(conjectureProof.get());
        return Optional.of(assembly.toCandidate(context, single, Candidate.Kind.SINGLE));
    }

    /**
     * Il lemma astratto non compare nella prova per refutazione: si parte dalla
     * sua prova memorizzata e lo si aggiunge come assioma.
     */
    public Optional<Candidate> evaluateAbstract(RootContext context, String abstractLemma)
            throws LemmaNotFoundException, IOException {

        Optional<StoredProof> stored = repository.storedProof(abstractLemma);
        if (stored.isEmpty()) {
            LOGGER.warning("Nessuna prova memorizzata per il lemma astratto " + abstractLemma);
            return Optional.empty();
        }

        ExtraDependencies extra = new ExtraDependencies();
        NamedFormula abstractFormula = new NamedFormula(abstractLemma, repository.load(abstractLemma).formula());
        NamedFormula root = context.root();
        List<NamedFormula> axioms = List.of(root, abstractFormula);

        Optional<ReProof> rootProof = reProver.prove(context.input(), axioms, root, List.of(), extra);
        if (rootProof.isEmpty()) {
            return Optional.empty();
        }
        Optional<ReProof> conjectureProof = reProver.prove(context.input(), axioms, null, List.of(), extra);
        if (conjectureProof.isEmpty()) {
            return Optional.empty();
        }

        boolean rootUsed = ProofUsage.uses(conjectureProof.get().text(), root.name());
        Assembly assembly = new Assembly(context.inputText())
                .add(stored.get().text(), stored.get().steps())
                .addIf(rootUsed, rootProof.get())
                .add(conjectureProof.get());
        return Optional.of(assembly.toCandidate(context, abstractLemma, Candidate.Kind.ABSTRACT));
    }

    /**
     * Nessun candidato di supporto: la prova memorizzata della radice seguita
     * dalla prova della congettura.
     *
     * @throws StructuralInconsistencyException se la radice dipende da un lemma storico
     * @throws LemmaNotFoundException se la radice non ha una prova memorizzata
     */
    public Optional<Candidate> evaluateRootOnly(RootContext context)
            throws LemmaNotFoundException, StructuralInconsistencyException, IOException {

        NamedFormula root = context.root();
        boolean dependsOnHistory = context.dag().graph().children(root.name()).stream()
                .anyMatch(child -> LemmaCategory.of(child).orElse(null) == LemmaCategory.HISTORY);
        if (dependsOnHistory) {
            throw new StructuralInconsistencyException(root.name(),
                    "La radice " + root.name() + " dipende da un lemma storico: prova della sola radice rifiutata");
        }

        StoredProof stored = repository.storedProof(root.name())
                .orElseThrow(() -> new LemmaNotFoundException(root.name(), "Nessuna prova memorizzata per " + root.name()));

        ExtraDependencies extra = new ExtraDependencies();
        String rootText = stored.text();
        int rootSteps = stored.steps();

        if (stored.prover() == Prover.VAMPIRE) {
            Optional<Extraction> extraction = parser.extract(parser.parse(stored.text()), root);
            if (extraction.isPresent()) {
                SuperpositionAnnotator.Annotation annotation =
                        annotator.annotate(extraction.get(), extra.entries(), root.name());
                extra.extend(extraction.get(), annotation.renaming());
                rootText = annotation.text();
                rootSteps = extraction.get().stepCount();
            }
        }

        Optional<ReProof> conjectureProof = reProver.prove(context.input(), List.of(root), null, List.of(), extra);
        if (conjectureProof.isEmpty()) {
            return Optional.empty();
        }

        boolean rootUsed = ProofUsage.uses(conjectureProof.get().text(), root.name());
        Assembly assembly = new Assembly(context.inputText())
                .addIf(rootUsed, rootText, rootSteps)
                .add(conjectureProof.get());
        return Optional.of(assembly.toCandidate(context, null, Candidate.Kind.ROOT_ONLY));
    }

    //endregion

    //region ASSEMBLAGGIO

    /**
     * Problema di input commentato, riga per riga.
     */
    static String inputBlock(String inputText) {
        StringBuilder block = new StringBuilder(INPUT_HEADER).append('\n');
        inputText.lines().forEach(line -> block.append("% ").append(line).append('\n'));
        return block.append('\n').toString();
    }

    /**
     * Prova combinata in costruzione e somma dei passi dei segmenti mantenuti.
     */
    private static final class Assembly {
        private final StringBuilder text;
        private int steps;

        Assembly(String inputText) {
            this.text = new StringBuilder(inputBlock(inputText));
        }

        Assembly add(String segment, int segmentSteps) {
            text.append(segment);
            if (!segment.isEmpty() && !segment.endsWith("\n")) {
                text.append('\n');
            }
            steps += segmentSteps;
            return this;
        }

        Assembly add(ReProof proof) {
            return add(proof.text(), proof.steps());
        }

        Assembly addIf(boolean keep, ReProof proof) {
            return keep ? add(proof) : this;
        }

        Assembly addIf(boolean keep, String segment, int segmentSteps) {
            return keep ? add(segment, segmentSteps) : this;
        }

        Candidate toCandidate(RootContext context, String support, Candidate.Kind kind) {
            return new Candidate(context.root().name(), support, kind, text.toString(), steps,
                    context.dag().lemmaCount());
        }
    }

    //endregion
}
