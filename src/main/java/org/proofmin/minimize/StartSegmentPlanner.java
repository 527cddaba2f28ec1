package org.proofmin.minimize;

import org.proofmin.dag.DependencyGraph;
import org.proofmin.lemma.LemmaCategory;
import org.proofmin.lemma.LemmaNotFoundException;
import org.proofmin.lemma.LemmaRepository;
import org.proofmin.lemma.StoredProof;
import org.proofmin.proof.ExtraDependencies;
import org.proofmin.proof.Extraction;
import org.proofmin.proof.NamedFormula;
import org.proofmin.proof.ParsedProof;
import org.proofmin.proof.ProofStepParser;
import org.proofmin.proof.SuperpositionAnnotator;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * PIANIFICAZIONE DEL SEGMENTO INIZIALE
 *
 * Le dipendenze di partenza di un lemma storico sono i suoi figli singoli nel
 * grafo; in mancanza, i figli storici che nessun altro lemma usa (e allora si
 * forza la superposition); in mancanza anche di questi, il lemma stesso, che
 * viene quindi dimostrato direttamente dalla prova per refutazione. Un lemma
 * non storico parte da se stesso.
 *
 * Le formule delle dipendenze vengono cercate nella prova per refutazione del
 * problema; i passi necessari a derivarle si confrontano con le prove
 * memorizzate, preferite a parità di lunghezza.
 */
public class StartSegmentPlanner {

    private static final Logger LOGGER = Logger.getLogger(StartSegmentPlanner.class.getName());

    private final LemmaRepository repository;
    private final ProofStepParser parser;
    private final SuperpositionAnnotator annotator;

    public StartSegmentPlanner(LemmaRepository repository, ProofStepParser parser) {
        this.repository = repository;
        this.parser = parser;
        this.annotator = new SuperpositionAnnotator();
    }

    /**
     * Dipendenze di partenza e passi estratti per un candidato.
     *
     * @param dependencies lemmi le cui prove memorizzate formano l'alternativa ai passi estratti
     * @param extraction passi estratti, null se nessuna formula compare nella prova
     * @param provedHistory il lemma storico stesso è derivato dai passi estratti
     */
    public record Plan(List<String> dependencies, Extraction extraction, boolean provedHistory) {

        public Plan {
            dependencies = List.copyOf(dependencies);
        }

        public int superpositionSteps() {
            return extraction == null ? 0 : extraction.stepCount();
        }
    }

    /**
     * @param lemma candidato (storico o singolo)
     * @param graph grafo delle dipendenze della radice corrente
     * @param refutation prova per refutazione del problema, già rinumerata
     */
    public Plan plan(String lemma, DependencyGraph graph, ParsedProof refutation) {
        List<String> dependencies = new ArrayList<>();
        boolean provedHistory = false;
        boolean forceSuperposition = false;

        if (LemmaCategory.of(lemma).orElse(null) == LemmaCategory.HISTORY) {
            for (String child : graph.children(lemma)) {
                if (LemmaCategory.of(child).orElse(null) == LemmaCategory.SINGLE) {
                    dependencies.add(child);
                }
            }

            if (dependencies.isEmpty()) {
                for (String child : graph.children(lemma)) {
                    if (LemmaCategory.of(child).orElse(null) == LemmaCategory.HISTORY
                            && graph.parents(child).stream().allMatch(lemma::equals)) {
                        dependencies.add(child);
                    }
                }
                if (dependencies.isEmpty()) {
                    LOGGER.fine(lemma + " non ha figli utilizzabili, viene derivato direttamente");
                    dependencies.add(lemma);
                    provedHistory = true;
                } else {
                    forceSuperposition = true;
                }
            }
        } else {
            dependencies.add(lemma);
        }

        List<NamedFormula> targets = new ArrayList<>();
        for (String dependency : dependencies) {
            try {
                targets.add(new NamedFormula(dependency, repository.load(dependency).formula()));
            } catch (LemmaNotFoundException e) {
                LOGGER.warning("Formula di " + dependency + " non disponibile: " + e.getMessage());
            }
        }

        Extraction extraction = parser.extract(refutation, targets).orElse(null);
        if (extraction == null) {
            LOGGER.fine("Nessun passo di superposizione per " + lemma + ", restano le prove memorizzate");
            // il lemma storico non può riusare la propria prova come segmento iniziale
            return new Plan(provedHistory ? List.of() : dependencies, null, false);
        }
        if (provedHistory || forceSuperposition) {
            dependencies.clear();
        }
        return new Plan(dependencies, extraction, provedHistory);
    }

    /**
     * Sceglie la sorgente del segmento iniziale. Le prove memorizzate vincono
     * se esistono e non sono più lunghe dei passi estratti, oppure se non c'è
     * alcun passo estratto. Scegliendo i passi estratti, questi vengono
     * aggiunti alle dipendenze accumulate del candidato.
     *
     * @throws LemmaNotFoundException se la formula di una dipendenza memorizzata manca
     */
    public StartSegment choose(Plan plan, ExtraDependencies extra) throws LemmaNotFoundException {
        List<StoredProof> stored = repository.loadDependencyProofs(plan.dependencies());
        int storedSteps = stored.stream().mapToInt(StoredProof::steps).sum();
        int superpositionSteps = plan.superpositionSteps();

        if (storedSteps != 0 && (superpositionSteps == 0 || storedSteps <= superpositionSteps)) {
            List<NamedFormula> axioms = new ArrayList<>();
            for (StoredProof proof : stored) {
                axioms.add(new NamedFormula(proof.lemmaName(), repository.load(proof.lemmaName()).formula()));
            }
            String text = String.join("\n\n", stored.stream().map(StoredProof::text).toList());
            LOGGER.fine("Segmento iniziale da prove memorizzate: " + storedSteps + " passi");
            return new StartSegment(StartSegment.Source.STORED, text, storedSteps, axioms);
        }

        if (plan.extraction() == null) {
            return new StartSegment(StartSegment.Source.SUPERPOSITION, "", 0, List.of());
        }

        SuperpositionAnnotator.Annotation annotation =
                annotator.annotate(plan.extraction(), List.of(), plan.extraction().derivedName());
        extra.extend(plan.extraction(), annotation.renaming());
        LOGGER.fine("Segmento iniziale da superposition: " + superpositionSteps + " passi");
        return new StartSegment(StartSegment.Source.SUPERPOSITION, annotation.text(), superpositionSteps, List.of());
    }
}
