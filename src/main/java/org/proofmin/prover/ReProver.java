package org.proofmin.prover;

import org.proofmin.lemma.ProblemFile;
import org.proofmin.proof.ExtraDependencies;
import org.proofmin.proof.Extraction;
import org.proofmin.proof.NamedFormula;
import org.proofmin.proof.ParsedProof;
import org.proofmin.proof.ProofDirectionNormalizer;
import org.proofmin.proof.ProofLength;
import org.proofmin.proof.ProofStepParser;
import org.proofmin.proof.SuperpositionAnnotator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * RIDIMOSTRAZIONE - Un lemma (o la congettura originale) a partire da assiomi aggiunti
 *
 * Per ogni richiesta:
 * 1. copia privata del problema di input
 * 2. in coda, come assiomi: segmento iniziale, dipendenze accumulate, assiomi del candidato
 * 3. promozione a congettura del lemma bersaglio (oppure congettura dell'input)
 * 4. esecuzione di tutti i prover, scelta della prova più corta
 * 5. se vince il prover per refutazione, o se i suoi passi estratti sono meno
 *    della prova a completamento, si usano i passi annotati
 * La copia viene cancellata in ogni caso.
 */
public class ReProver {

    private static final Logger LOGGER = Logger.getLogger(ReProver.class.getName());

    /** Nome del bersaglio quando si dimostra la congettura dell'input */
    public static final String INPUT_CONJECTURE = "conjecture";

    private final List<TheoremProver> provers;
    private final Path tmpDir;
    private final ProofStepParser parser;
    private final ProofDirectionNormalizer normalizer;
    private final SuperpositionAnnotator annotator;

    public ReProver(List<TheoremProver> provers, Path tmpDir, ProofStepParser parser) {
        if (provers == null || provers.isEmpty()) {
            throw new IllegalArgumentException("Serve almeno un prover");
        }
        if (tmpDir == null) {
            throw new IllegalArgumentException("Directory temporanea non specificata");
        }
        this.provers = List.copyOf(provers);
        this.tmpDir = tmpDir;
        this.parser = parser;
        this.normalizer = new ProofDirectionNormalizer();
        this.annotator = new SuperpositionAnnotator();
    }

    /**
     * Esito di un singolo prover, con la lunghezza già calcolata.
     */
    private record Attempt(Prover prover, String text, int steps) {
    }

    /**
     * @param input problema originale
     * @param axioms assiomi del candidato, in ordine
     * @param target lemma da dimostrare; null per la congettura dell'input
     * @param startSegment formule del segmento iniziale
     * @param extra dipendenze accumulate dal candidato corrente, estese se si usano i passi annotati
     * @return vuoto se nessun prover dimostra il bersaglio
     * @throws IOException se la copia temporanea non può essere preparata
     */
    public Optional<ReProof> prove(Path input,
                                   List<NamedFormula> axioms,
                                   NamedFormula target,
                                   List<NamedFormula> startSegment,
                                   ExtraDependencies extra) throws IOException {

        Path problem = ProblemFile.createTemporaryCopy(input, tmpDir);
        try {
            Set<String> appended = new HashSet<>();
            List<NamedFormula> all = new ArrayList<>(startSegment);
            all.addAll(extra.entries());
            all.addAll(axioms);
            for (NamedFormula axiom : all) {
                if (appended.add(axiom.name())) {
                    ProblemFile.appendAxiom(problem, axiom.name(), axiom.formula());
                }
            }

            NamedFormula goal = prepareGoal(problem, target, appended);
            if (goal == null) {
                return Optional.empty();
            }

            List<Attempt> attempts = new ArrayList<>();
            for (TheoremProver prover : provers) {
                prover.prove(problem).ifPresent(text ->
                        attempts.add(new Attempt(prover.kind(), text, ProofLength.count(prover.kind(), text))));
            }
            if (attempts.isEmpty()) {
                LOGGER.info("Nessun prover ha dimostrato " + goal.name());
                return Optional.empty();
            }

            return Optional.of(choose(attempts, goal, extra));

        } finally {
            try {
                Files.deleteIfExists(problem);
            } catch (IOException e) {
                LOGGER.warning("Impossibile cancellare " + problem + ": " + e.getMessage());
            }
        }
    }

    private NamedFormula prepareGoal(Path problem, NamedFormula target, Set<String> appended) throws IOException {
        if (target == null) {
            Optional<String> conjecture = ProblemFile.extractConjecture(problem);
            if (conjecture.isEmpty()) {
                LOGGER.warning("Il problema non contiene una congettura: " + problem);
                return null;
            }
            return new NamedFormula(INPUT_CONJECTURE, conjecture.get());
        }

        if (appended.add(target.name())) {
            ProblemFile.appendAxiom(problem, target.name(), target.formula());
        }
        if (!ProblemFile.promoteToConjecture(problem, target.name())) {
            return null;
        }
        return target;
    }

    private ReProof choose(List<Attempt> attempts, NamedFormula goal, ExtraDependencies extra) {
        Attempt best = attempts.stream()
                .min(Comparator.comparingInt(Attempt::steps).thenComparing(Attempt::prover))
                .orElseThrow();

        Optional<Attempt> refutation = attempts.stream().filter(a -> a.prover() == Prover.VAMPIRE).findFirst();
        if (refutation.isPresent()) {
            ParsedProof parsed = parser.parseNormalized(refutation.get().text(), normalizer);
            Optional<Extraction> extraction = parser.extract(parsed, goal);

            if (extraction.isPresent()
                    && (best.prover() == Prover.VAMPIRE || extraction.get().stepCount() < best.steps())) {
                SuperpositionAnnotator.Annotation annotation =
                        annotator.annotate(extraction.get(), extra.entries(), goal.name());
                extra.extend(extraction.get(), annotation.renaming());
                LOGGER.fine(goal.name() + ": " + extraction.get().stepCount() + " passi di superposizione");
                return new ReProof(Prover.VAMPIRE, annotation.text(), extraction.get().stepCount(), true);
            }
        }

        LOGGER.fine(goal.name() + ": " + best.steps() + " passi con " + best.prover().id());
        return new ReProof(best.prover(), best.text(), best.steps(), false);
    }
}
