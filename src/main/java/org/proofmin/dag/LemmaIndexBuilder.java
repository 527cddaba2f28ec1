package org.proofmin.dag;

import org.proofmin.lemma.LemmaCategory;
import org.proofmin.lemma.LemmaNames;
import org.proofmin.lemma.LemmaNotFoundException;
import org.proofmin.lemma.LemmaRepository;
import org.proofmin.matching.FormulaMatcher;
import org.proofmin.proof.CompletionProofParser;
import org.proofmin.proof.NamedFormula;
import org.proofmin.prover.Prover;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Costruzione dell'indice dei lemmi a partire dalle prove memorizzate.
 *
 * Per ogni lemma con prova, le dipendenze sono gli altri lemmi dichiarati come
 * assiomi (o obiettivi) nella sua prova a completamento. I lemmi intermedi
 * dedotti dal prover a completamento diventano candidati duplicati con nome
 * canonico {@code twee_lemma_NN}, unico per formula normalizzata.
 */
public class LemmaIndexBuilder {

    private static final Logger LOGGER = Logger.getLogger(LemmaIndexBuilder.class.getName());

    private static final String CANDIDATE_PREFIX = "twee_lemma_";
    private static final int FIRST_CANDIDATE_INDEX = 2;

    private final LemmaRepository repository;
    private final FormulaMatcher matcher;

    public LemmaIndexBuilder(LemmaRepository repository, FormulaMatcher matcher) {
        this.repository = repository;
        this.matcher = matcher;
    }

    /**
     * @param completionProofsDir directory con le prove {@code <lemma>_twee.proof}
     * @throws IOException se la directory delle prove non è leggibile
     */
    public LemmaIndex build(Path completionProofsDir) throws IOException {
        Map<String, LemmaIndex.LemmaInfo> lemmas = new TreeMap<>();
        Map<String, String> canonicalNames = new HashMap<>();
        Map<String, MutableCandidate> candidates = new LinkedHashMap<>();

        for (String lemmaName : storedLemmaNames()) {
            Optional<String> proof = completionProof(lemmaName, completionProofsDir);
            if (proof.isEmpty()) {
                LOGGER.warning("Nessuna prova a completamento per " + lemmaName + ": dipendenze ignote");
            }

            String formula;
            try {
                formula = repository.load(lemmaName).formula();
            } catch (LemmaNotFoundException e) {
                LOGGER.warning("Lemma escluso dall'indice: " + e.getMessage());
                continue;
            }

            List<NamedFormula> dependencies = new ArrayList<>();
            if (proof.isPresent()) {
                dependencies.addAll(usedLemmas(proof.get()));

                for (NamedFormula derived : CompletionProofParser.lemmas(proof.get())) {
                    String key = matcher.normalize(derived.formula());
                    String canonical = canonicalNames.computeIfAbsent(key,
                            k -> String.format("%s%02d", CANDIDATE_PREFIX, FIRST_CANDIDATE_INDEX + canonicalNames.size()));

                    candidates.computeIfAbsent(canonical, n -> new MutableCandidate(n, derived.formula()))
                            .addParent(lemmaName);
                    dependencies.add(new NamedFormula(canonical, derived.formula()));
                }
            }

            lemmas.put(lemmaName, new LemmaIndex.LemmaInfo(formula, dependencies));
        }

        List<LemmaIndex.DuplicateCandidate> duplicates = candidates.values().stream()
                .map(MutableCandidate::freeze)
                .toList();

        LOGGER.info("Indice lemmi: " + lemmas.size() + " lemmi, " + duplicates.size() + " candidati duplicati");
        return new LemmaIndex(lemmas, duplicates);
    }

    private List<String> storedLemmaNames() throws IOException {
        TreeSet<String> names = new TreeSet<>();
        try (Stream<Path> files = Files.list(repository.getProofsDir())) {
            files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(LemmaNames.PROOF_EXTENSION))
                    .map(LemmaNames::stripProverSuffix)
                    .filter(n -> LemmaCategory.of(n).isPresent())
                    .forEach(names::add);
        }
        return new ArrayList<>(names);
    }

    private Optional<String> completionProof(String lemmaName, Path completionProofsDir) {
        Path file = completionProofsDir.resolve(Prover.TWEE.proofFileName(lemmaName));
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            LOGGER.warning("Prova non leggibile " + file + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Lemmi dichiarati come assiomi o obiettivi, con le formule lette dai file dei lemmi.
     */
    List<NamedFormula> usedLemmas(String proof) {
        List<NamedFormula> used = new ArrayList<>();

        for (NamedFormula axiom : CompletionProofParser.axioms(proof)) {
            String name = axiom.name();
            if (LemmaNames.isTerminal(name)) continue;

            if (refersToStoredLemma(name)) {
                resolve(name).ifPresent(used::add);
            } else {
                used.add(axiom);
            }
        }
        for (NamedFormula goal : CompletionProofParser.goals(proof)) {
            if (goal.name().startsWith(LemmaNames.PLAIN_LEMMA_PREFIX)) {
                resolve(goal.name()).ifPresent(used::add);
            }
        }

        used.sort(Comparator.comparing(NamedFormula::name));
        return used;
    }

    private static boolean refersToStoredLemma(String name) {
        return name.startsWith(LemmaNames.PLAIN_LEMMA_PREFIX) || LemmaCategory.of(name).isPresent();
    }

    private Optional<NamedFormula> resolve(String name) {
        try {
            String actual = LemmaNames.stripProverSuffix(repository.resolveVariant(name));
            return Optional.of(new NamedFormula(actual, repository.load(actual).formula()));
        } catch (LemmaNotFoundException e) {
            LOGGER.warning("Dipendenza non risolta " + name + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Candidato in costruzione: i genitori si accumulano durante la scansione.
     */
    private static final class MutableCandidate {
        private final String name;
        private final String formula;
        private final List<String> parents = new ArrayList<>();

        MutableCandidate(String name, String formula) {
            this.name = name;
            this.formula = formula;
        }

        void addParent(String parent) {
            if (!parents.contains(parent)) parents.add(parent);
        }

        LemmaIndex.DuplicateCandidate freeze() {
            return new LemmaIndex.DuplicateCandidate(name, formula, parents);
        }
    }
}
