package org.proofmin.lemma;

import org.proofmin.proof.ProofLength;
import org.proofmin.prover.Prover;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * ARCHIVIO DEI LEMMI - Accesso ai file dei lemmi e alle loro prove memorizzate
 *
 * ORGANIZZAZIONE SU DISCO:
 * - {@code <lemmasDir>/<categoria>/<lemma>.p}: file FOF con il lemma come
 *   {@code fof(conjecture_NNNN, conjecture, ...)}; il nome interno sostituisce il
 *   prefisso di categoria con {@code conjecture_}
 * - {@code <proofsDir>/<lemma>_<prover>.proof}: prova canonica del lemma
 *
 * I nomi ricevuti possono contenere il suffisso del prover, che viene rimosso
 * prima di ogni ricerca.
 */
public class LemmaRepository {

    private static final Logger LOGGER = Logger.getLogger(LemmaRepository.class.getName());

    /** Ordine in cui le categorie sono provate da {@link #resolveVariant(String)} */
    private static final LemmaCategory[] VARIANT_ORDER = {
            LemmaCategory.HISTORY, LemmaCategory.SINGLE, LemmaCategory.ABSTRACT
    };

    /** Prover le cui prove sono cercate da {@link #resolveVariant(String)} */
    private static final Prover[] VARIANT_PROVERS = {Prover.TWEE, Prover.VAMPIRE};

    private final Path lemmasDir;
    private final Path proofsDir;

    public LemmaRepository(Path lemmasDir, Path proofsDir) {
        if (lemmasDir == null || proofsDir == null) {
            throw new IllegalArgumentException("Directory dei lemmi e delle prove obbligatorie");
        }
        this.lemmasDir = lemmasDir;
        this.proofsDir = proofsDir;
    }

    public Path getLemmasDir() {
        return lemmasDir;
    }

    public Path getProofsDir() {
        return proofsDir;
    }

    //region CARICAMENTO FORMULE

    /**
     * Carica un lemma la cui categoria è codificata nel nome.
     *
     * @param name nome del lemma, eventualmente con suffisso del prover
     * @return lemma con la formula letta dal file
     * @throws LemmaNotFoundException se la categoria è ignota, il file manca o non contiene la formula
     */
    public Lemma load(String name) throws LemmaNotFoundException {
        LemmaCategory category = LemmaCategory.of(name)
                .orElseThrow(() -> new LemmaNotFoundException(name, "Tipo di lemma sconosciuto: " + name));
        return load(category, name);
    }

    /**
     * Carica un lemma dalla sottocartella della categoria indicata.
     */
    public Lemma load(LemmaCategory category, String name) throws LemmaNotFoundException {
        String bare = LemmaNames.stripProverSuffix(name);
        Path file = lemmasDir.resolve(category.directory()).resolve(bare + ".p");

        if (!Files.isRegularFile(file)) {
            throw new LemmaNotFoundException(bare, "File non trovato per il lemma " + bare + ": " + file);
        }

        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LemmaNotFoundException(bare, "File non leggibile per il lemma " + bare + ": " + e.getMessage());
        }

        String internal = LemmaNames.internalName(bare);
        String formula = extractFormulaBody(content, internal)
                .orElseThrow(() -> new LemmaNotFoundException(bare,
                        "Formula " + internal + " non presente nel file " + file));

        LOGGER.finest("Lemma " + bare + " caricato: " + formula);
        return new Lemma(bare, category, formula);
    }

    /**
     * Estrae il corpo della formula di nome {@code name} da un testo FOF, sia su
     * una sola riga sia distribuito su più righe fino alla chiusura {@code ).}.
     *
     * @return corpo della formula (senza nome e ruolo), vuoto se assente
     */
    public static Optional<String> extractFormulaBody(String content, String name) {
        String header = "fof(" + name + ",";
        List<String> lines = content.lines().toList();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (!line.replace(" ", "").contains(header)) continue;

            // salta nome e ruolo
            String rest = afterRole(line);
            List<String> parts = new ArrayList<>();
            if (rest.endsWith(").")) {
                parts.add(rest.substring(0, rest.length() - 2));
            } else {
                if (!rest.isBlank()) parts.add(rest);
                for (int j = i + 1; j < lines.size(); j++) {
                    String next = lines.get(j).strip();
                    if (next.endsWith(").")) {
                        parts.add(next.substring(0, next.length() - 2));
                        break;
                    }
                    parts.add(next);
                }
            }

            String body = String.join(" ", parts).replaceAll("\\s+", " ").strip();
            return body.isEmpty() ? Optional.empty() : Optional.of(body);
        }
        return Optional.empty();
    }

    private static String afterRole(String line) {
        int first = line.indexOf(',');
        int second = first < 0 ? -1 : line.indexOf(',', first + 1);
        return second < 0 ? "" : line.substring(second + 1).strip();
    }

    //endregion

    //region VARIANTI E PROVE MEMORIZZATE

    /**
     * Risolve un nome nudo (ad esempio {@code lemma_0003}) nel lemma realmente
     * presente tra le prove memorizzate, provando ogni categoria con ogni suffisso.
     * Assiomi e congetture sono restituiti invariati.
     *
     * @return nome del lemma senza estensione {@code .proof}, con il suffisso del prover
     * @throws LemmaNotFoundException se nessuna variante esiste su disco
     */
    public String resolveVariant(String name) throws LemmaNotFoundException {
        if (LemmaNames.isTerminal(name)) {
            return name;
        }

        String bare = LemmaNames.stripProverSuffix(name);
        String number = LemmaCategory.of(bare)
                .map(c -> bare.substring(c.prefix().length()))
                .orElseGet(() -> bare.startsWith(LemmaNames.PLAIN_LEMMA_PREFIX)
                        ? bare.substring(LemmaNames.PLAIN_LEMMA_PREFIX.length())
                        : bare);

        for (LemmaCategory category : VARIANT_ORDER) {
            for (Prover prover : VARIANT_PROVERS) {
                String candidate = category.prefix() + number + prover.suffix();
                if (Files.isRegularFile(proofsDir.resolve(candidate + LemmaNames.PROOF_EXTENSION))) {
                    return candidate;
                }
            }
        }
        throw new LemmaNotFoundException(name, "Nessuna prova memorizzata per " + name + " in " + proofsDir);
    }

    /**
     * Prova memorizzata del lemma, se presente in una qualsiasi variante di prover.
     */
    public Optional<StoredProof> storedProof(String name) {
        String bare = LemmaNames.stripProverSuffix(name);
        for (Prover prover : Prover.values()) {
            Path file = proofsDir.resolve(prover.proofFileName(bare));
            if (!Files.isRegularFile(file)) continue;
            try {
                String text = Files.readString(file, StandardCharsets.UTF_8);
                return Optional.of(new StoredProof(bare, prover, ProofLength.count(prover, text), text));
            } catch (IOException e) {
                LOGGER.warning("Prova non leggibile " + file + ": " + e.getMessage());
            }
        }
        return Optional.empty();
    }

    /**
     * Carica le prove memorizzate delle dipendenze; quelle mancanti sono ignorate.
     */
    public List<StoredProof> loadDependencyProofs(List<String> names) {
        List<StoredProof> proofs = new ArrayList<>();
        for (String name : names) {
            Optional<StoredProof> proof = storedProof(name);
            if (proof.isPresent()) {
                proofs.add(proof.get());
            } else {
                LOGGER.warning("Nessuna prova memorizzata per la dipendenza " + name);
            }
        }
        return proofs;
    }

    //endregion
}
