package org.proofmin;

import org.proofmin.minimize.Candidate;
import org.proofmin.minimize.MinimizationConfiguration;
import org.proofmin.minimize.MinimizationException;
import org.proofmin.minimize.MinimizationResult;
import org.proofmin.minimize.MinimizationSearch;
import org.proofmin.proof.ProofDirectionNormalizer;
import org.proofmin.proof.ProofStepParser;
import org.proofmin.proof.SuperpositionStep;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.SortedMap;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * MINIMIZZATORE DI PROVE EQUAZIONALI
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: problema TPTP, prova per refutazione del problema, indice riassuntivo
 * 2. INDICE DEI LEMMI: prove memorizzate e lemmi intermedi del prover a completamento
 * 3. GRAFO: dipendenze minime di ogni radice, con fusione dei lemmi duplicati
 * 4. RICERCA: combinazioni radice + lemma di supporto, ridimostrate con i prover esterni
 * 5. OUTPUT: grafo, file dei lemmi e prova combinata annotata del candidato migliore
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - Minimizzazione (-f): ricerca completa su un problema
 * - Rovesciamento (-turnaround): stampa i passi di una prova per refutazione
 *   dopo averne reso costruttiva la catena della congettura negata
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String REFUTER_PARAM = "-r";
    private static final String SUMMARY_PARAM = "-s";
    private static final String LEMMAS_PARAM = "-l";
    private static final String PROOFS_PARAM = "-p";
    private static final String COMPLETION_PARAM = "-c";
    private static final String OUTPUT_PARAM = "-o";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String ROOTS_PARAM = "-k";
    private static final String PERMUTATION_PARAM = "-perm=";
    private static final String VAMPIRE_PARAM = "-vampire";
    private static final String TWEE_PARAM = "-twee";
    private static final String TURNAROUND_PARAM = "-turnaround";

    /**
     * Valori predefiniti
     * */
    private static final String DEFAULT_LEMMAS_DIR = "lemmas";
    private static final String DEFAULT_PROOFS_DIR = "proofs";
    private static final String DEFAULT_SUMMARY = "summary.json";
    private static final String REFUTER_PROOF_SUFFIX = "_vampire.proof";
    private static final String LOGGING_CONFIG = "/logging.properties";

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale del minimizzatore.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        configureLogging();
        System.out.println("---> AVVIO MINIMIZZATORE DI PROVE <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            MinimizerSettings settings = parseAndValidateArguments(args);
            if (settings == null) return; // Help mostrato o errore

            if (settings.turnaroundFile != null) {
                System.out.println("[I] Modalità: Rovesciamento della prova");
                printTurnaround(settings.turnaroundFile);
            } else {
                System.out.println("[I] Modalità: Minimizzazione");
                displayConfigurationSummary(settings);
                runMinimization(settings);
            }

        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Esecuzione interrotta", e);
            System.out.println("[E] Esecuzione interrotta: " + e.getMessage());
            System.exit(1);
        } finally {
            System.out.println("---> FINE ESECUZIONE MINIMIZZATORE <---");
        }
    }

    private static void configureLogging() {
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione del logging non caricata: " + e.getMessage());
        }
    }

    //endregion

    //region ESECUZIONE

    private static void runMinimization(MinimizerSettings settings) {
        MinimizationSearch search = new MinimizationSearch(settings.configuration);
        try {
            MinimizationResult result = search.minimize(settings.problem, settings.refuterProof, settings.summary);
            Candidate best = result.best();

            System.out.println("\n[RESULT] Migliore combinazione trovata");
            System.out.println("[RESULT] Root lemma: " + best.rootLemma());
            System.out.println("[RESULT] Supporting lemma: " + best.support().orElse("-") + " (" + best.kind() + ")");
            System.out.println("[RESULT] Total steps: " + best.totalSteps());
            System.out.println("[RESULT] DAG lemmas: " + best.lemmaCount());
            System.out.println("[RESULT] Initial proof steps: " + result.initialSteps());
            System.out.println("[I] Grafo: " + result.dagFile());
            System.out.println("[I] Lemmi: " + result.lemmasFile());
            System.out.println("[I] Prova: " + result.proofFile());

        } catch (MinimizationException e) {
            System.out.println("[E] " + e.getMessage());
            System.exit(2);
        }
    }

    /**
     * Stampa i passi rinumerati della prova, rovesciati se necessario.
     */
    private static void printTurnaround(Path proofFile) throws IOException {
        String text = Files.readString(proofFile, StandardCharsets.UTF_8);
        ProofStepParser parser = new ProofStepParser();
        ProofDirectionNormalizer normalizer = new ProofDirectionNormalizer();

        SortedMap<Integer, SuperpositionStep> steps = parser.parseAll(text);
        if (steps.isEmpty()) {
            System.out.println("[W] Nessun passo riconosciuto in " + proofFile);
            return;
        }
        boolean turnaround = normalizer.needsTurnaround(steps);
        System.out.println("[I] Rovesciamento necessario: " + (turnaround ? "sì" : "no"));

        for (Map.Entry<Integer, SuperpositionStep> entry : normalizer.normalize(steps).entrySet()) {
            SuperpositionStep step = entry.getValue();
            System.out.println(entry.getKey() + ". " + step.formula() + " [" + step.inference() + "]");
        }
    }

    private static void displayConfigurationSummary(MinimizerSettings settings) {
        MinimizationConfiguration config = settings.configuration;
        System.out.println("\n-->> CONFIGURAZIONE MINIMIZZATORE <<--");
        System.out.println("Problema: " + settings.problem);
        System.out.println("Prova per refutazione: " + settings.refuterProof);
        System.out.println("Indice riassuntivo: " + settings.summary);
        System.out.println("Lemmi: " + config.getLemmasDir());
        System.out.println("Prove: " + config.getProofsDir());
        System.out.println("Timeout ridimostrazione: " + config.getReproveTimeoutSeconds() + " secondi");
        System.out.println("Radici valutate: " + config.getMaxRootCandidates());
        System.out.println("Limite permutazioni: " + config.getPermutationBound());
        System.out.println("Output: " + (config.getOutputDir() != null ? config.getOutputDir() : "Directory input"));
        System.out.println("====================================\n");
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static MinimizerSettings parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> MINIMIZZATORE DI PROVE <<::");
        System.out.println("Riduce prove per refutazione equazionali a certificati più corti e ridimostrabili\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar minimizzatore-prove.jar [opzioni]\n");

        System.out.println("MODALITÀ OPERATIVE:");
        System.out.println("  1. MINIMIZZAZIONE:");
        System.out.println("     -f <file.p>         Problema TPTP da minimizzare");
        System.out.println("     -r <file>           Prova per refutazione (default: <prove>/<problema>_vampire.proof)");
        System.out.println("     -s <file.json>      Indice riassuntivo (default: <prove>/summary.json)");
        System.out.println("     -l <directory>      Directory dei lemmi (default: lemmas)");
        System.out.println("     -p <directory>      Directory delle prove (default: proofs)");
        System.out.println("     -c <directory>      Prove del prover a completamento (default: directory delle prove)");
        System.out.println("     -o <directory>      Directory di output (default: stessa del problema)");
        System.out.println("     -t <secondi>        Timeout per ridimostrazione (default: 10)");
        System.out.println("     -k <numero>         Radici da valutare (default: 4)");
        System.out.println("     -perm=<numero>      Variabili quantificate permutabili nel confronto (default: 3)");
        System.out.println("     -vampire <percorso> Eseguibile del prover per refutazione");
        System.out.println("     -twee <percorso>    Eseguibile del prover a completamento");
        System.out.println();
        System.out.println("  2. ROVESCIAMENTO:");
        System.out.println("     -turnaround <file>  Stampa i passi della prova resi costruttivi");
        System.out.println();
        System.out.println("  3. AIUTO:");
        System.out.println("     -h                  Mostra questa guida\n");

        System.out.println("OUTPUT GENERATO:");
        System.out.println("  <problema>_dag.txt          Grafo delle dipendenze del candidato migliore");
        System.out.println("  <problema>_lemmas.p         Lemmi del grafo in formato fof");
        System.out.println("  <problema>_minimized.proof  Prova combinata annotata\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Parametri validati della riga di comando.
     */
    static class MinimizerSettings {
        final Path problem;
        final Path refuterProof;
        final Path summary;
        final MinimizationConfiguration configuration;
        final Path turnaroundFile;

        MinimizerSettings(Path problem, Path refuterProof, Path summary,
                          MinimizationConfiguration configuration, Path turnaroundFile) {
            this.problem = problem;
            this.refuterProof = refuterProof;
            this.summary = summary;
            this.configuration = configuration;
            this.turnaroundFile = turnaroundFile;
        }
    }

    /**
     * Parser dei parametri della riga di comando.
     */
    static class ArgumentParser {

        /**
         * @return parametri validati, null se è stato richiesto l'help
         * @throws IllegalArgumentException se un parametro è mancante o non valido
         */
        public MinimizerSettings parse(String[] args) {
            String problem = null;
            String refuterProof = null;
            String summary = null;
            String turnaround = null;
            String lemmasDir = DEFAULT_LEMMAS_DIR;
            String proofsDir = DEFAULT_PROOFS_DIR;
            MinimizationConfiguration.Builder builder = MinimizationConfiguration.builder();

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        problem = argumentAfter(args, ++i, "file");
                        requireReadable(problem, false);
                    }
                    case REFUTER_PARAM -> refuterProof = argumentAfter(args, ++i, "file");
                    case SUMMARY_PARAM -> summary = argumentAfter(args, ++i, "file");
                    case LEMMAS_PARAM -> {
                        lemmasDir = argumentAfter(args, ++i, "directory");
                        requireReadable(lemmasDir, true);
                    }
                    case PROOFS_PARAM -> {
                        proofsDir = argumentAfter(args, ++i, "directory");
                        requireReadable(proofsDir, true);
                    }
                    case COMPLETION_PARAM -> {
                        String dir = argumentAfter(args, ++i, "directory");
                        requireReadable(dir, true);
                        builder.completionProofsDir(Path.of(dir));
                    }
                    case OUTPUT_PARAM -> builder.outputDir(Path.of(argumentAfter(args, ++i, "directory output")));
                    case TIMEOUT_PARAM -> builder.reproveTimeoutSeconds(parsePositive(args, ++i, "numero secondi"));
                    case ROOTS_PARAM -> builder.maxRootCandidates(parsePositive(args, ++i, "numero di radici"));
                    case VAMPIRE_PARAM -> builder.vampireExecutable(argumentAfter(args, ++i, "percorso"));
                    case TWEE_PARAM -> builder.tweeExecutable(argumentAfter(args, ++i, "percorso"));
                    case TURNAROUND_PARAM -> {
                        turnaround = argumentAfter(args, ++i, "file");
                        requireReadable(turnaround, false);
                    }
                    default -> {
                        if (args[i].startsWith(PERMUTATION_PARAM)) {
                            builder.permutationBound(parseNumber(args[i].substring(PERMUTATION_PARAM.length())));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (turnaround != null) {
                if (problem != null) {
                    throw new IllegalArgumentException("-turnaround non può essere combinato con -f");
                }
                return new MinimizerSettings(null, null, null, null, Path.of(turnaround));
            }
            if (problem == null) {
                throw new IllegalArgumentException("Specificare il problema con -f oppure una prova con -turnaround");
            }

            Path problemPath = Path.of(problem);
            Path proofs = Path.of(proofsDir);
            String stem = problemPath.getFileName().toString().replaceFirst("\\.[^.]*$", "");
            Path refuter = refuterProof != null ? Path.of(refuterProof) : proofs.resolve(stem + REFUTER_PROOF_SUFFIX);
            Path summaryPath = summary != null ? Path.of(summary) : proofs.resolve(DEFAULT_SUMMARY);
            requireReadable(refuter.toString(), false);
            requireReadable(summaryPath.toString(), false);

            MinimizationConfiguration configuration = builder
                    .lemmasDir(Path.of(lemmasDir))
                    .proofsDir(proofs)
                    .build();
            return new MinimizerSettings(problemPath, refuter, summaryPath, configuration, null);
        }

        /**
         * Valore che segue il parametro in posizione {@code index - 1}.
         */
        private String argumentAfter(String[] args, int index, String expected) {
            if (index >= args.length || args[index].startsWith("-")) {
                throw new IllegalArgumentException("Manca " + expected + " dopo " + args[index - 1]);
            }
            return args[index];
        }

        private int parsePositive(String[] args, int currentIndex, String argumentType) {
            int value = parseNumber(argumentAfter(args, currentIndex, argumentType));
            if (value <= 0) {
                throw new IllegalArgumentException("Valore deve essere positivo: " + value);
            }
            return value;
        }

        private int parseNumber(String text) {
            try {
                return Integer.parseInt(text.strip());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore numerico non valido: " + text);
            }
        }

        /**
         * Verifica che il percorso esista, sia del tipo atteso e sia leggibile.
         */
        private void requireReadable(String location, boolean directory) {
            Path path = Path.of(location);
            String kind = directory ? "Directory" : "File";
            if (!Files.exists(path)) {
                throw new IllegalArgumentException(kind + " non esistente: " + location);
            }
            if (directory ? !Files.isDirectory(path) : !Files.isRegularFile(path)) {
                throw new IllegalArgumentException("Non è " + (directory ? "una directory" : "un file") + ": " + location);
            }
            if (!Files.isReadable(path)) {
                throw new IllegalArgumentException(kind + " non leggibile: " + location);
            }
        }
    }

    //endregion
}
