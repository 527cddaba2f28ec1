package org.proofmin.minimize;

import org.proofmin.matching.FormulaMatcher;

import java.nio.file.Path;

/**
 * Configurazione immutabile della minimizzazione.
 *
 * Le directory dei lemmi e delle prove sono obbligatorie; per tutto il resto
 * il builder applica i valori predefiniti.
 */
public final class MinimizationConfiguration {

    public static final String DEFAULT_VAMPIRE = "vampire";
    public static final String DEFAULT_TWEE = "twee";
    public static final int DEFAULT_REPROVE_TIMEOUT_SECONDS = 10;
    public static final int DEFAULT_MAX_ROOT_CANDIDATES = 4;

    private final Path lemmasDir;
    private final Path proofsDir;
    private final Path completionProofsDir;
    private final Path outputDir;
    private final Path temporaryDir;
    private final String vampireExecutable;
    private final String tweeExecutable;
    private final int reproveTimeoutSeconds;
    private final int maxRootCandidates;
    private final int permutationBound;

    private MinimizationConfiguration(Builder builder) {
        this.lemmasDir = builder.lemmasDir;
        this.proofsDir = builder.proofsDir;
        this.completionProofsDir = builder.completionProofsDir != null ? builder.completionProofsDir : builder.proofsDir;
        this.outputDir = builder.outputDir;
        this.temporaryDir = builder.temporaryDir != null
                ? builder.temporaryDir
                : Path.of(System.getProperty("java.io.tmpdir"));
        this.vampireExecutable = builder.vampireExecutable;
        this.tweeExecutable = builder.tweeExecutable;
        this.reproveTimeoutSeconds = builder.reproveTimeoutSeconds;
        this.maxRootCandidates = builder.maxRootCandidates;
        this.permutationBound = builder.permutationBound;
    }

    public static Builder builder() {
        return new Builder();
    }

    //region ACCESSORI

    public Path getLemmasDir() {
        return lemmasDir;
    }

    public Path getProofsDir() {
        return proofsDir;
    }

    public Path getCompletionProofsDir() {
        return completionProofsDir;
    }

    /**
     * Directory degli artefatti; null significa "la directory del problema".
     */
    public Path getOutputDir() {
        return outputDir;
    }

    public Path getTemporaryDir() {
        return temporaryDir;
    }

    public String getVampireExecutable() {
        return vampireExecutable;
    }

    public String getTweeExecutable() {
        return tweeExecutable;
    }

    public int getReproveTimeoutSeconds() {
        return reproveTimeoutSeconds;
    }

    public int getMaxRootCandidates() {
        return maxRootCandidates;
    }

    public int getPermutationBound() {
        return permutationBound;
    }

    /**
     * Directory in cui scrivere gli artefatti del problema indicato.
     */
    public Path outputDirFor(Path problem) {
        if (outputDir != null) {
            return outputDir;
        }
        Path parent = problem.toAbsolutePath().getParent();
        return parent != null ? parent : Path.of(".");
    }

    //endregion

    public static final class Builder {
        private Path lemmasDir;
        private Path proofsDir;
        private Path completionProofsDir;
        private Path outputDir;
        private Path temporaryDir;
        private String vampireExecutable = DEFAULT_VAMPIRE;
        private String tweeExecutable = DEFAULT_TWEE;
        private int reproveTimeoutSeconds = DEFAULT_REPROVE_TIMEOUT_SECONDS;
        private int maxRootCandidates = DEFAULT_MAX_ROOT_CANDIDATES;
        private int permutationBound = FormulaMatcher.DEFAULT_PERMUTATION_BOUND;

        private Builder() {
        }

        public Builder lemmasDir(Path lemmasDir) {
            this.lemmasDir = lemmasDir;
            return this;
        }

        public Builder proofsDir(Path proofsDir) {
            this.proofsDir = proofsDir;
            return this;
        }

        public Builder completionProofsDir(Path completionProofsDir) {
            this.completionProofsDir = completionProofsDir;
            return this;
        }

        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder temporaryDir(Path temporaryDir) {
            this.temporaryDir = temporaryDir;
            return this;
        }

        public Builder vampireExecutable(String vampireExecutable) {
            this.vampireExecutable = vampireExecutable;
            return this;
        }

        public Builder tweeExecutable(String tweeExecutable) {
            this.tweeExecutable = tweeExecutable;
            return this;
        }

        public Builder reproveTimeoutSeconds(int reproveTimeoutSeconds) {
            this.reproveTimeoutSeconds = reproveTimeoutSeconds;
            return this;
        }

        public Builder maxRootCandidates(int maxRootCandidates) {
            this.maxRootCandidates = maxRootCandidates;
            return this;
        }

        public Builder permutationBound(int permutationBound) {
            this.permutationBound = permutationBound;
            return this;
        }

        /**
         * @throws IllegalArgumentException se mancano le directory obbligatorie o un valore è fuori intervallo
         */
        public MinimizationConfiguration build() {
            if (lemmasDir == null) {
                throw new IllegalArgumentException("Directory dei lemmi non specificata");
            }
            if (proofsDir == null) {
                throw new IllegalArgumentException("Directory delle prove non specificata");
            }
            if (reproveTimeoutSeconds <= 0) {
                throw new IllegalArgumentException("Timeout deve essere positivo: " + reproveTimeoutSeconds);
            }
            if (maxRootCandidates <= 0) {
                throw new IllegalArgumentException("Numero di radici deve essere positivo: " + maxRootCandidates);
            }
            if (permutationBound < 0) {
                throw new IllegalArgumentException("Limite di permutazione non può essere negativo: " + permutationBound);
            }
            return new MinimizationConfiguration(this);
        }
    }
}
