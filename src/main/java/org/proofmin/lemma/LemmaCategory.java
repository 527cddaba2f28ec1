package org.proofmin.lemma;

import java.util.Optional;

/**
 * Strategie di estrazione dei lemmi. La categoria è codificata nel nome del
 * lemma ({@code <categoria>_lemma_NNNN}) e determina la sottocartella in cui
 * il file del lemma è memorizzato.
 */
public enum LemmaCategory {
    SINGLE("single"),
    HISTORY("history"),
    ABSTRACT("abstract");

    private final String directory;

    LemmaCategory(String directory) {
        this.directory = directory;
    }

    /** Sottocartella della directory dei lemmi */
    public String directory() {
        return directory;
    }

    /** Prefisso dei nomi, ad esempio {@code history_lemma_} */
    public String prefix() {
        return directory + "_lemma_";
    }

    /**
     * @param name nome del lemma, eventualmente con suffisso del prover
     * @return categoria codificata nel nome, vuota per assiomi e congetture
     */
    public static Optional<LemmaCategory> of(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (LemmaCategory category : values()) {
            if (name.startsWith(category.prefix())) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /**
     * Nome del lemma di questa categoria con l'indice dato, ad esempio {@code single_lemma_0007}.
     */
    public String lemmaName(int index) {
        return String.format("%s%04d", prefix(), index);
    }
}
