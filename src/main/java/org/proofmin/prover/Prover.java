package org.proofmin.prover;

import java.util.Optional;

/**
 * Prover esterni che producono le prove memorizzate.
 * L'ordine di dichiarazione è la preferenza a parità di lunghezza.
 */
public enum Prover {
    TWEE("twee"),
    VAMPIRE("vampire"),
    EGG("egg");

    private final String id;

    Prover(String id) {
        this.id = id;
    }

    /** Identificativo usato nei nomi dei file e nell'indice riassuntivo */
    public String id() {
        return id;
    }

    /** Suffisso dei file di prova, ad esempio {@code _twee} */
    public String suffix() {
        return "_" + id;
    }

    /** Nome del file di prova per il lemma dato */
    public String proofFileName(String lemmaName) {
        return lemmaName + suffix() + ".proof";
    }

    public static Optional<Prover> fromId(String id) {
        for (Prover p : values()) {
            if (p.id.equalsIgnoreCase(id)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    /**
     * Ricava il prover dal nome di un file di prova ({@code <lemma>_<prover>.proof}).
     */
    public static Optional<Prover> fromFileName(String fileName) {
        String stem = fileName.endsWith(".proof") ? fileName.substring(0, fileName.length() - 6) : fileName;
        for (Prover p : values()) {
            if (stem.endsWith(p.suffix())) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}
