package org.proofmin.lemma;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Convenzioni sui nomi di lemmi, assiomi e file di prova.
 */
public final class LemmaNames {

    /** Suffissi dei file di prova, uno per prover */
    public static final String[] PROVER_SUFFIXES = {"_twee", "_vampire", "_egg"};

    public static final String PROOF_EXTENSION = ".proof";
    public static final String CONJECTURE_PREFIX = "conjecture_";
    public static final String PLAIN_LEMMA_PREFIX = "lemma_";

    private static final Pattern BUILT_IN_AXIOM = Pattern.compile("a\\d+");
    private static final Pattern TRAILING_INDEX = Pattern.compile("(\\d+)$");

    private LemmaNames() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Rimuove l'estensione {@code .proof} e il suffisso del prover, se presenti.
     */
    public static String stripProverSuffix(String name) {
        String result = name.endsWith(PROOF_EXTENSION)
                ? name.substring(0, name.length() - PROOF_EXTENSION.length())
                : name;
        for (String suffix : PROVER_SUFFIXES) {
            if (result.endsWith(suffix)) {
                return result.substring(0, result.length() - suffix.length());
            }
        }
        return result;
    }

    /** Assiomi del problema originale: a1, a2, ... */
    public static boolean isBuiltInAxiom(String name) {
        return name != null && BUILT_IN_AXIOM.matcher(name).matches();
    }

    public static boolean isConjecture(String name) {
        return name != null && name.startsWith(CONJECTURE_PREFIX);
    }

    /** Assiomi e congetture terminano la visita delle dipendenze */
    public static boolean isTerminal(String name) {
        return isBuiltInAxiom(name) || isConjecture(name);
    }

    /**
     * Indice numerico finale del nome ({@code history_lemma_0012} → 12).
     *
     * @return indice, oppure -1 se il nome non termina con cifre
     */
    public static int index(String name) {
        Matcher m = TRAILING_INDEX.matcher(stripProverSuffix(name));
        return m.find() ? Integer.parseInt(m.group(1)) : -1;
    }

    /**
     * Nome del simbolo usato dentro il file del lemma: il prefisso di categoria
     * è sostituito da {@code conjecture_}.
     */
    public static String internalName(String lemmaName) {
        String bare = stripProverSuffix(lemmaName);
        return LemmaCategory.of(bare)
                .map(c -> CONJECTURE_PREFIX + bare.substring(c.prefix().length()))
                .orElse(bare);
    }
}
