package org.proofmin.lemma;

/**
 * Un lemma referenziato non ha un file su disco, oppure il file non contiene
 * la formula attesa.
 */
public class LemmaNotFoundException extends Exception {

    private final String lemmaName;

    public LemmaNotFoundException(String lemmaName, String message) {
        super(message);
        this.lemmaName = lemmaName;
    }

    public String getLemmaName() {
        return lemmaName;
    }
}
