package org.proofmin.minimize;

/**
 * Il grafo delle dipendenze di un candidato contiene il candidato stesso
 * (ridirezione ciclica). Il candidato viene scartato.
 */
public class StructuralInconsistencyException extends Exception {

    private final String lemmaName;

    public StructuralInconsistencyException(String lemmaName, String message) {
        super(message);
        this.lemmaName = lemmaName;
    }

    public String getLemmaName() {
        return lemmaName;
    }
}
