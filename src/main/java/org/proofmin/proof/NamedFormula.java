package org.proofmin.proof;

/**
 * Coppia (nome, formula) usata per assiomi aggiunti e dipendenze accumulate.
 */
public record NamedFormula(String name, String formula) {

    public NamedFormula {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome non può essere null o vuoto");
        }
        if (formula == null) {
            throw new IllegalArgumentException("Formula mancante per " + name);
        }
    }
}
