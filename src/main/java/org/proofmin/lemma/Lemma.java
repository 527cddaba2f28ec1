package org.proofmin.lemma;

import org.proofmin.fol.Formula;
import org.proofmin.fol.FormulaReader;

/**
 * Lemma con nome, categoria e testo della formula così come memorizzato su disco.
 */
public record Lemma(String name, LemmaCategory category, String formula) {

    public Lemma {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome del lemma non può essere null o vuoto");
        }
        if (category == null) {
            throw new IllegalArgumentException("Categoria mancante per il lemma " + name);
        }
        if (formula == null || formula.isBlank()) {
            throw new IllegalArgumentException("Formula vuota per il lemma " + name);
        }
    }

    /**
     * @return albero della formula
     * @throws org.proofmin.fol.FormulaParseException se il testo non è valido
     */
    public Formula toFormula() {
        return FormulaReader.parse(formula);
    }

    public int index() {
        return LemmaNames.index(name);
    }
}
