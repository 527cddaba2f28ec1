package org.proofmin.minimize;

import org.proofmin.proof.NamedFormula;

import java.util.List;

/**
 * Segmento iniziale della prova di un candidato.
 *
 * @param source provenienza del segmento
 * @param text testo da anteporre alla prova combinata
 * @param steps passi conteggiati
 * @param axioms formule da aggiungere come assiomi nelle ridimostrazioni
 *               (vuoto per i passi di superposizione, che vivono nelle dipendenze accumulate)
 */
public record StartSegment(Source source, String text, int steps, List<NamedFormula> axioms) {

    public enum Source {
        /** Prove memorizzate delle dipendenze */
        STORED,
        /** Passi estratti dalla prova per refutazione del problema */
        SUPERPOSITION
    }

    public StartSegment {
        axioms = List.copyOf(axioms);
    }
}
