package org.proofmin.minimize;

/**
 * Errore che interrompe l'intera minimizzazione: indice riassuntivo corrotto,
 * file di input non leggibili, output non scrivibile, nessun candidato valido.
 */
public class MinimizationException extends Exception {

    public MinimizationException(String message) {
        super(message);
    }

    public MinimizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
