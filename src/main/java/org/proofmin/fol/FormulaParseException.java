package org.proofmin.fol;

/**
 * Testo non conforme alla sintassi FOF accettata da {@link FormulaReader}.
 */
public class FormulaParseException extends RuntimeException {

    public FormulaParseException(String message) {
        super(message);
    }

    public FormulaParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
