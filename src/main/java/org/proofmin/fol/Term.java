package org.proofmin.fol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Termine del primo ordine rappresentato come albero etichettato.
 *
 * Non esiste un costruttore separato per le variabili: una foglia la cui
 * etichetta inizia con una lettera maiuscola è una variabile, ogni altro nodo è
 * un'applicazione di funzione (costante se senza argomenti). La convenzione è
 * puramente sintattica ed è verificata solo da {@link #isVariable(String)}.
 */
public final class Term {

    /** Etichetta del nodo: nome di variabile, di funzione o di costante */
    private final String label;

    /** Argomenti dell'applicazione (vuota per variabili e costanti) */
    private final List<Term> args;

    //region COSTRUTTORI

    /**
     * Costruisce una foglia (variabile o costante).
     *
     * @param label etichetta non vuota
     * @throws IllegalArgumentException se label null o vuota
     */
    public Term(String label) {
        this(label, List.of());
    }

    /**
     * Costruisce un'applicazione di funzione.
     *
     * @param label nome della funzione
     * @param args argomenti (copiati difensivamente)
     * @throws IllegalArgumentException se label vuota o args contiene null
     */
    public Term(String label, List<Term> args) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Etichetta del termine non può essere null o vuota");
        }
        if (args == null || args.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Argomenti del termine non validi per " + label);
        }
        this.label = label;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    //endregion

    //region CONVENZIONE VARIABILI

    /**
     * Unico predicato che decide se un'etichetta denota una variabile.
     *
     * @param label etichetta da classificare
     * @return true se la prima lettera è maiuscola
     */
    public static boolean isVariable(String label) {
        return label != null && !label.isEmpty() && Character.isUpperCase(label.charAt(0));
    }

    /**
     * @return true se il termine è una foglia con etichetta da variabile
     */
    public boolean isVariable() {
        return args.isEmpty() && isVariable(label);
    }

    //endregion

    public String label() {
        return label;
    }

    public List<Term> args() {
        return args;
    }

    public int arity() {
        return args.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Term other)) return false;
        return label.equals(other.label) && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, args);
    }

    @Override
    public String toString() {
        if (args.isEmpty()) {
            return label;
        }
        StringBuilder sb = new StringBuilder(label).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(args.get(i));
        }
        return sb.append(')').toString();
    }
}
