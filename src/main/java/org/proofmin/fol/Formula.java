package org.proofmin.fol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Formula del primo ordine immutabile, confrontata strutturalmente.
 *
 * Il nodo è un variante etichettato da {@link Type}: i campi significativi
 * dipendono dal tipo. L'uguaglianza è il predicato di nome {@code "="}.
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodo supportati.
     */
    public enum Type {
        TRUE,       // $true
        FALSE,      // $false
        PREDICATE,  // p(t1,...,tn), incluso t1 = t2
        NOT,        // ~A
        AND,        // A & B & ...
        OR,         // A | B | ...
        IMPLIES,    // A => B
        IFF,        // A <=> B
        FORALL,     // ! [X,...] : A
        EXISTS      // ? [X,...] : A
    }

    /** Nome del predicato di uguaglianza */
    public static final String EQUALITY = "=";

    private static final Formula TRUE_FORMULA = new Formula(Type.TRUE, null, List.of(), List.of(), List.of());
    private static final Formula FALSE_FORMULA = new Formula(Type.FALSE, null, List.of(), List.of(), List.of());

    private final Type type;

    /** Nome del predicato (solo PREDICATE) */
    private final String name;

    /** Argomenti del predicato (solo PREDICATE) */
    private final List<Term> args;

    /** Sottoformule: una per NOT e quantificatori, due per IMPLIES/IFF, n per AND/OR */
    private final List<Formula> operands;

    /** Variabili legate (solo FORALL/EXISTS) */
    private final List<String> variables;

    private Formula(Type type, String name, List<Term> args, List<Formula> operands, List<String> variables) {
        this.type = type;
        this.name = name;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
    }

    //endregion

    //region COSTRUTTORI STATICI

    public static Formula truth() {
        return TRUE_FORMULA;
    }

    public static Formula falsity() {
        return FALSE_FORMULA;
    }

    /**
     * Costruisce un atomo.
     *
     * @throws IllegalArgumentException se nome vuoto o argomenti null
     */
    public static Formula predicate(String name, List<Term> args) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome del predicato non può essere null o vuoto");
        }
        if (args == null || args.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Argomenti del predicato non validi: " + name);
        }
        return new Formula(Type.PREDICATE, name, args, List.of(), List.of());
    }

    public static Formula equality(Term left, Term right) {
        return predicate(EQUALITY, List.of(left, right));
    }

    public static Formula not(Formula operand) {
        return new Formula(Type.NOT, null, List.of(), List.of(requireOperand(operand)), List.of());
    }

    public static Formula and(List<Formula> operands) {
        return nary(Type.AND, operands);
    }

    public static Formula or(List<Formula> operands) {
        return nary(Type.OR, operands);
    }

    public static Formula implies(Formula premise, Formula conclusion) {
        return new Formula(Type.IMPLIES, null, List.of(),
                List.of(requireOperand(premise), requireOperand(conclusion)), List.of());
    }

    public static Formula iff(Formula left, Formula right) {
        return new Formula(Type.IFF, null, List.of(),
                List.of(requireOperand(left), requireOperand(right)), List.of());
    }

    public static Formula forall(List<String> variables, Formula body) {
        return quantified(Type.FORALL, variables, body);
    }

    public static Formula exists(List<String> variables, Formula body) {
        return quantified(Type.EXISTS, variables, body);
    }

    private static Formula nary(Type type, List<Formula> operands) {
        if (operands == null || operands.size() < 2 || operands.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Operazione " + type + " richiede almeno due operandi non null");
        }
        return new Formula(type, null, List.of(), operands, List.of());
    }

    private static Formula quantified(Type type, List<String> variables, Formula body) {
        if (variables == null || variables.isEmpty() || variables.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Quantificatore senza variabili");
        }
        return new Formula(type, null, List.of(), List.of(requireOperand(body)), variables);
    }

    private static Formula requireOperand(Formula operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando non può essere null");
        }
        return operand;
    }

    //endregion

    //region ACCESSO

    public Type type() {
        return type;
    }

    public String name() {
        return name;
    }

    public List<Term> args() {
        return args;
    }

    public List<Formula> operands() {
        return operands;
    }

    public List<String> variables() {
        return variables;
    }

    /**
     * Corpo di un quantificatore o operando di una negazione.
     */
    public Formula body() {
        if (operands.size() != 1) {
            throw new IllegalStateException("Formula di tipo " + type + " non ha un unico operando");
        }
        return operands.get(0);
    }

    //endregion

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Formula other)) return false;
        return type == other.type
                && Objects.equals(name, other.name)
                && args.equals(other.args)
                && operands.equals(other.operands)
                && variables.equals(other.variables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, args, operands, variables);
    }

    @Override
    public String toString() {
        return switch (type) {
            case TRUE -> "$true";
            case FALSE -> "$false";
            case PREDICATE -> {
                if (EQUALITY.equals(name) && args.size() == 2) {
                    yield args.get(0) + " = " + args.get(1);
                }
                yield args.isEmpty() ? name : new Term(name, args).toString();
            }
            case NOT -> "~" + wrap(operands.get(0));
            case AND -> join(" & ");
            case OR -> join(" | ");
            case IMPLIES -> join(" => ");
            case IFF -> join(" <=> ");
            case FORALL -> "! [" + String.join(",", variables) + "] : " + wrap(operands.get(0));
            case EXISTS -> "? [" + String.join(",", variables) + "] : " + wrap(operands.get(0));
        };
    }

    private String join(String separator) {
        List<String> parts = new ArrayList<>();
        for (Formula operand : operands) {
            parts.add(wrap(operand));
        }
        return String.join(separator, parts);
    }

    private static String wrap(Formula f) {
        return switch (f.type) {
            case TRUE, FALSE, NOT, FORALL, EXISTS -> f.toString();
            case PREDICATE -> EQUALITY.equals(f.name) ? "(" + f + ")" : f.toString();
            default -> "(" + f + ")";
        };
    }
}
