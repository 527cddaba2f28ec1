package org.proofmin.matching;

import org.proofmin.fol.Formula;
import org.proofmin.fol.FormulaParseException;
import org.proofmin.fol.FormulaReader;
import org.proofmin.fol.Term;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MATCHER DI FORMULE - Alfa-equivalenza e pattern matching su formule FOF
 *
 * Unico oracolo di uguaglianza usato per stabilire se due lemmi esprimono lo
 * stesso fatto, anche quando provengono da prover diversi che nominano le
 * variabili in modo diverso.
 *
 * NORMALIZZAZIONE:
 * 1. Se la formula è {@code ! [vars] : body}, le variabili quantificate diventano V0, V1, ...
 * 2. Le variabili libere X&lt;cifre&gt; rimaste diventano il primo V&lt;i&gt; non ancora usato
 * 3. Tutti gli spazi vengono rimossi
 *
 * MATCHING:
 * - Unidirezionale: le variabili del pattern si legano al primo sottotermine
 *   dell'istanza incontrato e devono restare coerenti nei riusi
 * - Con al più {@code permutationBound} variabili quantificate si provano
 *   tutte le permutazioni dell'ordine delle variabili
 * - Due formule sono alfa-equivalenti se il matching riesce nei due sensi
 *
 * Il matcher non solleva mai eccezioni: input malformato significa "nessun match".
 */
public class FormulaMatcher {

    private static final Logger LOGGER = Logger.getLogger(FormulaMatcher.class.getName());

    /** Limite di default delle variabili quantificate da permutare */
    public static final int DEFAULT_PERMUTATION_BOUND = 3;

    private static final Pattern LEADING_QUANTIFIER =
            Pattern.compile("^\\s*!\\s*\\[([^\\]]*)\\]\\s*:\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern FREE_VARIABLE = Pattern.compile("\\bX\\d+\\b");
    private static final Pattern CANONICAL_VARIABLE = Pattern.compile("\\bV(\\d+)\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int permutationBound;

    public FormulaMatcher() {
        this(DEFAULT_PERMUTATION_BOUND);
    }

    /**
     * @param permutationBound numero massimo di variabili quantificate per cui
     *                         provare tutte le permutazioni
     * @throws IllegalArgumentException se negativo
     */
    public FormulaMatcher(int permutationBound) {
        if (permutationBound < 0) {
            throw new IllegalArgumentException("Limite permutazioni non può essere negativo: " + permutationBound);
        }
        this.permutationBound = permutationBound;
    }

    public int getPermutationBound() {
        return permutationBound;
    }

    //region NORMALIZZAZIONE

    /**
     * Forma canonica testuale, invariante per ridenominazione delle variabili
     * quantificate e per i diversi schemi di nomi liberi dei prover.
     *
     * @param formula testo della formula
     * @return stringa canonica senza spazi
     */
    public String normalize(String formula) {
        if (formula == null) {
            return "";
        }

        String text = formula;
        Matcher quantifier = LEADING_QUANTIFIER.matcher(text);
        if (quantifier.matches()) {
            text = renameVariables(quantifier.group(2), splitVariables(quantifier.group(1)));
        }

        text = canonicalizeFreeVariables(text);
        return WHITESPACE.matcher(text).replaceAll("");
    }

    /**
     * Sostituisce ciascuna variabile, in ordine, con V0, V1, ... usando i confini di parola.
     * La sostituzione è simultanea: una variabile già rinominata non viene toccata di nuovo.
     */
    private static String renameVariables(String body, List<String> variables) {
        if (variables.isEmpty()) {
            return body;
        }
        Map<String, String> renaming = new HashMap<>();
        for (int i = 0; i < variables.size(); i++) {
            renaming.putIfAbsent(variables.get(i), "V" + i);
        }
        Pattern names = Pattern.compile("\\b(" + String.join("|", renaming.keySet().stream().map(Pattern::quote).toList()) + ")\\b");
        return names.matcher(body).replaceAll(m -> Matcher.quoteReplacement(renaming.get(m.group(1))));
    }

    private static String canonicalizeFreeVariables(String text) {
        int next = 0;
        Matcher used = CANONICAL_VARIABLE.matcher(text);
        List<Integer> taken = new ArrayList<>();
        while (used.find()) {
            taken.add(Integer.parseInt(used.group(1)));
        }

        Map<String, String> renaming = new LinkedHashMap<>();
        Matcher free = FREE_VARIABLE.matcher(text);
        while (free.find()) {
            if (renaming.containsKey(free.group())) continue;
            while (taken.contains(next)) next++;
            renaming.put(free.group(), "V" + next);
            taken.add(next);
        }
        if (renaming.isEmpty()) {
            return text;
        }
        return FREE_VARIABLE.matcher(text).replaceAll(m -> renaming.get(m.group()));
    }

    private static List<String> splitVariables(String list) {
        List<String> variables = new ArrayList<>();
        for (String v : list.split(",")) {
            if (!v.isBlank()) {
                variables.add(v.trim());
            }
        }
        return variables;
    }

    //endregion

    //region MATCHING

    /**
     * Matching unidirezionale di {@code pattern} su {@code instance}.
     *
     * @return true se esiste un legame coerente delle variabili del pattern
     */
    public boolean match(String pattern, String instance) {
        try {
            Formula target = FormulaReader.parse(normalize(instance));

            Matcher quantifier = LEADING_QUANTIFIER.matcher(pattern == null ? "" : pattern);
            if (quantifier.matches()) {
                List<String> variables = splitVariables(quantifier.group(1));
                String body = quantifier.group(2);

                if (variables.size() <= permutationBound) {
                    for (List<String> order : permutations(variables)) {
                        if (matchNormalized(renameVariables(body, order), target)) {
                            return true;
                        }
                    }
                    return false;
                }
                return matchNormalized(body, target);
            }
            return matchNormalized(pattern, target);

        } catch (FormulaParseException e) {
            LOGGER.fine("Formula non interpretabile, nessun match: " + e.getMessage());
            return false;
        }
    }

    /**
     * Alfa-equivalenza: matching riuscito in entrambe le direzioni.
     */
    public boolean equivalent(String first, String second) {
        return match(first, second) && match(second, first);
    }

    private boolean matchNormalized(String pattern, Formula target) {
        Formula source = FormulaReader.parse(normalize(pattern));
        return matchFormula(source, target, new HashMap<>());
    }

    private static boolean matchFormula(Formula pattern, Formula instance, Map<String, Term> bindings) {
        if (pattern.type() != instance.type()) {
            return false;
        }
        return switch (pattern.type()) {
            case TRUE, FALSE -> true;
            case PREDICATE -> pattern.name().equals(instance.name())
                    && matchArguments(pattern.args(), instance.args(), bindings);
            case NOT, AND, OR, IMPLIES, IFF -> matchOperands(pattern.operands(), instance.operands(), bindings);
            case FORALL, EXISTS -> {
                if (pattern.variables().size() != instance.variables().size()) {
                    yield false;
                }
                for (int i = 0; i < pattern.variables().size(); i++) {
                    if (!bind(pattern.variables().get(i), new Term(instance.variables().get(i)), bindings)) {
                        yield false;
                    }
                }
                yield matchFormula(pattern.body(), instance.body(), bindings);
            }
        };
    }

    private static boolean matchOperands(List<Formula> pattern, List<Formula> instance, Map<String, Term> bindings) {
        if (pattern.size() != instance.size()) {
            return false;
        }
        for (int i = 0; i < pattern.size(); i++) {
            if (!matchFormula(pattern.get(i), instance.get(i), bindings)) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchArguments(List<Term> pattern, List<Term> instance, Map<String, Term> bindings) {
        if (pattern.size() != instance.size()) {
            return false;
        }
        for (int i = 0; i < pattern.size(); i++) {
            if (!matchTerm(pattern.get(i), instance.get(i), bindings)) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchTerm(Term pattern, Term instance, Map<String, Term> bindings) {
        if (pattern.isVariable()) {
            return bind(pattern.label(), instance, bindings);
        }
        return pattern.label().equals(instance.label())
                && matchArguments(pattern.args(), instance.args(), bindings);
    }

    private static boolean bind(String variable, Term value, Map<String, Term> bindings) {
        Term previous = bindings.putIfAbsent(variable, value);
        return previous == null || previous.equals(value);
    }

    //endregion

    //region PERMUTAZIONI

    static List<List<String>> permutations(List<String> items) {
        List<List<String>> result = new ArrayList<>();
        permute(new ArrayList<>(items), 0, result);
        return result;
    }

    private static void permute(List<String> items, int start, List<List<String>> result) {
        if (start >= items.size()) {
            result.add(new ArrayList<>(items));
            return;
        }
        for (int i = start; i < items.size(); i++) {
            Collections.swap(items, start, i);
            permute(items, start + 1, result);
            Collections.swap(items, start, i);
        }
    }

    //endregion
}
