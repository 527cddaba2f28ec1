package org.proofmin.proof;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lettura delle prove del prover a completamento: blocchi
 * {@code Axiom N (nome): formula.}, {@code Goal N (nome): formula.} e
 * {@code Lemma N: formula. Proof: ...}.
 */
public final class CompletionProofParser {

    private static final Pattern AXIOM = Pattern.compile("^\\s*Axiom\\s+\\d+\\s+\\(([^)]+)\\)\\s*:\\s*(.+)$", Pattern.MULTILINE);
    private static final Pattern GOAL = Pattern.compile("^\\s*Goal\\s+\\d+\\s+\\(([^)]+)\\)\\s*:\\s*(.+)$", Pattern.MULTILINE);
    private static final Pattern LEMMA = Pattern.compile("Lemma\\s+(\\d+):\\s*(.*?)Proof:", Pattern.DOTALL);
    private static final Pattern UPPERCASE_VARIABLE = Pattern.compile("\\b([A-Z][0-9]*)\\b");

    private CompletionProofParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Assiomi dichiarati dalla prova, in ordine di comparsa.
     */
    public static List<NamedFormula> axioms(String proof) {
        return declarations(AXIOM, proof);
    }

    /**
     * Obiettivi dichiarati dalla prova.
     */
    public static List<NamedFormula> goals(String proof) {
        return declarations(GOAL, proof);
    }

    /**
     * Lemmi intermedi dedotti dal prover, con le variabili maiuscole chiuse
     * universalmente. Il nome è {@code lemma N} come nella prova.
     */
    public static List<NamedFormula> lemmas(String proof) {
        List<NamedFormula> result = new ArrayList<>();
        if (proof == null) return result;

        Matcher m = LEMMA.matcher(proof);
        while (m.find()) {
            String statement = String.join(" ", m.group(2).strip().lines().map(String::strip).toList());
            result.add(new NamedFormula("lemma " + m.group(1), quantify(stripPeriod(statement))));
        }
        return result;
    }

    private static List<NamedFormula> declarations(Pattern pattern, String proof) {
        List<NamedFormula> result = new ArrayList<>();
        if (proof == null) return result;

        Matcher m = pattern.matcher(proof);
        while (m.find()) {
            result.add(new NamedFormula(m.group(1).strip(), stripPeriod(m.group(2).strip())));
        }
        return result;
    }

    private static String stripPeriod(String text) {
        return text.endsWith(".") ? text.substring(0, text.length() - 1).strip() : text;
    }

    private static String quantify(String statement) {
        TreeSet<String> variables = new TreeSet<>();
        Matcher m = UPPERCASE_VARIABLE.matcher(statement);
        while (m.find()) {
            variables.add(m.group(1));
        }
        if (variables.isEmpty()) {
            return statement;
        }
        return "! [" + String.join(", ", variables) + "] : (" + statement + ")";
    }
}
