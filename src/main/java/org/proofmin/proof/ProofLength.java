package org.proofmin.proof;

import org.proofmin.prover.Prover;

import java.util.List;
import java.util.Locale;

/**
 * Conteggio dei passi di una prova secondo la notazione del prover che l'ha prodotta.
 *
 * Le prove che dichiarano uno stato SZS diverso da teorema valgono
 * {@link #NON_THEOREM_STEPS} passi, così da perdere ogni confronto.
 */
public final class ProofLength {

    public static final int NON_THEOREM_STEPS = 1000;

    private static final List<String> REFUTER_KEYWORDS = List.of(
            "demodulation", "superposition", "resolution", "trivial inequality removal");

    private ProofLength() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param prover prover che ha prodotto il testo
     * @param proof testo della prova
     * @return numero di passi
     */
    public static int count(Prover prover, String proof) {
        if (proof == null || proof.isBlank()) {
            return 0;
        }
        if (declaresNonTheorem(proof)) {
            return NON_THEOREM_STEPS;
        }
        return switch (prover) {
            case VAMPIRE -> countRefuterSteps(proof);
            case TWEE -> countCompletionSteps(proof);
            case EGG -> countCertificateSteps(proof);
        };
    }

    /**
     * Stato SZS (o riga RESULT del prover a completamento) che indica soddisfacibilità o esito ignoto.
     */
    public static boolean declaresNonTheorem(String proof) {
        String status = proof.lines()
                .filter(l -> l.contains("RESULT:") || l.contains("SZS status"))
                .findFirst()
                .orElse("")
                .toLowerCase(Locale.ROOT);

        return status.contains("countersatisfiable")
                || status.contains("counter-satisfiable")
                || status.contains("counter_satisfiable")
                || (status.contains("satisfiable") && !status.contains("unsatisfiable"))
                || status.contains("unknown");
    }

    /**
     * Stato che dichiara un teorema (o l'insoddisfacibilità del problema negato).
     */
    public static boolean declaresTheorem(String proof) {
        if (proof == null || declaresNonTheorem(proof)) {
            return false;
        }
        String status = proof.lines()
                .filter(l -> l.contains("RESULT:") || l.contains("SZS status"))
                .findFirst()
                .orElse("")
                .toLowerCase(Locale.ROOT);
        return status.contains("theorem") || status.contains("unsatisfiable");
    }

    static int countRefuterSteps(String proof) {
        int count = 0;
        for (String raw : proof.split("\n")) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("%")) continue;

            int dot = line.indexOf('.');
            String body = dot >= 0 ? line.substring(dot + 1) : line;
            if (body.contains("[") && REFUTER_KEYWORDS.stream().anyMatch(body::contains)) {
                count++;
            }
        }
        return count;
    }

    static int countCompletionSteps(String proof) {
        int count = 0;
        boolean inProof = false;
        for (String raw : proof.split("\n")) {
            String line = raw.strip();
            if (line.startsWith("Proof:")) {
                inProof = true;
            } else if (inProof && line.contains("= { by")) {
                count++;
            }
        }
        return count;
    }

    static int countCertificateSteps(String proof) {
        return (int) proof.lines()
                .map(String::strip)
                .filter(l -> l.startsWith("fof(") && l.contains(", plain") && l.contains("inference("))
                .count();
    }
}
