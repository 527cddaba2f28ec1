package org.proofmin.prover;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Prover invocabile su un file problema.
 */
public interface TheoremProver {

    Prover kind();

    /**
     * @param problem file TPTP da dimostrare
     * @return testo della prova, vuoto in caso di fallimento o timeout
     */
    Optional<String> prove(Path problem);
}
