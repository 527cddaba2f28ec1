package org.proofmin.minimize;

import org.proofmin.dag.DependencyGraphBuilder;

import java.nio.file.Path;

/**
 * Esito della minimizzazione: candidato vincente, il suo grafo e gli artefatti scritti.
 *
 * @param best candidato con il minor numero di passi
 * @param dag grafo delle dipendenze della radice vincente
 * @param initialSteps lunghezza della prova per refutazione di partenza
 */
public record MinimizationResult(Candidate best,
                                 DependencyGraphBuilder.Result dag,
                                 int initialSteps,
                                 Path dagFile,
                                 Path lemmasFile,
                                 Path proofFile) {
}
