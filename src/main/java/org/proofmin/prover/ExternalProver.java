package org.proofmin.prover;

import org.proofmin.proof.ProofLength;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Prover eseguito come sottoprocesso con limite di tempo.
 *
 * Un'uscita con codice diverso da zero, un timeout o un esito diverso da
 * "teorema" producono un risultato vuoto, mai un'eccezione.
 */
public class ExternalProver implements TheoremProver {

    private static final Logger LOGGER = Logger.getLogger(ExternalProver.class.getName());

    private final Prover kind;
    private final String executable;
    private final List<String> options;
    private final int timeoutSeconds;

    public ExternalProver(Prover kind, String executable, List<String> options, int timeoutSeconds) {
        if (executable == null || executable.isBlank()) {
            throw new IllegalArgumentException("Eseguibile del prover " + kind + " non specificato");
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("Timeout deve essere positivo: " + timeoutSeconds);
        }
        this.kind = kind;
        this.executable = executable;
        this.options = List.copyOf(options);
        this.timeoutSeconds = timeoutSeconds;
    }

    /** Prover per refutazione, con i nomi degli assiomi riportati nella prova */
    public static ExternalProver vampire(String executable, int timeoutSeconds) {
        return new ExternalProver(Prover.VAMPIRE, executable,
                List.of("--input_syntax", "tptp", "--output_axiom_names", "on"), timeoutSeconds);
    }

    /** Prover a completamento */
    public static ExternalProver twee(String executable, int timeoutSeconds) {
        return new ExternalProver(Prover.TWEE, executable, List.of("--quiet"), timeoutSeconds);
    }

    @Override
    public Prover kind() {
        return kind;
    }

    @Override
    public Optional<String> prove(Path problem) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(options);
        command.add(problem.toString());

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            LOGGER.warning("Impossibile avviare " + executable + ": " + e.getMessage());
            return Optional.empty();
        }

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> output = executor.submit(
                    () -> new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8));

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                LOGGER.warning(kind.id() + " ha superato il timeout di " + timeoutSeconds + " secondi su " + problem);
                return Optional.empty();
            }

            String text = output.get(timeoutSeconds, TimeUnit.SECONDS);
            if (process.exitValue() != 0) {
                LOGGER.fine(kind.id() + " terminato con codice " + process.exitValue() + " su " + problem);
                return Optional.empty();
            }
            if (!ProofLength.declaresTheorem(text)) {
                LOGGER.fine(kind.id() + " non ha trovato una prova per " + problem);
                return Optional.empty();
            }
            return Optional.of(text);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.warning("Lettura dell'output di " + kind.id() + " fallita: " + e);
            return Optional.empty();
        } finally {
            executor.shutdownNow();
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }
}
