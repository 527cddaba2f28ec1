package org.proofmin.lemma;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Operazioni sui file problema TPTP usati per le riprove: copia privata,
 * aggiunta di assiomi, promozione di un assioma a congettura.
 */
public final class ProblemFile {

    private static final Logger LOGGER = Logger.getLogger(ProblemFile.class.getName());

    private static final Pattern FOF_BLOCK = Pattern.compile(
            "fof\\s*\\(\\s*([^,]+?)\\s*,\\s*([^,]+?)\\s*,(.*?)\\)\\s*\\.", Pattern.DOTALL);
    private static final Pattern X_VARIABLE = Pattern.compile("\\b(X\\d+)\\b");

    private ProblemFile() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Crea una copia privata del problema nella directory temporanea indicata.
     *
     * @return percorso della copia, da cancellare a cura del chiamante
     */
    public static Path createTemporaryCopy(Path input, Path tmpDir) throws IOException {
        Files.createDirectories(tmpDir);
        String name = input.getFileName().toString();
        String stem = name.contains(".") ? name.substring(0, name.lastIndexOf('.')) : name;
        Path copy = Files.createTempFile(tmpDir, stem + "_", ".p");
        Files.copy(input, copy, StandardCopyOption.REPLACE_EXISTING);
        LOGGER.finest("Copia temporanea creata: " + copy);
        return copy;
    }

    /**
     * Aggiunge in coda un assioma, quantificando universalmente le variabili
     * X&lt;cifre&gt; se la formula non inizia già con un quantificatore.
     */
    public static void appendAxiom(Path file, String name, String formula) throws IOException {
        String text = "\n" + axiomBlock(name, formula) + "\n";
        Files.writeString(file, text, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
    }

    static String axiomBlock(String name, String formula) {
        return "fof(" + name + ", axiom,\n" + quantify(formula) + "\n).";
    }

    /**
     * Chiusura universale sulle variabili X&lt;cifre&gt;, in ordine di nome.
     */
    public static String quantify(String formula) {
        String trimmed = formula.strip();
        if (trimmed.startsWith("!") || trimmed.startsWith("?")) {
            return trimmed;
        }
        TreeSet<String> variables = new TreeSet<>((a, b) -> {
            int byLength = Integer.compare(a.length(), b.length());
            return byLength != 0 ? byLength : a.compareTo(b);
        });
        Matcher m = X_VARIABLE.matcher(trimmed);
        while (m.find()) {
            variables.add(m.group(1));
        }
        if (variables.isEmpty()) {
            return trimmed;
        }
        return "! [" + String.join(", ", variables) + "] : (" + trimmed + ")";
    }

    /**
     * Rimuove le congetture esistenti e trasforma l'assioma indicato in congettura.
     *
     * @return true se l'assioma è stato trovato e promosso
     */
    public static boolean promoteToConjecture(Path file, String axiomName) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        Matcher m = FOF_BLOCK.matcher(content);
        StringBuilder out = new StringBuilder();
        boolean promoted = false;
        int last = 0;

        while (m.find()) {
            out.append(content, last, m.start());
            String name = m.group(1).strip();
            String role = m.group(2).strip().toLowerCase();

            if (name.equals(axiomName) && role.equals("axiom")) {
                out.append("fof(").append(name).append(", conjecture,").append(m.group(3)).append(").");
                promoted = true;
            } else if (!role.contains("conjecture")) {
                out.append(m.group());
            }
            last = m.end();
        }
        out.append(content.substring(last));

        Files.writeString(file, out.toString(), StandardCharsets.UTF_8);
        if (!promoted) {
            LOGGER.warning("Assioma " + axiomName + " non trovato in " + file);
        }
        return promoted;
    }

    /**
     * Corpo della prima congettura del testo.
     */
    public static Optional<String> extractConjecture(String content) {
        Matcher m = FOF_BLOCK.matcher(content);
        while (m.find()) {
            if (m.group(2).strip().equalsIgnoreCase("conjecture")) {
                return Optional.of(m.group(3).replaceAll("\\s+", " ").strip());
            }
        }
        return Optional.empty();
    }

    public static Optional<String> extractConjecture(Path file) throws IOException {
        return extractConjecture(Files.readString(file, StandardCharsets.UTF_8));
    }
}
