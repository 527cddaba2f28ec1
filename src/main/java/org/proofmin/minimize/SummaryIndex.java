package org.proofmin.minimize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * INDICE RIASSUNTIVO - Passaggio di consegne tra la raccolta delle prove e la minimizzazione
 *
 * Oggetto JSON con chiave l'indice del lemma e valore {@code [nome, prover, prova]}:
 * <pre>
 * {"16": ["history_lemma_0016", "twee", "..."]}
 * </pre>
 * Un contenuto malformato rende impossibile proseguire ed è un errore fatale.
 */
public final class SummaryIndex {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Voce dell'indice.
     */
    public record Entry(int index, String lemmaName, String prover, String proofText) {
    }

    private final NavigableMap<Integer, Entry> entries;

    public SummaryIndex(Map<Integer, Entry> entries) {
        this.entries = Collections.unmodifiableNavigableMap(new TreeMap<>(entries));
    }

    public static SummaryIndex read(Path file) throws MinimizationException {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MinimizationException("Impossibile leggere l'indice riassuntivo " + file, e);
        }
        return parse(content);
    }

    public static SummaryIndex parse(String json) throws MinimizationException {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MinimizationException("Indice riassuntivo corrotto: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MinimizationException("L'indice riassuntivo deve contenere un oggetto JSON");
        }

        Map<Integer, Entry> entries = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            int index;
            try {
                index = Integer.parseInt(field.getKey().strip());
            } catch (NumberFormatException e) {
                throw new MinimizationException("Chiave non numerica nell'indice riassuntivo: " + field.getKey(), e);
            }

            JsonNode value = field.getValue();
            if (!value.isArray() || value.size() < 1 || !value.get(0).isTextual()) {
                throw new MinimizationException("Voce malformata per l'indice " + index + ": " + value);
            }
            entries.put(index, new Entry(index,
                    value.get(0).asText(),
                    value.path(1).asText(""),
                    value.path(2).asText("")));
        }
        return new SummaryIndex(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public Optional<Entry> entry(int index) {
        return Optional.ofNullable(entries.get(index));
    }

    /**
     * @throws IllegalStateException se l'indice è vuoto
     */
    public int maxIndex() {
        if (entries.isEmpty()) {
            throw new IllegalStateException("Indice riassuntivo vuoto");
        }
        return entries.lastKey();
    }

    /**
     * Voci dalla più recente (indice più alto) alla più vecchia.
     */
    public List<Entry> descending() {
        return new ArrayList<>(entries.descendingMap().values());
    }
}
