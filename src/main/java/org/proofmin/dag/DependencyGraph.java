package org.proofmin.dag;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grafo delle dipendenze tra lemmi: ogni nodo è associato all'insieme delle
 * sue dipendenze dirette. Formato testuale, una riga per nodo:
 * <pre>
 * history_lemma_0016 -> {"history_lemma_0012", "single_lemma_0010"}
 * single_lemma_0010 -> {}
 * </pre>
 */
public class DependencyGraph {

    private static final Pattern LINE = Pattern.compile("^\\s*(\\S+)\\s*->\\s*\\{([^}]*)\\}");

    private final SortedMap<String, SortedSet<String>> edges = new TreeMap<>();

    public void addNode(String name) {
        edges.computeIfAbsent(name, k -> new TreeSet<>());
    }

    public void addEdge(String parent, String child) {
        addNode(parent);
        addNode(child);
        edges.get(parent).add(child);
    }

    public boolean contains(String name) {
        return edges.containsKey(name);
    }

    /**
     * Dipendenze dirette del nodo, vuote se il nodo non esiste.
     */
    public SortedSet<String> children(String name) {
        SortedSet<String> children = edges.get(name);
        return children == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(children);
    }

    /**
     * Nodi che hanno {@code name} tra le dipendenze dirette.
     */
    public Set<String> parents(String name) {
        Set<String> parents = new TreeSet<>();
        edges.forEach((parent, children) -> {
            if (children.contains(name)) parents.add(parent);
        });
        return parents;
    }

    /** Tutti i nodi in ordine di nome */
    public SortedSet<String> nodes() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(edges.keySet()));
    }

    public int nodeCount() {
        return edges.size();
    }

    //region FORMATO TESTUALE

    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, SortedSet<String>> entry : edges.entrySet()) {
            List<String> quoted = new ArrayList<>();
            entry.getValue().forEach(child -> quoted.add("\"" + child + "\""));
            sb.append(entry.getKey()).append(" -> {").append(String.join(", ", quoted)).append("}\n");
        }
        return sb.toString();
    }

    public static DependencyGraph parse(String text) {
        DependencyGraph graph = new DependencyGraph();
        for (String line : text.split("\n")) {
            Matcher m = LINE.matcher(line);
            if (!m.find()) continue;

            String parent = m.group(1);
            graph.addNode(parent);
            for (String child : m.group(2).split(",")) {
                String name = child.strip().replace("\"", "");
                if (!name.isEmpty()) {
                    graph.addEdge(parent, name);
                }
            }
        }
        return graph;
    }

    public void write(Path file) throws IOException {
        Files.writeString(file, render(), StandardCharsets.UTF_8);
    }

    public static DependencyGraph read(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    //endregion

    @Override
    public boolean equals(Object o) {
        return o instanceof DependencyGraph other && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return edges.hashCode();
    }

    @Override
    public String toString() {
        return render();
    }
}
