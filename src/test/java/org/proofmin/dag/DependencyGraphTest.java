package org.proofmin.dag;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;
import java.util.Set;

import static org.junit.Assert.*;

public class DependencyGraphTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private DependencyGraph graph;

    @Before
    public void setUp() {
        graph = new DependencyGraph();
        graph.addEdge("history_lemma_0016", "single_lemma_0005");
        graph.addEdge("history_lemma_0016", "history_lemma_0012");
        graph.addEdge("history_lemma_0012", "single_lemma_0005");
    }

    @Test
    public void testStructure() {
        assertEquals(3, graph.nodeCount());
        assertEquals(Set.of("history_lemma_0012", "single_lemma_0005"), graph.children("history_lemma_0016"));
        assertEquals(Set.of("history_lemma_0012", "history_lemma_0016"), graph.parents("single_lemma_0005"));
        assertTrue(graph.children("single_lemma_0005").isEmpty());
        assertTrue(graph.children("assente").isEmpty());
    }

    @Test
    public void testRender() {
        String expected = "history_lemma_0012 -> {\"single_lemma_0005\"}\n"
                + "history_lemma_0016 -> {\"history_lemma_0012\", \"single_lemma_0005\"}\n"
                + "single_lemma_0005 -> {}\n";

        assertEquals(expected, graph.render());
    }

    @Test
    public void testParseRenderedGraph() {
        assertEquals(graph, DependencyGraph.parse(graph.render()));
    }

    @Test
    public void testParseIgnoresUnrelatedLines() {
        DependencyGraph parsed = DependencyGraph.parse("# grafo\nroot -> {\"a\", \"b\"}\n\n");

        assertEquals(Set.of("root", "a", "b"), parsed.nodes());
    }

    @Test
    public void testWriteAndRead() throws Exception {
        Path file = folder.getRoot().toPath().resolve("dag.txt");

        graph.write(file);

        assertEquals(graph, DependencyGraph.read(file));
    }
}
