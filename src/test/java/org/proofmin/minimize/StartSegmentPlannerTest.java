package org.proofmin.minimize;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.proofmin.Fixtures;
import org.proofmin.dag.DependencyGraph;
import org.proofmin.lemma.LemmaRepository;
import org.proofmin.proof.ExtraDependencies;
import org.proofmin.proof.ParsedProof;
import org.proofmin.proof.ProofStepParser;
import org.proofmin.proof.SuperpositionAnnotator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class StartSegmentPlannerTest {

    /** Dedotta al secondo passo della prova per refutazione */
    private static final String DERIVED = "! [X0,X1,X2] : op(X0,op(X1,X2)) = op(X0,X2)";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path root;
    private StartSegmentPlanner planner;
    private ParsedProof refutation;

    @Before
    public void setUp() throws IOException {
        root = folder.getRoot().toPath();
        ProofStepParser parser = new ProofStepParser();
        planner = new StartSegmentPlanner(new LemmaRepository(root.resolve("lemmas"), root.resolve("proofs")), parser);
        refutation = parser.parse(Fixtures.read("equation2892_vampire.proof"));
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private void lemma(String category, String name, String formula) throws IOException {
        String internal = "conjecture_" + name.substring(name.lastIndexOf('_') + 1);
        write("lemmas/" + category + "/" + name + ".p", "fof(" + internal + ", conjecture, " + formula + ").\n");
    }

    private void storedProof(String name, int steps) throws IOException {
        write("proofs/" + name + "_twee.proof", "Proof:\n  x\n" + "= { by axiom 1 (a1) }\n  x\n".repeat(steps));
    }

    @Test
    public void testSingleChildrenWithShorterStoredProof() throws Exception {
        lemma("single", "single_lemma_0011", DERIVED);
        storedProof("single_lemma_0011", 1);
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("history_lemma_0012", "single_lemma_0011");

        StartSegmentPlanner.Plan plan = planner.plan("history_lemma_0012", graph, refutation);
        assertEquals(List.of("single_lemma_0011"), plan.dependencies());
        assertEquals(2, plan.superpositionSteps());
        assertFalse(plan.provedHistory());

        ExtraDependencies extra = new ExtraDependencies();
        StartSegment start = planner.choose(plan, extra);

        assertEquals(StartSegment.Source.STORED, start.source());
        assertEquals(1, start.steps());
        assertEquals("single_lemma_0011", start.axioms().get(0).name());
        assertEquals(DERIVED, start.axioms().get(0).formula());
        assertTrue(extra.isEmpty());
    }

    @Test
    public void testEqualLengthPrefersStoredProof() throws Exception {
        lemma("single", "single_lemma_0011", DERIVED);
        storedProof("single_lemma_0011", 2);

        StartSegment start = planner.choose(
                planner.plan("single_lemma_0011", new DependencyGraph(), refutation), new ExtraDependencies());

        assertEquals(StartSegment.Source.STORED, start.source());
        assertEquals(2, start.steps());
    }

    @Test
    public void testLongerStoredProofLosesToExtraction() throws Exception {
        lemma("single", "single_lemma_0011", DERIVED);
        storedProof("single_lemma_0011", 3);
        ExtraDependencies extra = new ExtraDependencies();

        StartSegment start = planner.choose(
                planner.plan("single_lemma_0011", new DependencyGraph(), refutation), extra);

        assertEquals(StartSegment.Source.SUPERPOSITION, start.source());
        assertEquals(2, start.steps());
        assertTrue(start.text().startsWith(SuperpositionAnnotator.HEADER));
        assertTrue(start.axioms().isEmpty());
        assertEquals(2, extra.size());
    }

    @Test
    public void testExclusiveHistoryChildForcesSuperposition() throws Exception {
        lemma("history", "history_lemma_0008", DERIVED);
        storedProof("history_lemma_0008", 1);
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("history_lemma_0012", "history_lemma_0008");

        StartSegmentPlanner.Plan plan = planner.plan("history_lemma_0012", graph, refutation);

        assertTrue(plan.dependencies().isEmpty());
        assertFalse(plan.provedHistory());
        assertEquals(StartSegment.Source.SUPERPOSITION, planner.choose(plan, new ExtraDependencies()).source());
    }

    @Test
    public void testSharedHistoryChildIsNotUsed() throws Exception {
        lemma("history", "history_lemma_0008", DERIVED);
        lemma("history", "history_lemma_0012", DERIVED);
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("history_lemma_0012", "history_lemma_0008");
        graph.addEdge("history_lemma_0016", "history_lemma_0008");

        StartSegmentPlanner.Plan plan = planner.plan("history_lemma_0012", graph, refutation);

        // nessun figlio utilizzabile: il lemma storico è dedotto direttamente
        assertTrue(plan.provedHistory());
        assertEquals("history_lemma_0012", plan.extraction().derivedName());
    }

    @Test
    public void testNothingFoundInRefutation() throws Exception {
        lemma("single", "single_lemma_0004", "! [X0] : f(X0) = X0");

        StartSegmentPlanner.Plan plan = planner.plan("single_lemma_0004", new DependencyGraph(), refutation);
        StartSegment start = planner.choose(plan, new ExtraDependencies());

        assertNull(plan.extraction());
        assertEquals(List.of("single_lemma_0004"), plan.dependencies());
        // nessuna prova memorizzata da riusare
        assertEquals(StartSegment.Source.SUPERPOSITION, start.source());
        assertEquals(0, start.steps());
        assertEquals("", start.text());
    }

    @Test
    public void testMissingExtractionFallsBackToStoredProof() throws Exception {
        lemma("single", "single_lemma_0004", "! [X0] : f(X0) = X0");
        storedProof("single_lemma_0004", 4);

        StartSegmentPlanner.Plan plan = planner.plan("single_lemma_0004", new DependencyGraph(), refutation);
        StartSegment start = planner.choose(plan, new ExtraDependencies());

        assertEquals(StartSegment.Source.STORED, start.source());
        assertEquals(4, start.steps());
    }

    @Test
    public void testEmptyRefutationReusesSingleChildProofs() throws Exception {
        lemma("single", "single_lemma_0011", DERIVED);
        lemma("history", "history_lemma_0012", "! [X0,X1] : op(X0,X1) = op(X0,X0)");
        storedProof("single_lemma_0011", 2);
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("history_lemma_0012", "single_lemma_0011");
        ExtraDependencies extra = new ExtraDependencies();

        StartSegmentPlanner.Plan plan = planner.plan("history_lemma_0012", graph, ParsedProof.empty());
        StartSegment start = planner.choose(plan, extra);

        assertEquals(List.of("single_lemma_0011"), plan.dependencies());
        assertEquals(StartSegment.Source.STORED, start.source());
        assertEquals(2, start.steps());
        assertEquals("single_lemma_0011", start.axioms().get(0).name());
        assertTrue(extra.isEmpty());
    }

    @Test
    public void testEmptyRefutationForDirectHistory() throws Exception {
        lemma("history", "history_lemma_0012", "! [X0,X1] : op(X0,X1) = op(X0,X0)");
        storedProof("history_lemma_0012", 3);

        StartSegmentPlanner.Plan plan = planner.plan("history_lemma_0012", new DependencyGraph(), ParsedProof.empty());

        assertTrue(plan.dependencies().isEmpty());
        assertFalse(plan.provedHistory());
        assertEquals(0, planner.choose(plan, new ExtraDependencies()).steps());
    }
}
