package org.proofmin.lemma;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.proofmin.prover.Prover;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.*;

public class LemmaRepositoryTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path lemmasDir;
    private Path proofsDir;
    private LemmaRepository repository;

    @Before
    public void setUp() throws IOException {
        lemmasDir = folder.newFolder("lemmas").toPath();
        proofsDir = folder.newFolder("proofs").toPath();
        repository = new LemmaRepository(lemmasDir, proofsDir);
    }

    private void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    //region CARICAMENTO

    @Test
    public void testLoadSingleLine() throws Exception {
        write(lemmasDir.resolve("single/single_lemma_0005.p"),
                "fof(a1, axiom, ! [X0,X1] : op(X0,X1) = X1).\n"
                        + "fof(conjecture_0005, conjecture, ! [X0,X1] : op(op(X0,X1),X0) = X0).\n");

        Lemma lemma = repository.load("single_lemma_0005");

        assertEquals("single_lemma_0005", lemma.name());
        assertEquals(LemmaCategory.SINGLE, lemma.category());
        assertEquals("! [X0,X1] : op(op(X0,X1),X0) = X0", lemma.formula());
        assertEquals(5, lemma.index());
    }

    @Test
    public void testLoadMultiLineWithProverSuffix() throws Exception {
        write(lemmasDir.resolve("history/history_lemma_0012.p"),
                "fof(conjecture_0012, conjecture,\n    ! [X0,X1] :\n    op(X0,X1) = X0\n).\n");

        Lemma lemma = repository.load("history_lemma_0012_twee");

        assertEquals("history_lemma_0012", lemma.name());
        assertEquals("! [X0,X1] : op(X0,X1) = X0", lemma.formula());
    }

    @Test
    public void testMissingFile() {
        try {
            repository.load("single_lemma_0042");
            fail("Attesa LemmaNotFoundException");
        } catch (LemmaNotFoundException e) {
            assertEquals("single_lemma_0042", e.getLemmaName());
        }
    }

    @Test(expected = LemmaNotFoundException.class)
    public void testMissingFormula() throws Exception {
        write(lemmasDir.resolve("single/single_lemma_0007.p"), "fof(a1, axiom, op(X0,X1) = X1).\n");
        repository.load("single_lemma_0007");
    }

    @Test(expected = LemmaNotFoundException.class)
    public void testUnknownCategory() throws Exception {
        repository.load("lemma_0007");
    }

    //endregion

    //region VARIANTI E PROVE

    @Test
    public void testResolveVariant() throws Exception {
        write(proofsDir.resolve("single_lemma_0003_vampire.proof"), "...");

        assertEquals("single_lemma_0003_vampire", repository.resolveVariant("lemma_0003"));
        assertEquals("single_lemma_0003_vampire", repository.resolveVariant("history_lemma_0003"));
        assertEquals("a4", repository.resolveVariant("a4"));
        assertEquals("conjecture_0003", repository.resolveVariant("conjecture_0003"));
    }

    @Test(expected = LemmaNotFoundException.class)
    public void testResolveMissingVariant() throws Exception {
        repository.resolveVariant("lemma_0008");
    }

    @Test
    public void testStoredProof() throws Exception {
        write(proofsDir.resolve("single_lemma_0003_twee.proof"),
                "Proof:\n  x\n= { by axiom 1 (a1) }\n  y\n= { by axiom 1 (a1) }\n  z\n");

        Optional<StoredProof> proof = repository.storedProof("single_lemma_0003");

        assertTrue(proof.isPresent());
        assertEquals(Prover.TWEE, proof.get().prover());
        assertEquals(2, proof.get().steps());
        assertEquals("single_lemma_0003", proof.get().lemmaName());
        assertFalse(repository.storedProof("single_lemma_0004").isPresent());
    }

    @Test
    public void testLoadDependencyProofsSkipsMissing() throws Exception {
        write(proofsDir.resolve("single_lemma_0003_twee.proof"), "Proof:\n= { by axiom 1 (a1) }\n");

        List<StoredProof> proofs = repository.loadDependencyProofs(List.of("single_lemma_0003", "single_lemma_0004"));

        assertEquals(1, proofs.size());
        assertEquals("single_lemma_0003", proofs.get(0).lemmaName());
    }

    //endregion

    @Test(expected = IllegalArgumentException.class)
    public void testMissingDirectories() {
        new LemmaRepository(null, proofsDir);
    }
}
