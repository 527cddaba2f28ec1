package org.proofmin.prover;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class ExternalProverTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testFactories() {
        assertEquals(Prover.VAMPIRE, ExternalProver.vampire("vampire", 10).kind());
        assertEquals(Prover.TWEE, ExternalProver.twee("twee", 10).kind());
    }

    @Test
    public void testMissingExecutableGivesNoProof() throws Exception {
        Path problem = folder.newFile("problem.p").toPath();
        ExternalProver prover = ExternalProver.twee(folder.getRoot().toPath().resolve("assente").toString(), 1);

        assertFalse(prover.prove(problem).isPresent());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBlankExecutable() {
        new ExternalProver(Prover.TWEE, " ", List.of(), 10);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveTimeout() {
        ExternalProver.vampire("vampire", 0);
    }
}
