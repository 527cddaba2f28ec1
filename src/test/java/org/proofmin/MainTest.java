package org.proofmin;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class MainTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path problem;
    private Path lemmas;
    private Path proofs;

    @Before
    public void setUp() throws IOException {
        lemmas = folder.newFolder("lemmas").toPath();
        proofs = folder.newFolder("proofs").toPath();
        problem = folder.newFile("Equation2892.p").toPath();
        Files.writeString(proofs.resolve("Equation2892_vampire.proof"), "% vuota\n");
        Files.writeString(proofs.resolve("summary.json"), "{}");
    }

    private static Main.MinimizerSettings parse(String... args) {
        return new Main.ArgumentParser().parse(args);
    }

    @Test
    public void testDefaultsDerivedFromProofsDirectory() {
        Main.MinimizerSettings settings = parse("-f", problem.toString(),
                "-l", lemmas.toString(), "-p", proofs.toString(), "-k", "2", "-perm=1");

        assertEquals(problem, settings.problem);
        assertEquals(proofs.resolve("Equation2892_vampire.proof"), settings.refuterProof);
        assertEquals(proofs.resolve("summary.json"), settings.summary);
        assertEquals(2, settings.configuration.getMaxRootCandidates());
        assertEquals(1, settings.configuration.getPermutationBound());
        assertNull(settings.turnaroundFile);
    }

    @Test
    public void testTurnaroundMode() throws IOException {
        Path proof = folder.newFile("refutation.proof").toPath();

        Main.MinimizerSettings settings = parse("-turnaround", proof.toString());

        assertEquals(proof, settings.turnaroundFile);
        assertNull(settings.configuration);
    }

    @Test
    public void testHelpReturnsNoSettings() {
        assertNull(parse("-h"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDirectoryGivenAsProblemFile() {
        parse("-f", lemmas.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFileGivenAsLemmasDirectory() {
        parse("-f", problem.toString(), "-l", problem.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingDirectory() {
        parse("-f", problem.toString(), "-p", proofs.resolve("assente").toString());
    }

    @Test
    public void testMissingValueIsReported() {
        try {
            parse("-f", problem.toString(), "-l");
            fail("Parametro senza valore accettato");
        } catch (IllegalArgumentException e) {
            assertEquals("Manca directory dopo -l", e.getMessage());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFlagIsNotTakenAsValue() {
        parse("-f", "-l", lemmas.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveTimeout() {
        parse("-f", problem.toString(), "-t", "0");
    }
}
