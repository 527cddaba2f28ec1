package org.proofmin.minimize;

import org.junit.Test;
import org.proofmin.matching.FormulaMatcher;

import java.nio.file.Path;

import static org.junit.Assert.*;

public class MinimizationConfigurationTest {

    @Test
    public void testDefaults() {
        MinimizationConfiguration config = MinimizationConfiguration.builder()
                .lemmasDir(Path.of("lemmas"))
                .proofsDir(Path.of("proofs"))
                .build();

        assertEquals(Path.of("proofs"), config.getCompletionProofsDir());
        assertEquals(MinimizationConfiguration.DEFAULT_VAMPIRE, config.getVampireExecutable());
        assertEquals(MinimizationConfiguration.DEFAULT_TWEE, config.getTweeExecutable());
        assertEquals(10, config.getReproveTimeoutSeconds());
        assertEquals(4, config.getMaxRootCandidates());
        assertEquals(FormulaMatcher.DEFAULT_PERMUTATION_BOUND, config.getPermutationBound());
        assertEquals(Path.of(System.getProperty("java.io.tmpdir")), config.getTemporaryDir());
        assertNull(config.getOutputDir());
    }

    @Test
    public void testOutputDirFollowsProblem() {
        MinimizationConfiguration config = MinimizationConfiguration.builder()
                .lemmasDir(Path.of("lemmas"))
                .proofsDir(Path.of("proofs"))
                .build();
        Path problem = Path.of("problems", "Equation2892.p").toAbsolutePath();

        assertEquals(problem.getParent(), config.outputDirFor(problem));
    }

    @Test
    public void testExplicitOutputDir() {
        MinimizationConfiguration config = MinimizationConfiguration.builder()
                .lemmasDir(Path.of("lemmas"))
                .proofsDir(Path.of("proofs"))
                .outputDir(Path.of("out"))
                .build();

        assertEquals(Path.of("out"), config.outputDirFor(Path.of("problems", "Equation2892.p")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingLemmasDir() {
        MinimizationConfiguration.builder().proofsDir(Path.of("proofs")).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveRoots() {
        MinimizationConfiguration.builder()
                .lemmasDir(Path.of("lemmas"))
                .proofsDir(Path.of("proofs"))
                .maxRootCandidates(0)
                .build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativePermutationBound() {
        MinimizationConfiguration.builder()
                .lemmasDir(Path.of("lemmas"))
                .proofsDir(Path.of("proofs"))
                .permutationBound(-2)
                .build();
    }
}
