package org.proofmin.matching;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class FormulaMatcherTest {

    private final FormulaMatcher matcher = new FormulaMatcher();

    //region NORMALIZZAZIONE

    @Test
    public void testNormalizeRenamesQuantifiedVariables() {
        assertEquals("op(V0,V1)=V1", matcher.normalize("! [X0,X1] : op(X0,X1) = X1"));
    }

    @Test
    public void testNormalizeIsInvariantUnderRenaming() {
        assertEquals(matcher.normalize("! [X0,X1] : op(X0,X1) = X1"),
                matcher.normalize("! [Y, Z] : op(Y, Z) = Z"));
    }

    @Test
    public void testNormalizeFreeVariables() {
        assertEquals(matcher.normalize("op(X3,X7) = X7"), matcher.normalize("op(X0,X1) = X1"));
    }

    @Test
    public void testNormalizeNull() {
        assertEquals("", matcher.normalize(null));
    }

    //endregion

    //region MATCHING

    @Test
    public void testMatchIsOneDirectional() {
        assertTrue(matcher.match("op(X0,X1)=X1", "op(X0,X0)=X0"));
        assertFalse(matcher.match("op(X0,X0)=X0", "op(X0,X1)=X1"));
    }

    @Test
    public void testMatchRequiresConsistentBindings() {
        assertFalse(matcher.match("op(X0,X0) = X0", "op(X1,X2) = X1"));
    }

    @Test
    public void testMatchAgainstQuantifiedInstance() {
        assertTrue(matcher.match("! [X0,X1,X2] : op(X0,op(X1,X2)) = op(X0,X2)",
                "(op(X3,op(X4,X5)) = op(X3,X5))"));
    }

    @Test
    public void testMatchIdenticalQuantifiedFormula() {
        String formula = "! [X0,X1] : op(op(X0,X1),X0) = X0";
        assertTrue(matcher.match(formula, formula));
    }

    @Test
    public void testVariableBindsConstant() {
        assertTrue(matcher.match("p(X0)", "p(a)"));
        assertFalse(matcher.match("p(a)", "p(X0)"));
    }

    @Test
    public void testEquivalentUnderFreeRenaming() {
        assertTrue(matcher.equivalent("op(op(X0,X1),X0) = X0", "op(op(X5,X7),X5) = X5"));
    }

    @Test
    public void testMatchWithPermutedQuantifier() {
        assertTrue(matcher.match("! [X1,X0] : op(X0,X1) = X1", "! [X0,X1] : op(X0,X1) = X1"));
    }

    @Test
    public void testDifferentFunctionSymbols() {
        assertFalse(matcher.match("op(X0,X1) = X1", "f(X0,X1) = X1"));
    }

    @Test
    public void testMalformedFormulaDoesNotMatch() {
        assertFalse(matcher.match("op(X0,X1 = X1", "op(X0,X1) = X1"));
        assertFalse(matcher.match("op(X0,X1) = X1", "op(X0,"));
        assertFalse(matcher.match(null, "op(X0,X1) = X1"));
    }

    @Test
    public void testEquivalentIsSymmetric() {
        String first = "! [X0,X1] : op(op(X0,X1),X0) = X0";
        String second = "! [Y0,Y1] : op(op(Y0,Y1),Y0) = Y0";

        assertTrue(matcher.equivalent(first, second));
        assertTrue(matcher.equivalent(second, first));
        assertFalse(matcher.equivalent("op(X0,X1) = X1", "op(X0,X0) = X0"));
    }

    @Test
    public void testEqualityIsNotSymmetric() {
        assertFalse(matcher.match("op(X0,X1) = X0", "X0 = op(X0,X1)"));
    }

    //endregion

    //region CONFIGURAZIONE

    @Test
    public void testPermutations() {
        List<List<String>> permutations = FormulaMatcher.permutations(List.of("A", "B", "C"));

        assertEquals(6, permutations.size());
        assertEquals(6, permutations.stream().distinct().count());
        assertTrue(permutations.contains(List.of("C", "B", "A")));
    }

    @Test
    public void testZeroBoundStillMatchesIdenticalOrder() {
        FormulaMatcher strict = new FormulaMatcher(0);

        assertEquals(0, strict.getPermutationBound());
        assertTrue(strict.match("! [X0,X1] : op(X0,X1) = X1", "op(X5,X6) = X6"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeBound() {
        new FormulaMatcher(-1);
    }

    //endregion
}
