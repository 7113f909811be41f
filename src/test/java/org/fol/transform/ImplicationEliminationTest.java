package org.fol.transform;

import org.fol.formula.Formula;
import org.fol.parser.FormulaParser;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link ImplicationElimination}.
 */
public class ImplicationEliminationTest {

    private final FormulaParser parser = new FormulaParser();
    private final ImplicationElimination pass = new ImplicationElimination();

    @Test
    public void testImplication() {
        RewriteResult result = pass.apply(parser.parse("p \\rightarrow q"));

        assertEquals("(\\neg p \\lor q)", result.formula().toString());
        assertEquals(1, result.trace().size());
        assertEquals("Substituímos a implicação: $$(p \\rightarrow q) \\equiv (\\neg p \\lor q)$$",
                result.trace().get(0).toString());
    }

    @Test
    public void testBiconditional() {
        RewriteResult result = pass.apply(parser.parse("p \\leftrightarrow q"));

        assertEquals("((\\neg p \\lor q) \\land (\\neg q \\lor p))", result.formula().toString());
        assertEquals(TraceEntry.Kind.EQUIVALENCE, result.trace().get(0).kind());
        assertEquals("Substituímos o bicondicional", result.trace().get(0).message());
    }

    /**
     * The inner implication is rewritten, and recorded, before the outer one.
     */
    @Test
    public void testNestedImplication() {
        RewriteResult result = pass.apply(parser.parse("(a \\rightarrow b) \\rightarrow c"));

        assertEquals("(\\neg (\\neg a \\lor b) \\lor c)", result.formula().toString());
        assertEquals(2, result.trace().size());
        assertEquals("(a \\rightarrow b)", result.trace().get(0).before());
        assertEquals("((a \\rightarrow b) \\rightarrow c)", result.trace().get(1).before());
    }

    @Test
    public void testRewritesUnderQuantifiers() {
        RewriteResult result = pass.apply(parser.parse("\\forall x (P(x) \\rightarrow \\exists y Q(x,y))"));
        assertEquals("\\forall x (\\neg P(x) \\lor \\exists y Q(x,y))", result.formula().toString());
    }

    @Test
    public void testFormulaWithoutImplicationsIsUnchanged() {
        Formula input = parser.parse("\\neg (p \\land q) \\lor r");
        RewriteResult result = pass.apply(input);

        assertEquals(input, result.formula());
        assertTrue(result.trace().isEmpty());
    }

    @Test
    public void testNoImplicationsRemain() {
        RewriteResult result = pass.apply(parser.parse(
                "(p \\iff q) \\to \\neg (r \\leftrightarrow \\forall x (P(x) \\to s))"));
        assertFalse(FormulaInspection.contains(result.formula(), Formula.Type.IMPLIES));
        assertFalse(FormulaInspection.contains(result.formula(), Formula.Type.IFF));
    }
}
