package org.fol.transform;

import org.fol.parser.FormulaParser;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link NegationNormalForm}.
 */
public class NegationNormalFormTest {

    private final FormulaParser parser = new FormulaParser();
    private final NegationNormalForm pass = new NegationNormalForm();

    private RewriteResult apply(String input) {
        return pass.apply(parser.parse(input));
    }

    @Test
    public void testDoubleNegation() {
        RewriteResult result = apply("\\neg \\neg p");

        assertEquals("p", result.formula().toString());
        assertEquals(1, result.trace().size());
        assertEquals("Eliminamos a negação dupla", result.trace().get(0).message());
    }

    @Test
    public void testTripleNegationLeavesLiteral() {
        RewriteResult result = apply("\\neg \\neg \\neg p");

        assertEquals("\\neg p", result.formula().toString());
        assertEquals(1, result.trace().size());
    }

    @Test
    public void testDeMorgan() {
        assertEquals("(\\neg p \\lor \\neg q)", apply("\\neg (p \\land q)").formula().toString());
        assertEquals("(\\neg p \\land \\neg q)", apply("\\neg (p \\lor q)").formula().toString());
        assertEquals("Aplicamos De Morgan", apply("\\neg (p \\lor q)").trace().get(0).message());
    }

    @Test
    public void testQuantifierDuality() {
        RewriteResult universal = apply("\\neg \\forall x P(x)");
        assertEquals("\\exists x \\neg P(x)", universal.formula().toString());
        assertEquals("Negação de quantificador universal", universal.trace().get(0).message());

        RewriteResult existential = apply("\\neg \\exists x P(x)");
        assertEquals("\\forall x \\neg P(x)", existential.formula().toString());
        assertEquals("Negação de quantificador existencial", existential.trace().get(0).message());
    }

    /**
     * Rules applied inside the result are recorded before the enclosing rewrite.
     */
    @Test
    public void testInnerRewritesAreRecordedFirst() {
        RewriteResult result = apply("\\neg \\exists x (P(x) \\land Q(x))");

        assertEquals("\\forall x (\\neg P(x) \\lor \\neg Q(x))", result.formula().toString());
        assertEquals(2, result.trace().size());
        assertEquals("Aplicamos De Morgan", result.trace().get(0).message());
        assertEquals("Negação de quantificador existencial", result.trace().get(1).message());
    }

    @Test
    public void testLiteralsAreUnchanged() {
        RewriteResult result = apply("\\neg p \\land \\forall x \\neg Q(x)");

        assertEquals("(\\neg p \\land \\forall x \\neg Q(x))", result.formula().toString());
        assertTrue(result.trace().isEmpty());
    }

    @Test
    public void testNegationsEndOnAtoms() {
        RewriteResult result = apply(
                "\\neg (\\neg (p \\lor \\neg q) \\land \\forall x \\neg \\exists y (R(x,y) \\lor \\neg \\neg S(y)))");
        assertTrue(FormulaInspection.negationsOnAtomsOnly(result.formula()));
    }
}
