package org.fol.parser;

import org.fol.formula.Formula;
import org.junit.Test;

import static org.fol.formula.Formula.and;
import static org.fol.formula.Formula.atom;
import static org.fol.formula.Formula.exists;
import static org.fol.formula.Formula.forall;
import static org.fol.formula.Formula.iff;
import static org.fol.formula.Formula.implies;
import static org.fol.formula.Formula.not;
import static org.fol.formula.Formula.or;
import static org.junit.Assert.*;

/**
 * Unit tests for {@link FormulaParser}: precedence, aliases, quantifier placement,
 * atom text reconstruction and error reporting.
 */
public class FormulaParserTest {

    private final FormulaParser parser = new FormulaParser();

    @Test
    public void testSimpleImplication() {
        Formula f = parser.parse("p \\rightarrow q");
        assertEquals(implies(atom("p"), atom("q")), f);
        assertEquals("(p \\rightarrow q)", f.toString());
    }

    /**
     * Every operator has two admissible spellings.
     */
    @Test
    public void testOperatorAliases() {
        assertEquals(parser.parse("p \\rightarrow q"), parser.parse("p \\to q"));
        assertEquals(parser.parse("p \\leftrightarrow q"), parser.parse("p \\iff q"));
        assertEquals(parser.parse("p \\land q"), parser.parse("p \\wedge q"));
        assertEquals(parser.parse("p \\lor q"), parser.parse("p \\vee q"));
        assertEquals(parser.parse("\\neg p"), parser.parse("\\lnot p"));
    }

    @Test
    public void testConjunctionBindsTighterThanDisjunction() {
        assertEquals(or(atom("a"), and(atom("b"), atom("c"))), parser.parse("a \\lor b \\land c"));
        assertEquals(or(and(atom("a"), atom("b")), atom("c")), parser.parse("a \\land b \\lor c"));
    }

    @Test
    public void testDisjunctionBindsTighterThanImplication() {
        assertEquals(implies(or(atom("a"), atom("b")), atom("c")), parser.parse("a \\lor b \\rightarrow c"));
    }

    /**
     * Implication chains fold to the left, mixing both operators.
     */
    @Test
    public void testImplicationChainFoldsLeft() {
        assertEquals(implies(implies(atom("a"), atom("b")), atom("c")),
                parser.parse("a \\rightarrow b \\rightarrow c"));
        assertEquals(implies(iff(atom("a"), atom("b")), atom("c")),
                parser.parse("a \\leftrightarrow b \\rightarrow c"));
    }

    @Test
    public void testBinaryOperatorsFoldLeft() {
        assertEquals(and(and(atom("a"), atom("b")), atom("c")), parser.parse("a \\land b \\land c"));
        assertEquals(or(or(atom("a"), atom("b")), atom("c")), parser.parse("a \\lor b \\lor c"));
    }

    @Test
    public void testNestedNegation() {
        assertEquals(not(not(atom("p"))), parser.parse("\\neg \\neg p"));
        assertEquals(and(not(atom("p")), atom("q")), parser.parse("\\neg p \\land q"));
        assertEquals(not(and(atom("p"), atom("q"))), parser.parse("\\neg(p \\land q)"));
    }

    /**
     * A quantifier body extends as far to the right as possible.
     */
    @Test
    public void testQuantifierBodyIsGreedy() {
        assertEquals(forall("x", and(atom("P(x)"), atom("Q(x)"))),
                parser.parse("\\forall x P(x) \\land Q(x)"));
        assertEquals(and(forall("x", atom("P(x)")), atom("Q(x)")),
                parser.parse("(\\forall x P(x)) \\land Q(x)"));
    }

    @Test
    public void testQuantifierInOperandPosition() {
        assertEquals(and(atom("p"), exists("y", atom("R(y)"))), parser.parse("p \\land \\exists y R(y)"));
        assertEquals(not(forall("x", atom("P(x)"))), parser.parse("\\neg \\forall x P(x)"));
        assertEquals(forall("x", exists("y", atom("P(x,y)"))), parser.parse("\\forall x \\exists y P(x,y)"));
    }

    @Test
    public void testQuantifierWithParenthesizedBody() {
        assertEquals(forall("x", or(atom("P(x)"), atom("Q(x)"))), parser.parse("\\forall x (P(x) \\lor Q(x))"));
    }

    /**
     * Arguments are rebuilt into the opaque atom text without spaces.
     */
    @Test
    public void testAtomTextReconstruction() {
        assertEquals("P(x,f(y,z))", parser.parse("P( x , f( y ,z))").text());
        assertEquals("Loves(john,mother(mother(x)))", parser.parse("Loves(john, mother(mother(x)))").text());
        assertEquals("P()", parser.parse("P()").text());
        assertEquals("p_1", parser.parse("p_1").text());
    }

    @Test
    public void testThinSpaceAndWhitespaceIgnored() {
        assertEquals(and(atom("p"), atom("q")), parser.parse("p\\,\\land\\,q"));
        assertEquals(and(atom("p"), atom("q")), parser.parse("  p \n\t\\land   q  "));
    }

    @Test
    public void testKeywordsAreCaseSensitive() {
        try {
            parser.parse("p \\LAND q");
            fail("Expected FormulaSyntaxException");
        } catch (FormulaSyntaxException e) {
            assertEquals(2, e.getOffset());
        }
    }

    /**
     * Unknown LaTeX commands are rejected instead of being split into keyword + identifier.
     */
    @Test
    public void testUnknownCommandRejected() {
        try {
            parser.parse("a \\top");
            fail("Expected FormulaSyntaxException");
        } catch (FormulaSyntaxException e) {
            assertEquals(2, e.getOffset());
        }
    }

    @Test
    public void testMissingRightOperandReportsEndOfInput() {
        try {
            parser.parse("p \\land");
            fail("Expected FormulaSyntaxException");
        } catch (FormulaSyntaxException e) {
            assertEquals(7, e.getOffset());
            assertTrue(e.getMessage().contains("7"));
        }
    }

    @Test
    public void testTrailingTokenRejected() {
        try {
            parser.parse("p q");
            fail("Expected FormulaSyntaxException");
        } catch (FormulaSyntaxException e) {
            assertEquals(2, e.getOffset());
        }
    }

    @Test
    public void testUnmatchedParenthesis() {
        try {
            parser.parse("(p \\land q");
            fail("Expected FormulaSyntaxException");
        } catch (FormulaSyntaxException e) {
            assertEquals(10, e.getOffset());
        }

        try {
            parser.parse("p \\land q)");
            fail("Expected FormulaSyntaxException");
        } catch (FormulaSyntaxException e) {
            assertEquals(9, e.getOffset());
        }
    }

    @Test
    public void testUnrecognizedCharacter() {
        try {
            parser.parse("p & q");
            fail("Expected FormulaSyntaxException");
        } catch (FormulaSyntaxException e) {
            assertEquals(2, e.getOffset());
        }
    }

    @Test
    public void testBlankInputRejected() {
        try {
            parser.parse("   ");
            fail("Expected FormulaSyntaxException");
        } catch (FormulaSyntaxException e) {
            assertEquals(0, e.getOffset());
        }
    }

    @Test
    public void testMissingQuantifiedVariable() {
        try {
            parser.parse("\\forall (P(x))");
            fail("Expected FormulaStructureException");
        } catch (FormulaStructureException e) {
            assertEquals("Variável esperada", e.getDescription());
        }

        try {
            parser.parse("\\exists");
            fail("Expected FormulaStructureException");
        } catch (FormulaStructureException e) {
            assertEquals("Variável esperada", e.getDescription());
        }
    }

    @Test
    public void testMissingTerm() {
        try {
            parser.parse("P(a,)");
            fail("Expected FormulaStructureException");
        } catch (FormulaStructureException e) {
            assertEquals("Termo esperado", e.getDescription());
        }
    }

    /**
     * parse(serialize(parse(x))) must give back the same tree.
     */
    @Test
    public void testSerializeParseRoundTrip() {
        String[] inputs = {
                "p \\rightarrow q",
                "\\neg(p \\land q) \\leftrightarrow r",
                "\\forall x \\exists y P(x,y)",
                "(\\forall x P(x)) \\land Q(a)",
                "\\neg \\exists x P(x) \\lor q",
                "(\\neg \\forall x P(x)) \\lor q",
                "a \\rightarrow b \\rightarrow c",
                "\\forall x (P(x) \\rightarrow \\exists y (Q(x,y) \\land \\neg R(f(y))))",
                "p \\land (q \\lor (r \\land s))"
        };

        for (String input : inputs) {
            Formula parsed = parser.parse(input);
            assertEquals(input, parsed, parser.parse(parsed.toString()));
        }
    }
}
