package org.fol.formula;

import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link TermSubstitution}.
 */
public class TermSubstitutionTest {

    @Test
    public void testReplaceMatchesWholeIdentifiers() {
        assertEquals("P(y,x1,xx)", TermSubstitution.replace("P(x,x1,xx)", "x", "y"));
        assertEquals("P(f1(a,b))", TermSubstitution.replace("P(z)", "z", "f1(a,b)"));
        assertEquals("P(a)", TermSubstitution.replace("P(a)", "x", "y"));
    }

    /**
     * Renamings are applied in one pass, so a freshly introduced name is never renamed again.
     */
    @Test
    public void testReplaceAllIsSimultaneous() {
        Map<String, String> mapping = new LinkedHashMap<>();
        mapping.put("x", "x1");
        mapping.put("x1", "x11");
        assertEquals("P(x1,x11)", TermSubstitution.replaceAll("P(x,x1)", mapping));
    }

    @Test
    public void testReplacementWithRegexSpecialCharacters() {
        assertEquals("P($1)", TermSubstitution.replace("P(x)", "x", "$1"));
    }

    @Test
    public void testMentions() {
        assertTrue(TermSubstitution.mentions("P(x,y)", "x"));
        assertFalse(TermSubstitution.mentions("P(x1,y)", "x"));
        assertFalse(TermSubstitution.mentions("max", "x"));
    }
}
