package org.fol.transform;

import org.fol.formula.Formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks shared by the rewrite pass tests.
 */
final class FormulaInspection {

    private FormulaInspection() {
    }

    static boolean contains(Formula f, Formula.Type type) {
        if (f.type() == type) {
            return true;
        }
        return switch (f.type()) {
            case ATOM -> false;
            case NOT -> contains(f.operand(), type);
            case FORALL, EXISTS -> contains(f.body(), type);
            case AND, OR, IMPLIES, IFF -> contains(f.left(), type) || contains(f.right(), type);
        };
    }

    /**
     * True when every negation applies directly to an atom.
     */
    static boolean negationsOnAtomsOnly(Formula f) {
        return switch (f.type()) {
            case ATOM -> true;
            case NOT -> f.operand().type() == Formula.Type.ATOM;
            case FORALL, EXISTS -> negationsOnAtomsOnly(f.body());
            case AND, OR, IMPLIES, IFF -> negationsOnAtomsOnly(f.left()) && negationsOnAtomsOnly(f.right());
        };
    }

    /**
     * Bound variables in pre-order.
     */
    static List<String> boundVariables(Formula f) {
        List<String> names = new ArrayList<>();
        collectBound(f, names);
        return names;
    }

    private static void collectBound(Formula f, List<String> names) {
        switch (f.type()) {
            case ATOM -> { }
            case NOT -> collectBound(f.operand(), names);
            case FORALL, EXISTS -> {
                names.add(f.variable());
                collectBound(f.body(), names);
            }
            case AND, OR, IMPLIES, IFF -> {
                collectBound(f.left(), names);
                collectBound(f.right(), names);
            }
        }
    }

    /**
     * Strips the leading quantifier prefix.
     */
    static Formula stripPrefix(Formula f) {
        Formula current = f;
        while (current.isQuantifier()) {
            current = current.body();
        }
        return current;
    }
}
