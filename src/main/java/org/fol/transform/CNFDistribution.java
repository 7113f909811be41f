package org.fol.transform;

import org.fol.formula.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Distribuisce OR sopra AND fino a ottenere la Forma Normale Congiuntiva.
 *
 * PROPRIETÀ DISTRIBUTIVA APPLICATA:
 * • A | (B & C) -> (A | B) & (A | C)
 * • (A & B) | C -> (A | C) & (B | C)
 *
 * Gli operandi di ogni OR vengono distribuiti prima del nodo stesso e ogni nuovo OR
 * prodotto viene riesaminato; il tutto è ripetuto finché nessun OR ha un AND
 * al di sotto.
 */
public class CNFDistribution implements RewritePass {

    private static final Logger LOGGER = Logger.getLogger(CNFDistribution.class.getName());

    @Override
    public String title() {
        return "Conversão para Forma Normal Conjuntiva (FNC)";
    }

    @Override
    public RewriteResult apply(Formula formula) {
        List<TraceEntry> trace = new ArrayList<>();
        Formula result = formula;
        int rounds = 0;

        Formula previous;
        do {
            previous = result;
            result = distribute(result, trace);
            rounds++;
        } while (!result.equals(previous) && hasConjunctionUnderDisjunction(result, false));

        trace.add(TraceEntry.text("Forma Normal Conjuntiva final: $$" + result + "$$"));
        LOGGER.fine("CNF ottenuta in " + rounds + " giri e " + (trace.size() - 1) + " distribuzioni: " + result);
        return new RewriteResult(result, trace);
    }

    private Formula distribute(Formula f, List<TraceEntry> trace) {
        return switch (f.type()) {
            case ATOM -> f;
            case OR -> distributeOr(distribute(f.left(), trace), distribute(f.right(), trace), trace);
            case AND, IMPLIES, IFF -> Formula.binary(f.type(), distribute(f.left(), trace), distribute(f.right(), trace));
            case NOT -> Formula.not(distribute(f.operand(), trace));
            case FORALL, EXISTS -> Formula.quantified(f.type(), f.variable(), distribute(f.body(), trace));
        };
    }

    /**
     * Combina in OR due operandi già in CNF, distribuendo se uno dei due è un AND.
     */
    private Formula distributeOr(Formula left, Formula right, List<TraceEntry> trace) {
        Formula result;

        if (left.type() == Formula.Type.AND) {
            // (A & B) | C -> (A | C) & (B | C)
            result = Formula.and(
                    distributeOr(left.left(), right, trace),
                    distributeOr(left.right(), right, trace));
        } else if (right.type() == Formula.Type.AND) {
            // A | (B & C) -> (A | B) & (A | C)
            result = Formula.and(
                    distributeOr(left, right.left(), trace),
                    distributeOr(left, right.right(), trace));
        } else {
            return Formula.or(left, right);
        }

        trace.add(TraceEntry.equivalence("Distribuímos OR sobre AND", Formula.or(left, right), result));
        return result;
    }

    /**
     * Vero se esiste un AND sotto un OR. Le negazioni sono letterali e un quantificatore
     * apre un nuovo ambito: in entrambi i casi la distribuzione non li attraversa.
     */
    static boolean hasConjunctionUnderDisjunction(Formula f, boolean underDisjunction) {
        return switch (f.type()) {
            case ATOM, NOT, IMPLIES, IFF -> false;
            case AND -> underDisjunction
                    || hasConjunctionUnderDisjunction(f.left(), false)
                    || hasConjunctionUnderDisjunction(f.right(), false);
            case OR -> hasConjunctionUnderDisjunction(f.left(), true)
                    || hasConjunctionUnderDisjunction(f.right(), true);
            case FORALL, EXISTS -> hasConjunctionUnderDisjunction(f.body(), false);
        };
    }
}
