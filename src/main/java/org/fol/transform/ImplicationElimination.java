package org.fol.transform;

import org.fol.formula.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Elimina implicazioni e bicondizionali.
 *
 * TRASFORMAZIONI APPLICATE:
 * • A -> B  ~  !A | B
 * • A <-> B ~  (!A | B) & (!B | A)
 *
 * Gli altri nodi vengono ricostruiti con lo stesso tipo.
 */
public class ImplicationElimination implements RewritePass {

    private static final Logger LOGGER = Logger.getLogger(ImplicationElimination.class.getName());

    @Override
    public String title() {
        return "Eliminação de Implicações e Bicondicionais";
    }

    @Override
    public RewriteResult apply(Formula formula) {
        LOGGER.fine("Eliminazione implicazioni per: " + formula);

        List<TraceEntry> trace = new ArrayList<>();
        Formula result = eliminate(formula, trace);

        LOGGER.fine("Implicazioni eliminate: " + result);
        return new RewriteResult(result, trace);
    }

    private Formula eliminate(Formula f, List<TraceEntry> trace) {
        return switch (f.type()) {
            case ATOM -> f;

            case IMPLIES -> {
                Formula result = Formula.or(
                        Formula.not(eliminate(f.left(), trace)),
                        eliminate(f.right(), trace));
                trace.add(TraceEntry.equivalence("Substituímos a implicação", f, result));
                yield result;
            }

            case IFF -> {
                Formula left = eliminate(f.left(), trace);
                Formula right = eliminate(f.right(), trace);
                Formula result = Formula.and(
                        Formula.or(Formula.not(left), right),
                        Formula.or(Formula.not(right), left));
                trace.add(TraceEntry.equivalence("Substituímos o bicondicional", f, result));
                yield result;
            }

            case AND, OR -> Formula.binary(f.type(), eliminate(f.left(), trace), eliminate(f.right(), trace));
            case NOT -> Formula.not(eliminate(f.operand(), trace));
            case FORALL, EXISTS -> Formula.quantified(f.type(), f.variable(), eliminate(f.body(), trace));
        };
    }
}
