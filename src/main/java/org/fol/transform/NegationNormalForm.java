package org.fol.transform;

import org.fol.formula.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Porta la formula in forma normale negativa spingendo le negazioni verso gli atomi.
 *
 * TRASFORMAZIONI APPLICATE (dall'alto verso il basso):
 * • !!A -> A
 * • !(A & B) -> !A | !B
 * • !(A | B) -> !A & !B
 * • !∀x A -> ∃x !A
 * • !∃x A -> ∀x !A
 *
 * Richiede una formula senza implicazioni né bicondizionali.
 */
public class NegationNormalForm implements RewritePass {

    private static final Logger LOGGER = Logger.getLogger(NegationNormalForm.class.getName());

    @Override
    public String title() {
        return "Aplicação das Leis de De Morgan";
    }

    @Override
    public RewriteResult apply(Formula formula) {
        LOGGER.fine("Normalizzazione negazioni per: " + formula);

        List<TraceEntry> trace = new ArrayList<>();
        Formula result = normalize(formula, trace);

        LOGGER.fine("Forma normale negativa: " + result);
        return new RewriteResult(result, trace);
    }

    private Formula normalize(Formula f, List<TraceEntry> trace) {
        return switch (f.type()) {
            case ATOM -> f;
            case NOT -> pushNegation(f, trace);
            case AND, OR, IMPLIES, IFF -> Formula.binary(f.type(), normalize(f.left(), trace), normalize(f.right(), trace));
            case FORALL, EXISTS -> Formula.quantified(f.type(), f.variable(), normalize(f.body(), trace));
        };
    }

    /**
     * Applica la regola adatta all'operando della negazione.
     */
    private Formula pushNegation(Formula negation, List<TraceEntry> trace) {
        Formula inner = negation.operand();

        return switch (inner.type()) {
            // Letterale: negazione già in posizione finale
            case ATOM -> negation;

            case NOT -> {
                Formula result = normalize(inner.operand(), trace);
                trace.add(TraceEntry.equivalence("Eliminamos a negação dupla", negation, result));
                yield result;
            }

            case AND -> {
                Formula result = Formula.or(
                        normalize(Formula.not(inner.left()), trace),
                        normalize(Formula.not(inner.right()), trace));
                trace.add(TraceEntry.equivalence("Aplicamos De Morgan", negation, result));
                yield result;
            }

            case OR -> {
                Formula result = Formula.and(
                        normalize(Formula.not(inner.left()), trace),
                        normalize(Formula.not(inner.right()), trace));
                trace.add(TraceEntry.equivalence("Aplicamos De Morgan", negation, result));
                yield result;
            }

            case FORALL -> {
                Formula result = Formula.exists(inner.variable(), normalize(Formula.not(inner.body()), trace));
                trace.add(TraceEntry.equivalence("Negação de quantificador universal", negation, result));
                yield result;
            }

            case EXISTS -> {
                Formula result = Formula.forall(inner.variable(), normalize(Formula.not(inner.body()), trace));
                trace.add(TraceEntry.equivalence("Negação de quantificador existencial", negation, result));
                yield result;
            }

            // Non dovrebbe accadere dopo l'eliminazione delle implicazioni
            case IMPLIES, IFF -> {
                LOGGER.warning("Negazione di implicazione non eliminata: " + negation);
                yield Formula.not(normalize(inner, trace));
            }
        };
    }
}
