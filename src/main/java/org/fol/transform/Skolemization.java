package org.fol.transform;

import org.fol.formula.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Elimina i quantificatori esistenziali sostituendo le loro variabili con termini di Skolem.
 *
 * Ogni ∃y viene rimpiazzato da:
 * • fN(u1,...,uk) se è nel campo dei quantificatori universali u1..uk (in ordine di legame)
 * • cN se non ci sono universali che lo racchiudono
 *
 * Il contatore N è unico per tutto il passo (funzioni e costanti condividono la
 * numerazione) e viene passato e restituito dalla ricorsione, partendo da 1.
 * Il risultato è equisoddisfacibile, non equivalente, alla formula di partenza.
 */
public class Skolemization implements RewritePass {

    private static final Logger LOGGER = Logger.getLogger(Skolemization.class.getName());

    private static final String FUNCTION_PREFIX = "f";
    private static final String CONSTANT_PREFIX = "c";
    private static final int FIRST_INDEX = 1;

    @Override
    public String title() {
        return "Skolemização";
    }

    @Override
    public RewriteResult apply(Formula formula) {
        List<TraceEntry> trace = new ArrayList<>();
        Skolemized result = skolemize(formula, List.of(), FIRST_INDEX, trace);

        LOGGER.fine("Skolemizzazione completata (" + (result.nextIndex - FIRST_INDEX)
                + " termini introdotti): " + result.formula);
        return new RewriteResult(result.formula, trace);
    }

    private Skolemized skolemize(Formula f, List<String> universals, int index, List<TraceEntry> trace) {
        return switch (f.type()) {
            case ATOM -> new Skolemized(f, index);

            case EXISTS -> {
                String skolemTerm = skolemTerm(universals, index);
                trace.add(TraceEntry.text("$\\exists " + f.variable() + "$ substituído por $" + skolemTerm + "$"));
                LOGGER.finest("Termine di Skolem per " + f.variable() + ": " + skolemTerm);

                // Il quantificatore sparisce: resta il corpo sostituito, trasformato a sua volta
                Formula substituted = f.body().substitute(f.variable(), skolemTerm);
                yield skolemize(substituted, universals, index + 1, trace);
            }

            case FORALL -> {
                List<String> scope = new ArrayList<>(universals);
                scope.add(f.variable());
                Skolemized body = skolemize(f.body(), List.copyOf(scope), index, trace);
                yield new Skolemized(Formula.forall(f.variable(), body.formula), body.nextIndex);
            }

            case AND, OR, IMPLIES, IFF -> {
                Skolemized left = skolemize(f.left(), universals, index, trace);
                Skolemized right = skolemize(f.right(), universals, left.nextIndex, trace);
                yield new Skolemized(Formula.binary(f.type(), left.formula, right.formula), right.nextIndex);
            }

            case NOT -> {
                Skolemized inner = skolemize(f.operand(), universals, index, trace);
                yield new Skolemized(Formula.not(inner.formula), inner.nextIndex);
            }
        };
    }

    /**
     * Costruisce il termine di Skolem: funzione delle universali in campo o costante.
     */
    static String skolemTerm(List<String> universals, int index) {
        if (universals.isEmpty()) {
            return CONSTANT_PREFIX + index;
        }
        return FUNCTION_PREFIX + index + "(" + String.join(",", universals) + ")";
    }

    /**
     * Sottoalbero skolemizzato e prossimo indice libero.
     */
    private record Skolemized(Formula formula, int nextIndex) {}
}
