package org.fol.transform;

import org.fol.formula.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Porta la formula in forma prenessa.
 *
 * Raccoglie i quantificatori in pre-ordine (da sinistra a destra, dall'esterno
 * verso l'interno) lungo congiunzioni, disgiunzioni e negazioni, li sostituisce
 * con il loro corpo e infine li rimette in testa alla matrice nello stesso ordine.
 *
 * Corretto solo se le variabili legate sono già state standardizzate.
 */
public class PrenexExtraction implements RewritePass {

    private static final Logger LOGGER = Logger.getLogger(PrenexExtraction.class.getName());

    @Override
    public String title() {
        return "Movendo Quantificadores para Forma Prenex";
    }

    @Override
    public RewriteResult apply(Formula formula) {
        List<Quantifier> quantifiers = new ArrayList<>();
        Formula result = extract(formula, quantifiers);

        // Il primo quantificatore raccolto diventa il più esterno
        for (int i = quantifiers.size() - 1; i >= 0; i--) {
            Quantifier q = quantifiers.get(i);
            result = Formula.quantified(q.type, q.variable, result);
        }

        List<TraceEntry> trace = new ArrayList<>();
        if (!quantifiers.isEmpty()) {
            trace.add(TraceEntry.text("Movemos os quantificadores para frente: $$" + result + "$$"));
        }

        LOGGER.fine("Forma prenessa con " + quantifiers.size() + " quantificatori: " + result);
        return new RewriteResult(result, trace);
    }

    /**
     * Restituisce la matrice senza quantificatori e accumula i quantificatori incontrati.
     */
    private Formula extract(Formula f, List<Quantifier> quantifiers) {
        return switch (f.type()) {
            case ATOM -> f;

            case FORALL, EXISTS -> {
                quantifiers.add(new Quantifier(f.type(), f.variable()));
                yield extract(f.body(), quantifiers);
            }

            case AND, OR -> Formula.binary(f.type(), extract(f.left(), quantifiers), extract(f.right(), quantifiers));
            case NOT -> Formula.not(extract(f.operand(), quantifiers));

            // Assenti dopo l'eliminazione delle implicazioni: lasciati intatti
            case IMPLIES, IFF -> f;
        };
    }

    private record Quantifier(Formula.Type type, String variable) {}
}
