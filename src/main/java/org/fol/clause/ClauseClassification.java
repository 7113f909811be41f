package org.fol.clause;

import org.fol.formula.Formula;

/**
 * Esito della classificazione di una singola clausola.
 *
 * @param clause clausola analizzata
 * @param positiveLiterals numero di letterali positivi al livello più alto
 * @param horn vero se i letterali positivi sono al più uno
 */
public record ClauseClassification(Formula clause, int positiveLiterals, boolean horn) {
}
