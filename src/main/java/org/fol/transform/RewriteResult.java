package org.fol.transform;

import org.fol.formula.Formula;

import java.util.List;

/**
 * Risultato di una trasformazione: la nuova formula e i passaggi che l'hanno prodotta.
 */
public record RewriteResult(Formula formula, List<TraceEntry> trace) {

    public RewriteResult {
        if (formula == null) {
            throw new IllegalArgumentException("Formula risultante non può essere null");
        }
        trace = List.copyOf(trace);
    }
}
