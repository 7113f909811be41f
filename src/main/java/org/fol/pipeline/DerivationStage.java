package org.fol.pipeline;

import org.fol.formula.Formula;
import org.fol.transform.TraceEntry;

import java.util.List;

/**
 * Un passo della derivazione consegnato al visualizzatore.
 *
 * @param title titolo del passo
 * @param formula formula risultante; null solo per il passo di errore
 * @param trace messaggi di derivazione del passo
 */
public record DerivationStage(String title, Formula formula, List<TraceEntry> trace) {

    public DerivationStage {
        if (title == null) {
            throw new IllegalArgumentException("Titolo del passo non può essere null");
        }
        trace = List.copyOf(trace);
    }
}
