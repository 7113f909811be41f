package org.fol.transform;

import org.fol.formula.Formula;

/**
 * Passo di riscrittura della pipeline di conversione in CNF.
 *
 * Ogni implementazione è una funzione pura: non modifica l'albero in ingresso,
 * non conserva stato fra due invocazioni e restituisce i propri messaggi di
 * derivazione insieme alla formula prodotta.
 */
public interface RewritePass {

    /**
     * @return titolo del passo mostrato nella derivazione
     */
    String title();

    /**
     * Applica la trasformazione.
     *
     * @param formula formula che rispetta le invarianti del passo precedente
     * @return formula trasformata con i messaggi di derivazione
     */
    RewriteResult apply(Formula formula);
}
