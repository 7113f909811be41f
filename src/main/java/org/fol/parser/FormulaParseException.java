package org.fol.parser;

/**
 * Errore durante la lettura di una formula.
 *
 * Un errore di parsing interrompe l'intera pipeline: non esistono risultati
 * parziali né tentativi di recupero.
 */
public abstract class FormulaParseException extends RuntimeException {

    private final String description;

    protected FormulaParseException(String message, String description) {
        super(message);
        this.description = description;
    }

    /**
     * @return descrizione dell'errore senza indicazione di posizione
     */
    public String getDescription() {
        return description;
    }
}
