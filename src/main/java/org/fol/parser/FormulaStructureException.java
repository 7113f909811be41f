package org.fol.parser;

/**
 * Errore strutturale: manca un identificatore (variabile o termine) dove la
 * grammatica lo richiede.
 */
public class FormulaStructureException extends FormulaParseException {

    public FormulaStructureException(String description) {
        super(description, description);
    }
}
