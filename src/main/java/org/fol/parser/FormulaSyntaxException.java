package org.fol.parser;

/**
 * Errore sintattico: token inatteso, parentesi non bilanciata, carattere non
 * riconosciuto o fine prematura dell'input.
 */
public class FormulaSyntaxException extends FormulaParseException {

    /** Indice (da 0) del carattere che ha causato l'errore */
    private final int offset;

    public FormulaSyntaxException(int offset, String description) {
        super("Erro de sintaxe na posição " + offset + ": " + description, description);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
