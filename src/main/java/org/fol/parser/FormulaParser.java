package org.fol.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.ParseTree;
import org.fol.antlr.FolFormulaLexer;
import org.fol.antlr.FolFormulaParser;
import org.fol.formula.Formula;

import java.util.logging.Logger;

/**
 * PARSER FORMULE DEL PRIMO ORDINE - Da notazione LaTeX a {@link Formula}
 *
 * Pipeline: Lexing -> Parsing ANTLR -> Visitor -> Formula.
 *
 * NOTAZIONE ACCETTATA:
 * - Implicazione: \rightarrow, \to
 * - Bicondizionale: \leftrightarrow, \iff
 * - Congiunzione: \land, \wedge
 * - Disgiunzione: \lor, \vee
 * - Negazione: \neg, \lnot
 * - Quantificatori: \forall x A, \exists x A (in qualsiasi posizione di operando)
 * - Atomi: identificatori [A-Za-z0-9_]+ con argomenti opzionali, es. P(x,f(y))
 * - Spazi e lo spazio sottile \, sono ignorati
 *
 * Il primo errore interrompe l'analisi con una {@link FormulaParseException}.
 */
public class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    /**
     * Analizza una formula testuale.
     *
     * @param text formula in notazione LaTeX
     * @return albero della formula
     * @throws FormulaSyntaxException se l'input non è una formula ben formata
     * @throws FormulaStructureException se manca una variabile o un termine richiesto
     */
    public Formula parse(String text) {
        if (text == null || text.isBlank()) {
            throw new FormulaSyntaxException(0, "fórmula vazia");
        }

        LOGGER.fine("Analisi formula: " + text);

        FolFormulaLexer lexer = new FolFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        FolFormulaParser parser = new FolFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        ParseTree tree = parser.formula();
        Formula formula = new FormulaBuilder().visit(tree);

        LOGGER.fine("Formula analizzata: " + formula);
        return formula;
    }
}
