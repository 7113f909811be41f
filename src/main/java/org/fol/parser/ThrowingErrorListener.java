package org.fol.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.antlr.v4.runtime.misc.Interval;
import org.fol.antlr.FolFormulaLexer;
import org.fol.antlr.FolFormulaParser;

import java.util.logging.Logger;

/**
 * Listener ANTLR che trasforma il primo errore di lexing o parsing in eccezione.
 *
 * Sostituisce il ConsoleErrorListener predefinito: nessun tentativo di recupero,
 * il primo errore interrompe l'analisi con la posizione del carattere coinvolto.
 */
final class ThrowingErrorListener extends BaseErrorListener {

    private static final Logger LOGGER = Logger.getLogger(ThrowingErrorListener.class.getName());

    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    private ThrowingErrorListener() {
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        LOGGER.fine("Errore ANTLR alla riga " + line + ":" + charPositionInLine + " - " + msg);

        if (e instanceof LexerNoViableAltException lexerError) {
            int offset = lexerError.getStartIndex();
            CharStream input = lexerError.getInputStream();
            String character = input.getText(Interval.of(offset, offset));
            throw new FormulaSyntaxException(offset, "Caractere não reconhecido '" + character + "'");
        }

        if (recognizer instanceof Parser parser && isIdentifierOnly(parser, e)) {
            throw new FormulaStructureException(describeMissingIdentifier(parser.getContext()));
        }

        if (offendingSymbol instanceof Token token) {
            throw new FormulaSyntaxException(token.getStartIndex(), describeUnexpected(token));
        }

        throw new FormulaSyntaxException(charPositionInLine, msg);
    }

    /**
     * Vero se nel punto di errore l'unico token accettabile è un identificatore.
     */
    private static boolean isIdentifierOnly(Parser parser, RecognitionException e) {
        IntervalSet expected = e != null ? e.getExpectedTokens() : parser.getExpectedTokens();
        return expected != null
                && expected.size() == 1
                && expected.contains(FolFormulaLexer.IDENTIFIER);
    }

    private static String describeMissingIdentifier(ParserRuleContext context) {
        if (context instanceof FolFormulaParser.QuantifiedFormulaContext) {
            return "Variável esperada";
        }
        if (context instanceof FolFormulaParser.TermContext
                || context instanceof FolFormulaParser.ArgumentsContext) {
            return "Termo esperado";
        }
        return "Átomo esperado";
    }

    private static String describeUnexpected(Token token) {
        if (token.getType() == Token.EOF) {
            return "fim inesperado da entrada";
        }
        return "token inesperado '" + token.getText() + "'";
    }
}
