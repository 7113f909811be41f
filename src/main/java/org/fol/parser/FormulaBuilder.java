package org.fol.parser;

import org.antlr.v4.runtime.Token;
import org.fol.antlr.FolFormulaBaseVisitor;
import org.fol.antlr.FolFormulaLexer;
import org.fol.antlr.FolFormulaParser.ArgumentsContext;
import org.fol.antlr.FolFormulaParser.AtomContext;
import org.fol.antlr.FolFormulaParser.AtomicFormulaContext;
import org.fol.antlr.FolFormulaParser.ConjunctionContext;
import org.fol.antlr.FolFormulaParser.DisjunctionContext;
import org.fol.antlr.FolFormulaParser.ExpressionContext;
import org.fol.antlr.FolFormulaParser.FormulaContext;
import org.fol.antlr.FolFormulaParser.NotFormulaContext;
import org.fol.antlr.FolFormulaParser.ParenthesizedFormulaContext;
import org.fol.antlr.FolFormulaParser.PrimaryFormulaContext;
import org.fol.antlr.FolFormulaParser.QuantifiedFormulaContext;
import org.fol.antlr.FolFormulaParser.TermContext;
import org.fol.formula.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Convertitore da albero sintattico ANTLR a {@link Formula}.
 *
 * OPERATORI (in ordine di precedenza crescente):
 * - Implicazione e bicondizionale: catena piegata a sinistra, (A -> B) <-> C
 * - Disgiunzione: associativa a sinistra
 * - Congiunzione: associativa a sinistra
 * - Negazione: prefissa, annidabile
 * - Primari: quantificatori, parentesi, atomi
 *
 * Gli argomenti degli atomi non diventano nodi: la chiamata viene ricomposta nel
 * testo opaco dell'atomo, es. P(x,f(y)).
 */
class FormulaBuilder extends FolFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaBuilder.class.getName());

    //region PUNTO DI INGRESSO

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        return visit(ctx.expression());
    }

    //endregion

    //region OPERATORI BINARI

    /**
     * Implicazioni e bicondizionali: ogni operatore della catena combina il
     * risultato accumulato con l'operando successivo.
     */
    @Override
    public Formula visitExpression(ExpressionContext ctx) {
        Formula result = visit(ctx.disjunction(0));

        for (int i = 0; i < ctx.ops.size(); i++) {
            Formula right = visit(ctx.disjunction(i + 1));
            Token operator = ctx.ops.get(i);

            if (operator.getType() == FolFormulaLexer.IMPLIES) {
                result = Formula.implies(result, right);
            } else {
                result = Formula.iff(result, right);
            }
        }
        return result;
    }

    @Override
    public Formula visitDisjunction(DisjunctionContext ctx) {
        Formula result = visit(ctx.conjunction(0));
        for (int i = 1; i < ctx.conjunction().size(); i++) {
            result = Formula.or(result, visit(ctx.conjunction(i)));
        }
        return result;
    }

    @Override
    public Formula visitConjunction(ConjunctionContext ctx) {
        Formula result = visit(ctx.negation(0));
        for (int i = 1; i < ctx.negation().size(); i++) {
            result = Formula.and(result, visit(ctx.negation(i)));
        }
        return result;
    }

    //endregion

    //region NEGAZIONI E PRIMARI

    @Override
    public Formula visitNotFormula(NotFormulaContext ctx) {
        return Formula.not(visit(ctx.negation()));
    }

    @Override
    public Formula visitPrimaryFormula(PrimaryFormulaContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public Formula visitQuantifiedFormula(QuantifiedFormulaContext ctx) {
        String variable = ctx.IDENTIFIER().getText();
        Formula body = visit(ctx.expression());

        LOGGER.finest("Quantificatore " + ctx.quantifier.getText() + " su " + variable);
        return ctx.quantifier.getType() == FolFormulaLexer.FORALL
                ? Formula.forall(variable, body)
                : Formula.exists(variable, body);
    }

    @Override
    public Formula visitParenthesizedFormula(ParenthesizedFormulaContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public Formula visitAtomicFormula(AtomicFormulaContext ctx) {
        return visit(ctx.atom());
    }

    //endregion

    //region ATOMI E TERMINI

    @Override
    public Formula visitAtom(AtomContext ctx) {
        String text = renderCall(ctx.IDENTIFIER().getText(), ctx.arguments());
        LOGGER.finest("Atomo: " + text);
        return Formula.atom(text);
    }

    /**
     * Ricompone un termine, con eventuali argomenti annidati, in testo.
     */
    private String renderTerm(TermContext ctx) {
        return renderCall(ctx.IDENTIFIER().getText(), ctx.arguments());
    }

    private String renderCall(String name, ArgumentsContext arguments) {
        if (arguments == null) {
            return name;
        }

        List<String> rendered = new ArrayList<>();
        for (TermContext term : arguments.term()) {
            rendered.add(renderTerm(term));
        }
        return name + "(" + String.join(",", rendered) + ")";
    }

    //endregion
}
