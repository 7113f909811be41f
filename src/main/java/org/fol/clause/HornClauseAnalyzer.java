package org.fol.clause;

import org.fol.formula.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * ANALISI DELLE CLAUSOLE - Forma clausale e verifica di Horn
 *
 * Opera sulla formula in CNF prodotta dalla pipeline:
 * 1. Rimozione dei quantificatori residui (matrice)
 * 2. Separazione della matrice in clausole lungo le congiunzioni
 * 3. Conteggio dei letterali positivi per clausola
 *
 * Una clausola è di Horn se contiene al più un letterale positivo; la formula lo è
 * se lo sono tutte le sue clausole.
 */
public class HornClauseAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(HornClauseAnalyzer.class.getName());

    //region FORMA CLAUSALE

    /**
     * Rimuove i quantificatori lasciando invariato il resto della struttura.
     *
     * Dopo la skolemizzazione restano solo universali; un esistenziale residuo viene
     * comunque rimosso e segnalato.
     *
     * @param formula formula in forma prenessa skolemizzata
     * @return matrice senza quantificatori
     */
    public Formula getMatrix(Formula formula) {
        return switch (formula.type()) {
            case ATOM -> formula;
            case FORALL -> getMatrix(formula.body());
            case EXISTS -> {
                LOGGER.warning("Quantificatore esistenziale residuo rimosso: \\exists " + formula.variable());
                yield getMatrix(formula.body());
            }
            case NOT -> Formula.not(getMatrix(formula.operand()));
            case AND, OR, IMPLIES, IFF -> Formula.binary(formula.type(),
                    getMatrix(formula.left()), getMatrix(formula.right()));
        };
    }

    /**
     * Separa la matrice in clausole seguendo la spina delle congiunzioni da sinistra a destra.
     *
     * @param matrix matrice in CNF
     * @return clausole nell'ordine di apparizione
     */
    public List<Formula> extractClauses(Formula matrix) {
        List<Formula> clauses = new ArrayList<>();
        collectClauses(matrix, clauses);
        return clauses;
    }

    private void collectClauses(Formula f, List<Formula> clauses) {
        if (f.type() == Formula.Type.AND) {
            collectClauses(f.left(), clauses);
            collectClauses(f.right(), clauses);
        } else {
            clauses.add(f);
        }
    }

    //endregion

    //region CLASSIFICAZIONE DI HORN

    /**
     * Conta i letterali positivi scendendo solo attraverso le disgiunzioni.
     * Un atomo vale 1, una negazione 0 qualunque sia il suo operando.
     */
    public int countPositiveLiterals(Formula clause) {
        return switch (clause.type()) {
            case OR -> countPositiveLiterals(clause.left()) + countPositiveLiterals(clause.right());
            case ATOM -> 1;
            case NOT, AND, IMPLIES, IFF, FORALL, EXISTS -> 0;
        };
    }

    public ClauseClassification classify(Formula clause) {
        int positives = countPositiveLiterals(clause);
        return new ClauseClassification(clause, positives, positives <= 1);
    }

    /**
     * Analizza tutte le clausole di una formula in CNF.
     *
     * @param formula formula in CNF, eventualmente con quantificatori universali in testa
     * @return classificazione di ogni clausola e verdetto complessivo
     */
    public HornAnalysis analyze(Formula formula) {
        List<ClauseClassification> classifications = new ArrayList<>();
        for (Formula clause : extractClauses(getMatrix(formula))) {
            classifications.add(classify(clause));
        }

        boolean allHorn = classifications.stream().allMatch(ClauseClassification::horn);
        LOGGER.fine("Analisi di Horn: " + classifications.size() + " clausole, tutte Horn = " + allHorn);
        return new HornAnalysis(classifications, allHorn);
    }

    //endregion
}
