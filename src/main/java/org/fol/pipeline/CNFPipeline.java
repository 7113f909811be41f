package org.fol.pipeline;

import org.fol.clause.HornAnalysis;
import org.fol.clause.HornClauseAnalyzer;
import org.fol.formula.Formula;
import org.fol.parser.FormulaParseException;
import org.fol.parser.FormulaParser;
import org.fol.transform.CNFDistribution;
import org.fol.transform.ImplicationElimination;
import org.fol.transform.NegationNormalForm;
import org.fol.transform.PrenexExtraction;
import org.fol.transform.RewritePass;
import org.fol.transform.RewriteResult;
import org.fol.transform.Skolemization;
import org.fol.transform.TraceEntry;
import org.fol.transform.VariableStandardization;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * PIPELINE DI CONVERSIONE - Da formula testuale a CNF con analisi di Horn
 *
 * PASSI IN ORDINE:
 * 1. Parsing della formula originale
 * 2. Eliminazione di implicazioni e bicondizionali
 * 3. Forma normale negativa (De Morgan, dualità dei quantificatori)
 * 4. Standardizzazione delle variabili legate
 * 5. Forma prenessa
 * 6. Skolemizzazione
 * 7. Distribuzione OR su AND
 * 8. Forma clausale (matrice senza quantificatori)
 * 9. Verifica delle clausole di Horn
 *
 * Ogni passo dipende dalle invarianti del precedente. Un errore di parsing
 * produce un solo passo di errore e nessun risultato parziale.
 */
public class CNFPipeline {

    private static final Logger LOGGER = Logger.getLogger(CNFPipeline.class.getName());

    static final String ORIGINAL_TITLE = "Fórmula original";
    static final String CLAUSAL_TITLE = "Forma Clausal (quantificadores removidos)";
    static final String HORN_TITLE = "Cláusula de Horn";
    static final String ERROR_TITLE = "Erro";

    private final FormulaParser parser;
    private final List<RewritePass> passes;
    private final HornClauseAnalyzer analyzer;

    public CNFPipeline() {
        this(new FormulaParser(), defaultPasses(), new HornClauseAnalyzer());
    }

    CNFPipeline(FormulaParser parser, List<RewritePass> passes, HornClauseAnalyzer analyzer) {
        this.parser = parser;
        this.passes = List.copyOf(passes);
        this.analyzer = analyzer;
    }

    /**
     * I sei passi di riscrittura nell'ordine richiesto dalle loro precondizioni.
     */
    public static List<RewritePass> defaultPasses() {
        return List.of(
                new ImplicationElimination(),
                new NegationNormalForm(),
                new VariableStandardization(),
                new PrenexExtraction(),
                new Skolemization(),
                new CNFDistribution());
    }

    /**
     * Esegue l'intera pipeline su una formula testuale.
     *
     * @param input formula in notazione LaTeX
     * @return derivazione completa, oppure un solo passo di errore se l'input non è valido
     */
    public Derivation run(String input) {
        Formula current;
        try {
            current = parser.parse(input);
        } catch (FormulaParseException e) {
            LOGGER.warning("Formula non valida: " + e.getMessage());
            return Derivation.failed(new DerivationStage(ERROR_TITLE, null, List.of(TraceEntry.text(e.getMessage()))));
        }

        List<DerivationStage> stages = new ArrayList<>();
        stages.add(new DerivationStage(ORIGINAL_TITLE, current, List.of()));

        for (RewritePass pass : passes) {
            RewriteResult result = pass.apply(current);
            current = result.formula();
            stages.add(new DerivationStage(pass.title(), current, result.trace()));
            LOGGER.finest("Dopo " + pass.getClass().getSimpleName() + ": " + current);
        }

        Formula matrix = analyzer.getMatrix(current);
        stages.add(new DerivationStage(CLAUSAL_TITLE, matrix,
                List.of(TraceEntry.text("Removemos os quantificadores para obter a matriz: $$" + matrix + "$$"))));

        HornAnalysis horn = analyzer.analyze(current);
        List<TraceEntry> hornTrace = new ArrayList<>();
        for (String line : horn.reportLines()) {
            hornTrace.add(TraceEntry.text(line));
        }
        stages.add(new DerivationStage(HORN_TITLE, matrix, hornTrace));

        LOGGER.info("Formula convertita in CNF: " + current);
        return Derivation.completed(stages, current, horn);
    }
}
