package org.fol.pipeline;

import org.fol.clause.HornAnalysis;
import org.fol.formula.Formula;

import java.util.List;

/**
 * Derivazione completa prodotta da {@link CNFPipeline}.
 *
 * In caso di successo contiene i passi in ordine, dalla formula originale
 * all'analisi di Horn; in caso di errore di parsing un unico passo "Erro".
 */
public final class Derivation {

    private final List<DerivationStage> stages;
    private final Formula cnf;
    private final HornAnalysis hornAnalysis;

    private Derivation(List<DerivationStage> stages, Formula cnf, HornAnalysis hornAnalysis) {
        this.stages = List.copyOf(stages);
        this.cnf = cnf;
        this.hornAnalysis = hornAnalysis;
    }

    static Derivation completed(List<DerivationStage> stages, Formula cnf, HornAnalysis hornAnalysis) {
        return new Derivation(stages, cnf, hornAnalysis);
    }

    static Derivation failed(DerivationStage errorStage) {
        return new Derivation(List.of(errorStage), null, null);
    }

    public List<DerivationStage> stages() {
        return stages;
    }

    public boolean isFailed() {
        return cnf == null;
    }

    /**
     * @return formula in CNF (con eventuali universali in testa), null se fallita
     */
    public Formula finalFormula() {
        return cnf;
    }

    /**
     * @return analisi di Horn, null se fallita
     */
    public HornAnalysis hornAnalysis() {
        return hornAnalysis;
    }

    /**
     * @return messaggio d'errore del parsing, null se la derivazione è riuscita
     */
    public String errorMessage() {
        return isFailed() ? stages.get(0).trace().get(0).message() : null;
    }
}
