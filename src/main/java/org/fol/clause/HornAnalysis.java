package org.fol.clause;

import java.util.ArrayList;
import java.util.List;

/**
 * Risultato dell'analisi di Horn su tutte le clausole di una formula in CNF.
 */
public record HornAnalysis(List<ClauseClassification> clauses, boolean allHorn) {

    public HornAnalysis {
        clauses = List.copyOf(clauses);
    }

    /**
     * Una riga per clausola seguita dal verdetto complessivo.
     */
    public List<String> reportLines() {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < clauses.size(); i++) {
            ClauseClassification c = clauses.get(i);
            lines.add("Cláusula " + (i + 1) + ": $$" + c.clause() + "$$ → Literais positivos: "
                    + c.positiveLiterals() + " → Horn? " + (c.horn() ? "Sim" : "Não"));
        }
        lines.add("Resultado final: " + (allHorn
                ? "Sim, todas as cláusulas são Horn"
                : "Não, nem todas as cláusulas são Horn"));
        return lines;
    }
}
