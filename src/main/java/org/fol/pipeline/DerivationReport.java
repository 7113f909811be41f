package org.fol.pipeline;

import org.fol.transform.TraceEntry;

/**
 * Resa testuale di una {@link Derivation} per la linea di comando e i file di output.
 */
public final class DerivationReport {

    private DerivationReport() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static String render(Derivation derivation) {
        StringBuilder report = new StringBuilder();
        int index = 1;

        for (DerivationStage stage : derivation.stages()) {
            report.append(index++).append(". ").append(stage.title()).append('\n');
            for (TraceEntry entry : stage.trace()) {
                report.append("   - ").append(entry).append('\n');
            }
            if (stage.formula() != null) {
                report.append("   = ").append(stage.formula()).append('\n');
            }
            report.append('\n');
        }

        return report.toString();
    }
}
