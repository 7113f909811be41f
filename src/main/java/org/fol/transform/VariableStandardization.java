package org.fol.transform;

import org.fol.formula.Formula;
import org.fol.formula.TermSubstitution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Standardizzazione delle variabili legate (α-ridenominazione).
 *
 * Dopo questo passo ogni quantificatore lega un nome diverso, condizione necessaria
 * per spostare i quantificatori in testa senza catture accidentali.
 *
 * La ricorsione porta con sé due informazioni:
 * - i nomi già usati, accumulati da sinistra a destra su tutto l'albero
 *   (il ramo destro vede i nomi introdotti nel ramo sinistro);
 * - la mappa nome originale -> nome corrente, valida solo nel sottoalbero del
 *   quantificatore che l'ha estesa.
 *
 * In caso di collisione il nuovo nome è l'originale seguito dal più piccolo intero
 * positivo che lo rende inutilizzato (x -> x1 -> x2 ...).
 */
public class VariableStandardization implements RewritePass {

    private static final Logger LOGGER = Logger.getLogger(VariableStandardization.class.getName());

    @Override
    public String title() {
        return "Padronização de Variáveis Ligadas (α-renomeação)";
    }

    @Override
    public RewriteResult apply(Formula formula) {
        LOGGER.fine("Standardizzazione variabili per: " + formula);

        List<TraceEntry> trace = new ArrayList<>();
        Standardized result = standardize(formula, Collections.emptySet(), Collections.emptyMap(), trace);

        LOGGER.fine("Variabili standardizzate: " + result.formula + " (nomi usati: " + result.used + ")");
        return new RewriteResult(result.formula, trace);
    }

    private Standardized standardize(Formula f, Set<String> used, Map<String, String> mapping,
                                     List<TraceEntry> trace) {
        return switch (f.type()) {
            case ATOM -> new Standardized(renameInAtom(f, mapping, trace), used);

            case NOT -> {
                Standardized inner = standardize(f.operand(), used, mapping, trace);
                yield new Standardized(Formula.not(inner.formula), inner.used);
            }

            case AND, OR, IMPLIES, IFF -> {
                // Entrambi i rami partono dalla mappa dell'antenato, ma i nomi usati proseguono
                Standardized left = standardize(f.left(), used, mapping, trace);
                Standardized right = standardize(f.right(), left.used, mapping, trace);
                yield new Standardized(Formula.binary(f.type(), left.formula, right.formula), right.used);
            }

            case FORALL, EXISTS -> {
                String original = f.variable();
                String fresh = freshName(original, used);
                if (!fresh.equals(original)) {
                    trace.add(TraceEntry.text("Renomeamos a variável ligada " + original + " para " + fresh));
                    LOGGER.finest("Ridenominazione " + original + " -> " + fresh);
                }

                Set<String> scopeUsed = new LinkedHashSet<>(used);
                scopeUsed.add(fresh);
                Map<String, String> scopeMapping = new LinkedHashMap<>(mapping);
                scopeMapping.put(original, fresh);

                Standardized body = standardize(f.body(), scopeUsed, scopeMapping, trace);
                yield new Standardized(Formula.quantified(f.type(), fresh, body.formula), body.used);
            }
        };
    }

    /**
     * Applica le ridenominazioni in vigore al testo di un atomo.
     */
    private Formula renameInAtom(Formula atom, Map<String, String> mapping, List<TraceEntry> trace) {
        Map<String, String> effective = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            if (!entry.getKey().equals(entry.getValue()) && TermSubstitution.mentions(atom.text(), entry.getKey())) {
                effective.put(entry.getKey(), entry.getValue());
            }
        }

        if (effective.isEmpty()) {
            return atom;
        }

        for (Map.Entry<String, String> entry : effective.entrySet()) {
            trace.add(TraceEntry.text("Substituímos " + entry.getKey() + " por " + entry.getValue()
                    + " em " + atom.text()));
        }
        return Formula.atom(TermSubstitution.replaceAll(atom.text(), effective));
    }

    /**
     * Restituisce il nome stesso se libero, altrimenti nome + il più piccolo suffisso libero.
     */
    static String freshName(String name, Set<String> used) {
        if (!used.contains(name)) {
            return name;
        }
        int suffix = 1;
        while (used.contains(name + suffix)) {
            suffix++;
        }
        return name + suffix;
    }

    /**
     * Sottoalbero standardizzato e nomi usati fino a quel punto.
     */
    private record Standardized(Formula formula, Set<String> used) {}
}
