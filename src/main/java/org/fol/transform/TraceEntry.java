package org.fol.transform;

/**
 * Messaggio di derivazione prodotto da una trasformazione.
 *
 * Può essere testo esplicativo semplice oppure un'equivalenza fra la resa della
 * formula prima e dopo la riscrittura. Il contenuto serve solo a chi visualizza
 * la derivazione; nessuna trasformazione successiva lo legge.
 *
 * @param kind tipo del messaggio
 * @param message testo esplicativo
 * @param before formula prima della riscrittura (solo EQUIVALENCE)
 * @param after formula dopo la riscrittura (solo EQUIVALENCE)
 */
public record TraceEntry(Kind kind, String message, String before, String after) {

    public enum Kind {
        TEXT,           // Solo testo
        EQUIVALENCE     // Testo con coppia prima/dopo
    }

    public TraceEntry {
        if (kind == null || message == null) {
            throw new IllegalArgumentException("Tipo e messaggio non possono essere null");
        }
        if (kind == Kind.EQUIVALENCE && (before == null || after == null)) {
            throw new IllegalArgumentException("Equivalenza richiede formula prima e dopo");
        }
    }

    public static TraceEntry text(String message) {
        return new TraceEntry(Kind.TEXT, message, null, null);
    }

    public static TraceEntry equivalence(String message, Object before, Object after) {
        return new TraceEntry(Kind.EQUIVALENCE, message, before.toString(), after.toString());
    }

    /**
     * Resa nel formato MathJax della derivazione: le formule fra $$...$$.
     */
    @Override
    public String toString() {
        return switch (kind) {
            case TEXT -> message;
            case EQUIVALENCE -> message + ": $$" + before + " \\equiv " + after + "$$";
        };
    }
}
