package org.fol.formula;

import java.util.Objects;

/**
 * Rappresentazione immutabile ad albero di una formula del primo ordine.
 *
 * Ogni nodo ha un tipo fra quelli di {@link Type}; le trasformazioni non modificano
 * mai un nodo esistente ma ne costruiscono di nuovi. Sottoalberi condivisi fra rami
 * diversi (ad esempio dopo una distribuzione) sono quindi sicuri.
 *
 * FORMATO TESTUALE (toString):
 * • Atomi: testo opaco, es. P(x,f(y))
 * • Negazioni: \neg A
 * • Binari: (A \land B), (A \lor B), (A \rightarrow B), (A \leftrightarrow B)
 * • Quantificatori: \forall x A, \exists x A
 *
 * Il testo prodotto è rileggibile dal parser e restituisce un albero uguale.
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodi supportati.
     */
    public enum Type {
        ATOM,       // Predicato o proposizione: P, Q(x), R(f(x),y)
        NOT,        // Negazione: \neg A
        AND,        // Congiunzione: A \land B
        OR,         // Disgiunzione: A \lor B
        IMPLIES,    // Implicazione: A \rightarrow B
        IFF,        // Bicondizionale: A \leftrightarrow B
        FORALL,     // Quantificatore universale: \forall x A
        EXISTS      // Quantificatore esistenziale: \exists x A
    }

    private final Type type;

    /** Testo dell'atomo (ATOM) oppure variabile legata (FORALL, EXISTS) */
    private final String name;

    /** Operando di NOT, corpo dei quantificatori, operando sinistro dei binari */
    private final Formula left;

    /** Operando destro (solo nodi binari) */
    private final Formula right;

    private Formula(Type type, String name, Formula left, Formula right) {
        this.type = type;
        this.name = name;
        this.left = left;
        this.right = right;
    }

    //endregion

    //region COSTRUTTORI STATICI

    /**
     * Costruisce una foglia atomica.
     *
     * @param text testo opaco dell'atomo (non null, non vuoto)
     * @throws IllegalArgumentException se text null o vuoto
     */
    public static Formula atom(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("Testo dell'atomo non può essere null o vuoto");
        }
        return new Formula(Type.ATOM, text.trim(), null, null);
    }

    /**
     * Costruisce la negazione di una sottoformula.
     *
     * @throws IllegalArgumentException se operand null
     */
    public static Formula not(Formula operand) {
        requireOperand(operand, "negazione");
        return new Formula(Type.NOT, null, operand, null);
    }

    public static Formula and(Formula left, Formula right) {
        return binary(Type.AND, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return binary(Type.OR, left, right);
    }

    public static Formula implies(Formula left, Formula right) {
        return binary(Type.IMPLIES, left, right);
    }

    public static Formula iff(Formula left, Formula right) {
        return binary(Type.IFF, left, right);
    }

    public static Formula forall(String variable, Formula body) {
        return quantified(Type.FORALL, variable, body);
    }

    public static Formula exists(String variable, Formula body) {
        return quantified(Type.EXISTS, variable, body);
    }

    /**
     * Costruisce un nodo binario del tipo indicato.
     *
     * @param type AND, OR, IMPLIES o IFF
     * @throws IllegalArgumentException se tipo non binario o operandi null
     */
    public static Formula binary(Type type, Formula left, Formula right) {
        if (type == null || !isBinary(type)) {
            throw new IllegalArgumentException("Tipo non binario: " + type);
        }
        requireOperand(left, type.name());
        requireOperand(right, type.name());
        return new Formula(type, null, left, right);
    }

    /**
     * Costruisce un nodo quantificato del tipo indicato.
     *
     * @param type FORALL o EXISTS
     * @param variable nome della variabile legata (non vuoto)
     * @param body corpo del quantificatore
     * @throws IllegalArgumentException se parametri non validi
     */
    public static Formula quantified(Type type, String variable, Formula body) {
        if (type != Type.FORALL && type != Type.EXISTS) {
            throw new IllegalArgumentException("Tipo deve essere FORALL o EXISTS: " + type);
        }
        if (variable == null || variable.trim().isEmpty()) {
            throw new IllegalArgumentException("Variabile quantificata non può essere null o vuota");
        }
        requireOperand(body, type.name());
        return new Formula(type, variable.trim(), body, null);
    }

    private static void requireOperand(Formula operand, String operatorName) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando null per operatore " + operatorName);
        }
    }

    //endregion

    //region ACCESSO AI CAMPI

    public Type type() {
        return type;
    }

    /**
     * @return testo dell'atomo
     * @throws IllegalStateException se il nodo non è un atomo
     */
    public String text() {
        if (type != Type.ATOM) {
            throw new IllegalStateException("Nodo " + type + " non ha testo atomico");
        }
        return name;
    }

    /**
     * @return variabile legata dal quantificatore
     * @throws IllegalStateException se il nodo non è un quantificatore
     */
    public String variable() {
        if (!isQuantifier()) {
            throw new IllegalStateException("Nodo " + type + " non lega variabili");
        }
        return name;
    }

    /**
     * @return operando della negazione
     */
    public Formula operand() {
        if (type != Type.NOT) {
            throw new IllegalStateException("Nodo " + type + " non è una negazione");
        }
        return left;
    }

    /**
     * @return corpo del quantificatore
     */
    public Formula body() {
        if (!isQuantifier()) {
            throw new IllegalStateException("Nodo " + type + " non ha corpo quantificato");
        }
        return left;
    }

    public Formula left() {
        if (!isBinary(type)) {
            throw new IllegalStateException("Nodo " + type + " non è binario");
        }
        return left;
    }

    public Formula right() {
        if (!isBinary(type)) {
            throw new IllegalStateException("Nodo " + type + " non è binario");
        }
        return right;
    }

    public boolean isQuantifier() {
        return type == Type.FORALL || type == Type.EXISTS;
    }

    public boolean isBinary() {
        return isBinary(type);
    }

    private static boolean isBinary(Type type) {
        return switch (type) {
            case AND, OR, IMPLIES, IFF -> true;
            case ATOM, NOT, FORALL, EXISTS -> false;
        };
    }

    //endregion

    //region UTILITÀ STRUTTURALI

    /**
     * Sostituisce le occorrenze libere di una variabile con un termine.
     *
     * La sostituzione è testuale e per identificatori interi dentro gli atomi
     * (vedi {@link TermSubstitution}); non scende sotto un quantificatore che
     * rilega la stessa variabile.
     *
     * @param variable variabile da sostituire
     * @param term testo del termine sostitutivo
     * @return nuova formula con la sostituzione applicata
     */
    public Formula substitute(String variable, String term) {
        return switch (type) {
            case ATOM -> {
                String replaced = TermSubstitution.replace(name, variable, term);
                yield replaced.equals(name) ? this : atom(replaced);
            }
            case NOT -> not(left.substitute(variable, term));
            case AND, OR, IMPLIES, IFF -> binary(type, left.substitute(variable, term), right.substitute(variable, term));
            case FORALL, EXISTS -> name.equals(variable)
                    ? this
                    : quantified(type, name, left.substitute(variable, term));
        };
    }

    /**
     * Conta i nodi dell'albero.
     */
    public int size() {
        return switch (type) {
            case ATOM -> 1;
            case NOT, FORALL, EXISTS -> 1 + left.size();
            case AND, OR, IMPLIES, IFF -> 1 + left.size() + right.size();
        };
    }

    /**
     * Calcola la profondità massima dell'albero.
     */
    public int depth() {
        return switch (type) {
            case ATOM -> 0;
            case NOT, FORALL, EXISTS -> 1 + left.depth();
            case AND, OR, IMPLIES, IFF -> 1 + Math.max(left.depth(), right.depth());
        };
    }

    //endregion

    //region UGUAGLIANZA E HASH

    /**
     * Uguaglianza strutturale: stesso tipo, stesso testo o variabile, figli uguali
     * nello stesso ordine.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Formula other = (Formula) obj;
        return type == other.type
                && Objects.equals(name, other.name)
                && Objects.equals(left, other.left)
                && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, left, right);
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    @Override
    public String toString() {
        return switch (type) {
            case ATOM -> name;
            case NOT -> "\\neg " + left;
            case AND -> renderBinary("\\land");
            case OR -> renderBinary("\\lor");
            case IMPLIES -> renderBinary("\\rightarrow");
            case IFF -> renderBinary("\\leftrightarrow");
            case FORALL -> "\\forall " + name + " " + left;
            case EXISTS -> "\\exists " + name + " " + left;
        };
    }

    private String renderBinary(String operator) {
        // Il corpo di un quantificatore si estende il più possibile a destra:
        // a sinistra di un operatore va racchiuso fra parentesi
        String leftText = left.isOpenEnded() ? "(" + left + ")" : left.toString();
        return "(" + leftText + " " + operator + " " + right + ")";
    }

    /**
     * Vero se la resa testuale termina con il corpo di un quantificatore.
     */
    private boolean isOpenEnded() {
        return switch (type) {
            case FORALL, EXISTS -> true;
            case NOT -> left.isOpenEnded();
            case ATOM, AND, OR, IMPLIES, IFF -> false;
        };
    }

    //endregion
}
