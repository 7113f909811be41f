package org.fol.formula;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sostituzione testuale di variabili dentro il testo opaco degli atomi.
 *
 * Gli argomenti di un atomo non sono termini strutturati: una variabile viene
 * riconosciuta solo come identificatore intero ([A-Za-z0-9_]+), per cui rinominare
 * x non tocca x1 né max.
 */
public final class TermSubstitution {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_]+");

    private TermSubstitution() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Sostituisce ogni occorrenza intera di una variabile con un termine.
     *
     * @param text testo dell'atomo
     * @param variable identificatore da sostituire
     * @param term testo sostitutivo (anche composto, es. f1(x,y))
     * @return testo con la sostituzione applicata
     */
    public static String replace(String text, String variable, String term) {
        return replaceAll(text, Map.of(variable, term));
    }

    /**
     * Applica simultaneamente una mappa di ridenominazioni: ogni identificatore
     * viene letto una sola volta, quindi un nome appena introdotto non viene
     * ridenominato una seconda volta.
     *
     * @param text testo dell'atomo
     * @param mapping identificatore originale -> sostituto
     * @return testo con tutte le sostituzioni applicate
     */
    public static String replaceAll(String text, Map<String, String> mapping) {
        if (mapping.isEmpty()) {
            return text;
        }

        Matcher matcher = IDENTIFIER.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String replacement = mapping.getOrDefault(matcher.group(), matcher.group());
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Verifica se un identificatore compare come token intero nel testo.
     */
    public static boolean mentions(String text, String identifier) {
        Matcher matcher = IDENTIFIER.matcher(text);
        while (matcher.find()) {
            if (matcher.group().equals(identifier)) {
                return true;
            }
        }
        return false;
    }
}
