package org.logica.cnf;

import java.util.Comparator;
import java.util.regex.Pattern;

/**
 * Operazioni sui letterali in forma testuale.
 *
 * Due notazioni convivono:
 * - input: variabile con eventuale prefisso ¬ (es. "¬a")
 * - output: variabile con eventuale prefisso - (es. "-a", "n3", "-n0")
 */
public final class Literals {

    public static final String NEGATION = "¬";
    public static final String OUTPUT_NEGATION = "-";

    private static final String TOP = "⊤";
    private static final String BOTTOM = "⊥";

    private static final Pattern AUXILIARY_NAME = Pattern.compile("n\\d+");

    /**
     * Ordine per variabile base, usato nella formattazione della propagazione unitaria.
     * Letterali sulla stessa variabile restano nell'ordine di inserimento.
     */
    public static final Comparator<String> BY_VARIABLE = Comparator.comparing(Literals::variableOf);

    /**
     * Ordine canonico sui letterali in notazione di output:
     * - costanti ⊤ e ⊥ prima di ogni variabile
     * - variabili ordinarie in ordine alfabetico
     * - nomi ausiliari n0, n1, ... dopo le variabili ordinarie, in ordine numerico
     * - a parità di variabile, il letterale positivo precede quello negato
     */
    public static final Comparator<String> CANONICAL = Literals::compareCanonical;

    private Literals() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static boolean isNegated(String literal) {
        return literal.startsWith(NEGATION) || literal.startsWith(OUTPUT_NEGATION);
    }

    /**
     * Variabile base del letterale, in entrambe le notazioni.
     */
    public static String variableOf(String literal) {
        if (literal.startsWith(NEGATION)) return literal.substring(NEGATION.length());
        if (literal.startsWith(OUTPUT_NEGATION)) return literal.substring(OUTPUT_NEGATION.length());
        return literal;
    }

    /**
     * Letterale complementare in notazione di input.
     */
    public static String complement(String literal) {
        return literal.startsWith(NEGATION) ? literal.substring(NEGATION.length()) : NEGATION + literal;
    }

    /**
     * Letterale complementare in notazione di output.
     */
    public static String complementOutput(String literal) {
        return literal.startsWith(OUTPUT_NEGATION)
                ? literal.substring(OUTPUT_NEGATION.length())
                : OUTPUT_NEGATION + literal;
    }

    /**
     * Conversione da notazione di input (¬a) a notazione di output (-a).
     */
    public static String toOutput(String literal) {
        return literal.startsWith(NEGATION)
                ? OUTPUT_NEGATION + literal.substring(NEGATION.length())
                : literal;
    }

    public static boolean isAuxiliary(String variable) {
        return AUXILIARY_NAME.matcher(variable).matches();
    }

    private static boolean isConstant(String variable) {
        return TOP.equals(variable) || BOTTOM.equals(variable);
    }

    private static int compareCanonical(String a, String b) {
        String varA = variableOf(a);
        String varB = variableOf(b);

        if (!varA.equals(varB)) {
            boolean constA = isConstant(varA);
            boolean constB = isConstant(varB);
            if (constA != constB) {
                return constA ? -1 : 1;
            }
            boolean auxA = isAuxiliary(varA);
            boolean auxB = isAuxiliary(varB);
            if (auxA != auxB) {
                return auxA ? 1 : -1;
            }
            if (auxA) {
                return Long.compare(Long.parseLong(varA.substring(1)), Long.parseLong(varB.substring(1)));
            }
            return varA.compareTo(varB);
        }

        return Boolean.compare(isNegated(a), isNegated(b));
    }
}
