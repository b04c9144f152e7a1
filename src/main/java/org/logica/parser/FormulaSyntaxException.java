package org.logica.parser;

/**
 * Errore sintattico fatale nell'analisi di una formula.
 *
 * Non è previsto alcun recupero: la prima anomalia interrompe il parsing
 * e viene propagata invariata al chiamante.
 */
public class FormulaSyntaxException extends IllegalArgumentException {

    /**
     * Categorie di errore riconosciute.
     */
    public enum Kind {
        INVALID_CHARACTER,
        MISSING_CLOSING_PARENTHESIS,
        UNEXPECTED_TOKEN,
        TRAILING_TOKENS,
        UNEXPECTED_END
    }

    private final Kind kind;
    private final String fragment;
    private final int offset;

    public FormulaSyntaxException(Kind kind, String fragment, int offset) {
        super(describe(kind, fragment, offset));
        this.kind = kind;
        this.fragment = fragment;
        this.offset = offset;
    }

    private static String describe(Kind kind, String fragment, int offset) {
        return switch (kind) {
            case INVALID_CHARACTER -> "Carattere non valido: " + fragment + " (posizione " + offset + ")";
            case MISSING_CLOSING_PARENTHESIS -> "Parentesi di chiusura mancante (posizione " + offset + ")";
            case UNEXPECTED_TOKEN -> "Token inatteso: " + fragment + " (posizione " + offset + ")";
            case TRAILING_TOKENS -> "Token inattesi dopo la fine della formula: " + fragment
                    + " (posizione " + offset + ")";
            case UNEXPECTED_END -> "Fine inattesa della formula";
        };
    }

    public Kind getKind() {
        return kind;
    }

    /** Frammento di input che ha causato l'errore (vuoto a fine input) */
    public String getFragment() {
        return fragment;
    }

    /** Indice del carattere nell'input, lunghezza dell'input a fine formula */
    public int getOffset() {
        return offset;
    }
}
