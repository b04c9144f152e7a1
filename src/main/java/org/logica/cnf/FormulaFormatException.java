package org.logica.cnf;

/**
 * Input testuale con forma non valida: asserzioni di interpretazione,
 * enunciati da verificare, clausole CNF.
 *
 * Sollevata prima di qualsiasi valutazione.
 */
public class FormulaFormatException extends IllegalArgumentException {

    private final String input;

    public FormulaFormatException(String message, String input) {
        super(message + ": \"" + input + "\"");
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
