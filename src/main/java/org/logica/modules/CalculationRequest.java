package org.logica.modules;

/**
 * Parametri di una chiamata a {@link Calculator#calculate}.
 *
 * Ogni analisi legge soltanto i campi che le servono; quelli non pertinenti restano null.
 *
 * @param formula formula da analizzare (sempre richiesta)
 * @param position posizione puntata della sottoformula, null o vuota per la radice
 * @param interpretation asserzione I⊨l / I⊭l
 * @param statement enunciato I⊨expr / I⊭expr, con segnaposto A per la formula semplificata
 * @param type variante del controllo di determinismo: "cnf" o "general"
 */
public record CalculationRequest(String formula,
                                 String position,
                                 String interpretation,
                                 String statement,
                                 String type) {

    public CalculationRequest {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }
    }

    public static CalculationRequest of(String formula) {
        return new CalculationRequest(formula, null, null, null, null);
    }

    public static CalculationRequest atPosition(String formula, String position) {
        return new CalculationRequest(formula, position, null, null, null);
    }

    public static CalculationRequest withInterpretation(String formula, String interpretation, String statement) {
        return new CalculationRequest(formula, null, interpretation, statement, null);
    }

    public static CalculationRequest ofType(String formula, String type) {
        return new CalculationRequest(formula, null, null, null, type);
    }

    /** Posizione normalizzata: stringa vuota per la radice */
    public String positionOrRoot() {
        return position == null ? "" : position.trim();
    }
}
