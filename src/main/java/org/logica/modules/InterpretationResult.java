package org.logica.modules;

import java.util.Map;

/**
 * Esito della verifica di un enunciato sotto un'interpretazione parziale.
 *
 * @param formula formula in input
 * @param interpretation asserzione in input
 * @param statement enunciato in input
 * @param assignment assegnamento parziale derivato dall'asserzione
 * @param simplifiedFormula formula istanziata e semplificata
 * @param instantiatedStatement espressione dell'enunciato con il segnaposto sostituito
 * @param finalFormula espressione finale semplificata
 * @param expected valore atteso: true per ⊨, false per ⊭
 * @param determined vero se l'espressione finale è una costante
 * @param valid vero se l'espressione finale coincide con il valore atteso
 */
public record InterpretationResult(String formula,
                                   String interpretation,
                                   String statement,
                                   Map<String, Boolean> assignment,
                                   String simplifiedFormula,
                                   String instantiatedStatement,
                                   String finalFormula,
                                   boolean expected,
                                   boolean determined,
                                   boolean valid) implements CalculationResult {

    public InterpretationResult {
        assignment = Map.copyOf(assignment);
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.INTERPRETATION;
    }

    @Override
    public String toDisplayString() {
        return "Formula: " + formula + "\n"
                + "Interpretazione: " + interpretation + " " + assignment + "\n"
                + "Formula semplificata: " + simplifiedFormula + "\n"
                + "Enunciato: " + statement + " → " + instantiatedStatement + "\n"
                + "Valore finale: " + finalFormula + (determined ? "" : " (non determinato)") + "\n"
                + "Enunciato " + (valid ? "valido" : "non valido");
    }
}
