package org.logica.cnf;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Esito completo di una propagazione unitaria eseguita fino al termine.
 *
 * @param outcome stato terminale
 * @param steps passi nell'ordine di esecuzione
 * @param literals letterali propagati, senza ripetizioni, in ordine di propagazione
 * @param assignments assegnamenti derivati, variabile → valore
 * @param remainingClauses clausole residue (con la clausola vuota in caso di contraddizione)
 */
public record PropagationResult(PropagationOutcome outcome,
                                List<PropagationStep> steps,
                                List<String> literals,
                                Map<String, Boolean> assignments,
                                List<List<String>> remainingClauses) {

    public PropagationResult {
        steps = List.copyOf(steps);
        literals = List.copyOf(literals);
        assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
        remainingClauses = remainingClauses.stream().map(List::copyOf).toList();
    }

    /**
     * Vero se ogni variabile indicata ha ricevuto un valore durante la propagazione.
     */
    public boolean assignsAll(Iterable<String> variables) {
        for (String variable : variables) {
            if (!assignments.containsKey(variable)) {
                return false;
            }
        }
        return true;
    }
}
