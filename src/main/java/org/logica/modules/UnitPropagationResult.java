package org.logica.modules;

import org.logica.cnf.PropagationStep;

import java.util.List;

/**
 * Esito della propagazione unitaria autonoma.
 *
 * @param formula formula CNF in input
 * @param steps passi eseguiti, con istantanee delle clausole prima e dopo
 * @param finalClauses clausole residue, letterali separati da virgola
 * @param literals letterali propagati in ordine, senza ripetizioni
 * @param formattedResult formato canonico (l);(l);(l,l)
 */
public record UnitPropagationResult(String formula,
                                    List<PropagationStep> steps,
                                    List<String> finalClauses,
                                    List<String> literals,
                                    String formattedResult) implements CalculationResult {

    public UnitPropagationResult {
        steps = List.copyOf(steps);
        finalClauses = List.copyOf(finalClauses);
        literals = List.copyOf(literals);
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.UNIT_PROPAGATION;
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Formula: ").append(formula).append("\n");
        int index = 1;
        for (PropagationStep step : steps) {
            sb.append("Passo ").append(index++).append(": ").append(step.literal())
                    .append("  ").append(step.beforeClauses())
                    .append(" ⇒ ").append(step.afterClauses()).append("\n");
        }
        sb.append("Letterali propagati: ").append(literals).append("\n");
        sb.append("Risultato: ").append(formattedResult);
        return sb.toString();
    }
}
