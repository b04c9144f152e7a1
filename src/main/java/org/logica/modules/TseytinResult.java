package org.logica.modules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Esito della trasformazione di Tseytin.
 *
 * @param originalFormula formula in input
 * @param cnfFormula clausole rese con ∨ e ∧
 * @param auxVariables nome ausiliario → testo della sottoformula rappresentata, in ordine di assegnazione
 * @param clauses clausole nel formato (l,l,l)
 * @param formattedResult clausole separate da ';'
 * @param clauseLiterals clausole come liste di letterali in notazione di output
 */
public record TseytinResult(String originalFormula,
                            String cnfFormula,
                            Map<String, String> auxVariables,
                            List<String> clauses,
                            String formattedResult,
                            List<List<String>> clauseLiterals) implements CalculationResult {

    public TseytinResult {
        auxVariables = Collections.unmodifiableMap(new LinkedHashMap<>(auxVariables));
        clauses = List.copyOf(clauses);
        clauseLiterals = clauseLiterals.stream().map(List::copyOf).toList();
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.TSEYTIN;
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Formula: ").append(originalFormula).append("\n");
        auxVariables.forEach((name, represented) ->
                sb.append(name).append(" ≡ ").append(represented).append("\n"));
        sb.append("CNF: ").append(cnfFormula).append("\n");
        sb.append("Risultato: ").append(formattedResult);
        return sb.toString();
    }
}
