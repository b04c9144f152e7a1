package org.logica.modules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tavola di verità completa.
 *
 * @param formula formula in input
 * @param variables variabili in ordine alfabetico
 * @param rows righe nell'ordine di enumerazione
 */
public record TruthTableResult(String formula, List<String> variables, List<Row> rows) implements CalculationResult {

    /**
     * Riga della tavola: assegnamento e valore della formula.
     */
    public record Row(Map<String, Boolean> assignment, boolean result) {
        public Row {
            assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
        }
    }

    public TruthTableResult {
        variables = List.copyOf(variables);
        rows = List.copyOf(rows);
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.TRUTH_TABLE;
    }

    public long trueCount() {
        return rows.stream().filter(Row::result).count();
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder();
        for (String variable : variables) {
            sb.append(variable).append(" | ");
        }
        sb.append(formula).append("\n");

        for (Row row : rows) {
            for (String variable : variables) {
                sb.append(row.assignment().get(variable) ? "1" : "0").append(" | ");
            }
            sb.append(row.result() ? "1" : "0").append("\n");
        }
        sb.append("Righe vere: ").append(trueCount()).append("/").append(rows.size());
        return sb.toString();
    }
}
