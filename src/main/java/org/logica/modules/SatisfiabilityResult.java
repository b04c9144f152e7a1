package org.logica.modules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Esito della verifica di soddisfacibilità.
 *
 * @param formula formula in input
 * @param status classificazione
 * @param model primo assegnamento che soddisfa la formula, vuoto se insoddisfacibile
 * @param trueCount assegnamenti che rendono vera la formula
 * @param totalAssignments assegnamenti enumerati (2ⁿ)
 */
public record SatisfiabilityResult(String formula,
                                   Status status,
                                   Map<String, Boolean> model,
                                   long trueCount,
                                   long totalAssignments) implements CalculationResult {

    public enum Status {
        UNSATISFIABLE("insoddisfacibile"),
        VALID("valida"),
        SATISFIABLE("soddisfacibile");

        private final String description;

        Status(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    public SatisfiabilityResult {
        model = model == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(model));
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.SATISFIABILITY;
    }

    public Optional<Map<String, Boolean>> firstModel() {
        return status == Status.UNSATISFIABLE ? Optional.empty() : Optional.of(model);
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Formula: ").append(formula).append("\n");
        sb.append("Esito: ").append(status.description())
                .append(" (").append(trueCount).append("/").append(totalAssignments).append(" assegnamenti veri)");
        if (status != Status.UNSATISFIABLE) {
            sb.append("\nModello: ").append(model);
        }
        return sb.toString();
    }
}
