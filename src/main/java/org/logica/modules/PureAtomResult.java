package org.logica.modules;

import org.logica.core.Formula;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Esito della semplificazione degli atomi puri.
 *
 * @param formula formula in input
 * @param polarities atomi puri nell'ordine di prima occorrenza, con la loro polarità (true = positiva)
 * @param simplifiedFormula testo della formula semplificata
 * @param simplifiedTree albero della formula semplificata
 */
public record PureAtomResult(String formula,
                             Map<String, Boolean> polarities,
                             String simplifiedFormula,
                             Formula simplifiedTree) implements CalculationResult {

    public PureAtomResult {
        polarities = Collections.unmodifiableMap(new LinkedHashMap<>(polarities));
    }

    /** Nomi degli atomi puri nell'ordine di prima occorrenza */
    public List<String> pureAtoms() {
        return List.copyOf(polarities.keySet());
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.PURE_ATOM;
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Formula: ").append(formula).append("\n");
        sb.append("Atomi puri:");
        if (polarities.isEmpty()) {
            sb.append(" nessuno");
        }
        polarities.forEach((atom, positive) ->
                sb.append(" ").append(atom).append(positive ? " (positivo)" : " (negativo)"));
        sb.append("\nFormula semplificata: ").append(simplifiedFormula);
        return sb.toString();
    }
}
