package org.logica.modules;

import org.logica.cnf.PropagationResult;
import org.logica.modules.DeterminismChecker.Variant;
import org.logica.modules.DeterminismChecker.Verdict;

import java.util.List;
import java.util.Optional;

/**
 * Esito del controllo di determinismo.
 *
 * @param algorithm analisi che ha prodotto il risultato
 * @param formula formula in input
 * @param variant variante usata per testi ed enunciati
 * @param verdict classificazione
 * @param explanation spiegazione testuale del verdetto
 * @param statements enunciati tra cui scegliere
 * @param correctStatement numero (da 1) dell'enunciato corretto
 * @param propagation traccia della propagazione, null se non eseguita
 */
public record DeterminismResult(Algorithm algorithm,
                                String formula,
                                Variant variant,
                                Verdict verdict,
                                String explanation,
                                List<String> statements,
                                int correctStatement,
                                PropagationResult propagation) implements CalculationResult {

    public DeterminismResult {
        statements = List.copyOf(statements);
    }

    public boolean isDeterministic() {
        return verdict.isDeterministic();
    }

    public Optional<PropagationResult> propagationTrace() {
        return Optional.ofNullable(propagation);
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Formula: ").append(formula).append("\n");
        sb.append("Tipo: ").append(variant.key()).append("\n");
        sb.append("Verdetto: ").append(verdict).append(isDeterministic() ? " (deterministico)" : "").append("\n");
        sb.append("Spiegazione: ").append(explanation).append("\n");
        for (int i = 0; i < statements.size(); i++) {
            sb.append(i + 1 == correctStatement ? " * " : "   ")
                    .append(i + 1).append(". ").append(statements.get(i)).append("\n");
        }
        sb.append("Enunciato corretto: ").append(correctStatement);
        return sb.toString();
    }
}
