package org.logica.modules;

import org.logica.cnf.ClauseSet;
import org.logica.cnf.Literals;
import org.logica.cnf.PropagationResult;
import org.logica.cnf.UnitPropagationEngine;
import org.logica.cnf.UnitPropagationEngine.ContradictionPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * PROPAGAZIONE UNITARIA - Analisi autonoma su formula già in CNF
 *
 * Le clausole svuotate non sono considerate errori: vengono scartate e l'analisi
 * riporta le clausole rimaste.
 *
 * FORMATO DEL RISULTATO:
 * • Prima i letterali propagati, uno per clausola: (-a);(b)
 * • Poi le clausole residue, con letterali ordinati per variabile
 * • Negazione resa con '-', clausole separate da ';'
 */
public class UnitPropagationAnalyzer implements Calculator {

    private static final Logger LOGGER = Logger.getLogger(UnitPropagationAnalyzer.class.getName());

    private final UnitPropagationEngine engine = new UnitPropagationEngine(ContradictionPolicy.DISCARD);

    @Override
    public Algorithm algorithm() {
        return Algorithm.UNIT_PROPAGATION;
    }

    @Override
    public UnitPropagationResult calculate(CalculationRequest request) {
        LOGGER.fine("Propagazione unitaria su: " + request.formula());

        ClauseSet clauses = ClauseSet.parse(request.formula());
        PropagationResult propagation = engine.propagate(clauses);
        String formatted = formatResult(propagation.literals(), propagation.remainingClauses());

        LOGGER.fine("Letterali propagati: " + propagation.literals() + ", risultato: " + formatted);
        return new UnitPropagationResult(
                request.formula(),
                propagation.steps(),
                ClauseSet.join(propagation.remainingClauses()),
                propagation.literals(),
                formatted);
    }

    /**
     * Letterali propagati come clausole unitarie seguiti dalle clausole residue.
     */
    static String formatResult(List<String> literals, List<List<String>> remaining) {
        List<List<String>> output = new ArrayList<>();
        for (String literal : literals) {
            output.add(List.of(Literals.toOutput(literal)));
        }
        for (List<String> clause : remaining) {
            if (clause.isEmpty()) continue;
            output.add(clause.stream()
                    .sorted(Literals.BY_VARIABLE)
                    .map(Literals::toOutput)
                    .toList());
        }
        return ClauseSet.formatOutput(output);
    }
}
