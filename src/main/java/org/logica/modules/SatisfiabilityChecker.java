package org.logica.modules;

import org.logica.core.Formula;
import org.logica.core.FormulaEvaluator;
import org.logica.parser.FormulaParser;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * SODDISFACIBILITÀ - Classificazione per enumerazione esaustiva degli assegnamenti
 *
 * CLASSIFICAZIONE:
 * • Nessun assegnamento vero → insoddisfacibile
 * • Tutti gli assegnamenti veri → valida
 * • Altrimenti → soddisfacibile, con il primo modello trovato nell'ordine di enumerazione
 */
public class SatisfiabilityChecker implements Calculator {

    private static final Logger LOGGER = Logger.getLogger(SatisfiabilityChecker.class.getName());

    @Override
    public Algorithm algorithm() {
        return Algorithm.SATISFIABILITY;
    }

    @Override
    public SatisfiabilityResult calculate(CalculationRequest request) {
        LOGGER.fine("Verifica soddisfacibilità per: " + request.formula());

        Formula formula = FormulaParser.parse(request.formula());
        List<String> variables = FormulaEvaluator.extractVariables(formula);
        long total = FormulaEvaluator.assignmentCount(variables);

        long trueCount = 0;
        Map<String, Boolean> model = null;

        for (long i = 0; i < total; i++) {
            Map<String, Boolean> assignment = FormulaEvaluator.assignmentAt(variables, i);
            if (FormulaEvaluator.evaluate(formula, assignment)) {
                trueCount++;
                if (model == null) {
                    model = assignment;                 // Primo modello nell'ordine di enumerazione
                }
            }
        }

        SatisfiabilityResult.Status status;
        if (trueCount == 0) {
            status = SatisfiabilityResult.Status.UNSATISFIABLE;
        } else if (trueCount == total) {
            status = SatisfiabilityResult.Status.VALID;
        } else {
            status = SatisfiabilityResult.Status.SATISFIABLE;
        }

        LOGGER.fine("Esito: " + status + " (" + trueCount + "/" + total + " assegnamenti veri)");
        return new SatisfiabilityResult(request.formula(), status, model, trueCount, total);
    }
}
