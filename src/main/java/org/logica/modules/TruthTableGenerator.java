package org.logica.modules;

import org.logica.core.Formula;
import org.logica.core.FormulaEvaluator;
import org.logica.parser.FormulaParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * TAVOLA DI VERITÀ - Valutazione della formula su tutti i 2ⁿ assegnamenti
 *
 * Le righe seguono l'ordine del contatore: la riga i assegna alla variabile j
 * (in ordine alfabetico) il bit j di i.
 * Oltre {@link #MAX_VARIABLES} variabili la tavola non viene generata.
 */
public class TruthTableGenerator implements Calculator {

    private static final Logger LOGGER = Logger.getLogger(TruthTableGenerator.class.getName());

    /** Numero massimo di variabili distinte: 2¹⁶ righe */
    public static final int MAX_VARIABLES = 16;

    @Override
    public Algorithm algorithm() {
        return Algorithm.TRUTH_TABLE;
    }

    @Override
    public TruthTableResult calculate(CalculationRequest request) {
        LOGGER.fine("Generazione tavola di verità per: " + request.formula());

        Formula formula = FormulaParser.parse(request.formula());
        List<String> variables = FormulaEvaluator.extractVariables(formula);
        if (variables.size() > MAX_VARIABLES) {
            throw new IllegalArgumentException("Troppe variabili per la tavola di verità: "
                    + variables.size() + ", massimo " + MAX_VARIABLES);
        }
        long total = FormulaEvaluator.assignmentCount(variables);

        List<TruthTableResult.Row> rows = new ArrayList<>();
        for (long i = 0; i < total; i++) {
            Map<String, Boolean> assignment = FormulaEvaluator.assignmentAt(variables, i);
            rows.add(new TruthTableResult.Row(assignment, FormulaEvaluator.evaluate(formula, assignment)));
        }

        TruthTableResult result = new TruthTableResult(request.formula(), variables, rows);
        LOGGER.fine("Tavola generata: " + rows.size() + " righe, " + result.trueCount() + " vere");
        return result;
    }
}
