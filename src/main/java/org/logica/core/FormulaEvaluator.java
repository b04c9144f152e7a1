package org.logica.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * VALUTATORE - Estrazione variabili, enumerazione assegnamenti e valutazione ricorsiva
 *
 * Condiviso da tavola di verità e verifica di soddisfacibilità.
 *
 * ENUMERAZIONE:
 * - Variabili ordinate alfabeticamente
 * - L'assegnamento i-esimo (0 ≤ i < 2ⁿ) pone la variabile j al bit j di i
 * - L'assegnamento 0 rende quindi false tutte le variabili
 */
public final class FormulaEvaluator {

    private static final Logger LOGGER = Logger.getLogger(FormulaEvaluator.class.getName());

    private FormulaEvaluator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Nomi delle variabili, senza ripetizioni e in ordine alfabetico.
     */
    public static List<String> extractVariables(Formula formula) {
        TreeSet<String> variables = new TreeSet<>();
        collectVariables(formula, variables);
        return List.copyOf(variables);
    }

    private static void collectVariables(Formula node, TreeSet<String> variables) {
        if (node == null) return;
        if (node.isVariable()) {
            variables.add(node.getValue());
        }
        for (Formula child : node.children()) {
            collectVariables(child, variables);
        }
    }

    /**
     * Numero di assegnamenti totali 2ⁿ.
     */
    public static long assignmentCount(List<String> variables) {
        return 1L << variables.size();
    }

    /**
     * Assegnamento corrispondente al contatore indicato.
     *
     * @param variables variabili in ordine alfabetico
     * @param index contatore in [0, 2ⁿ)
     * @return mappa variabile → valore, nell'ordine delle variabili
     */
    public static Map<String, Boolean> assignmentAt(List<String> variables, long index) {
        Map<String, Boolean> assignment = new LinkedHashMap<>();
        for (int j = 0; j < variables.size(); j++) {
            assignment.put(variables.get(j), ((index >> j) & 1L) == 1L);
        }
        return Collections.unmodifiableMap(assignment);
    }

    /**
     * Valuta la formula sotto un assegnamento totale.
     *
     * @throws IllegalArgumentException se una variabile non è assegnata
     */
    public static boolean evaluate(Formula node, Map<String, Boolean> assignment) {
        return switch (node.getType()) {
            case VARIABLE -> {
                Boolean value = assignment.get(node.getValue());
                if (value == null) {
                    throw new IllegalArgumentException("Variabile non assegnata: " + node.getValue());
                }
                yield value;
            }
            case CONSTANT -> node.getConstantValue();
            case UNARY -> !evaluate(node.getOperand(), assignment);
            case BINARY -> node.getOperator().apply(
                    evaluate(node.getLeft(), assignment),
                    evaluate(node.getRight(), assignment));
        };
    }

    /**
     * Sostituisce le variabili assegnate con costanti, lasciando simboliche le altre.
     *
     * @param node formula di partenza
     * @param partialAssignment assegnamento parziale
     * @return nuovo albero con le sostituzioni applicate
     */
    public static Formula substitute(Formula node, Map<String, Boolean> partialAssignment) {
        return switch (node.getType()) {
            case VARIABLE -> {
                Boolean value = partialAssignment.get(node.getValue());
                if (value != null) {
                    LOGGER.finest("Sostituzione " + node.getValue() + " → " + (value ? Formula.TOP : Formula.BOTTOM));
                    yield Formula.constant(value);
                }
                yield Formula.variable(node.getValue());
            }
            case CONSTANT -> Formula.constant(node.getConstantValue());
            case UNARY -> Formula.not(substitute(node.getOperand(), partialAssignment));
            case BINARY -> Formula.binary(node.getOperator(),
                    substitute(node.getLeft(), partialAssignment),
                    substitute(node.getRight(), partialAssignment));
        };
    }
}
