package org.logica.core;

import org.logica.parser.FormulaParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormulaEvaluator")
class FormulaEvaluatorTest {

    @Test
    @DisplayName("Variabili senza ripetizioni in ordine alfabetico")
    void extractVariables() {
        assertEquals(List.of("a", "b", "c"), FormulaEvaluator.extractVariables(FormulaParser.parse("c∧(a∨¬c)→b∧a")));
        assertEquals(List.of(), FormulaEvaluator.extractVariables(FormulaParser.parse("⊤∨⊥")));
    }

    @Test
    @DisplayName("Il bit j del contatore assegna la variabile j")
    void assignmentEnumeration() {
        List<String> variables = List.of("a", "b", "c");
        assertEquals(8, FormulaEvaluator.assignmentCount(variables));
        assertEquals(Map.of("a", false, "b", false, "c", false), FormulaEvaluator.assignmentAt(variables, 0));
        assertEquals(Map.of("a", true, "b", false, "c", true), FormulaEvaluator.assignmentAt(variables, 5));
        assertEquals(List.of("a", "b", "c"), List.copyOf(FormulaEvaluator.assignmentAt(variables, 6).keySet()));
    }

    @Test
    @DisplayName("Valutazione dei connettivi e delle costanti")
    void evaluation() {
        Map<String, Boolean> assignment = Map.of("a", true, "b", false);
        assertFalse(FormulaEvaluator.evaluate(FormulaParser.parse("a→b"), assignment));
        assertTrue(FormulaEvaluator.evaluate(FormulaParser.parse("b→a"), assignment));
        assertFalse(FormulaEvaluator.evaluate(FormulaParser.parse("a↔b"), assignment));
        assertTrue(FormulaEvaluator.evaluate(FormulaParser.parse("¬b∧(a∨⊥)∧⊤"), assignment));
    }

    @Test
    @DisplayName("Variabile non assegnata nella valutazione totale")
    void unassignedVariable() {
        assertThrows(IllegalArgumentException.class,
                () -> FormulaEvaluator.evaluate(FormulaParser.parse("a∧b"), Map.of("a", true)));
    }

    @Test
    @DisplayName("Sostituzione parziale lascia simboliche le variabili non assegnate")
    void partialSubstitution() {
        Formula formula = FormulaParser.parse("a∧(b∨¬a)");
        Formula substituted = FormulaEvaluator.substitute(formula, Map.of("a", false));
        assertEquals("(⊥∧(b∨¬⊥))", substituted.toString());
        assertEquals("(a∧(b∨¬a))", formula.toString());
    }
}
