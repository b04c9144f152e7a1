package org.logica.modules;

import org.logica.cnf.FormulaFormatException;
import org.logica.modules.InterpretationTester.Assertion;
import org.logica.modules.InterpretationTester.Statement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InterpretationTester")
class InterpretationTesterTest {

    private final InterpretationTester tester = new InterpretationTester();

    private InterpretationResult run(String formula, String interpretation, String statement) {
        return tester.calculate(CalculationRequest.withInterpretation(formula, interpretation, statement));
    }

    @Nested
    @DisplayName("Forma di asserzioni ed enunciati")
    class Parsing {

        @Test
        @DisplayName("⊨ assegna il valore del letterale, ⊭ il suo opposto")
        void assertionValues() {
            assertEquals(new Assertion("a", true), InterpretationTester.parseAssertion("I⊨a"));
            assertEquals(new Assertion("a", false), InterpretationTester.parseAssertion("I⊨¬a"));
            assertEquals(new Assertion("b", false), InterpretationTester.parseAssertion("I⊭b"));
            assertEquals(new Assertion("c", true), InterpretationTester.parseAssertion(" I ⊭ ¬c "));
        }

        @Test
        @DisplayName("Enunciato con valore atteso ed espressione")
        void statement() {
            assertEquals(new Statement(true, "A∨b"), InterpretationTester.parseStatement("I⊨ A∨b"));
            assertEquals(new Statement(false, "A"), InterpretationTester.parseStatement("I⊭A"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"I⊨ab", "J⊨a", "I=a", "I⊨", "⊨a", "I⊨¬¬a", "I⊨A"})
        @DisplayName("Asserzioni malformate")
        void malformedAssertion(String interpretation) {
            assertThrows(FormulaFormatException.class, () -> InterpretationTester.parseAssertion(interpretation));
        }

        @ParameterizedTest
        @ValueSource(strings = {"I⊨", "I⊨   ", "A", "I A"})
        @DisplayName("Enunciati malformati")
        void malformedStatement(String statement) {
            assertThrows(FormulaFormatException.class, () -> InterpretationTester.parseStatement(statement));
        }

        @Test
        @DisplayName("Forma verificata prima di analizzare la formula")
        void formatCheckedFirst() {
            assertThrows(FormulaFormatException.class, () -> run("a∧", "I⊨", "I⊨A"));
            assertThrows(FormulaFormatException.class, () -> run("a", null, "I⊨A"));
        }
    }

    @Nested
    @DisplayName("Valutazione")
    class Evaluation {

        @Test
        @DisplayName("Formula ridotta a costante e enunciato negativo valido")
        void falsifiedConjunction() {
            InterpretationResult result = run("a∧b", "I⊨¬a", "I⊭A");
            assertEquals(Map.of("a", false), result.assignment());
            assertEquals("⊥", result.simplifiedFormula());
            assertEquals("⊥", result.instantiatedStatement());
            assertTrue(result.determined());
            assertTrue(result.valid());
        }

        @Test
        @DisplayName("Stessa formula con enunciato positivo non valido")
        void wrongPolarity() {
            InterpretationResult result = run("a∧b", "I⊨¬a", "I⊨A");
            assertTrue(result.determined());
            assertFalse(result.valid());
        }

        @Test
        @DisplayName("Espressione finale non costante: enunciato non determinato")
        void undetermined() {
            InterpretationResult result = run("a∧b", "I⊨a", "I⊨A");
            assertEquals("b", result.simplifiedFormula());
            assertEquals("b", result.finalFormula());
            assertFalse(result.determined());
            assertFalse(result.valid());
        }

        @Test
        @DisplayName("Segnaposto sostituito dal testo completo della formula semplificata")
        void compoundPlaceholder() {
            InterpretationResult result = run("b∨c", "I⊨a", "I⊨¬A");
            assertEquals("(b∨c)", result.simplifiedFormula());
            assertEquals("¬(b∨c)", result.instantiatedStatement());
            assertEquals("(¬b∧¬c)", result.finalFormula());
            assertFalse(result.determined());
        }

        @Test
        @DisplayName("Terzo escluso su formula semplificata composta")
        void compoundExcludedMiddle() {
            InterpretationResult result = run("b∧c", "I⊨a", "I⊨A∨¬A");
            assertEquals("(b∧c)", result.simplifiedFormula());
            assertEquals("(b∧c)∨¬(b∧c)", result.instantiatedStatement());
            assertEquals("⊤", result.finalFormula());
            assertTrue(result.determined());
            assertTrue(result.valid());
        }

        @Test
        @DisplayName("L'asserzione si applica anche alle variabili dell'enunciato")
        void statementVariablesAssigned() {
            InterpretationResult result = run("b", "I⊨a", "I⊨A∨a");
            assertEquals("b∨a", result.instantiatedStatement());
            assertEquals("⊤", result.finalFormula());
            assertTrue(result.valid());
        }

        @Test
        @DisplayName("Tautologia dell'enunciato con variabili libere")
        void excludedMiddle() {
            InterpretationResult result = run("a∨b", "I⊭a", "I⊨A∨¬b");
            assertEquals("b", result.simplifiedFormula());
            assertEquals("⊤", result.finalFormula());
            assertTrue(result.valid());
            assertTrue(result.toDisplayString().endsWith("Enunciato valido"));
        }
    }
}
