package org.logica.modules;

import org.logica.cnf.PropagationOutcome;
import org.logica.modules.DeterminismChecker.Variant;
import org.logica.modules.DeterminismChecker.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DeterminismChecker")
class DeterminismCheckerTest {

    @Nested
    @DisplayName("Variante CNF")
    class CnfVariant {

        private final DeterminismChecker checker = new DeterminismChecker(Variant.CNF);

        @ParameterizedTest(name = "{0} ⇒ {1}")
        @CsvSource({
                "(a∨b)∧(c∨d), NO_UNIT_CLAUSES, 1",
                "(a)∧(¬a∨b), SATISFIABLE, 2",
                "(a)∧(b∨c), UNDETERMINED, 3",
                "a∧¬a, UNSATISFIABLE, 4",
                "(a)∧(¬a∨b)∧(¬b), UNSATISFIABLE, 4",
                "(a∨a)∧(¬a∨b), NO_UNIT_CLAUSES, 1",
                "(b)∧(a∨a)∧(¬a∨c), SATISFIABLE, 2"
        })
        @DisplayName("Verdetto ed enunciato corretto")
        void verdicts(String formula, Verdict verdict, int statement) {
            DeterminismResult result = checker.calculate(CalculationRequest.of(formula));
            assertEquals(verdict, result.verdict());
            assertEquals(statement, result.correctStatement());
            assertEquals(4, result.statements().size());
            assertEquals(Algorithm.CNF_DETERMINISM, result.algorithm());
        }

        @Test
        @DisplayName("Senza clausole unitarie la propagazione non viene eseguita")
        void noPropagationWithoutUnits() {
            DeterminismResult result = checker.calculate(CalculationRequest.of("(a∨b)∧(c∨d)"));
            assertTrue(result.propagationTrace().isEmpty());
            assertFalse(result.isDeterministic());
            assertEquals("Unit propagation cannot be used within the formula", result.explanation());
        }

        @Test
        @DisplayName("Contraddizione rilevata con traccia della propagazione")
        void contradiction() {
            DeterminismResult result = checker.calculate(CalculationRequest.of("a∧¬a"));
            assertTrue(result.isDeterministic());
            assertEquals(PropagationOutcome.CONTRADICTION, result.propagationTrace().orElseThrow().outcome());
            assertEquals("Unit propagation determines that the formula is unsatisfiable", result.explanation());
        }

        @Test
        @DisplayName("Il tipo della richiesta sostituisce la variante predefinita")
        void typeOverride() {
            DeterminismResult result = checker.calculate(CalculationRequest.ofType("a∧¬a", "general"));
            assertEquals(Variant.GENERAL, result.variant());
            assertEquals(1, result.correctStatement());
        }

        @Test
        @DisplayName("Tipo sconosciuto")
        void unknownType() {
            assertThrows(IllegalArgumentException.class,
                    () -> checker.calculate(CalculationRequest.ofType("(a)", "dnf")));
        }
    }

    @Nested
    @DisplayName("Variante insieme di formule")
    class GeneralVariant {

        private final DeterminismChecker checker = new DeterminismChecker(Variant.GENERAL);

        @ParameterizedTest(name = "{0} ⇒ {1}")
        @CsvSource({
                "(a)∧(¬a∨b), SATISFIABLE, 1",
                "(a)∧(¬a), UNSATISFIABLE, 1",
                "(a)∧(b∨c), UNDETERMINED, 2",
                "(a∨b), NO_UNIT_CLAUSES, 3"
        })
        @DisplayName("Soddisfacibile e insoddisfacibile condividono l'enunciato")
        void verdicts(String formula, Verdict verdict, int statement) {
            DeterminismResult result = checker.calculate(CalculationRequest.of(formula));
            assertEquals(verdict, result.verdict());
            assertEquals(statement, result.correctStatement());
            assertEquals(3, result.statements().size());
            assertEquals(Algorithm.GENERAL_DETERMINISM, result.algorithm());
        }

        @Test
        @DisplayName("Spiegazione riferita all'insieme di formule")
        void explanation() {
            DeterminismResult result = checker.calculate(CalculationRequest.of("(a)∧(¬a∨b)"));
            assertEquals("Unit propagation determines that the set of formulas is satisfiable", result.explanation());
        }
    }

    @Test
    @DisplayName("Variante obbligatoria")
    void variantRequired() {
        assertThrows(IllegalArgumentException.class, () -> new DeterminismChecker(null));
    }
}
