package org.logica.modules;

import org.logica.modules.SatisfiabilityResult.Status;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SatisfiabilityChecker")
class SatisfiabilityCheckerTest {

    private final SatisfiabilityChecker checker = new SatisfiabilityChecker();

    @ParameterizedTest(name = "{0} è {1}")
    @CsvSource({
            "a∧¬a, UNSATISFIABLE",
            "a∨¬a, VALID",
            "(a→b)→(¬b→¬a), VALID",
            "a∧¬b, SATISFIABLE",
            "⊥, UNSATISFIABLE",
            "⊤, VALID",
            "(a↔b)∧(a↔¬b), UNSATISFIABLE"
    })
    @DisplayName("Classificazione")
    void classification(String formula, Status expected) {
        assertEquals(expected, checker.calculate(CalculationRequest.of(formula)).status());
    }

    @Test
    @DisplayName("Primo modello nell'ordine di enumerazione")
    void firstModel() {
        SatisfiabilityResult result = checker.calculate(CalculationRequest.of("a∧¬b"));
        assertEquals(Map.of("a", true, "b", false), result.firstModel().orElseThrow());
        assertEquals(1, result.trueCount());
        assertEquals(4, result.totalAssignments());

        SatisfiabilityResult valid = checker.calculate(CalculationRequest.of("a∨¬a"));
        assertEquals(Map.of("a", false), valid.model());
    }

    @Test
    @DisplayName("Nessun modello per formula insoddisfacibile")
    void noModel() {
        SatisfiabilityResult result = checker.calculate(CalculationRequest.of("a∧¬a"));
        assertTrue(result.firstModel().isEmpty());
        assertTrue(result.model().isEmpty());
        assertEquals(0, result.trueCount());
        assertTrue(result.toDisplayString().contains("insoddisfacibile"));
    }
}
