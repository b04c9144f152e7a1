package org.logica.cnf;

import org.logica.cnf.UnitPropagationEngine.ContradictionPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UnitPropagationEngine")
class UnitPropagationEngineTest {

    private final UnitPropagationEngine report = new UnitPropagationEngine(ContradictionPolicy.REPORT);
    private final UnitPropagationEngine discard = new UnitPropagationEngine(ContradictionPolicy.DISCARD);

    @Test
    @DisplayName("Politica obbligatoria")
    void policyRequired() {
        assertThrows(IllegalArgumentException.class, () -> new UnitPropagationEngine(null));
    }

    @Nested
    @DisplayName("Propagazione")
    class Propagation {

        @Test
        @DisplayName("Catena di clausole unitarie fino allo svuotamento")
        void chainToEmpty() {
            PropagationResult result = report.propagate(ClauseSet.parse("(a)∧(¬a∨b)∧(¬b∨c)"));
            assertEquals(PropagationOutcome.EMPTY, result.outcome());
            assertEquals(List.of("a", "b", "c"), result.literals());
            assertEquals(Map.of("a", true, "b", true, "c", true), result.assignments());
            assertTrue(result.remainingClauses().isEmpty());
        }

        @Test
        @DisplayName("Istantanee prima e dopo ogni passo")
        void stepSnapshots() {
            PropagationResult result = report.propagate(ClauseSet.parse("(a)∧(¬a∨b)∧(c∨d)"));
            assertEquals(PropagationOutcome.STALLED, result.outcome());
            assertEquals(2, result.steps().size());

            PropagationStep first = result.steps().get(0);
            assertEquals("a", first.literal());
            assertEquals(List.of("a", "¬a,b", "c,d"), first.beforeClauses());
            assertEquals(List.of("b", "c,d"), first.afterClauses());

            PropagationStep second = result.steps().get(1);
            assertEquals("b", second.variable());
            assertTrue(second.value());
            assertEquals(List.of(List.of("c", "d")), result.remainingClauses());
        }

        @Test
        @DisplayName("Letterale negato assegna falso")
        void negativeLiteral() {
            PropagationResult result = discard.propagate(ClauseSet.parse("(¬a)∧(a∨b)"));
            assertEquals(List.of("¬a", "b"), result.literals());
            assertEquals(Map.of("a", false, "b", true), result.assignments());
            assertEquals(PropagationOutcome.EMPTY, result.outcome());
        }

        @Test
        @DisplayName("Nessuna clausola unitaria: nessun passo")
        void noUnitClause() {
            PropagationResult result = report.propagate(ClauseSet.parse("(a∨b)∧(¬a∨c)"));
            assertEquals(PropagationOutcome.STALLED, result.outcome());
            assertTrue(result.steps().isEmpty());
            assertEquals(2, result.remainingClauses().size());
        }

        @Test
        @DisplayName("L'insieme di partenza non viene modificato")
        void inputUntouched() {
            ClauseSet clauses = ClauseSet.parse("(a)∧(¬a∨b)");
            report.propagate(clauses);
            assertEquals(List.of(List.of("a"), List.of("¬a", "b")), clauses.clauses());
            assertEquals(report.propagate(clauses), report.propagate(clauses));
        }

        @Test
        @DisplayName("Nessuna clausola unitaria nelle residue: una seconda propagazione non ha passi")
        void idempotentAtCompletion() {
            PropagationResult first = report.propagate(ClauseSet.parse("(a)∧(¬a∨b∨c)∧(¬b∨d∨e)∧(c∨¬d)"));
            assertEquals(PropagationOutcome.STALLED, first.outcome());

            PropagationResult second = report.propagate(new ClauseSet(first.remainingClauses()));
            assertTrue(second.steps().isEmpty());
            assertEquals(first.remainingClauses(), second.remainingClauses());
        }
    }

    @Nested
    @DisplayName("Clausole svuotate")
    class EmptiedClauses {

        @Test
        @DisplayName("REPORT: contraddizione con clausola vuota tra le residue")
        void reportContradiction() {
            PropagationResult result = report.propagate(ClauseSet.parse("(a)∧(¬a)"));
            assertEquals(PropagationOutcome.CONTRADICTION, result.outcome());
            assertEquals(List.of("a"), result.literals());
            assertEquals(List.of(List.of()), result.remainingClauses());
        }

        @Test
        @DisplayName("DISCARD: clausola vuota scartata, propagazione senza contraddizione")
        void discardEmptied() {
            PropagationResult result = discard.propagate(ClauseSet.parse("(a)∧(¬a)"));
            assertEquals(PropagationOutcome.EMPTY, result.outcome());
            assertEquals(List.of("a"), result.literals());
        }

        @Test
        @DisplayName("REPORT accorpa i letterali ripetuti in una clausola")
        void duplicateLiterals() {
            ClauseSet clauses = ClauseSet.parse("(a∨a)∧(¬a∨b)");

            PropagationResult reported = report.propagate(clauses);
            assertEquals(List.of("a", "b"), reported.literals());
            assertEquals(PropagationOutcome.EMPTY, reported.outcome());

            PropagationResult discarded = discard.propagate(clauses);
            assertTrue(discarded.steps().isEmpty());
            assertEquals(PropagationOutcome.STALLED, discarded.outcome());
        }
    }
}
