package org.logica.simplification;

import org.logica.core.Formula;
import org.logica.parser.FormulaParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PureAtomFolder")
class PureAtomFolderTest {

    @Nested
    @DisplayName("Polarità delle occorrenze")
    class Polarities {

        @Test
        @DisplayName("Antecedente e negazione invertono la polarità")
        void implicationAndNegation() {
            Map<String, Set<Boolean>> polarities = PureAtomFolder.collectPolarities(FormulaParser.parse("a∧¬b→c"));
            assertEquals(Set.of(false), polarities.get("a"));
            assertEquals(Set.of(true), polarities.get("b"));
            assertEquals(Set.of(true), polarities.get("c"));
        }

        @Test
        @DisplayName("Il bicondizionale assegna entrambe le polarità")
        void biconditional() {
            Map<String, Boolean> pure = PureAtomFolder.findPureAtoms(FormulaParser.parse("(a↔b)∨c"));
            assertEquals(Map.of("c", true), pure);
        }

        @Test
        @DisplayName("Atomi puri nell'ordine di prima occorrenza")
        void firstOccurrenceOrder() {
            Map<String, Boolean> pure = PureAtomFolder.findPureAtoms(FormulaParser.parse("c∧¬a∨b"));
            assertEquals(List.of("c", "a", "b"), List.copyOf(pure.keySet()));
            assertFalse(pure.get("a"));
        }

        @Test
        @DisplayName("Occorrenze miste escluse")
        void mixedExcluded() {
            Map<String, Boolean> pure = PureAtomFolder.findPureAtoms(FormulaParser.parse("(a∨b)∧(¬a∨c)"));
            assertEquals(Map.of("b", true, "c", true), pure);
        }
    }

    @Nested
    @DisplayName("Sostituzione e semplificazione")
    class Folding {

        @Test
        @DisplayName("Tutti gli atomi puri positivi: la formula diventa ⊤")
        void allPositive() {
            Formula formula = FormulaParser.parse("(a∨b)∧(a∨c)");
            assertEquals(Formula.top(), PureAtomFolder.fold(formula, PureAtomFolder.findPureAtoms(formula)));
        }

        @Test
        @DisplayName("Clausole soddisfatte dagli atomi puri eliminate")
        void satisfiedClausesRemoved() {
            Formula formula = FormulaParser.parse("(a∨b)∧(¬a∨c)");
            assertEquals(Formula.top(), PureAtomFolder.fold(formula, PureAtomFolder.findPureAtoms(formula)));
        }

        @Test
        @DisplayName("Implicazione con antecedente negativo puro")
        void implication() {
            Formula formula = FormulaParser.parse("a→b");
            assertEquals(Map.of("a", false, "b", true), PureAtomFolder.findPureAtoms(formula));
            assertEquals(Formula.top(), PureAtomFolder.fold(formula, PureAtomFolder.findPureAtoms(formula)));
        }

        @Test
        @DisplayName("Doppia negazione rimossa nella seconda passata")
        void doubleNegation() {
            Formula folded = PureAtomFolder.fold(FormulaParser.parse("¬¬a∧b"), Map.of("b", true));
            assertEquals(Formula.variable("a"), folded);
        }

        @Test
        @DisplayName("Nessun atomo puro: formula invariata")
        void nothingToFold() {
            Formula formula = FormulaParser.parse("(a↔b)∧(a∨b)");
            assertTrue(PureAtomFolder.findPureAtoms(formula).isEmpty());
            assertEquals(formula, PureAtomFolder.fold(formula, Map.of()));
        }

        @Test
        @DisplayName("Bicondizionale con lato falso diventa negazione")
        void iffWithBottom() {
            Formula substituted = PureAtomFolder.substitute(FormulaParser.parse("a↔b"), Map.of("b", false));
            assertEquals(FormulaParser.parse("¬a"), substituted);
        }
    }
}
