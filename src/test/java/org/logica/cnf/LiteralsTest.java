package org.logica.cnf;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Literals")
class LiteralsTest {

    @Test
    @DisplayName("Complemento e conversione tra notazioni")
    void complementAndNotation() {
        assertEquals("¬a", Literals.complement("a"));
        assertEquals("a", Literals.complement("¬a"));
        assertEquals("-n3", Literals.complementOutput("n3"));
        assertEquals("n3", Literals.complementOutput("-n3"));
        assertEquals("-b", Literals.toOutput("¬b"));
        assertEquals("b", Literals.toOutput("b"));
        assertEquals("c", Literals.variableOf("¬c"));
        assertEquals("n12", Literals.variableOf("-n12"));
    }

    @Test
    @DisplayName("Nomi ausiliari: n seguito da cifre")
    void auxiliaryNames() {
        assertTrue(Literals.isAuxiliary("n0"));
        assertTrue(Literals.isAuxiliary("n15"));
        assertFalse(Literals.isAuxiliary("n"));
        assertFalse(Literals.isAuxiliary("a"));
    }

    @Test
    @DisplayName("Ordine canonico: variabili, poi ausiliari in ordine numerico, positivo prima del negato")
    void canonicalOrder() {
        List<String> literals = new ArrayList<>(List.of("n10", "-a", "b", "n2", "a", "-n2"));
        literals.sort(Literals.CANONICAL);
        assertEquals(List.of("a", "-a", "b", "n2", "-n2", "n10"), literals);
    }

    @Test
    @DisplayName("Costanti prima di variabili e ausiliari")
    void constantsFirst() {
        List<String> literals = new ArrayList<>(List.of("n0", "-a", "⊥"));
        literals.sort(Literals.CANONICAL);
        assertEquals(List.of("⊥", "-a", "n0"), literals);
    }

    @Test
    @DisplayName("Ordine per variabile stabile a parità di variabile")
    void byVariableIsStable() {
        List<String> literals = new ArrayList<>(List.of("c", "¬a", "b", "a"));
        literals.sort(Literals.BY_VARIABLE);
        assertEquals(List.of("¬a", "a", "b", "c"), literals);
    }
}
