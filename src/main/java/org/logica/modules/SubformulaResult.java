package org.logica.modules;

import org.logica.core.Formula;

import java.util.List;

/**
 * Sottoformula estratta con le posizioni valide della formula.
 *
 * @param formula formula in input
 * @param position posizione richiesta, ε per la radice
 * @param subformula testo della sottoformula
 * @param latex rendering LaTeX della sottoformula
 * @param tree albero della formula completa
 * @param positions tutte le posizioni valide in ordine di lunghezza e poi lessicografico
 */
public record SubformulaResult(String formula,
                               String position,
                               String subformula,
                               String latex,
                               Formula tree,
                               List<String> positions) implements CalculationResult {

    public SubformulaResult {
        positions = List.copyOf(positions);
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.SUBFORMULA;
    }

    @Override
    public String toDisplayString() {
        return "Formula: " + formula + "\n"
                + "Posizione: " + position + "\n"
                + "Sottoformula: " + subformula + "\n"
                + "Posizioni valide: " + positions.stream()
                        .map(p -> p.isEmpty() ? SubformulaExtractor.ROOT_DISPLAY : p)
                        .toList();
    }
}
