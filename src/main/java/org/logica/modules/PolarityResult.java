package org.logica.modules;

import org.logica.modules.PolarityCalculator.AnnotatedNode;

/**
 * Polarità della sottoformula richiesta e albero annotato.
 *
 * @param formula formula in input
 * @param position posizione richiesta (vuota per la radice)
 * @param polarity polarità della sottoformula
 * @param subformula testo della sottoformula
 * @param subformulaLatex rendering LaTeX della sottoformula
 * @param tree albero annotato con posizioni e polarità
 * @param formattedTree rappresentazione a rami dell'albero annotato
 */
public record PolarityResult(String formula,
                             String position,
                             Polarity polarity,
                             String subformula,
                             String subformulaLatex,
                             AnnotatedNode tree,
                             String formattedTree) implements CalculationResult {

    public int polarityValue() {
        return polarity.value();
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.POLARITY;
    }

    @Override
    public String toDisplayString() {
        return "Formula: " + formula + "\n"
                + "Posizione: " + (position.isEmpty() ? SubformulaExtractor.ROOT_DISPLAY : position) + "\n"
                + "Sottoformula: " + subformula + "\n"
                + "Polarità: " + polarity.label() + " (" + polarityValue() + ")\n"
                + formattedTree;
    }
}
