package org.logica.modules;

import org.logica.core.Formula;
import org.logica.core.FormulaFormatter;
import org.logica.parser.FormulaParser;
import org.logica.simplification.PureAtomFolder;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Individua gli atomi puri della formula e li sostituisce con ⊤ o ⊥, semplificando il risultato.
 */
public class PureAtomSimplifier implements Calculator {

    private static final Logger LOGGER = Logger.getLogger(PureAtomSimplifier.class.getName());

    @Override
    public Algorithm algorithm() {
        return Algorithm.PURE_ATOM;
    }

    @Override
    public PureAtomResult calculate(CalculationRequest request) {
        LOGGER.fine("Semplificazione atomi puri per: " + request.formula());

        Formula formula = FormulaParser.parse(request.formula());
        Map<String, Boolean> pureAtoms = PureAtomFolder.findPureAtoms(formula);
        Formula simplified = PureAtomFolder.fold(formula, pureAtoms);

        // Un risultato costante è reso con il solo glifo
        String text = simplified.isConstant() ? simplified.getValue() : FormulaFormatter.toText(simplified);

        LOGGER.fine("Atomi puri: " + pureAtoms + ", formula semplificata: " + text);
        return new PureAtomResult(request.formula(), pureAtoms, text, simplified);
    }
}
