package org.logica.modules;

import org.logica.core.Formula;
import org.logica.core.FormulaFormatter;
import org.logica.core.PositionNavigator;
import org.logica.parser.FormulaParser;

import java.util.logging.Logger;

/**
 * Estrazione della sottoformula individuata da una posizione puntata.
 *
 * Una posizione non valida è un errore: solleva {@link org.logica.core.InvalidPositionException}.
 */
public class SubformulaExtractor implements Calculator {

    private static final Logger LOGGER = Logger.getLogger(SubformulaExtractor.class.getName());

    /** Rappresentazione della posizione radice */
    public static final String ROOT_DISPLAY = "ε";

    @Override
    public Algorithm algorithm() {
        return Algorithm.SUBFORMULA;
    }

    @Override
    public SubformulaResult calculate(CalculationRequest request) {
        String position = request.positionOrRoot();
        LOGGER.fine("Estrazione sottoformula in posizione '" + position + "' di: " + request.formula());

        Formula tree = FormulaParser.parse(request.formula());
        Formula subformula = PositionNavigator.requireSubformulaAt(tree, position);

        return new SubformulaResult(
                request.formula(),
                position.isEmpty() ? ROOT_DISPLAY : position,
                FormulaFormatter.toText(subformula),
                FormulaFormatter.toLatex(subformula),
                tree,
                PositionNavigator.allPositions(tree));
    }
}
