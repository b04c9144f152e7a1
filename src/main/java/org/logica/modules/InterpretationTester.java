package org.logica.modules;

import org.logica.cnf.FormulaFormatException;
import org.logica.core.Formula;
import org.logica.core.FormulaEvaluator;
import org.logica.core.FormulaFormatter;
import org.logica.parser.FormulaParser;
import org.logica.simplification.EquivalenceSimplifier;

import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * VERIFICA INTERPRETAZIONE - Valuta un enunciato sotto un'interpretazione parziale
 *
 * PIPELINE:
 * 1. L'asserzione I⊨l / I⊭l fissa il valore di una sola variabile
 * 2. La variabile viene sostituita nella formula, le altre restano simboliche
 * 3. Il semplificatore algebrico riduce la formula
 * 4. Il testo ridotto prende il posto del segnaposto A nell'enunciato I⊨expr / I⊭expr
 * 5. L'espressione risultante viene analizzata, istanziata e semplificata
 * 6. Il valore costante ottenuto si confronta con la polarità dell'enunciato (⊨ attende ⊤, ⊭ attende ⊥)
 *
 * Se l'espressione finale non si riduce a una costante l'enunciato non è determinato.
 */
public class InterpretationTester implements Calculator {

    private static final Logger LOGGER = Logger.getLogger(InterpretationTester.class.getName());

    /** Segnaposto della formula semplificata all'interno dell'enunciato */
    public static final String PLACEHOLDER = "A";

    private static final String MODELS = "⊨";

    private static final Pattern ASSERTION = Pattern.compile("^I\\s*(⊨|⊭)\\s*(¬?)\\s*([a-z])$");
    private static final Pattern STATEMENT = Pattern.compile("^I\\s*(⊨|⊭)\\s*(.+)$");

    /**
     * Asserzione interpretata: variabile e valore assegnato.
     */
    public record Assertion(String variable, boolean value) {
        public Map<String, Boolean> asAssignment() {
            return Map.of(variable, value);
        }
    }

    /**
     * Enunciato interpretato: valore atteso ed espressione con segnaposto.
     */
    public record Statement(boolean expected, String expression) {
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.INTERPRETATION;
    }

    @Override
    public InterpretationResult calculate(CalculationRequest request) {
        LOGGER.fine("Verifica interpretazione " + request.interpretation() + " / " + request.statement()
                + " per: " + request.formula());

        // Forma di asserzione ed enunciato verificata prima di qualsiasi valutazione
        Assertion assertion = parseAssertion(request.interpretation());
        Statement statement = parseStatement(request.statement());
        Map<String, Boolean> assignment = assertion.asAssignment();

        Formula formula = FormulaParser.parse(request.formula());
        Formula simplified = EquivalenceSimplifier.simplify(FormulaEvaluator.substitute(formula, assignment));
        String simplifiedText = FormulaFormatter.toText(simplified);
        LOGGER.finest("Formula semplificata: " + simplifiedText);

        String instantiated = statement.expression().replace(PLACEHOLDER, simplifiedText);
        Formula composite = FormulaParser.parse(instantiated);
        Formula finalFormula = EquivalenceSimplifier.simplify(FormulaEvaluator.substitute(composite, assignment));

        boolean determined = finalFormula.isConstant();
        boolean valid = determined && finalFormula.getConstantValue() == statement.expected();
        if (!determined) {
            LOGGER.fine("Enunciato non determinato: " + finalFormula + " non è una costante");
        }

        LOGGER.fine("Esito: " + (valid ? "valido" : "non valido"));
        return new InterpretationResult(
                request.formula(),
                request.interpretation(),
                request.statement(),
                assignment,
                simplifiedText,
                instantiated,
                FormulaFormatter.toText(finalFormula),
                statement.expected(),
                determined,
                valid);
    }

    //region FORMA DI ASSERZIONI ED ENUNCIATI

    /**
     * Interpreta I⊨l o I⊭l: ⊨ assegna alla variabile il valore del letterale, ⊭ il suo opposto.
     *
     * @throws FormulaFormatException se l'asserzione non ha la forma attesa
     */
    public static Assertion parseAssertion(String interpretation) {
        if (interpretation == null) {
            throw new FormulaFormatException("Interpretazione mancante", "null");
        }
        Matcher matcher = ASSERTION.matcher(interpretation.trim());
        if (!matcher.matches()) {
            throw new FormulaFormatException("Interpretazione non valida, attesa I⊨l oppure I⊭l", interpretation);
        }

        boolean literalValue = matcher.group(2).isEmpty();
        boolean models = MODELS.equals(matcher.group(1));
        return new Assertion(matcher.group(3), models == literalValue);
    }

    /**
     * Interpreta I⊨expr o I⊭expr.
     *
     * @throws FormulaFormatException se l'enunciato non ha la forma attesa
     */
    public static Statement parseStatement(String statement) {
        if (statement == null) {
            throw new FormulaFormatException("Enunciato mancante", "null");
        }
        Matcher matcher = STATEMENT.matcher(statement.trim());
        if (!matcher.matches() || matcher.group(2).isBlank()) {
            throw new FormulaFormatException("Enunciato non valido, atteso I⊨espressione oppure I⊭espressione",
                    statement);
        }
        return new Statement(MODELS.equals(matcher.group(1)), matcher.group(2).trim());
    }

    //endregion
}
