package org.logica.modules;

import org.logica.core.Formula;
import org.logica.core.InvalidPositionException;
import org.logica.parser.FormulaParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PolarityCalculator")
class PolarityCalculatorTest {

    private final PolarityCalculator calculator = new PolarityCalculator();

    @ParameterizedTest(name = "{0} in {1} ⇒ {2}")
    @CsvSource({
            "¬(a→b), 1.1, POSITIVE",
            "¬(a→b), 1.2, NEGATIVE",
            "¬(a→b), 1, NEGATIVE",
            "(a→b)→c, 1.1, POSITIVE",
            "(a→b)→c, 1.2, NEGATIVE",
            "a↔b, 1, POSITIVE",
            "¬¬a, 1.1, POSITIVE"
    })
    @DisplayName("Segno accumulato lungo il cammino")
    void polarityAlongPath(String formula, String position, Polarity expected) {
        assertEquals(expected, PolarityCalculator.polarityAt(FormulaParser.parse(formula), position));
    }

    @Test
    @DisplayName("Radice sempre positiva")
    void rootIsPositive() {
        PolarityResult result = calculator.calculate(CalculationRequest.of("¬a"));
        assertEquals(Polarity.POSITIVE, result.polarity());
        assertEquals(1, result.polarityValue());
        assertEquals("", result.position());
    }

    @Test
    @DisplayName("Sottoformula, LaTeX e valore numerico")
    void resultFields() {
        PolarityResult result = calculator.calculate(CalculationRequest.atPosition("¬(a→b)", "1"));
        assertEquals("(a→b)", result.subformula());
        assertEquals("(a \\rightarrow b)", result.subformulaLatex());
        assertEquals(-1, result.polarityValue());
    }

    @Test
    @DisplayName("Albero annotato reso a rami")
    void formattedTree() {
        PolarityResult result = calculator.calculate(CalculationRequest.atPosition("¬(a→b)", "1.1"));
        String expected = String.join("\n",
                "¬((a→b)) [positive]",
                "└── 1: (a→b) [negative]",
                "    ├── 1.1: a [positive]",
                "    └── 1.2: b [negative]");
        assertEquals(expected, result.formattedTree());
    }

    @Test
    @DisplayName("Rami verticali sotto un figlio non ultimo")
    void nestedBranches() {
        PolarityResult result = calculator.calculate(CalculationRequest.of("(a∧b)→c"));
        String expected = String.join("\n",
                "((a∧b)→c) [positive]",
                "├── 1: (a∧b) [negative]",
                "│   ├── 1.1: a [negative]",
                "│   └── 1.2: b [negative]",
                "└── 2: c [positive]");
        assertEquals(expected, result.formattedTree());
    }

    @Test
    @DisplayName("Annotazione coerente con la polarità per posizione")
    void annotationMatchesPath() {
        Formula tree = FormulaParser.parse("¬(a↔(b→¬c))∨d");
        PolarityCalculator.AnnotatedNode root = PolarityCalculator.annotate(tree, Polarity.POSITIVE, "");
        assertAnnotation(tree, root);
    }

    private static void assertAnnotation(Formula tree, PolarityCalculator.AnnotatedNode node) {
        assertEquals(PolarityCalculator.polarityAt(tree, node.position()), node.polarity(), node.position());
        node.children().forEach(child -> assertAnnotation(tree, child));
    }

    @Test
    @DisplayName("Posizione non valida")
    void invalidPosition() {
        assertThrows(InvalidPositionException.class,
                () -> calculator.calculate(CalculationRequest.atPosition("¬(a→b)", "2")));
    }
}
