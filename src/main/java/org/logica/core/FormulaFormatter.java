package org.logica.core;

/**
 * Rendering testuale e LaTeX delle formule.
 *
 * FORMATO TESTO:
 * - Foglie: nome della variabile o glifo della costante
 * - Binari: sempre tra parentesi, (sinistro OP destro), senza elisioni per precedenza
 * - Negazione: ¬ seguito dall'operando; un operando binario viene racchiuso in un'ulteriore
 *   coppia di parentesi, es. ¬((a∧b))
 * - I figli di un binario non ricevono parentesi aggiuntive: ((a∧b)∨c)
 *
 * FORMATO LATEX:
 * - Connettivi e costanti sostituiti dalle macro corrispondenti
 * - Binari tra parentesi con spazi attorno all'operatore
 * - Negazione con operando sempre tra graffe
 */
public final class FormulaFormatter {

    public enum Style {
        TEXT,
        LATEX
    }

    private FormulaFormatter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static String format(Formula formula, Style style) {
        return style == Style.LATEX ? toLatex(formula) : toText(formula);
    }

    /**
     * Rappresentazione testuale della formula, re-analizzabile dal parser.
     */
    public static String toText(Formula node) {
        if (node == null) return "";

        return switch (node.getType()) {
            case VARIABLE, CONSTANT -> node.getValue();
            case UNARY -> node.getOperator().symbol() + wrapBinary(node.getOperand());
            case BINARY -> "(" + toText(node.getLeft()) + node.getOperator().symbol()
                    + toText(node.getRight()) + ")";
        };
    }

    private static String wrapBinary(Formula operand) {
        String text = toText(operand);
        return operand.isBinary() ? "(" + text + ")" : text;
    }

    public static String toLatex(Formula node) {
        if (node == null) return "";

        return switch (node.getType()) {
            case VARIABLE -> node.getValue();
            case CONSTANT -> node.getConstantValue() ? "\\top" : "\\bot";
            case UNARY -> Operator.NOT.latex() + "{" + toLatex(node.getOperand()) + "}";
            case BINARY -> "(" + toLatex(node.getLeft()) + " " + node.getOperator().latex() + " "
                    + toLatex(node.getRight()) + ")";
        };
    }
}
