package org.logica.core;

/**
 * Connettivi della logica proposizionale supportati dal motore.
 *
 * Ogni operatore conosce il proprio glifo testuale, la macro LaTeX
 * corrispondente e, per i binari, la propria tavola di verità.
 */
public enum Operator {
    NOT("¬", "\\neg", 1),
    AND("∧", "\\land", 2),
    OR("∨", "\\lor", 2),
    IMPLIES("→", "\\rightarrow", 2),
    IFF("↔", "\\leftrightarrow", 2);

    private final String symbol;
    private final String latex;
    private final int arity;

    Operator(String symbol, String latex, int arity) {
        this.symbol = symbol;
        this.latex = latex;
        this.arity = arity;
    }

    public String symbol() {
        return symbol;
    }

    public String latex() {
        return latex;
    }

    public boolean isBinary() {
        return arity == 2;
    }

    /**
     * Applica la tavola di verità dell'operatore binario.
     *
     * @throws UnsupportedOperationException se invocato su NOT
     */
    public boolean apply(boolean left, boolean right) {
        return switch (this) {
            case AND -> left && right;
            case OR -> left || right;
            case IMPLIES -> !left || right;
            case IFF -> left == right;
            case NOT -> throw new UnsupportedOperationException("NOT non è un operatore binario");
        };
    }

    /**
     * Risolve un glifo nel relativo operatore.
     *
     * @param symbol glifo (¬, ∧, ∨, →, ↔)
     * @return operatore corrispondente
     * @throws IllegalArgumentException se il glifo non è un connettivo
     */
    public static Operator fromSymbol(String symbol) {
        for (Operator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Connettivo sconosciuto: " + symbol);
    }
}
