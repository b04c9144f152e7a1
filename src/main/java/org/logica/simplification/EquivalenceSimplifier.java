package org.logica.simplification;

import org.logica.core.Formula;

import java.util.logging.Logger;

/**
 * SEMPLIFICATORE ALGEBRICO - Riscritture che preservano l'equivalenza, iterate fino al punto fisso
 *
 * Ogni passata visita l'albero dal basso verso l'alto e applica a ciascun nodo la prima
 * regola utilizzabile. Le passate si ripetono finché l'albero non cambia, con un limite
 * di {@link #MAX_ITERATIONS} passate.
 *
 * REGOLE:
 * • ¬: costanti invertite, doppia negazione, De Morgan su ∧ e ∨, ¬(A→B) ≡ A∧¬B,
 *   ¬(A↔B) ≡ (A∧¬B)∨(¬A∧B)
 * • ∧: ⊥ assorbente, ⊤ neutro, A∧A ≡ A, A∧¬A ≡ ⊥
 * • ∨: ⊤ assorbente, ⊥ neutro, A∨A ≡ A, A∨¬A ≡ ⊤
 * • →: regole sulle costanti, A→A ≡ ⊤, altrimenti ¬A∨B
 * • ↔: regole sulle costanti, A↔A ≡ ⊤, altrimenti (¬A∨B)∧(A∨¬B)
 */
public final class EquivalenceSimplifier {

    private static final Logger LOGGER = Logger.getLogger(EquivalenceSimplifier.class.getName());

    /** Numero massimo di passate prima di interrompere la semplificazione */
    public static final int MAX_ITERATIONS = 20;

    /**
     * Esito della semplificazione.
     *
     * @param formula formula semplificata
     * @param iterations passate eseguite
     * @param converged falso se il limite di passate è stato raggiunto senza punto fisso
     */
    public record Outcome(Formula formula, int iterations, boolean converged) {
    }

    private EquivalenceSimplifier() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static Formula simplify(Formula formula) {
        return simplifyWithTrace(formula).formula();
    }

    /**
     * Semplifica la formula fino al punto fisso o fino al limite di passate.
     */
    public static Outcome simplifyWithTrace(Formula formula) {
        Formula current = formula;

        for (int iteration = 1; iteration <= MAX_ITERATIONS; iteration++) {
            Formula next = rewrite(current);
            if (next.equals(current)) {
                LOGGER.finest("Punto fisso raggiunto dopo " + iteration + " passate: " + next);
                return new Outcome(next, iteration, true);
            }
            current = next;
        }

        LOGGER.warning("Semplificazione interrotta dopo " + MAX_ITERATIONS + " passate senza punto fisso: " + current);
        return new Outcome(current, MAX_ITERATIONS, false);
    }

    //region PASSATA DI RISCRITTURA

    static Formula rewrite(Formula node) {
        return switch (node.getType()) {
            case VARIABLE, CONSTANT -> node;
            case UNARY -> rewriteNegation(rewrite(node.getOperand()));
            case BINARY -> {
                Formula left = rewrite(node.getLeft());
                Formula right = rewrite(node.getRight());
                yield switch (node.getOperator()) {
                    case AND -> rewriteAnd(left, right);
                    case OR -> rewriteOr(left, right);
                    case IMPLIES -> rewriteImplies(left, right);
                    case IFF -> rewriteIff(left, right);
                    case NOT -> throw new IllegalStateException("Negazione in nodo binario");
                };
            }
        };
    }

    private static Formula rewriteNegation(Formula operand) {
        if (operand.isConstant()) {
            return Formula.constant(!operand.getConstantValue());
        }
        if (operand.isUnary()) {
            return operand.getOperand();
        }
        if (operand.isVariable()) {
            return Formula.not(operand);
        }

        Formula left = operand.getLeft();
        Formula right = operand.getRight();
        return switch (operand.getOperator()) {
            case AND -> Formula.or(Formula.not(left), Formula.not(right));
            case OR -> Formula.and(Formula.not(left), Formula.not(right));
            case IMPLIES -> Formula.and(left, Formula.not(right));
            case IFF -> Formula.or(
                    Formula.and(left, Formula.not(right)),
                    Formula.and(Formula.not(left), right));
            case NOT -> throw new IllegalStateException("Negazione in nodo binario");
        };
    }

    private static Formula rewriteAnd(Formula left, Formula right) {
        if (left.isBottom() || right.isBottom()) return Formula.bottom();
        if (left.isTop()) return right;
        if (right.isTop()) return left;
        if (left.equals(right)) return left;
        if (areComplementary(left, right)) return Formula.bottom();
        return Formula.and(left, right);
    }

    private static Formula rewriteOr(Formula left, Formula right) {
        if (left.isTop() || right.isTop()) return Formula.top();
        if (left.isBottom()) return right;
        if (right.isBottom()) return left;
        if (left.equals(right)) return left;
        if (areComplementary(left, right)) return Formula.top();
        return Formula.or(left, right);
    }

    private static Formula rewriteImplies(Formula left, Formula right) {
        if (left.isBottom() || right.isTop()) return Formula.top();
        if (left.isTop()) return right;
        if (right.isBottom()) return Formula.not(left);
        if (left.equals(right)) return Formula.top();
        return Formula.or(Formula.not(left), right);
    }

    private static Formula rewriteIff(Formula left, Formula right) {
        if (left.isTop()) return right;
        if (right.isTop()) return left;
        if (left.isBottom()) return Formula.not(right);
        if (right.isBottom()) return Formula.not(left);
        if (left.equals(right)) return Formula.top();
        return Formula.and(
                Formula.or(Formula.not(left), right),
                Formula.or(left, Formula.not(right)));
    }

    /**
     * Vero se una delle due formule è la negazione dell'altra.
     *
     * I figli arrivano già riscritti: la negazione di una sottoformula composta è stata
     * spinta verso l'interno nella stessa passata, quindi il confronto avviene anche con
     * la negazione riscritta dell'altro lato.
     */
    private static boolean areComplementary(Formula a, Formula b) {
        if ((a.isUnary() && a.getOperand().equals(b)) || (b.isUnary() && b.getOperand().equals(a))) {
            return true;
        }
        return b.equals(rewriteNegation(a)) || a.equals(rewriteNegation(b));
    }

    //endregion
}
