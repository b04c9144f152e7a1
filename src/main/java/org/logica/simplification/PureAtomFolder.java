package org.logica.simplification;

import org.logica.core.Formula;
import org.logica.core.Operator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * ATOMI PURI - Analisi delle polarità delle occorrenze e sostituzione con costanti
 *
 * Un atomo è puro se tutte le sue occorrenze nella formula hanno la stessa polarità.
 * Sostituirlo con ⊤ (occorrenze positive) o ⊥ (occorrenze negative) preserva la
 * soddisfacibilità e permette di semplificare la formula.
 *
 * PROPAGAZIONE DELLA POLARITÀ:
 * • ∧, ∨: polarità invariata su entrambi i figli
 * • →: polarità invertita sull'antecedente, invariata sul conseguente
 * • ↔: ogni variabile sotto uno dei due lati riceve entrambe le polarità
 * • ¬: polarità invertita sull'operando
 *
 * SEMPLIFICAZIONE IN DUE PASSATE:
 * 1. Sostituzione e piegatura delle costanti con le regole di ∧, ∨, →, ↔
 * 2. Passata ricorsiva dal basso: costanti sotto negazione, doppia negazione, regole di ∧ e ∨
 *
 * Non si itera fino a un punto fisso: la formula risultante può contenere nuovi atomi puri.
 */
public final class PureAtomFolder {

    private static final Logger LOGGER = Logger.getLogger(PureAtomFolder.class.getName());

    private PureAtomFolder() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region ANALISI POLARITÀ

    /**
     * Polarità osservate per ogni variabile, nell'ordine di prima occorrenza.
     *
     * @param formula formula da analizzare
     * @return variabile → insieme delle polarità (true = positiva)
     */
    public static Map<String, Set<Boolean>> collectPolarities(Formula formula) {
        Map<String, Set<Boolean>> polarities = new LinkedHashMap<>();
        traverse(formula, true, polarities);
        return polarities;
    }

    private static void traverse(Formula node, boolean polarity, Map<String, Set<Boolean>> polarities) {
        switch (node.getType()) {
            case VARIABLE -> polarities.computeIfAbsent(node.getValue(), k -> new LinkedHashSet<>()).add(polarity);
            case CONSTANT -> {
                // Nessuna variabile
            }
            case UNARY -> traverse(node.getOperand(), !polarity, polarities);
            case BINARY -> {
                switch (node.getOperator()) {
                    case AND, OR -> {
                        traverse(node.getLeft(), polarity, polarities);
                        traverse(node.getRight(), polarity, polarities);
                    }
                    case IMPLIES -> {
                        traverse(node.getLeft(), !polarity, polarities);
                        traverse(node.getRight(), polarity, polarities);
                    }
                    case IFF -> {
                        traverse(node.getLeft(), true, polarities);
                        traverse(node.getLeft(), false, polarities);
                        traverse(node.getRight(), true, polarities);
                        traverse(node.getRight(), false, polarities);
                    }
                    default -> throw new IllegalStateException("Operatore binario inatteso: " + node.getOperator());
                }
            }
        }
    }

    /**
     * Atomi puri con la loro unica polarità, nell'ordine di prima occorrenza.
     */
    public static Map<String, Boolean> findPureAtoms(Map<String, Set<Boolean>> polarities) {
        Map<String, Boolean> pureAtoms = new LinkedHashMap<>();
        for (Map.Entry<String, Set<Boolean>> entry : polarities.entrySet()) {
            if (entry.getValue().size() == 1) {
                pureAtoms.put(entry.getKey(), entry.getValue().iterator().next());
            }
        }
        return Collections.unmodifiableMap(pureAtoms);
    }

    public static Map<String, Boolean> findPureAtoms(Formula formula) {
        return findPureAtoms(collectPolarities(formula));
    }

    //endregion

    //region SOSTITUZIONE E SEMPLIFICAZIONE

    /**
     * Sostituisce gli atomi puri con costanti e semplifica il risultato.
     *
     * @param formula formula di partenza (non modificata)
     * @param pureAtoms atomi puri con la relativa polarità
     * @return nuovo albero semplificato
     */
    public static Formula fold(Formula formula, Map<String, Boolean> pureAtoms) {
        Formula substituted = substitute(formula, pureAtoms);
        LOGGER.finest("Dopo sostituzione: " + substituted);
        Formula simplified = simplify(substituted);
        LOGGER.fine("Atomi puri " + pureAtoms.keySet() + ": " + formula + " ⇒ " + simplified);
        return simplified;
    }

    /**
     * Prima passata: sostituzione delle variabili pure con piegatura delle costanti.
     */
    static Formula substitute(Formula node, Map<String, Boolean> pureAtoms) {
        switch (node.getType()) {
            case VARIABLE -> {
                Boolean polarity = pureAtoms.get(node.getValue());
                return polarity != null ? Formula.constant(polarity) : node;
            }
            case CONSTANT -> {
                return node;
            }
            case UNARY -> {
                Formula operand = substitute(node.getOperand(), pureAtoms);
                return operand.isConstant() ? Formula.constant(!operand.getConstantValue()) : Formula.not(operand);
            }
            default -> {
                Formula left = substitute(node.getLeft(), pureAtoms);
                Formula right = substitute(node.getRight(), pureAtoms);
                Operator operator = node.getOperator();

                if (left.isConstant() && right.isConstant()) {
                    return Formula.constant(operator.apply(left.getConstantValue(), right.getConstantValue()));
                }

                Formula folded = switch (operator) {
                    case AND, OR -> foldAndOr(operator, left, right);
                    case IMPLIES -> foldImplies(left, right);
                    case IFF -> foldIff(left, right);
                    default -> null;
                };
                return folded != null ? folded : Formula.binary(operator, left, right);
            }
        }
    }

    /**
     * Seconda passata ricorsiva: regole di negazione e di ∧, ∨.
     */
    static Formula simplify(Formula node) {
        switch (node.getType()) {
            case VARIABLE, CONSTANT -> {
                return node;
            }
            case UNARY -> {
                Formula operand = simplify(node.getOperand());
                if (operand.isConstant()) {
                    return Formula.constant(!operand.getConstantValue());
                }
                if (operand.isUnary()) {
                    return simplify(operand.getOperand());              // ¬¬P ≡ P
                }
                return Formula.not(operand);
            }
            default -> {
                Formula left = simplify(node.getLeft());
                Formula right = simplify(node.getRight());
                Operator operator = node.getOperator();

                if (left.isConstant() && right.isConstant()) {
                    return Formula.constant(operator.apply(left.getConstantValue(), right.getConstantValue()));
                }

                Formula folded = operator == Operator.AND || operator == Operator.OR
                        ? foldAndOr(operator, left, right)
                        : null;
                return folded != null ? folded : Formula.binary(operator, left, right);
            }
        }
    }

    //endregion

    //region REGOLE PER OPERATORE

    /**
     * Elemento neutro e assorbente di ∧ (⊤, ⊥) e di ∨ (⊥, ⊤); null se nessun lato è costante.
     */
    private static Formula foldAndOr(Operator operator, Formula left, Formula right) {
        boolean absorbing = operator == Operator.OR;
        if (left.isConstant()) {
            return left.getConstantValue() == absorbing ? Formula.constant(absorbing) : right;
        }
        if (right.isConstant()) {
            return right.getConstantValue() == absorbing ? Formula.constant(absorbing) : left;
        }
        return null;
    }

    private static Formula foldImplies(Formula left, Formula right) {
        if (left.isConstant()) {
            return left.getConstantValue() ? right : Formula.top();             // ⊤→P ≡ P, ⊥→P ≡ ⊤
        }
        if (right.isConstant()) {
            return right.getConstantValue() ? Formula.top() : Formula.not(left); // P→⊤ ≡ ⊤, P→⊥ ≡ ¬P
        }
        return null;
    }

    private static Formula foldIff(Formula left, Formula right) {
        if (left.isConstant()) {
            return left.getConstantValue() ? right : Formula.not(right);         // ⊥↔P ≡ ¬P
        }
        if (right.isConstant()) {
            return right.getConstantValue() ? left : Formula.not(left);          // P↔⊥ ≡ ¬P
        }
        return null;
    }

    //endregion
}
