package org.logica.core;

import java.util.List;
import java.util.Objects;

/**
 * FORMULA PROPOSIZIONALE - Nodo immutabile dell'albero sintattico astratto
 *
 * Rappresenta una formula della logica proposizionale come albero finito e aciclico.
 * Ogni nodo appartiene a una delle quattro varianti chiuse descritte da {@link Type}:
 *
 * VARIANTI:
 * - VARIABLE: foglia con nome di una sola lettera minuscola (a, b, ..., z)
 * - CONSTANT: foglia con valore ⊤ o ⊥
 * - UNARY: negazione ¬ con esattamente un operando
 * - BINARY: ∧, ∨, →, ↔ con figlio sinistro e destro ordinati
 *
 * INVARIANTI:
 * - I nodi non vengono mai modificati dopo la costruzione
 * - Ogni trasformazione costruisce un nuovo albero
 * - Uguaglianza e hash sono strutturali sull'intero sottoalbero
 */
public final class Formula {

    /** Glifo della costante vera */
    public static final String TOP = "⊤";

    /** Glifo della costante falsa */
    public static final String BOTTOM = "⊥";

    //region TIPI E STRUTTURA DATI

    /**
     * Varianti di nodo ammesse nell'albero.
     */
    public enum Type {
        VARIABLE,   // Foglia: a, b, c, ...
        CONSTANT,   // Foglia: ⊤ oppure ⊥
        UNARY,      // Negazione: ¬A
        BINARY      // A ∧ B, A ∨ B, A → B, A ↔ B
    }

    private final Type type;

    /** Nome della variabile oppure glifo della costante (solo foglie) */
    private final String value;

    /** Connettivo (solo nodi UNARY e BINARY) */
    private final Operator operator;

    /** Operando della negazione oppure figlio sinistro */
    private final Formula left;

    /** Figlio destro (solo nodi BINARY) */
    private final Formula right;

    private final int hash;

    //endregion

    //region COSTRUZIONE

    private Formula(Type type, String value, Operator operator, Formula left, Formula right) {
        this.type = type;
        this.value = value;
        this.operator = operator;
        this.left = left;
        this.right = right;
        this.hash = Objects.hash(type, value, operator, left, right);
    }

    /**
     * Crea una foglia variabile.
     *
     * @param name nome di una sola lettera minuscola
     * @throws IllegalArgumentException se il nome non è una lettera minuscola ASCII
     */
    public static Formula variable(String name) {
        if (name == null || name.length() != 1 || name.charAt(0) < 'a' || name.charAt(0) > 'z') {
            throw new IllegalArgumentException("Nome variabile non valido: " + name);
        }
        return new Formula(Type.VARIABLE, name, null, null, null);
    }

    /**
     * Crea una foglia costante.
     *
     * @param value true per ⊤, false per ⊥
     */
    public static Formula constant(boolean value) {
        return new Formula(Type.CONSTANT, value ? TOP : BOTTOM, null, null, null);
    }

    public static Formula top() {
        return constant(true);
    }

    public static Formula bottom() {
        return constant(false);
    }

    /**
     * Crea la negazione di una formula.
     *
     * @param operand sottoformula da negare (non null)
     */
    public static Formula not(Formula operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
        return new Formula(Type.UNARY, null, Operator.NOT, operand, null);
    }

    /**
     * Crea un nodo binario.
     *
     * @param operator connettivo binario
     * @param left figlio sinistro (non null)
     * @param right figlio destro (non null)
     * @throws IllegalArgumentException se l'operatore non è binario o un figlio è null
     */
    public static Formula binary(Operator operator, Formula left, Formula right) {
        if (operator == null || !operator.isBinary()) {
            throw new IllegalArgumentException("Operatore binario richiesto, ricevuto: " + operator);
        }
        if (left == null || right == null) {
            throw new IllegalArgumentException("Operandi per " + operator.symbol() + " non possono essere null");
        }
        return new Formula(Type.BINARY, null, operator, left, right);
    }

    public static Formula and(Formula left, Formula right) {
        return binary(Operator.AND, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return binary(Operator.OR, left, right);
    }

    public static Formula implies(Formula left, Formula right) {
        return binary(Operator.IMPLIES, left, right);
    }

    public static Formula iff(Formula left, Formula right) {
        return binary(Operator.IFF, left, right);
    }

    //endregion

    //region ACCESSO STRUTTURA

    public Type getType() {
        return type;
    }

    public boolean isVariable() {
        return type == Type.VARIABLE;
    }

    public boolean isConstant() {
        return type == Type.CONSTANT;
    }

    public boolean isUnary() {
        return type == Type.UNARY;
    }

    public boolean isBinary() {
        return type == Type.BINARY;
    }

    public boolean isLeaf() {
        return type == Type.VARIABLE || type == Type.CONSTANT;
    }

    /**
     * Vero se il nodo è la costante ⊤.
     */
    public boolean isTop() {
        return type == Type.CONSTANT && TOP.equals(value);
    }

    /**
     * Vero se il nodo è la costante ⊥.
     */
    public boolean isBottom() {
        return type == Type.CONSTANT && BOTTOM.equals(value);
    }

    /**
     * Nome della variabile oppure glifo della costante.
     *
     * @throws IllegalStateException se il nodo non è una foglia
     */
    public String getValue() {
        if (!isLeaf()) {
            throw new IllegalStateException("Nodo " + type + " non ha valore");
        }
        return value;
    }

    /**
     * Valore di verità della costante.
     *
     * @throws IllegalStateException se il nodo non è una costante
     */
    public boolean getConstantValue() {
        if (type != Type.CONSTANT) {
            throw new IllegalStateException("Nodo " + type + " non è una costante");
        }
        return TOP.equals(value);
    }

    public Operator getOperator() {
        return operator;
    }

    /**
     * Operando della negazione.
     *
     * @throws IllegalStateException se il nodo non è UNARY
     */
    public Formula getOperand() {
        if (type != Type.UNARY) {
            throw new IllegalStateException("Nodo " + type + " non ha operando unario");
        }
        return left;
    }

    public Formula getLeft() {
        if (type != Type.BINARY) {
            throw new IllegalStateException("Nodo " + type + " non ha figlio sinistro");
        }
        return left;
    }

    public Formula getRight() {
        if (type != Type.BINARY) {
            throw new IllegalStateException("Nodo " + type + " non ha figlio destro");
        }
        return right;
    }

    /**
     * Figli in ordine di posizione (1 = operando o sinistro, 2 = destro).
     */
    public List<Formula> children() {
        return switch (type) {
            case VARIABLE, CONSTANT -> List.of();
            case UNARY -> List.of(left);
            case BINARY -> List.of(left, right);
        };
    }

    /**
     * Vero se il nodo è un letterale: variabile o negazione di variabile.
     */
    public boolean isLiteral() {
        return isVariable() || (isUnary() && left.isVariable());
    }

    //endregion

    //region UGUAGLIANZA STRUTTURALE

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Formula)) return false;
        Formula that = (Formula) other;
        return hash == that.hash
                && type == that.type
                && Objects.equals(value, that.value)
                && operator == that.operator
                && Objects.equals(left, that.left)
                && Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return FormulaFormatter.toText(this);
    }

    //endregion
}
