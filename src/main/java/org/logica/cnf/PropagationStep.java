package org.logica.cnf;

import java.util.List;

/**
 * Singolo passo di propagazione: letterale propagato e istantanee delle clausole
 * prima e dopo il passo, ciascuna clausola resa come "l,l,…".
 */
public record PropagationStep(String literal, List<String> beforeClauses, List<String> afterClauses) {

    public PropagationStep {
        beforeClauses = List.copyOf(beforeClauses);
        afterClauses = List.copyOf(afterClauses);
    }

    public String variable() {
        return Literals.variableOf(literal);
    }

    /** Valore assegnato alla variabile dal passo */
    public boolean value() {
        return !Literals.isNegated(literal);
    }
}
