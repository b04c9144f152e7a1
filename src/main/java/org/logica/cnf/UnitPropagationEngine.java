package org.logica.cnf;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * PROPAGAZIONE UNITARIA - Motore condiviso da analisi autonoma e classificatori di determinismo
 *
 * ALGORITMO:
 * 1. Cerca la prima clausola unitaria nell'ordine corrente delle clausole
 * 2. Il suo letterale L diventa vero: si registra il passo
 * 3. Le clausole che contengono L sono soddisfatte e vengono rimosse
 * 4. Dalle clausole rimanenti si rimuove il complemento di L
 * 5. Si ripete fino a quando non restano clausole unitarie
 *
 * POLITICHE SULLE CLAUSOLE SVUOTATE:
 * - REPORT: la clausola vuota è una contraddizione e termina la propagazione
 * - DISCARD: la clausola vuota viene scartata e la propagazione prosegue
 */
public final class UnitPropagationEngine {

    private static final Logger LOGGER = Logger.getLogger(UnitPropagationEngine.class.getName());

    /**
     * Trattamento delle clausole svuotate dalla rimozione di un complemento.
     */
    public enum ContradictionPolicy {
        /** Contraddizione rilevata e riportata come stato terminale */
        REPORT,
        /** Clausola vuota scartata, nessuno stato di contraddizione */
        DISCARD
    }

    private final ContradictionPolicy policy;

    public UnitPropagationEngine(ContradictionPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Politica di contraddizione non può essere null");
        }
        this.policy = policy;
    }

    public ContradictionPolicy getPolicy() {
        return policy;
    }

    //region PROPAGAZIONE

    /**
     * Esegue la propagazione unitaria fino al termine.
     *
     * @param clauseSet clausole di partenza (non modificate)
     * @return esito con passi, letterali, assegnamenti e clausole residue
     */
    public PropagationResult propagate(ClauseSet clauseSet) {
        List<List<String>> clauses = copyClauses(clauseSet);
        List<PropagationStep> steps = new ArrayList<>();
        Set<String> literals = new LinkedHashSet<>();
        Map<String, Boolean> assignments = new LinkedHashMap<>();

        LOGGER.fine("Propagazione unitaria (" + policy + ") su " + clauses.size() + " clausole");

        while (true) {
            int unitIndex = findFirstUnitClause(clauses);
            if (unitIndex < 0) {
                break;                                                  // Punto fisso: nessuna clausola unitaria
            }

            String literal = clauses.get(unitIndex).get(0);
            List<String> before = ClauseSet.join(clauses);

            literals.add(literal);
            assignments.put(Literals.variableOf(literal), !Literals.isNegated(literal));

            boolean contradiction = false;
            List<List<String>> next = new ArrayList<>();
            String complement = Literals.complement(literal);

            for (List<String> clause : clauses) {
                if (clause.contains(literal)) {
                    continue;                                           // Clausola soddisfatta
                }

                List<String> reduced = new ArrayList<>(clause);
                reduced.removeIf(complement::equals);

                if (reduced.isEmpty()) {
                    if (policy == ContradictionPolicy.REPORT) {
                        contradiction = true;
                        next.add(reduced);
                    }
                    continue;                                           // DISCARD: clausola vuota scartata
                }
                next.add(reduced);
            }

            clauses = next;
            steps.add(new PropagationStep(literal, before, ClauseSet.join(clauses)));
            LOGGER.finest("Propagato " + literal + ", clausole residue: " + clauses.size());

            if (contradiction) {
                LOGGER.fine("Contraddizione: clausola svuotata dalla rimozione di " + complement);
                return new PropagationResult(PropagationOutcome.CONTRADICTION, steps, new ArrayList<>(literals),
                        assignments, clauses);
            }
        }

        PropagationOutcome outcome = clauses.isEmpty() ? PropagationOutcome.EMPTY : PropagationOutcome.STALLED;
        LOGGER.fine("Propagazione terminata: " + outcome + " dopo " + steps.size() + " passi");
        return new PropagationResult(outcome, steps, new ArrayList<>(literals), assignments, clauses);
    }

    //endregion

    //region SUPPORTO

    /**
     * Copia indipendente delle clausole; con REPORT i letterali ripetuti in una clausola
     * vengono accorpati, così una clausola come (a∨a) è riconosciuta come unitaria.
     */
    private List<List<String>> copyClauses(ClauseSet clauseSet) {
        List<List<String>> copy = new ArrayList<>();
        for (List<String> clause : clauseSet.clauses()) {
            if (policy == ContradictionPolicy.REPORT) {
                copy.add(new ArrayList<>(new LinkedHashSet<>(clause)));
            } else {
                copy.add(new ArrayList<>(clause));
            }
        }
        return copy;
    }

    /** Indice della prima clausola con un solo letterale, -1 se assente */
    private static int findFirstUnitClause(List<List<String>> clauses) {
        for (int i = 0; i < clauses.size(); i++) {
            if (clauses.get(i).size() == 1) {
                return i;
            }
        }
        return -1;
    }

    //endregion
}
